package com.orderdesk.backend.exception;

/**
 * Wraps an unexpected persistence or cache failure. The message is meant
 * for the client; the cause stays in the logs.
 */
public class OperationFailedException extends RuntimeException {

    public OperationFailedException(String message) {
        super(message);
    }

    public OperationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
