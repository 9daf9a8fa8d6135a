package com.orderdesk.backend.exception;

/**
 * Thrown when the caller lacks the role or ownership an operation requires.
 */
public class ForbiddenAccessException extends RuntimeException {

    public ForbiddenAccessException(String message) {
        super(message);
    }
}
