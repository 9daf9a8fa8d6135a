package com.orderdesk.backend.exception;

/**
 * Thrown on uniqueness violations and on re-linking an order that already has a customer.
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String message) {
        super(message);
    }
}
