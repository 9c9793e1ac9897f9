package com.ais.common.exception;

/**
 * Exception thrown when creating a resource whose natural key is already taken,
 * e.g. registering an email that already has an account.
 * HTTP Status: 409 Conflict
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String message) {
        super(message);
    }

    public DuplicateResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
