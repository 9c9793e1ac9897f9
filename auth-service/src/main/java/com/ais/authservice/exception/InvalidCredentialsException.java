package com.ais.authservice.exception;

/**
 * Exception thrown when a login cannot be completed: unknown email, account
 * without a password, or wrong password. The message is the same in every case.
 * HTTP Status: 401 Unauthorized
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException(String message) {
        super(message);
    }
}
