package com.trustmail.error;

/**
 * Malformed or missing input. Raised before any side effect is attempted.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
