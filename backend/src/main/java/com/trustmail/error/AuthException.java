package com.trustmail.error;

/**
 * Credential or permission failure reported by the message store or the group directory.
 * Always surfaced to the caller as a hard failure.
 */
public class AuthException extends RuntimeException {

    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
