package com.trustmail.error;

/**
 * Rate limiting or a server-side failure on a single remote call.
 */
public class TransientApiException extends RuntimeException {

    public TransientApiException(String message) {
        super(message);
    }

    public TransientApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
