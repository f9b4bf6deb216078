package com.trustmail.error;

/**
 * The confirmation transport cannot run an interactive prompt for this caller.
 * Triggers the configured fallback policy rather than failing the request.
 */
public class UnsupportedCapabilityException extends RuntimeException {

    public UnsupportedCapabilityException(String message) {
        super(message);
    }
}
