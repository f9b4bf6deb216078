package com.trustmail.message;

import org.springframework.dao.PermissionDeniedDataAccessException;
import org.springframework.dao.TransientDataAccessException;

import com.trustmail.error.AuthException;
import com.trustmail.error.TransientApiException;

/**
 * Translates Spring Data access exceptions into the service's error taxonomy.
 */
public final class StoreErrors {

    private StoreErrors() {
    }

    public static Throwable translate(Throwable error) {
        if (error instanceof PermissionDeniedDataAccessException) {
            return new AuthException("Store access denied: " + error.getMessage(), error);
        }
        if (error instanceof TransientDataAccessException) {
            return new TransientApiException("Store temporarily unavailable: " + error.getMessage(), error);
        }
        return error;
    }
}
