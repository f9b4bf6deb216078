package com.trustmail.trust;

public class ConcurrentTrustListUpdateException extends RuntimeException {

    public ConcurrentTrustListUpdateException(long expectedVersion) {
        super("Trust list changed concurrently (expected version " + expectedVersion + ")");
    }
}
