package com.trustmail.trust;

import java.util.List;

/**
 * Snapshot of the persisted token list. {@code version} is the optimistic concurrency
 * token; 0 means the list has never been written.
 */
public record TrustList(List<String> tokens, long version) {

    public TrustList {
        tokens = List.copyOf(tokens);
    }
}
