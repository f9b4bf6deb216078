package com.trustmail.trust;

/**
 * A single parsed trust-list token: either a literal address or a reference to a
 * directory group.
 */
public interface TrustEntry {

    /** The token exactly as it appeared in the persisted list, trimmed. */
    String raw();
}
