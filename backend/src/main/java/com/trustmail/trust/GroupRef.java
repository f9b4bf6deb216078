package com.trustmail.trust;

/**
 * Reference to a directory group, written as {@code group:<name>} or
 * {@code groupId:<resource-id>} in the trust list.
 */
public record GroupRef(String raw, GroupKind kind, String value) implements TrustEntry {}
