package com.trustmail.trust;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Normalized set of trusted addresses. Each address remembers whether it was listed
 * explicitly or came from a group, which is only used for diagnostics.
 *
 * <p>A set is configured when the persisted list held at least one token. A configured
 * set may still hold no address, for example when every group failed to expand.
 */
public final class ResolvedTrustSet {

    public enum Source {
        EXPLICIT,
        GROUP
    }

    private static final ResolvedTrustSet EMPTY = new ResolvedTrustSet(Map.of(), false);

    private final Map<String, Source> addresses;
    private final boolean configured;

    private ResolvedTrustSet(Map<String, Source> addresses, boolean configured) {
        this.addresses = Collections.unmodifiableMap(new TreeMap<>(addresses));
        this.configured = configured;
    }

    public static ResolvedTrustSet empty() {
        return EMPTY;
    }

    public static ResolvedTrustSet of(Collection<String> explicit, Collection<String> groupDerived) {
        return of(explicit, groupDerived, false);
    }

    /**
     * @param configured whether the list these addresses came from held any token; a set
     *                   with at least one address is always configured
     */
    public static ResolvedTrustSet of(Collection<String> explicit, Collection<String> groupDerived,
                                      boolean configured) {
        Map<String, Source> merged = new TreeMap<>();
        for (String address : groupDerived) {
            String normalized = normalize(address);
            if (!normalized.isEmpty()) {
                merged.put(normalized, Source.GROUP);
            }
        }
        // explicit listing wins over group membership
        for (String address : explicit) {
            String normalized = normalize(address);
            if (!normalized.isEmpty()) {
                merged.put(normalized, Source.EXPLICIT);
            }
        }
        if (merged.isEmpty() && !configured) {
            return EMPTY;
        }
        return new ResolvedTrustSet(merged, true);
    }

    public static String normalize(String address) {
        return address == null ? "" : address.trim().toLowerCase(Locale.ROOT);
    }

    public boolean contains(String address) {
        return addresses.containsKey(normalize(address));
    }

    public Source sourceOf(String address) {
        return addresses.get(normalize(address));
    }

    public Set<String> addresses() {
        return addresses.keySet();
    }

    public boolean isEmpty() {
        return addresses.isEmpty();
    }

    public boolean isConfigured() {
        return configured;
    }

    public int size() {
        return addresses.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedTrustSet other)) return false;
        return configured == other.configured && addresses.keySet().equals(other.addresses.keySet());
    }

    @Override
    public int hashCode() {
        return 31 * addresses.keySet().hashCode() + Boolean.hashCode(configured);
    }

    @Override
    public String toString() {
        return (configured ? "ResolvedTrustSet" : "ResolvedTrustSet(unconfigured)") + addresses.keySet();
    }
}
