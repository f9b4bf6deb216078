package com.trustmail.trust;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

/**
 * Classifies recipients as trusted or untrusted.
 *
 * <p>Recipients reaching the gate are concrete addresses: group tokens used as recipients
 * are expanded before evaluation, so no prefix is special-cased here. Every recipient passes
 * only when no list is configured. A configured list that resolved to no address trusts
 * nobody.
 */
@Component
public class TrustGate {

    public TrustDecision evaluate(Collection<String> recipients, ResolvedTrustSet trustSet) {
        Set<String> candidates = normalizeRecipients(recipients);
        if (trustSet == null || !trustSet.isConfigured()) {
            return new TrustDecision(new ArrayList<>(candidates), List.of());
        }
        List<String> trusted = new ArrayList<>();
        List<String> untrusted = new ArrayList<>();
        for (String recipient : candidates) {
            if (trustSet.contains(recipient)) {
                trusted.add(recipient);
            } else {
                untrusted.add(recipient);
            }
        }
        return new TrustDecision(trusted, untrusted);
    }

    /**
     * Splits comma-joined entries, trims, lowercases and removes duplicates while keeping
     * first-seen order.
     */
    public static Set<String> normalizeRecipients(Collection<String> recipients) {
        Set<String> normalized = new LinkedHashSet<>();
        if (recipients == null) {
            return normalized;
        }
        for (String entry : recipients) {
            if (entry == null) {
                continue;
            }
            for (String part : entry.split(",")) {
                String address = ResolvedTrustSet.normalize(part);
                if (!address.isEmpty()) {
                    normalized.add(address);
                }
            }
        }
        return normalized;
    }
}
