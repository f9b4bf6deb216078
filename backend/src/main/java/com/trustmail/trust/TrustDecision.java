package com.trustmail.trust;

import java.util.List;

/**
 * Partition of the normalized recipients of one outbound message.
 */
public record TrustDecision(List<String> trustedRecipients, List<String> untrustedRecipients) {

    public TrustDecision {
        trustedRecipients = List.copyOf(trustedRecipients);
        untrustedRecipients = List.copyOf(untrustedRecipients);
    }

    public boolean requiresConfirmation() {
        return !untrustedRecipients.isEmpty();
    }
}
