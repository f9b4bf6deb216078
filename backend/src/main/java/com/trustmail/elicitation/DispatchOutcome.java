package com.trustmail.elicitation;

import java.util.List;

/**
 * @param fallbackPolicy the policy that decided the outcome, null when the caller answered
 *                       or no confirmation was needed
 * @param messageId      id of the sent message, null when nothing was sent
 * @param draftId        id of the saved draft, null when no draft was saved
 */
public record DispatchOutcome(
        DispatchStatus status,
        FallbackPolicy fallbackPolicy,
        String messageId,
        String draftId,
        List<String> untrustedRecipients,
        String message
) {

    public DispatchOutcome {
        untrustedRecipients = untrustedRecipients != null ? List.copyOf(untrustedRecipients) : List.of();
    }

    public boolean success() {
        if (status == DispatchStatus.FALLBACK_APPLIED) {
            return fallbackPolicy == FallbackPolicy.ALLOW;
        }
        return status.isSuccess();
    }
}
