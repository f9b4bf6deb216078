package com.trustmail.elicitation;

import java.util.List;

/**
 * What the caller is asked when a message has untrusted recipients.
 */
public record ElicitationPrompt(
        String promptId,
        String mailbox,
        String message,
        List<String> untrustedRecipients,
        List<ElicitationAction> choices,
        long timeoutSeconds
) {

    public ElicitationPrompt {
        untrustedRecipients = List.copyOf(untrustedRecipients);
        choices = List.copyOf(choices);
    }
}
