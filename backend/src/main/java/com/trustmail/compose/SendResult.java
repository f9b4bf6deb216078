package com.trustmail.compose;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.trustmail.elicitation.DispatchOutcome;
import com.trustmail.elicitation.DispatchStatus;
import com.trustmail.elicitation.FallbackPolicy;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SendResult(
        boolean success,
        SendIntent intent,
        DispatchStatus status,
        FallbackPolicy fallbackPolicy,
        String messageId,
        String draftId,
        List<String> untrustedRecipients,
        String message
) {

    public static SendResult of(SendIntent intent, DispatchOutcome outcome) {
        return new SendResult(
                outcome.success(),
                intent,
                outcome.status(),
                outcome.fallbackPolicy(),
                outcome.messageId(),
                outcome.draftId(),
                outcome.untrustedRecipients(),
                outcome.message());
    }
}
