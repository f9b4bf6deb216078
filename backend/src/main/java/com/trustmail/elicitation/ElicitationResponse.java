package com.trustmail.elicitation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trustmail.error.ValidationException;

/**
 * Answer to a confirmation prompt. {@code choice} is only meaningful for {@link ResponseKind#ACCEPT}.
 */
public record ElicitationResponse(
        @JsonProperty("action") ResponseKind kind,
        @JsonProperty("choice") ElicitationAction choice
) {

    public ElicitationResponse {
        if (kind == null) {
            throw new ValidationException("'action' is required (accept, decline or cancel)");
        }
        if (kind == ResponseKind.ACCEPT && choice == null) {
            throw new ValidationException("'choice' is required when accepting (send, save_draft or cancel)");
        }
    }

    public static ElicitationResponse accept(ElicitationAction choice) {
        return new ElicitationResponse(ResponseKind.ACCEPT, choice);
    }

    public static ElicitationResponse decline() {
        return new ElicitationResponse(ResponseKind.DECLINE, null);
    }

    public static ElicitationResponse cancel() {
        return new ElicitationResponse(ResponseKind.CANCEL, null);
    }
}
