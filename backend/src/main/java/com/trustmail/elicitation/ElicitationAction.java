package com.trustmail.elicitation;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.trustmail.error.ValidationException;

/**
 * Choice carried by an accepted confirmation prompt.
 */
public enum ElicitationAction {
    SEND("send"),
    SAVE_DRAFT("save_draft"),
    CANCEL("cancel");

    private final String wireName;

    ElicitationAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ElicitationAction fromWire(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (ElicitationAction action : values()) {
                if (action.wireName.equals(normalized)) {
                    return action;
                }
            }
        }
        throw new ValidationException("Unsupported choice: " + value + " (expected send, save_draft or cancel)");
    }
}
