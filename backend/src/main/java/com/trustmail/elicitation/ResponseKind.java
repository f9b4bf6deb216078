package com.trustmail.elicitation;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.trustmail.error.ValidationException;

public enum ResponseKind {
    ACCEPT,
    DECLINE,
    CANCEL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ResponseKind fromWire(String value) {
        if (value != null) {
            for (ResponseKind kind : values()) {
                if (kind.name().equalsIgnoreCase(value.trim())) {
                    return kind;
                }
            }
        }
        throw new ValidationException("Unsupported response: " + value + " (expected accept, decline or cancel)");
    }
}
