package com.trustmail.rule;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.trustmail.error.ValidationException;

public enum SizeComparison {
    LARGER,
    SMALLER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SizeComparison fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (SizeComparison comparison : values()) {
            if (comparison.name().equalsIgnoreCase(value.trim())) {
                return comparison;
            }
        }
        throw new ValidationException("Unsupported sizeComparison: " + value + " (expected larger or smaller)");
    }
}
