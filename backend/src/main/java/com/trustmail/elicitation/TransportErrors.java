package com.trustmail.elicitation;

import java.util.List;
import java.util.Locale;

import com.trustmail.error.UnsupportedCapabilityException;

/**
 * Classifies transport failures. Clients that lack the confirmation capability answer either
 * with {@link UnsupportedCapabilityException} or with the protocol's "method not found" error.
 * Anything else, including unrelated errors that merely mention "unsupported", is a hard
 * failure.
 */
public final class TransportErrors {

    public enum Kind { UNSUPPORTED, OTHER }

    private static final List<String> UNSUPPORTED_MARKERS = List.of("method not found");

    private TransportErrors() {
    }

    public static Kind classify(Throwable error) {
        if (error instanceof UnsupportedCapabilityException) {
            return Kind.UNSUPPORTED;
        }
        String text = error.getMessage();
        if (text != null) {
            String lower = text.toLowerCase(Locale.ROOT);
            for (String marker : UNSUPPORTED_MARKERS) {
                if (lower.contains(marker)) {
                    return Kind.UNSUPPORTED;
                }
            }
        }
        return Kind.OTHER;
    }
}
