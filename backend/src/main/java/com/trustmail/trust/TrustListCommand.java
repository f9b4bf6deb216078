package com.trustmail.trust;

import java.util.List;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.trustmail.config.StringOrListDeserializer;

/**
 * Request body for the trust-list verbs. {@code email} takes a single address, a
 * comma-separated string or a list.
 */
public record TrustListCommand(
        @JsonDeserialize(using = StringOrListDeserializer.class)
        List<String> email
) {

    public TrustListCommand {
        email = email != null ? List.copyOf(email) : List.of();
    }
}
