package com.trustmail.compose;

import java.util.List;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.trustmail.config.StringOrListDeserializer;

/**
 * Outbound message as submitted by a client. Each recipient field takes a single address,
 * a comma-separated string or a list; entries may be {@code group:<name>} or
 * {@code groupId:<id>} references, which are expanded to their members before sending.
 *
 * <p>{@code originalMessageId} is required for replies and forwards.
 */
public record SendRequest(
        @JsonDeserialize(using = StringOrListDeserializer.class) List<String> to,
        @JsonDeserialize(using = StringOrListDeserializer.class) List<String> cc,
        @JsonDeserialize(using = StringOrListDeserializer.class) List<String> bcc,
        String subject,
        String body,
        String htmlBody,
        String originalMessageId
) {

    public SendRequest {
        to = to != null ? List.copyOf(to) : List.of();
        cc = cc != null ? List.copyOf(cc) : List.of();
        bcc = bcc != null ? List.copyOf(bcc) : List.of();
    }
}
