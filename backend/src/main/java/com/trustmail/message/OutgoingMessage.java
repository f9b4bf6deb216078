package com.trustmail.message;

import java.util.List;

/**
 * Fully resolved message content handed to {@link MessageStore#send} or
 * {@link MessageStore#createDraft}. Recipients are concrete addresses.
 */
public record OutgoingMessage(
        String mailbox,
        List<String> to,
        List<String> cc,
        List<String> bcc,
        String subject,
        String body,
        String htmlBody,
        String threadId,
        String inReplyTo
) {

    public OutgoingMessage {
        to = to != null ? List.copyOf(to) : List.of();
        cc = cc != null ? List.copyOf(cc) : List.of();
        bcc = bcc != null ? List.copyOf(bcc) : List.of();
    }
}
