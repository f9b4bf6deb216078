package com.trustmail.message;

import java.util.Set;

/**
 * Listing entry returned by the mailbox search endpoint.
 */
public record MessageSummary(
        String id,
        String threadId,
        String sender,
        String subject,
        long timestamp,
        Set<String> labelIds
) {}
