package com.trustmail.message;

import java.util.List;
import java.util.Set;

public record MessageDetail(
        String id,
        String threadId,
        String sender,
        List<String> to,
        List<String> cc,
        String subject,
        String body,
        String htmlBody,
        boolean hasAttachment,
        long sizeBytes,
        Set<String> labelIds
) {}
