package com.trustmail.trust;

import java.util.List;

public record LabelUpdateResult(
        boolean success,
        String action,
        String label,
        String groupId,
        int emailsProcessed,
        List<String> notFound,
        String message
) {}
