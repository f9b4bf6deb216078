package com.trustmail.trust;

import java.util.List;

/**
 * Privacy-masked listing of the trust list. Group tokens are shown in their raw form.
 */
public record TrustListView(
        boolean success,
        int count,
        List<String> maskedAddresses,
        List<String> groupTokens,
        String message
) {}
