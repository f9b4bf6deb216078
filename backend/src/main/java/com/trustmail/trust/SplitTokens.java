package com.trustmail.trust;

import java.util.List;

public record SplitTokens(List<String> literalTokens, List<String> groupTokens) {

    public SplitTokens {
        literalTokens = List.copyOf(literalTokens);
        groupTokens = List.copyOf(groupTokens);
    }
}
