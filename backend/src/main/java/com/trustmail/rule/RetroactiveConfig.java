package com.trustmail.rule;

import java.time.Duration;

import com.trustmail.config.TrustMailProperties;

/**
 * @param maxItems safety limit on candidate ids; 0 or less means unlimited
 */
public record RetroactiveConfig(int batchSize, int maxItems, Duration rateLimitDelay) {

    public RetroactiveConfig {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        rateLimitDelay = rateLimitDelay != null ? rateLimitDelay : Duration.ZERO;
    }

    public static RetroactiveConfig from(TrustMailProperties.Retroactive settings) {
        return new RetroactiveConfig(settings.getBatchSize(), settings.getMaxItems(), settings.getRateLimitDelay());
    }

    public boolean isLimited() {
        return maxItems > 0;
    }
}
