package com.trustmail.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.trustmail.elicitation.FallbackPolicy;

/**
 * Process-level settings for the outbound trust gateway and rule engine.
 *
 * <p>Values are read at decision time, so a refreshed environment takes effect on the
 * next request without restarting the service.
 */
@ConfigurationProperties(prefix = "trustmail")
public class TrustMailProperties {

    private final TrustList trustList = new TrustList();
    private final Elicitation elicitation = new Elicitation();
    private final Retroactive retroactive = new Retroactive();
    private final Store store = new Store();

    public TrustList getTrustList() { return trustList; }
    public Elicitation getElicitation() { return elicitation; }
    public Retroactive getRetroactive() { return retroactive; }
    public Store getStore() { return store; }

    public static class TrustList {

        /** Comma-separated tokens used when the durable list has never been written. */
        private String seed = "";

        /** Backing store: {@code cassandra} (default) or {@code memory}. */
        private String store = "cassandra";

        /** Attempts at a compare-and-set write before giving up on a concurrent update. */
        private int maxWriteAttempts = 3;

        public String getSeed() { return seed; }
        public String getStore() { return store; }
        public void setStore(String store) { this.store = store; }
        public void setSeed(String seed) { this.seed = seed; }
        public int getMaxWriteAttempts() { return maxWriteAttempts; }
        public void setMaxWriteAttempts(int maxWriteAttempts) { this.maxWriteAttempts = maxWriteAttempts; }
    }

    public static class Elicitation {

        /** Master toggle for interactive confirmation of untrusted recipients. */
        private boolean enabled = true;

        /** What to do when confirmation cannot be performed. */
        private FallbackPolicy fallback = FallbackPolicy.BLOCK;

        /** How long to wait for the caller's answer. */
        private Duration timeout = Duration.ofSeconds(300);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public FallbackPolicy getFallback() { return fallback; }
        public void setFallback(FallbackPolicy fallback) { this.fallback = fallback; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class Retroactive {

        private int batchSize = 100;

        /** Safety limit on the number of messages touched by one run; 0 disables it. */
        private int maxItems = 10_000;

        private Duration rateLimitDelay = Duration.ofMillis(50);

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
        public int getMaxItems() { return maxItems; }
        public void setMaxItems(int maxItems) { this.maxItems = maxItems; }
        public Duration getRateLimitDelay() { return rateLimitDelay; }
        public void setRateLimitDelay(Duration rateLimitDelay) { this.rateLimitDelay = rateLimitDelay; }
    }

    public static class Store {

        /** Rows fetched per Cassandra page when listing a mailbox. */
        private int pageSize = 100;

        public int getPageSize() { return pageSize; }
        public void setPageSize(int pageSize) { this.pageSize = pageSize; }
    }
}
