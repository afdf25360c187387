package com.ascend.modsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "modsync")
public class ModSyncProperties {
    private static final String DEFAULT_USER_AGENT = "ascend-mod-sync/0.1 (+contact)";

    private TokenBucket tokenBucket = new TokenBucket();
    private Cache cache = new Cache();
    private Scheduler scheduler = new Scheduler();
    private Daemon daemon = new Daemon();
    private Upstream upstream = new Upstream();

    public TokenBucket getTokenBucket() {
        return tokenBucket;
    }

    public void setTokenBucket(TokenBucket tokenBucket) {
        this.tokenBucket = tokenBucket;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Daemon getDaemon() {
        return daemon;
    }

    public void setDaemon(Daemon daemon) {
        this.daemon = daemon;
    }

    public Upstream getUpstream() {
        return upstream;
    }

    public void setUpstream(Upstream upstream) {
        this.upstream = upstream;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class TokenBucket {
        private int capacity = 60;
        private double refillRatePerSecond = 1.0;

        public int getCapacity() {
            return Math.max(1, capacity);
        }

        public void setCapacity(int capacity) {
            this.capacity = Math.max(1, capacity);
        }

        public double getRefillRatePerSecond() {
            return refillRatePerSecond > 0 ? refillRatePerSecond : 0.0001;
        }

        public void setRefillRatePerSecond(double refillRatePerSecond) {
            this.refillRatePerSecond = refillRatePerSecond > 0 ? refillRatePerSecond : 0.0001;
        }
    }

    public static class Cache {
        private long ttlMinutes = 1440;

        public long getTtlMinutes() {
            return Math.max(1, ttlMinutes);
        }

        public void setTtlMinutes(long ttlMinutes) {
            this.ttlMinutes = Math.max(1, ttlMinutes);
        }
    }

    public static class Scheduler {
        private int sweepIntervalSeconds = 30;
        private int retryBaseDelayMs = 1000;
        private int retryMaxDelayMs = 300_000;
        private int maxRetries = 3;
        private int fetchConcurrency = 4;

        public int getSweepIntervalSeconds() {
            return Math.max(1, sweepIntervalSeconds);
        }

        public void setSweepIntervalSeconds(int sweepIntervalSeconds) {
            this.sweepIntervalSeconds = Math.max(1, sweepIntervalSeconds);
        }

        public int getRetryBaseDelayMs() {
            return Math.max(1, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(1, retryBaseDelayMs);
        }

        public int getRetryMaxDelayMs() {
            return Math.max(getRetryBaseDelayMs(), retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(int retryMaxDelayMs) {
            this.retryMaxDelayMs = retryMaxDelayMs;
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getFetchConcurrency() {
            return Math.max(1, fetchConcurrency);
        }

        public void setFetchConcurrency(int fetchConcurrency) {
            this.fetchConcurrency = Math.max(1, fetchConcurrency);
        }
    }

    public static class Daemon {
        private boolean enabled;
        private List<String> seedModIds = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getSeedModIds() {
            return seedModIds;
        }

        public void setSeedModIds(List<String> seedModIds) {
            this.seedModIds = seedModIds == null ? new ArrayList<>() : seedModIds;
        }
    }

    public static class Upstream {
        private String baseUrl = "https://api.curseforge.com/v1";
        private String apiKey;
        private String userAgent;
        private int requestTimeoutSeconds = 20;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            if (baseUrl == null || baseUrl.isBlank()) {
                return;
            }
            String trimmed = baseUrl.trim();
            this.baseUrl = trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey == null ? null : apiKey.trim();
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }
    }
}
