package com.ascend.modsync.config;

import com.ascend.modsync.sync.http.UpstreamQuotaTracker;
import com.ascend.modsync.sync.service.MetadataCache;
import com.ascend.modsync.sync.service.TokenBucket;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ModSyncConfig {

    @Bean(name = "fetchExecutor", destroyMethod = "shutdown")
    public ExecutorService fetchExecutor(ModSyncProperties properties) {
        return Executors.newFixedThreadPool(
            properties.getScheduler().getFetchConcurrency(),
            namedDaemonThreads("mod-fetch-worker")
        );
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ModSyncProperties properties) {
        int size = Math.max(2, properties.getScheduler().getFetchConcurrency());
        return Executors.newFixedThreadPool(size, namedDaemonThreads("mod-http"));
    }

    @Bean(name = "syncScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService syncScheduler() {
        return Executors.newSingleThreadScheduledExecutor(namedDaemonThreads("mod-sync-scheduler"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenBucket tokenBucket(ModSyncProperties properties) {
        return new TokenBucket(
            properties.getTokenBucket().getCapacity(),
            properties.getTokenBucket().getRefillRatePerSecond()
        );
    }

    @Bean
    public MetadataCache metadataCache(ModSyncProperties properties, Clock clock) {
        return new MetadataCache(clock, Duration.ofMinutes(properties.getCache().getTtlMinutes()));
    }

    @Bean
    public UpstreamQuotaTracker upstreamQuotaTracker(Clock clock) {
        return new UpstreamQuotaTracker(clock);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
