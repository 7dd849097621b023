package com.example.vrpassistant.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Periodic caller of {@link ContextStore#evictOlderThan(Duration)}. The store itself never
 * expires entries on its own.
 */
@Service
@ConditionalOnProperty(name = "app.context.eviction.enabled", havingValue = "true", matchIfMissing = true)
public class ContextEvictionScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ContextEvictionScheduler.class);

    private final ContextStore contextStore;
    private final Duration maxAge;

    public ContextEvictionScheduler(ContextStore contextStore,
                                    @Value("${app.context.eviction.max-age:PT24H}") Duration maxAge) {
        this.contextStore = contextStore;
        this.maxAge = maxAge;
    }

    @Scheduled(fixedDelayString = "${app.context.eviction.interval-ms:3600000}",
               initialDelayString = "${app.context.eviction.interval-ms:3600000}")
    public void run() {
        try {
            int removed = contextStore.evictOlderThan(maxAge);
            logger.debug("Eviction pass removed {} sessions, {} remain", removed, contextStore.size());
        } catch (ContextStoreException e) {
            logger.warn("Eviction pass skipped: {}", e.getMessage());
        }
    }

    public Duration getMaxAge() {
        return maxAge;
    }
}
