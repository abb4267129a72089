package com.di.phaselink.bus;

import com.di.phaselink.config.PhaseLinkProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Remembers which (subscription, producer, content hash) triples were already processed so that a
 * redelivered duplicate is acknowledged without re-running the stage. Entries are only added after
 * a successful run; bounded by size and expire after write.
 */
@Component
public class DeliveryDeduplicator {

    private final Cache<String, Boolean> processed;

    @Autowired
    public DeliveryDeduplicator(PhaseLinkProperties properties) {
        this(properties.getDedup().getMaxSize(), properties.getDedup().getExpireAfterWrite());
    }

    public DeliveryDeduplicator(long maxSize, Duration expireAfterWrite) {
        this.processed = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(expireAfterWrite)
                .build();
    }

    public boolean isDuplicate(String subscription, String producingStage, String contentHash) {
        if (contentHash == null) {
            return false;
        }
        return processed.getIfPresent(key(subscription, producingStage, contentHash)) != null;
    }

    public void markProcessed(String subscription, String producingStage, String contentHash) {
        if (contentHash != null) {
            processed.put(key(subscription, producingStage, contentHash), Boolean.TRUE);
        }
    }

    private static String key(String subscription, String producingStage, String contentHash) {
        return subscription + '|' + producingStage + '|' + contentHash;
    }
}
