package com.stratdsl.engine;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded record of evaluation request ids already processed, so that a redelivered request
 * produces no second evaluation and no second publication.
 *
 * <p>Entries expire {@code ttl} after they were claimed and the oldest are evicted beyond
 * {@code maxSize}, so memory stays bounded in long-running processes. Claiming is atomic through
 * the cache's {@code ConcurrentMap} view; concurrent claims of the same id let exactly one
 * caller through.
 */
public class ProcessedRequestCache {

    private static final Logger log = LoggerFactory.getLogger(ProcessedRequestCache.class);

    private final Cache<String, Instant> processed;

    public ProcessedRequestCache(long maxSize, Duration ttl) {
        this(maxSize, ttl, Ticker.systemTicker());
    }

    public ProcessedRequestCache(long maxSize, Duration ttl, Ticker ticker) {
        this.processed = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    /**
     * Records {@code requestId} as processed.
     *
     * @return true if this call claimed the id, false if it had already been claimed
     */
    public boolean claim(String requestId, Instant claimedAt) {
        Instant previous = processed.asMap().putIfAbsent(requestId, claimedAt);
        if (previous != null) {
            log.debug("Request {} already processed at {}", requestId, previous);
            return false;
        }
        return true;
    }

    public boolean isProcessed(String requestId) {
        return processed.getIfPresent(requestId) != null;
    }

    public long size() {
        processed.cleanUp();
        return processed.estimatedSize();
    }

    public void clear() {
        processed.invalidateAll();
    }
}
