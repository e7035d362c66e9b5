package com.lawcheck.verify;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Size-bounded cache of check outcomes, keyed by content fingerprints.
 *
 * The cache is created by the caller and handed to the verifier; it is never
 * shared implicitly. A key is computed at most once at a time, and stored
 * outcomes are immutable snapshots, so a hit returns exactly what a cold run
 * would have produced.
 */
public class VerificationCache {

    private static final Logger log = LoggerFactory.getLogger(VerificationCache.class);

    public static final long DEFAULT_MAXIMUM_SIZE = 10_000;

    private final Cache<String, CheckOutcome> cache;

    public VerificationCache() {
        this(DEFAULT_MAXIMUM_SIZE);
    }

    public VerificationCache(long maximumSize) {
        this.cache = Caffeine.newBuilder()
            .recordStats()
            .maximumSize(maximumSize)
            .build();
    }

    public CheckOutcome get(String key, Supplier<CheckOutcome> compute) {
        return cache.get(key, k -> compute.get());
    }

    public long size() {
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public void invalidateAll() {
        log.info("Invalidating verification cache ({} entries)", cache.estimatedSize());
        cache.invalidateAll();
    }
}
