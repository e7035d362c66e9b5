package com.lawcheck.eval;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.lawcheck.model.Condition;

/**
 * Caches evaluation results by {@code (condition, context fingerprint)}.
 *
 * Only valid when every custom predicate reachable from the evaluated
 * conditions is pure; a hit must never differ from a cold evaluation.
 */
public final class MemoizingConditionEvaluator implements ConditionEvaluator {

    private final ConditionEvaluator delegate;
    private final Cache<Key, Boolean> cache;

    public MemoizingConditionEvaluator(ConditionEvaluator delegate, long maximumSize) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .recordStats()
            .build();
    }

    @Override
    public boolean evaluate(Condition condition, EvaluationContext context) {
        return cache.get(new Key(condition, context.fingerprint()),
            key -> delegate.evaluate(condition, context));
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    private record Key(Condition condition, String contextFingerprint) {}
}
