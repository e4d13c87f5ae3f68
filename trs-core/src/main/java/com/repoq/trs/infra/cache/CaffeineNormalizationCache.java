/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.infra.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.repoq.trs.api.model.NormalizationResult;

import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * In-process normalization cache backed by Caffeine (W-TinyLFU eviction, lock-free reads).
 *
 * <p>Results that did not reach a normal form are rejected, so a transient step-limit hit is
 * retried on the next lookup instead of being served from the cache.
 */
public final class CaffeineNormalizationCache implements NormalizationCache {

    private static final Logger logger = Logger.getLogger(CaffeineNormalizationCache.class.getName());

    private final Cache<CacheKey, NormalizationResult> cache;
    private final boolean statsEnabled;

    private CaffeineNormalizationCache(Builder builder) {
        Caffeine<Object, Object> cacheBuilder = Caffeine.newBuilder();
        if (builder.maxSize > 0) {
            cacheBuilder.maximumSize(builder.maxSize);
        }
        if (builder.expireAfterWriteDuration > 0) {
            cacheBuilder.expireAfterWrite(builder.expireAfterWriteDuration, builder.expireAfterWriteUnit);
        }
        this.statsEnabled = builder.recordStats;
        if (builder.recordStats) {
            cacheBuilder.recordStats();
        }
        this.cache = cacheBuilder.build();

        logger.info(String.format("CaffeineNormalizationCache initialized: maxSize=%d, ttl=%d %s, stats=%b",
                builder.maxSize, builder.expireAfterWriteDuration, builder.expireAfterWriteUnit, builder.recordStats));
    }

    @Override
    public Optional<NormalizationResult> get(CacheKey key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(CacheKey key, NormalizationResult result) {
        if (!result.terminated()) {
            logger.fine("Not caching non-terminated result for " + key);
            return;
        }
        cache.put(key, result);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    @Override
    public CacheMetrics getMetrics() {
        CacheStats stats = statsEnabled ? cache.stats() : CacheStats.empty();
        return new CacheMetrics(
                stats.hitRate(),
                stats.requestCount(),
                stats.hitCount(),
                stats.missCount(),
                stats.evictionCount(),
                cache.estimatedSize());
    }

    /**
     * Forces pending evictions; for tests.
     */
    public void cleanup() {
        cache.cleanUp();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long maxSize = 10_000;
        private long expireAfterWriteDuration = 30;
        private TimeUnit expireAfterWriteUnit = TimeUnit.MINUTES;
        private boolean recordStats = false;

        public Builder maxSize(long maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder expireAfterWrite(long duration, TimeUnit unit) {
            this.expireAfterWriteDuration = duration;
            this.expireAfterWriteUnit = unit;
            return this;
        }

        public Builder recordStats(boolean recordStats) {
            this.recordStats = recordStats;
            return this;
        }

        public CaffeineNormalizationCache build() {
            return new CaffeineNormalizationCache(this);
        }
    }
}
