/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.infra.cache;

import com.repoq.trs.api.model.NormalizationResult;

import java.util.Optional;

/**
 * Optional memo of normalization results. Only terminated results are worth caching.
 *
 * <p>Implementations must be thread-safe.
 */
public interface NormalizationCache {

    Optional<NormalizationResult> get(CacheKey key);

    void put(CacheKey key, NormalizationResult result);

    void invalidateAll();

    CacheMetrics getMetrics();

    /**
     * Point-in-time cache statistics.
     *
     * @param hitRate       hits / requests, 0.0 when no requests
     * @param requestCount  lookups
     * @param hitCount      lookups that found an entry
     * @param missCount     lookups that found nothing
     * @param evictionCount entries evicted by size or age
     * @param size          estimated entry count
     */
    record CacheMetrics(double hitRate, long requestCount, long hitCount, long missCount,
                        long evictionCount, long size) {

        public static CacheMetrics empty() {
            return new CacheMetrics(0.0, 0, 0, 0, 0, 0);
        }
    }
}
