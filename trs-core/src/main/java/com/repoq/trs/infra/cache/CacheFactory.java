/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.infra.cache;

/**
 * Creates the cache implementation selected by a {@link CacheConfig}.
 */
public final class CacheFactory {

    private CacheFactory() {
        throw new AssertionError("No instances");
    }

    public static NormalizationCache create(CacheConfig config) {
        if (!config.enabled() || config.maxSize() == 0) {
            return NoOpNormalizationCache.INSTANCE;
        }
        return CaffeineNormalizationCache.builder()
                .maxSize(config.maxSize())
                .expireAfterWrite(config.ttlDuration(), config.ttlUnit())
                .recordStats(config.recordStats())
                .build();
    }
}
