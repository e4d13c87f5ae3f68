/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.infra.cache;

import com.repoq.trs.api.model.NormalizationResult;

import java.util.Optional;

/**
 * Cache that stores nothing. Used when caching is disabled and in determinism checks.
 */
public final class NoOpNormalizationCache implements NormalizationCache {

    public static final NoOpNormalizationCache INSTANCE = new NoOpNormalizationCache();

    private NoOpNormalizationCache() {
    }

    @Override
    public Optional<NormalizationResult> get(CacheKey key) {
        return Optional.empty();
    }

    @Override
    public void put(CacheKey key, NormalizationResult result) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheMetrics getMetrics() {
        return CacheMetrics.empty();
    }
}
