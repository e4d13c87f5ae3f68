/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.infra.cache;

import com.repoq.trs.infra.config.EnvironmentSettings;

import java.util.concurrent.TimeUnit;

/**
 * Normalization cache settings.
 *
 * <p><b>Environment Variable Override:</b>
 * <pre>
 * TRS_CACHE_ENABLED=true
 * TRS_CACHE_MAX_SIZE=50000
 * TRS_CACHE_TTL_MINUTES=30
 * TRS_CACHE_RECORD_STATS=true
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * NormalizationCache cache = CacheFactory.create(CacheConfig.fromEnvironment());
 * }</pre>
 */
public final class CacheConfig {

    private static final String ENV_ENABLED = "TRS_CACHE_ENABLED";
    private static final String ENV_MAX_SIZE = "TRS_CACHE_MAX_SIZE";
    private static final String ENV_TTL_MINUTES = "TRS_CACHE_TTL_MINUTES";
    private static final String ENV_RECORD_STATS = "TRS_CACHE_RECORD_STATS";

    private final boolean enabled;
    private final long maxSize;
    private final long ttlDuration;
    private final TimeUnit ttlUnit;
    private final boolean recordStats;

    private CacheConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.maxSize = builder.maxSize;
        this.ttlDuration = builder.ttlDuration;
        this.ttlUnit = builder.ttlUnit;
        this.recordStats = builder.recordStats;
        validate();
    }

    private void validate() {
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize must be >= 0: " + maxSize);
        }
        if (ttlDuration < 0) {
            throw new IllegalArgumentException("ttlDuration must be >= 0: " + ttlDuration);
        }
    }

    /**
     * Small cache without statistics.
     */
    public static CacheConfig forDevelopment() {
        return builder().enabled(true).maxSize(1_000).ttl(5, TimeUnit.MINUTES).recordStats(false).build();
    }

    /**
     * Larger cache with statistics, suitable for a full repository scan.
     */
    public static CacheConfig forProduction() {
        return builder().enabled(true).maxSize(100_000).ttl(60, TimeUnit.MINUTES).recordStats(true).build();
    }

    public static CacheConfig disabled() {
        return builder().enabled(false).build();
    }

    /**
     * Production defaults overridden by {@code TRS_CACHE_*} variables.
     */
    public static CacheConfig fromEnvironment() {
        CacheConfig defaults = forProduction();
        return builder()
                .enabled(EnvironmentSettings.getBoolean(ENV_ENABLED, defaults.enabled))
                .maxSize(EnvironmentSettings.getLong(ENV_MAX_SIZE, defaults.maxSize))
                .ttl(EnvironmentSettings.getLong(ENV_TTL_MINUTES, defaults.ttlUnit.toMinutes(defaults.ttlDuration)),
                        TimeUnit.MINUTES)
                .recordStats(EnvironmentSettings.getBoolean(ENV_RECORD_STATS, defaults.recordStats))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean enabled() {
        return enabled;
    }

    public long maxSize() {
        return maxSize;
    }

    public long ttlDuration() {
        return ttlDuration;
    }

    public TimeUnit ttlUnit() {
        return ttlUnit;
    }

    public boolean recordStats() {
        return recordStats;
    }

    @Override
    public String toString() {
        return "CacheConfig{enabled=" + enabled + ", maxSize=" + maxSize + ", ttl=" + ttlDuration + " " + ttlUnit
                + ", recordStats=" + recordStats + "}";
    }

    public static final class Builder {
        private boolean enabled = true;
        private long maxSize = 10_000;
        private long ttlDuration = 30;
        private TimeUnit ttlUnit = TimeUnit.MINUTES;
        private boolean recordStats = false;

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder maxSize(long maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder ttl(long duration, TimeUnit unit) {
            this.ttlDuration = duration;
            this.ttlUnit = unit;
            return this;
        }

        public Builder recordStats(boolean recordStats) {
            this.recordStats = recordStats;
            return this;
        }

        public CacheConfig build() {
            return new CacheConfig(this);
        }
    }
}
