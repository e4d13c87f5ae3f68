/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.runtime;

import com.repoq.trs.api.model.TraceLevel;
import com.repoq.trs.infra.config.EnvironmentSettings;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Rewrite engine settings.
 *
 * <p>Environment overrides: {@code TRS_MAX_STEPS}, {@code TRS_DEADLINE_MS},
 * {@code TRS_TRACE_LEVEL} (or the {@code trs.max.steps}-style system properties).
 */
public final class EngineConfig {

    public static final int DEFAULT_MAX_STEPS = 10_000;

    private final int maxSteps;
    private final Duration deadline;
    private final TraceLevel traceLevel;

    private EngineConfig(Builder builder) {
        this.maxSteps = builder.maxSteps;
        this.deadline = builder.deadline;
        this.traceLevel = builder.traceLevel;
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive: " + maxSteps);
        }
        if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
            throw new IllegalArgumentException("deadline must be positive: " + deadline);
        }
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static EngineConfig fromEnvironment() {
        Builder builder = builder()
                .maxSteps(EnvironmentSettings.getInt("TRS_MAX_STEPS", DEFAULT_MAX_STEPS))
                .traceLevel(TraceLevel.valueOf(EnvironmentSettings.getString("TRS_TRACE_LEVEL", "NONE")
                        .toUpperCase(Locale.ROOT)));
        long deadlineMillis = EnvironmentSettings.getLong("TRS_DEADLINE_MS", 0);
        if (deadlineMillis > 0) {
            builder.deadline(Duration.ofMillis(deadlineMillis));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().maxSteps(maxSteps).deadline(deadline).traceLevel(traceLevel);
    }

    public int maxSteps() {
        return maxSteps;
    }

    /**
     * Wall-clock bound per normalize call, or {@code null} for none.
     */
    public Duration deadline() {
        return deadline;
    }

    public TraceLevel traceLevel() {
        return traceLevel;
    }

    @Override
    public String toString() {
        return "EngineConfig{maxSteps=" + maxSteps + ", deadline=" + deadline + ", traceLevel=" + traceLevel + "}";
    }

    public static final class Builder {
        private int maxSteps = DEFAULT_MAX_STEPS;
        private Duration deadline;
        private TraceLevel traceLevel = TraceLevel.NONE;

        public Builder maxSteps(int maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder deadline(Duration deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder traceLevel(TraceLevel traceLevel) {
            this.traceLevel = Objects.requireNonNull(traceLevel, "traceLevel must not be null");
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
