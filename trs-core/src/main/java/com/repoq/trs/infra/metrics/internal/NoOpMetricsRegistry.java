/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.infra.metrics.internal;

import com.repoq.trs.infra.metrics.Counter;
import com.repoq.trs.infra.metrics.MetricsRegistry;
import com.repoq.trs.infra.metrics.Timer;

import java.time.Duration;

/**
 * Fallback when no provider is configured.
 */
public final class NoOpMetricsRegistry implements MetricsRegistry {

    public static final NoOpMetricsRegistry INSTANCE = new NoOpMetricsRegistry();

    private static final Counter NO_OP_COUNTER = new NoOpCounter();
    private static final Timer NO_OP_TIMER = new NoOpTimer();

    private NoOpMetricsRegistry() {
    }

    @Override
    public Counter counter(String name, String... tags) {
        return NO_OP_COUNTER;
    }

    @Override
    public Timer timer(String name, String... tags) {
        return NO_OP_TIMER;
    }

    private static final class NoOpCounter implements Counter {
        public void increment() {}
        public void increment(long amount) {}
        public long count() { return 0L; }
    }

    private static final class NoOpTimer implements Timer {
        public void record(Duration duration) {}
        public Duration percentile(double p) { return Duration.ZERO; }
        public long count() { return 0L; }
    }
}
