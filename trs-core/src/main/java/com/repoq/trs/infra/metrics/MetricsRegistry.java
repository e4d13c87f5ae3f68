/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.infra.metrics;

import com.repoq.trs.infra.metrics.internal.MetricsRegistryHolder;
import com.repoq.trs.infra.metrics.internal.NoOpMetricsRegistry;

/**
 * Framework-agnostic metrics registry.
 *
 * <p>The process-wide instance is discovered via {@link java.util.ServiceLoader}; engines and
 * verifiers also accept an explicit registry so tests can observe them in isolation.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * MetricsRegistry metrics = MetricsRegistry.getInstance();
 * metrics.counter("trs.normalize.calls", "domain", "spdx").increment();
 * }</pre>
 */
public interface MetricsRegistry {

    /**
     * Creates or retrieves a counter.
     *
     * @param name metric name
     * @param tags alternating key/value pairs
     */
    Counter counter(String name, String... tags);

    /**
     * Creates or retrieves a timer.
     *
     * @param name metric name
     * @param tags alternating key/value pairs
     */
    Timer timer(String name, String... tags);

    /**
     * Registry selected by the highest-priority provider on the class path, or the no-op
     * registry when there is none.
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }

    static MetricsRegistry noop() {
        return NoOpMetricsRegistry.INSTANCE;
    }
}
