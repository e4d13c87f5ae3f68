/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.infra.metrics.api;

import com.repoq.trs.infra.metrics.MetricsRegistry;

/**
 * Service Provider Interface for {@link MetricsRegistry} implementations.
 *
 * <p>Implementations need a public no-arg constructor and are registered in
 * {@code META-INF/services/com.repoq.trs.infra.metrics.api.MetricsRegistryProvider}.
 */
public interface MetricsRegistryProvider {

    /**
     * @return a thread-safe registry
     */
    MetricsRegistry create();

    /**
     * Higher values win when several providers are present.
     */
    default int priority() {
        return 0;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
