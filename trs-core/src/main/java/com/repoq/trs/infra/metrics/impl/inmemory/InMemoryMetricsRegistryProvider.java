/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.infra.metrics.impl.inmemory;

import com.repoq.trs.infra.metrics.MetricsRegistry;
import com.repoq.trs.infra.metrics.api.MetricsRegistryProvider;

/**
 * Provider for {@link InMemoryMetricsRegistry}. Registered by the runner and by test
 * resources.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public String name() {
        return "InMemory";
    }
}
