/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.infra.metrics;

import java.time.Duration;

/**
 * Latency recorder with percentile lookup.
 * Thread-safe.
 */
public interface Timer {

    void record(Duration duration);

    /**
     * @param percentile value between 0.0 and 1.0
     * @return recorded duration at that percentile, {@link Duration#ZERO} when empty
     */
    Duration percentile(double percentile);

    long count();
}
