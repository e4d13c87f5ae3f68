/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.runtime;

import com.repoq.trs.api.model.NormalizationResult;
import com.repoq.trs.infra.metrics.Counter;
import com.repoq.trs.infra.metrics.MetricsRegistry;
import com.repoq.trs.infra.metrics.Timer;

import java.time.Duration;

/**
 * Counters and latency for one engine, tagged with the domain and rule-set id.
 */
final class EngineMetrics {

    private final Counter calls;
    private final Counter steps;
    private final Counter nonTerminating;
    private final Counter ruleFailures;
    private final Timer latency;

    EngineMetrics(MetricsRegistry registry, String domain, String ruleSetId) {
        String[] tags = {"domain", domain, "ruleset", ruleSetId};
        this.calls = registry.counter("trs.normalize.calls", tags);
        this.steps = registry.counter("trs.normalize.steps", tags);
        this.nonTerminating = registry.counter("trs.normalize.nonterminating", tags);
        this.ruleFailures = registry.counter("trs.normalize.rule_failures", tags);
        this.latency = registry.timer("trs.normalize.latency", tags);
    }

    void record(NormalizationResult result, long elapsedNanos) {
        calls.increment();
        steps.increment(result.stepsTaken());
        switch (result.outcome()) {
            case STEP_LIMIT, DEADLINE -> nonTerminating.increment();
            case RULE_FAILURE -> ruleFailures.increment();
            default -> {
            }
        }
        latency.record(Duration.ofNanos(elapsedNanos));
    }
}
