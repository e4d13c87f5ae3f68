/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.metrics;

import com.repoq.trs.api.NormalizationDomain;
import com.repoq.trs.api.SemanticOracle;
import com.repoq.trs.api.TermGenerator;
import com.repoq.trs.api.TermModel;
import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.RuleSet;

/**
 * Metric aggregation formulas.
 */
public final class MetricsDomain implements NormalizationDomain {

    private final MetricsModel model = new MetricsModel();
    private final RuleSet ruleSet = MetricsRules.create();
    private final MetricsGenerator generator = new MetricsGenerator();
    private final MetricsOracle oracle = new MetricsOracle();

    @Override
    public Domain domain() {
        return Domain.METRICS;
    }

    @Override
    public TermModel model() {
        return model;
    }

    @Override
    public RuleSet ruleSet() {
        return ruleSet;
    }

    @Override
    public TermGenerator generator() {
        return generator;
    }

    @Override
    public SemanticOracle oracle() {
        return oracle;
    }
}
