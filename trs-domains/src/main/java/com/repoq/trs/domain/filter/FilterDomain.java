/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.filter;

import com.repoq.trs.api.NormalizationDomain;
import com.repoq.trs.api.SemanticOracle;
import com.repoq.trs.api.TermGenerator;
import com.repoq.trs.api.TermModel;
import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.RuleSet;

/**
 * Path filters over literals and globs.
 */
public final class FilterDomain implements NormalizationDomain {

    private final FilterModel model = new FilterModel();
    private final RuleSet ruleSet = FilterRules.create();
    private final FilterGenerator generator = new FilterGenerator();
    private final FilterOracle oracle = new FilterOracle();

    @Override
    public Domain domain() {
        return Domain.FILTER;
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
