/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.semver;

import com.repoq.trs.api.NormalizationDomain;
import com.repoq.trs.api.SemanticOracle;
import com.repoq.trs.api.TermGenerator;
import com.repoq.trs.api.TermModel;
import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.RuleSet;

/**
 * npm-style semantic version ranges.
 */
public final class SemVerDomain implements NormalizationDomain {

    private final SemVerModel model = new SemVerModel();
    private final RuleSet ruleSet = SemVerRules.create();
    private final SemVerGenerator generator = new SemVerGenerator();
    private final SemVerOracle oracle = new SemVerOracle(model);

    @Override
    public Domain domain() {
        return Domain.SEMVER;
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
