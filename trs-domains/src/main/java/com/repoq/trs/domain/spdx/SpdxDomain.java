/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.spdx;

import com.repoq.trs.api.NormalizationDomain;
import com.repoq.trs.api.SemanticOracle;
import com.repoq.trs.api.TermGenerator;
import com.repoq.trs.api.TermModel;
import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.RuleSet;

/**
 * SPDX license expressions.
 */
public final class SpdxDomain implements NormalizationDomain {

    private final SpdxModel model = new SpdxModel();
    private final RuleSet ruleSet = SpdxRules.create();
    private final SpdxGenerator generator = new SpdxGenerator();
    private final SpdxOracle oracle = new SpdxOracle();

    @Override
    public Domain domain() {
        return Domain.SPDX;
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
