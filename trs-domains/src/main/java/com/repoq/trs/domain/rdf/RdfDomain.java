/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.rdf;

import com.repoq.trs.api.NormalizationDomain;
import com.repoq.trs.api.SemanticOracle;
import com.repoq.trs.api.TermGenerator;
import com.repoq.trs.api.TermModel;
import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.RuleSet;

/**
 * RDF graphs in N-Triples or Turtle syntax, canonicalized to sorted N-Triples.
 */
public final class RdfDomain implements NormalizationDomain {

    private final RdfModel model = new RdfModel();
    private final RuleSet ruleSet = RdfRules.create();
    private final RdfGenerator generator = new RdfGenerator();
    private final RdfOracle oracle = new RdfOracle();

    @Override
    public Domain domain() {
        return Domain.RDF;
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
