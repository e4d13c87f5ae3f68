/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api;

import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.RuleSet;

/**
 * Everything needed to normalize and verify one domain.
 */
public interface NormalizationDomain {

    Domain domain();

    TermModel model();

    RuleSet ruleSet();

    TermGenerator generator();

    SemanticOracle oracle();
}
