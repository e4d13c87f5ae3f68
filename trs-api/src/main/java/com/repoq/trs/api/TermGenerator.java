/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api;

import com.repoq.trs.api.model.Term;

import java.util.List;

/**
 * Source of test terms for one domain: curated edge cases, seeded random terms and small
 * ground samples used to instantiate rule patterns.
 */
public interface TermGenerator {

    /**
     * Hand-picked surface strings that exercise edge cases of the rule set.
     */
    List<String> curatedSources();

    /**
     * Pseudo-random terms. The same seed always yields the same list.
     *
     * @param count    number of terms
     * @param maxDepth maximum nesting depth
     * @param seed     random seed
     */
    List<Term> generate(int count, int maxDepth, long seed);

    /**
     * Small ground terms that may replace a metavariable of the given sort.
     *
     * @param sort head operator required by a sorted variable, or {@code null} for any term
     */
    List<Term> groundSamples(String sort);
}
