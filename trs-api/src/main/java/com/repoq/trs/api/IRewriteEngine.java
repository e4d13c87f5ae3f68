/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api;

import com.repoq.trs.api.model.NormalizationResult;
import com.repoq.trs.api.model.RewriteStep;
import com.repoq.trs.api.model.RuleSet;
import com.repoq.trs.api.model.Term;

import java.util.List;
import java.util.Optional;

/**
 * Rewrites terms to normal form with one fixed {@link RuleSet}.
 *
 * <h2>Strategy</h2>
 * <p>Leftmost-outermost. At each position the candidate rules are tried in declaration order;
 * a rule whose side condition is false is skipped.
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations must be thread-safe. Terms and rule sets are immutable, so independent
 * terms can be normalized concurrently without locking.
 *
 * <h2>Failure semantics</h2>
 * <p>{@code normalize} never throws for non-termination or for a failing rule; it returns the
 * best partial term with {@link NormalizationResult#terminated()} {@code == false}.
 */
public interface IRewriteEngine {

    RuleSet ruleSet();

    /**
     * Normalizes with the engine's configured step bound.
     */
    NormalizationResult normalize(Term term);

    /**
     * Normalizes with an explicit step bound.
     *
     * @param maxSteps maximum number of contractions, must be positive
     */
    NormalizationResult normalize(Term term, int maxSteps);

    /**
     * Leftmost-outermost redex and its contraction, if any rule applies.
     */
    Optional<RewriteStep> findRedex(Term term);

    /**
     * One leftmost-outermost rewrite step.
     *
     * @return the rewritten term, or empty if {@code term} is a normal form
     */
    Optional<Term> applyStep(Term term);

    /**
     * Normalizes terms independently. Order of results matches order of inputs.
     */
    default List<NormalizationResult> normalizeBatch(List<Term> terms) {
        return terms.stream().map(this::normalize).toList();
    }
}
