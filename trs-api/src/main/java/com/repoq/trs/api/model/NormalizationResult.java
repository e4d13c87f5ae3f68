/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one {@code normalize} call.
 *
 * <p>Non-termination and rule failures are reported here rather than thrown: the caller gets
 * the best partial term together with {@code terminated() == false} and can degrade
 * gracefully.
 *
 * @param original    input term
 * @param normalForm  normal form, or the last term reached when normalization stopped early
 * @param stepsTaken  number of contractions performed
 * @param outcome     why normalization stopped
 * @param trace       steps in order; empty unless tracing was enabled
 */
public record NormalizationResult(
        Term original,
        Term normalForm,
        int stepsTaken,
        Outcome outcome,
        List<RewriteStep> trace
) {

    public NormalizationResult {
        Objects.requireNonNull(original, "original must not be null");
        Objects.requireNonNull(normalForm, "normalForm must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        trace = trace == null ? List.of() : List.copyOf(trace);
        if (stepsTaken < 0) {
            throw new IllegalArgumentException("stepsTaken must be >= 0");
        }
    }

    public static NormalizationResult alreadyNormal(Term term) {
        return new NormalizationResult(term, term, 0, Outcome.NORMAL_FORM, List.of());
    }

    /**
     * {@code true} iff a normal form was reached.
     */
    public boolean terminated() {
        return outcome == Outcome.NORMAL_FORM;
    }

    public boolean changed() {
        return stepsTaken > 0;
    }

    /**
     * Why the rewrite loop stopped.
     */
    public enum Outcome {
        /** No rule applies anywhere. */
        NORMAL_FORM,
        /** The step bound was exhausted (non-termination suspected). */
        STEP_LIMIT,
        /** The wall-clock deadline passed between two steps. */
        DEADLINE,
        /** A side condition or replacement threw; the term before that step is returned. */
        RULE_FAILURE
    }
}
