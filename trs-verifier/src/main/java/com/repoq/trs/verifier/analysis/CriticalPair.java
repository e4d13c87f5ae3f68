/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.verifier.analysis;

import com.repoq.trs.api.model.Position;
import com.repoq.trs.api.model.Term;

import java.util.Objects;

/**
 * One overlap of two rules and what sampling found out about it.
 *
 * @param outerRule  rule applied at the root of the overlap
 * @param innerRule  rule applied at {@code position}
 * @param position   position in the outer pattern where the inner pattern was unified
 * @param overlap    most general common instance of both left-hand sides
 * @param status     verdict over the sampled ground instances
 * @param instances  number of ground instances to which both rules applied
 * @param exhaustive whether the sample space was enumerated completely
 * @param witness    smallest instance that proves the status, or {@code null}
 * @param reduct1    normal form of the outer contraction of {@code witness}, or {@code null}
 * @param reduct2    normal form of the inner contraction of {@code witness}, or {@code null}
 */
public record CriticalPair(
        String outerRule,
        String innerRule,
        Position position,
        Term overlap,
        Status status,
        int instances,
        boolean exhaustive,
        Term witness,
        Term reduct1,
        Term reduct2
) {

    public CriticalPair {
        Objects.requireNonNull(outerRule, "outerRule must not be null");
        Objects.requireNonNull(innerRule, "innerRule must not be null");
        Objects.requireNonNull(position, "position must not be null");
        Objects.requireNonNull(overlap, "overlap must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    public enum Status {
        /** Both reducts of every sampled instance reach the same normal form. */
        JOINABLE,
        /** Some sampled instance has two different normal forms. */
        NOT_JOINABLE,
        /** The overlap is ground and the two rules never both apply to it. */
        INFEASIBLE,
        /** A reduct did not reach a normal form within the step bound, or no sample made both rules apply. */
        UNDECIDED
    }

    public String describe() {
        return outerRule + " / " + innerRule + " @" + position + ": " + status
                + (exhaustive ? "" : " (non-exhaustive)");
    }
}
