/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api.model;

import java.util.Objects;

/**
 * One contraction: {@code redex} at {@code position} was rewritten to {@code contractum} by
 * {@code ruleName}. Redex and contractum are {@code null} in {@link TraceLevel#BASIC} traces.
 */
public record RewriteStep(int index, String ruleName, Position position, Term redex, Term contractum) {

    public RewriteStep {
        Objects.requireNonNull(ruleName, "ruleName must not be null");
        Objects.requireNonNull(position, "position must not be null");
    }

    public RewriteStep withoutTerms() {
        return new RewriteStep(index, ruleName, position, null, null);
    }

    @Override
    public String toString() {
        return "#" + index + " " + ruleName + " @" + position;
    }
}
