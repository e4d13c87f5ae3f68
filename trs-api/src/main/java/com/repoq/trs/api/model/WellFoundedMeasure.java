/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api.model;

import java.util.List;
import java.util.Objects;
import java.util.function.ToLongFunction;

/**
 * Human-supplied termination argument for a rule: a map from terms into a well-ordered set
 * that every application of the rule must strictly decrease.
 */
public interface WellFoundedMeasure {

    String name();

    MeasureValue apply(Term term);

    /**
     * Single-component measure from a non-negative integer function.
     */
    static WellFoundedMeasure of(String name, ToLongFunction<Term> function) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(function, "function must not be null");
        return new WellFoundedMeasure() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public MeasureValue apply(Term term) {
                return MeasureValue.of(function.applyAsLong(term));
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }

    /**
     * Concatenates the components of {@code parts}, most significant first.
     */
    static WellFoundedMeasure lexicographic(WellFoundedMeasure... parts) {
        if (parts.length == 0) {
            throw new IllegalArgumentException("lexicographic measure needs at least one part");
        }
        List<WellFoundedMeasure> ordered = List.of(parts);
        StringBuilder name = new StringBuilder("lex(");
        for (int i = 0; i < parts.length; i++) {
            name.append(i == 0 ? "" : ", ").append(parts[i].name());
        }
        String joinedName = name.append(')').toString();
        return new WellFoundedMeasure() {
            @Override
            public String name() {
                return joinedName;
            }

            @Override
            public MeasureValue apply(Term term) {
                MeasureValue value = ordered.get(0).apply(term);
                for (int i = 1; i < ordered.size(); i++) {
                    value = value.concat(ordered.get(i).apply(term));
                }
                return value;
            }

            @Override
            public String toString() {
                return joinedName;
            }
        };
    }
}
