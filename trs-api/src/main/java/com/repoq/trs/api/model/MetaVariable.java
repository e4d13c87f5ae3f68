/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api.model;

import java.util.List;
import java.util.Objects;

/**
 * Pattern variable. Appears only in rule patterns, templates and overlap terms.
 *
 * <p>An unsorted variable ({@code sort == null}) matches any term. A sorted variable matches
 * only terms whose {@link Term#operator()} equals its sort, which lets a rule address a
 * variadic node such as a graph or an aggregate as a whole.
 *
 * <p>{@code generation} distinguishes otherwise equal names when two patterns are renamed
 * apart before unification.
 */
public record MetaVariable(String name, String sort, int generation) implements Term {

    public MetaVariable {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Variable name must not be blank");
        }
        if (generation < 0) {
            throw new IllegalArgumentException("generation must be >= 0");
        }
    }

    public static MetaVariable of(String name) {
        return new MetaVariable(name, null, 0);
    }

    public static MetaVariable sorted(String name, String sort) {
        return new MetaVariable(name, Objects.requireNonNull(sort, "sort must not be null"), 0);
    }

    /**
     * Binding key: name plus generation. The sort is a constraint, not part of identity.
     */
    public String key() {
        return generation == 0 ? name : name + "#" + generation;
    }

    public MetaVariable withGeneration(int newGeneration) {
        return new MetaVariable(name, sort, newGeneration);
    }

    public boolean isSorted() {
        return sort != null;
    }

    /**
     * Whether this variable may stand for a term with the given head operator.
     */
    public boolean admits(Term term) {
        if (sort == null) {
            return true;
        }
        if (term instanceof MetaVariable other) {
            return other.sort == null || sort.equals(other.sort);
        }
        return sort.equals(term.operator());
    }

    @Override
    public Domain domain() {
        return null;
    }

    @Override
    public String operator() {
        return "?";
    }

    @Override
    public List<Term> arguments() {
        return List.of();
    }

    @Override
    public Term withArguments(List<Term> arguments) {
        return this;
    }

    @Override
    public Object payload() {
        return key();
    }

    @Override
    public boolean isVariable() {
        return true;
    }

    @Override
    public String toString() {
        return sort == null ? "?" + key() : "?" + key() + ":" + sort;
    }
}
