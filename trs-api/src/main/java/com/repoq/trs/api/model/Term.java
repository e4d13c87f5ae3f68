/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api.model;

import java.util.List;
import java.util.Objects;

/**
 * Immutable node of a term tree.
 *
 * <p>Each domain declares a sealed family of record variants implementing this interface.
 * The methods here give every variant the same first-order view (head symbol plus ordered
 * children) so matching, unification, substitution and ordering are written once and work
 * for all five domains.
 *
 * <h2>Head of a node</h2>
 * <p>Two nodes have the same head when they are of the same variant class and agree on
 * {@link #operator()}, {@link #payload()} and arity. Leaves carry their identity in the
 * payload (a license id, a version tuple, an IRI); inner nodes usually have a {@code null}
 * payload, but may carry one for non-term attributes such as a {@code WITH} exception id.
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations must be deeply immutable. {@link #arguments()} returns an unmodifiable
 * list.
 */
public interface Term {

    /**
     * Domain of this term, or {@code null} for domain-agnostic pattern variables.
     */
    Domain domain();

    /**
     * Head symbol, e.g. {@code "or"}, {@code "graph"}, {@code "version"}.
     */
    String operator();

    /**
     * Ordered children. Empty for leaves.
     */
    List<Term> arguments();

    /**
     * Returns a node with the same head and the given children.
     *
     * @param arguments new children; size must equal {@code arguments().size()} for
     *                  fixed-arity variants
     */
    Term withArguments(List<Term> arguments);

    /**
     * Leaf label or non-child attribute; {@code null} when the head is the operator alone.
     */
    default Object payload() {
        return null;
    }

    default boolean isLeaf() {
        return arguments().isEmpty();
    }

    default boolean isVariable() {
        return false;
    }

    /**
     * Head comparison used by structural equality, matching and unification.
     */
    default boolean sameHead(Term other) {
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        return operator().equals(other.operator())
                && Objects.equals(payload(), other.payload())
                && arguments().size() == other.arguments().size();
    }
}
