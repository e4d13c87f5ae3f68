/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.runtime.measure;

import com.repoq.trs.api.model.Term;
import com.repoq.trs.api.model.WellFoundedMeasure;
import com.repoq.trs.core.term.Chains;
import com.repoq.trs.core.term.TermOrdering;
import com.repoq.trs.core.term.Terms;

import java.util.Comparator;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.ToLongFunction;

/**
 * Building blocks for rule termination measures. Combine them with
 * {@link WellFoundedMeasure#lexicographic(WellFoundedMeasure...)}.
 *
 * <p>All measures map into the naturals and are computed iteratively.
 */
public final class Measures {

    private Measures() {
        throw new AssertionError("No instances");
    }

    /**
     * Number of nodes. Decreases under deletion rules (idempotence, absorption, folding).
     */
    public static WellFoundedMeasure nodeCount() {
        return WellFoundedMeasure.of("node-count", Terms::size);
    }

    /**
     * Sum of per-node weights. Lets a desugaring rule replace one heavy node by several
     * light ones.
     */
    public static WellFoundedMeasure weightedSize(String name, ToLongFunction<Term> weight) {
        return WellFoundedMeasure.of(name, term -> {
            long[] total = {0};
            Terms.walk(term, (node, parent, index) -> total[0] += weight.applyAsLong(node));
            return total[0];
        });
    }

    /**
     * Nodes satisfying a predicate.
     */
    public static WellFoundedMeasure count(String name, Predicate<Term> predicate) {
        return WellFoundedMeasure.of(name, term -> {
            long[] total = {0};
            Terms.walk(term, (node, parent, index) -> {
                if (predicate.test(node)) {
                    total[0]++;
                }
            });
            return total[0];
        });
    }

    /**
     * For every binary node of the given operators whose left child has the same operator,
     * the size of that left child. Strictly decreases under right-association
     * {@code op(op(x,y),z) -> op(x,op(y,z))}.
     */
    public static WellFoundedMeasure leftNesting(Set<String> operators) {
        return WellFoundedMeasure.of("left-nesting", term -> {
            long[] total = {0};
            Terms.walk(term, (node, parent, index) -> {
                if (isBinary(node, operators)) {
                    Term left = node.arguments().get(0);
                    if (left.operator().equals(node.operator()) && left.arguments().size() == 2) {
                        total[0] += Terms.size(left);
                    }
                }
            });
            return total[0];
        });
    }

    /**
     * Inversions among the operands of every maximal right-nested chain of the given binary
     * operators. Swapping two adjacent out-of-order operands lowers it by one.
     */
    public static WellFoundedMeasure chainInversions(Set<String> operators, Comparator<Term> order) {
        return WellFoundedMeasure.of("chain-inversions", term -> {
            long[] total = {0};
            Terms.walk(term, (node, parent, index) -> {
                if (!isBinary(node, operators) || continuesChain(node, parent, index)) {
                    return;
                }
                total[0] += TermOrdering.inversions(Chains.operands(node), order);
            });
            return total[0];
        });
    }

    /**
     * Inversions among the arguments of every node with one of the given operators, for
     * variadic nodes whose arguments are sorted in place.
     */
    public static WellFoundedMeasure argumentInversions(Set<String> operators, Comparator<Term> order) {
        return WellFoundedMeasure.of("argument-inversions", term -> {
            long[] total = {0};
            Terms.walk(term, (node, parent, index) -> {
                if (operators.contains(node.operator())) {
                    total[0] += TermOrdering.inversions(node.arguments(), order);
                }
            });
            return total[0];
        });
    }

    /**
     * For every negation node, the size of its operand. Decreases under double-negation
     * elimination and under De Morgan pushes, which move a negation onto smaller operands.
     */
    public static WellFoundedMeasure negationWeight(String negationOperator) {
        return WellFoundedMeasure.of("negation-weight", term -> {
            long[] total = {0};
            Terms.walk(term, (node, parent, index) -> {
                if (node.operator().equals(negationOperator) && node.arguments().size() == 1) {
                    total[0] += Terms.size(node.arguments().get(0));
                }
            });
            return total[0];
        });
    }

    private static boolean isBinary(Term node, Set<String> operators) {
        return node.arguments().size() == 2 && operators.contains(node.operator());
    }

    private static boolean continuesChain(Term node, Term parent, int index) {
        return parent != null && index == 1 && parent.arguments().size() == 2
                && parent.operator().equals(node.operator()) && parent.getClass() == node.getClass();
    }
}
