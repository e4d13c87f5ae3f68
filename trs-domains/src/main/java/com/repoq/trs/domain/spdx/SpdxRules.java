/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.spdx;

import com.repoq.trs.api.model.Bindings;
import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.MetaVariable;
import com.repoq.trs.api.model.RewriteRule;
import com.repoq.trs.api.model.RuleSet;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.api.model.WellFoundedMeasure;
import com.repoq.trs.core.term.Chains;
import com.repoq.trs.core.term.TermOrdering;
import com.repoq.trs.core.term.Terms;
import com.repoq.trs.runtime.measure.Measures;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BinaryOperator;

/**
 * Rule set for SPDX expressions. Normal forms are right-nested {@code AND}/{@code OR}
 * chains whose operands are sorted by {@link TermOrdering}, free of duplicates and free of
 * absorbed operands ({@code A OR (A AND B)} becomes {@code A}).
 */
public final class SpdxRules {

    public static final String NAME = "spdx";
    public static final String VERSION = "1.0.0";

    private static final Set<String> CHAIN_OPERATORS = Set.of(SpdxTerm.OP_AND, SpdxTerm.OP_OR);
    private static final MetaVariable X = MetaVariable.of("x");
    private static final MetaVariable Y = MetaVariable.of("y");
    private static final MetaVariable Z = MetaVariable.of("z");

    private SpdxRules() {
        throw new AssertionError("No instances");
    }

    /**
     * {@code (node count, left nesting, chain inversions)}.
     */
    public static WellFoundedMeasure measure() {
        return WellFoundedMeasure.lexicographic(
                Measures.nodeCount(),
                Measures.leftNesting(CHAIN_OPERATORS),
                Measures.chainInversions(CHAIN_OPERATORS, TermOrdering.INSTANCE));
    }

    public static RuleSet create() {
        WellFoundedMeasure measure = measure();
        RuleSet.Builder builder = RuleSet.builder(Domain.SPDX, NAME, VERSION);
        for (Connective c : connectives()) {
            builder.add(rule(c.prefix + "-assoc", measure,
                    c.make(c.make(X, Y), Z), c.make(X, c.make(Y, Z)),
                    "(a " + c.operator + " b) " + c.operator + " c -> a " + c.operator + " (b " + c.operator + " c)"));
        }
        for (Connective c : connectives()) {
            builder.add(rule(c.prefix + "-idempotent", measure, c.make(X, X), X, "a " + c.operator + " a -> a"));
            builder.add(rule(c.prefix + "-idempotent-chain", measure,
                    c.make(X, c.make(X, Y)), c.make(X, Y), "drops a repeated leading operand"));
        }
        for (Connective c : connectives()) {
            builder.add(RewriteRule.builder(c.prefix + "-absorb", Domain.SPDX)
                    .pattern(c.make(X, Y))
                    .when(bindings -> absorbedIndex(c, chainOf(c, bindings)) >= 0)
                    .replacement(bindings -> absorb(c, chainOf(c, bindings)))
                    .measure(measure)
                    .description("drops an operand whose " + c.dual + "-operands include another operand's")
                    .build());
        }
        for (Connective c : connectives()) {
            builder.add(RewriteRule.builder(c.prefix + "-comm", Domain.SPDX)
                    .pattern(c.make(X, Y))
                    .when(bindings -> !c.isOp(bindings.get("x")) && !c.isOp(bindings.get("y"))
                            && Terms.compare(bindings.get("y"), bindings.get("x")) < 0)
                    .template(c.make(Y, X))
                    .measure(measure)
                    .description("orders the last two operands of a chain")
                    .build());
            builder.add(RewriteRule.builder(c.prefix + "-comm-chain", Domain.SPDX)
                    .pattern(c.make(X, c.make(Y, Z)))
                    .when(bindings -> !c.isOp(bindings.get("x")) && !c.isOp(bindings.get("y"))
                            && Terms.compare(bindings.get("y"), bindings.get("x")) < 0)
                    .template(c.make(Y, c.make(X, Z)))
                    .measure(measure)
                    .description("swaps two adjacent out-of-order operands of a chain")
                    .build());
        }
        return builder.build();
    }

    private static List<Connective> connectives() {
        return List.of(
                new Connective("or", SpdxTerm.OP_OR, SpdxTerm.Or::new, SpdxTerm.OP_AND),
                new Connective("and", SpdxTerm.OP_AND, SpdxTerm.And::new, SpdxTerm.OP_OR));
    }

    private static RewriteRule rule(String name, WellFoundedMeasure measure, Term pattern, Term template,
                                    String description) {
        return RewriteRule.builder(name, Domain.SPDX)
                .pattern(pattern)
                .template(template)
                .measure(measure)
                .description(description)
                .build();
    }

    private static List<Term> chainOf(Connective c, Bindings bindings) {
        return Chains.operands(c.make(bindings.get("x"), bindings.get("y")));
    }

    /**
     * Index of the first operand whose dual-operand set strictly contains another operand's
     * dual-operand set, or -1. Under {@code OR}, {@code A} absorbs {@code A AND B}; under
     * {@code AND}, {@code A} absorbs {@code A OR B}.
     *
     * <p>Only dual operands can be absorbed. Single operands are looked up by key, so the cost
     * is linear in the chain plus quadratic in the number of dual operands.
     */
    static int absorbedIndex(Connective c, List<Term> operands) {
        IntList duals = new IntArrayList();
        for (int i = 0; i < operands.size(); i++) {
            if (c.dual.equals(operands.get(i).operator())) {
                duals.add(i);
            }
        }
        if (duals.isEmpty()) {
            return -1;
        }
        Set<String> singles = new HashSet<>();
        for (int i = 0; i < operands.size(); i++) {
            if (!c.dual.equals(operands.get(i).operator())) {
                singles.add(Terms.canonicalKey(operands.get(i)));
            }
        }
        List<Set<String>> parts = new ArrayList<>(duals.size());
        for (int d = 0; d < duals.size(); d++) {
            Set<String> keys = new HashSet<>();
            for (Term part : Chains.flatOperands(operands.get(duals.getInt(d)))) {
                keys.add(Terms.canonicalKey(part));
            }
            parts.add(keys);
        }
        for (int d = 0; d < duals.size(); d++) {
            Set<String> keys = parts.get(d);
            if (keys.size() > 1 && !Collections.disjoint(keys, singles)) {
                return duals.getInt(d);
            }
            for (int e = 0; e < duals.size(); e++) {
                Set<String> other = parts.get(e);
                if (e != d && other.size() < keys.size() && keys.containsAll(other)) {
                    return duals.getInt(d);
                }
            }
        }
        return -1;
    }

    private static Term absorb(Connective c, List<Term> operands) {
        int index = absorbedIndex(c, operands);
        List<Term> kept = new ArrayList<>(operands);
        kept.remove(index);
        return Chains.build(kept, c.constructor);
    }

    record Connective(String prefix, String operator, BinaryOperator<Term> constructor, String dual) {
        Term make(Term left, Term right) {
            return constructor.apply(left, right);
        }

        boolean isOp(Term term) {
            return term.getClass() != MetaVariable.class && operator.equals(term.operator());
        }
    }
}
