/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.filter;

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
import com.repoq.trs.domain.filter.FilterTerm.Glob;
import com.repoq.trs.domain.filter.FilterTerm.Intersect;
import com.repoq.trs.domain.filter.FilterTerm.MatchAll;
import com.repoq.trs.domain.filter.FilterTerm.MatchNone;
import com.repoq.trs.domain.filter.FilterTerm.Negate;
import com.repoq.trs.domain.filter.FilterTerm.PathLiteral;
import com.repoq.trs.domain.filter.FilterTerm.Union;
import com.repoq.trs.runtime.measure.Measures;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.BinaryOperator;

/**
 * Rule set for path filters. Negations are pushed onto leaves, {@code |}/{@code &} chains
 * are right-nested and sorted, and leaves are spelled canonically. Chains lose every operand
 * another operand makes redundant, and collapse to {@code **} or {@code {}} when their leaves
 * decide them: {@code *.md | README.md} is {@code *.md}, {@code src/** & src/main/**} is
 * {@code src/main/**}, {@code README.md & docs/*} is {@code {}}. Containment is decided by
 * {@link PathSpace}, so it does not depend on how an expression is bracketed or negated.
 */
public final class FilterRules {

    public static final String NAME = "filter";
    public static final String VERSION = "1.0.0";

    private static final Set<String> CHAIN_OPERATORS = Set.of(FilterTerm.OP_UNION, FilterTerm.OP_INTERSECT);
    private static final MetaVariable X = MetaVariable.of("x");
    private static final MetaVariable Y = MetaVariable.of("y");
    private static final MetaVariable Z = MetaVariable.of("z");

    private FilterRules() {
        throw new AssertionError("No instances");
    }

    /**
     * {@code (negation weight, node count, non-canonical leaves, left nesting, chain inversions)}.
     */
    public static WellFoundedMeasure measure() {
        return WellFoundedMeasure.lexicographic(
                Measures.negationWeight(FilterTerm.OP_NEGATE),
                Measures.nodeCount(),
                Measures.count("non-canonical-leaves", node -> node.isLeaf() && !canonicalLeaf(node).equals(node)),
                Measures.leftNesting(CHAIN_OPERATORS),
                Measures.chainInversions(CHAIN_OPERATORS, TermOrdering.INSTANCE));
    }

    public static RuleSet create() {
        WellFoundedMeasure measure = measure();
        RuleSet.Builder builder = RuleSet.builder(Domain.FILTER, NAME, VERSION);

        MetaVariable glob = MetaVariable.sorted("g", FilterTerm.OP_GLOB);
        builder.add(RewriteRule.builder("glob-canonical", Domain.FILTER)
                .pattern(glob)
                .when(bindings -> !canonicalLeaf(bindings.get("g")).equals(bindings.get("g")))
                .replacement(bindings -> canonicalLeaf(bindings.get("g")))
                .measure(measure)
                .description("collapses separators and star runs, sorts classes, demotes wildcard-free globs")
                .build());
        MetaVariable path = MetaVariable.sorted("p", FilterTerm.OP_PATH);
        builder.add(RewriteRule.builder("path-canonical", Domain.FILTER)
                .pattern(path)
                .when(bindings -> !canonicalLeaf(bindings.get("p")).equals(bindings.get("p")))
                .replacement(bindings -> canonicalLeaf(bindings.get("p")))
                .measure(measure)
                .description("collapses separators, strips ./ and trailing /")
                .build());

        builder.add(rule("negate-double", measure, new Negate(new Negate(X)), X, "!!a -> a"));
        builder.add(rule("negate-all", measure, new Negate(new MatchAll()), new MatchNone(), "!** -> {}"));
        builder.add(rule("negate-none", measure, new Negate(new MatchNone()), new MatchAll(), "!{} -> **"));
        builder.add(rule("demorgan-union", measure, new Negate(new Union(X, Y)),
                new Intersect(new Negate(X), new Negate(Y)), "!(a | b) -> !a & !b"));
        builder.add(rule("demorgan-intersect", measure, new Negate(new Intersect(X, Y)),
                new Union(new Negate(X), new Negate(Y)), "!(a & b) -> !a | !b"));

        for (Connective c : connectives()) {
            builder.add(rule(c.prefix + "-assoc", measure,
                    c.make(c.make(X, Y), Z), c.make(X, c.make(Y, Z)),
                    "(a " + c.operator + " b) " + c.operator + " c -> a " + c.operator + " (b " + c.operator + " c)"));
        }
        for (Connective c : connectives()) {
            builder.add(rule(c.prefix + "-idempotent", measure, c.make(X, X), X, "a " + c.operator + " a -> a"));
            builder.add(rule(c.prefix + "-idempotent-chain", measure,
                    c.make(X, c.make(X, Y)), c.make(X, Y), "drops a repeated leading operand"));
            builder.add(rule(c.prefix + "-identity-left", measure, c.make(c.identity, X), X,
                    c.identity + " " + c.operator + " a -> a"));
            builder.add(rule(c.prefix + "-identity-right", measure, c.make(X, c.identity), X,
                    "a " + c.operator + " " + c.identity + " -> a"));
            builder.add(rule(c.prefix + "-annihilate-left", measure, c.make(c.annihilator, X), c.annihilator,
                    c.annihilator + " " + c.operator + " a -> " + c.annihilator));
            builder.add(rule(c.prefix + "-annihilate-right", measure, c.make(X, c.annihilator), c.annihilator,
                    "a " + c.operator + " " + c.annihilator + " -> " + c.annihilator));
            builder.add(RewriteRule.builder(c.prefix + "-complement", Domain.FILTER)
                    .pattern(c.make(X, Y))
                    .when(bindings -> hasComplementPair(chainOf(c, bindings)))
                    .template(c.annihilator)
                    .measure(measure)
                    .description("a " + c.operator + " !a -> " + c.annihilator)
                    .build());
        }
        Connective union = connectives().get(0);
        Connective intersect = connectives().get(1);
        builder.add(RewriteRule.builder("union-cover", Domain.FILTER)
                .pattern(union.make(X, Y))
                .when(bindings -> decides(union.make(bindings.get("x"), bindings.get("y")), true))
                .template(new MatchAll())
                .measure(measure)
                .description("operands that together contain every path -> **")
                .build());
        builder.add(RewriteRule.builder("intersect-disjoint", Domain.FILTER)
                .pattern(intersect.make(X, Y))
                .when(bindings -> decides(intersect.make(bindings.get("x"), bindings.get("y")), false))
                .template(new MatchNone())
                .measure(measure)
                .description("operands without a common path -> {}")
                .build());
        for (Connective c : connectives()) {
            builder.add(RewriteRule.builder(c.prefix + "-subsume", Domain.FILTER)
                    .pattern(c.make(X, Y))
                    .when(bindings -> redundantIndex(c, flatChainOf(c, bindings)) >= 0)
                    .replacement(bindings -> {
                        List<Term> operands = flatChainOf(c, bindings);
                        return without(c, operands, redundantIndex(c, operands));
                    })
                    .measure(measure)
                    .description(c.operator.equals(FilterTerm.OP_UNION)
                            ? "drops an operand another operand contains (absorption, glob subsumption)"
                            : "drops an operand that contains another operand (absorption, glob subsumption)")
                    .build());
        }

        for (Connective c : connectives()) {
            builder.add(RewriteRule.builder(c.prefix + "-comm", Domain.FILTER)
                    .pattern(c.make(X, Y))
                    .when(bindings -> !c.isOp(bindings.get("x")) && !c.isOp(bindings.get("y"))
                            && Terms.compare(bindings.get("y"), bindings.get("x")) < 0)
                    .template(c.make(Y, X))
                    .measure(measure)
                    .description("orders the last two operands of a chain")
                    .build());
            builder.add(RewriteRule.builder(c.prefix + "-comm-chain", Domain.FILTER)
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

    /**
     * The canonical spelling of a leaf; compound terms are returned unchanged.
     */
    static Term canonicalLeaf(Term leaf) {
        if (leaf instanceof PathLiteral literal) {
            String normalized = Globs.normalizePath(literal.path());
            return normalized.equals(literal.path()) ? leaf : new PathLiteral(normalized);
        }
        if (leaf instanceof Glob glob) {
            String canonical = Globs.canonical(glob.pattern());
            if (canonical.equals("**")) {
                return new MatchAll();
            }
            if (!Globs.hasWildcard(canonical)) {
                return new PathLiteral(canonical);
            }
            return canonical.equals(glob.pattern()) ? leaf : new Glob(canonical);
        }
        return leaf;
    }

    private static boolean hasComplementPair(List<Term> operands) {
        Set<String> keys = new HashSet<>();
        for (Term operand : operands) {
            keys.add(Terms.canonicalKey(operand));
        }
        for (Term operand : operands) {
            if (operand instanceof Negate negate && keys.contains(Terms.canonicalKey(negate.operand()))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether the leaves of {@code chain} prove it to be every path ({@code everything}) or
     * no path.
     */
    private static boolean decides(Term chain, boolean everything) {
        Optional<PathSpace> space = PathSpace.of(List.of(chain));
        if (space.isEmpty()) {
            return false;
        }
        return everything ? space.get().isEverything(chain) : space.get().isEmpty(chain);
    }

    /**
     * Index of an operand the chain does not need, or -1. Under {@code |} an operand
     * contained in another is redundant, under {@code &} one that contains another. Of two
     * operands with the same paths the smaller term stays, so repeated removal ends with the
     * same operands whichever redundant one goes first.
     */
    static int redundantIndex(Connective c, List<Term> operands) {
        Optional<PathSpace> found = PathSpace.of(operands);
        if (found.isEmpty()) {
            return -1;
        }
        PathSpace space = found.get();
        boolean union = c.operator.equals(FilterTerm.OP_UNION);
        for (int i = 0; i < operands.size(); i++) {
            Term candidate = operands.get(i);
            for (int j = 0; j < operands.size(); j++) {
                if (i == j) {
                    continue;
                }
                Term other = operands.get(j);
                boolean covered = union ? space.contains(other, candidate) : space.contains(candidate, other);
                if (!covered) {
                    continue;
                }
                boolean same = union ? space.contains(candidate, other) : space.contains(other, candidate);
                if (!same || preferred(other, j, candidate, i)) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Smaller terms first, then the term order; of two identical operands the earlier one.
     */
    private static boolean preferred(Term a, int aIndex, Term b, int bIndex) {
        int bySize = Integer.compare(Terms.size(a), Terms.size(b));
        if (bySize != 0) {
            return bySize < 0;
        }
        int byOrder = Terms.compare(a, b);
        return byOrder != 0 ? byOrder < 0 : aIndex < bIndex;
    }

    private static List<Connective> connectives() {
        return List.of(
                new Connective("union", FilterTerm.OP_UNION, Union::new,
                        new MatchNone(), new MatchAll()),
                new Connective("intersect", FilterTerm.OP_INTERSECT, Intersect::new,
                        new MatchAll(), new MatchNone()));
    }

    private static RewriteRule rule(String name, WellFoundedMeasure measure, Term pattern, Term template,
                                    String description) {
        return RewriteRule.builder(name, Domain.FILTER)
                .pattern(pattern)
                .template(template)
                .measure(measure)
                .description(description)
                .build();
    }

    private static List<Term> chainOf(Connective c, Bindings bindings) {
        return Chains.operands(c.make(bindings.get("x"), bindings.get("y")));
    }

    private static List<Term> flatChainOf(Connective c, Bindings bindings) {
        return Chains.flatOperands(c.make(bindings.get("x"), bindings.get("y")));
    }

    private static Term without(Connective c, List<Term> operands, int index) {
        List<Term> kept = new ArrayList<>(operands);
        kept.remove(index);
        return Chains.build(kept, c.constructor);
    }

    record Connective(String prefix, String operator, BinaryOperator<Term> constructor, Term identity,
                      Term annihilator) {
        Term make(Term left, Term right) {
            return constructor.apply(left, right);
        }

        boolean isOp(Term term) {
            return term.getClass() != MetaVariable.class && operator.equals(term.operator());
        }
    }
}
