/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.metrics;

import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.MetaVariable;
import com.repoq.trs.api.model.RewriteRule;
import com.repoq.trs.api.model.RuleSet;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.api.model.WellFoundedMeasure;
import com.repoq.trs.core.term.TermOrdering;
import com.repoq.trs.domain.metrics.MetricTerm.Aggregate;
import com.repoq.trs.domain.metrics.MetricTerm.NumberLiteral;
import com.repoq.trs.domain.metrics.MetricTerm.Variable;
import com.repoq.trs.domain.metrics.MetricTerm.Weighted;
import com.repoq.trs.runtime.measure.Measures;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.Function;

/**
 * Rule set for metric formulas. In a normal form every aggregate has sorted arguments,
 * {@code sum}/{@code min}/{@code max} contain no nested aggregate of the same function and
 * at most one literal, {@code min}/{@code max} hold no duplicates, one-argument aggregates
 * other than {@code count} are gone, aggregates of literals only are evaluated, and weights
 * are neither 0 nor 1 nor stacked literals.
 */
public final class MetricsRules {

    public static final String NAME = "metrics";
    public static final String VERSION = "1.0.0";

    private static final MetaVariable E = MetaVariable.of("e");
    private static final MetaVariable N = MetaVariable.sorted("n", MetricTerm.OP_NUMBER);
    private static final MetaVariable K = MetaVariable.sorted("k", MetricTerm.OP_NUMBER);
    private static final MetaVariable V = MetaVariable.sorted("v", MetricTerm.OP_VARIABLE);

    private MetricsRules() {
        throw new AssertionError("No instances");
    }

    /**
     * {@code (node count, literal operands under a symbolic weight, argument inversions)}.
     */
    public static WellFoundedMeasure measure() {
        return WellFoundedMeasure.lexicographic(
                Measures.nodeCount(),
                Measures.count("literal-under-symbolic-weight",
                        node -> node instanceof Weighted w && w.expr() instanceof NumberLiteral
                                && w.weight() instanceof Variable),
                Measures.argumentInversions(MetricTerm.FUNCTIONS, TermOrdering.INSTANCE));
    }

    public static RuleSet create() {
        WellFoundedMeasure m = measure();
        RuleSet.Builder builder = RuleSet.builder(Domain.METRICS, NAME, VERSION);

        for (String fn : List.of(MetricTerm.SUM, MetricTerm.MIN, MetricTerm.MAX)) {
            MetaVariable a = aggregate(fn);
            builder.add(RewriteRule.builder(fn + "-flatten", Domain.METRICS)
                    .pattern(a)
                    .when(b -> args(b.get("a")).stream().anyMatch(arg -> fn.equals(arg.operator())))
                    .replacement(b -> flatten(fn, args(b.get("a"))))
                    .measure(m)
                    .description(fn + "(x, " + fn + "(y, z)) -> " + fn + "(x, y, z)")
                    .build());
        }
        for (String fn : List.of(MetricTerm.MIN, MetricTerm.MAX)) {
            builder.add(RewriteRule.builder(fn + "-dedupe", Domain.METRICS)
                    .pattern(aggregate(fn))
                    .when(b -> distinct(args(b.get("a"))).size() < args(b.get("a")).size())
                    .replacement(b -> new Aggregate(fn, distinct(args(b.get("a")))))
                    .measure(m)
                    .description("drops repeated arguments of " + fn)
                    .build());
        }

        builder.add(fold(MetricTerm.SUM, BigDecimal::add, m));
        builder.add(fold(MetricTerm.MIN, BigDecimal::min, m));
        builder.add(fold(MetricTerm.MAX, BigDecimal::max, m));
        builder.add(RewriteRule.builder("sum-zero", Domain.METRICS)
                .pattern(aggregate(MetricTerm.SUM))
                .when(b -> args(b.get("a")).size() > 1 && args(b.get("a")).stream().anyMatch(MetricsRules::isZero))
                .replacement(b -> {
                    List<Term> kept = new ArrayList<>();
                    for (Term arg : args(b.get("a"))) {
                        if (!isZero(arg)) {
                            kept.add(arg);
                        }
                    }
                    return kept.isEmpty() ? NumberLiteral.ZERO : new Aggregate(MetricTerm.SUM, kept);
                })
                .measure(m)
                .description("drops zero summands")
                .build());
        builder.add(RewriteRule.builder("avg-fold", Domain.METRICS)
                .pattern(aggregate(MetricTerm.AVG))
                .when(b -> args(b.get("a")).size() > 1 && allLiterals(args(b.get("a"))))
                .replacement(b -> {
                    List<Term> args = args(b.get("a"));
                    BigDecimal total = BigDecimal.ZERO;
                    for (Term arg : args) {
                        total = total.add(value(arg));
                    }
                    return NumberLiteral.quotient(total, BigDecimal.valueOf(args.size()));
                })
                .measure(m)
                .description("evaluates an average of literals")
                .build());
        builder.add(RewriteRule.builder("count-fold", Domain.METRICS)
                .pattern(aggregate(MetricTerm.COUNT))
                .when(b -> allLiterals(args(b.get("a"))))
                .replacement(b -> new NumberLiteral(BigDecimal.valueOf(
                        args(b.get("a")).stream().filter(arg -> !isZero(arg)).count())))
                .measure(m)
                .description("counts the non-zero literals")
                .build());

        builder.add(statistic(MetricTerm.MEDIAN, MetricsRules::median, m));
        builder.add(statistic(MetricTerm.VARIANCE, values -> variance(values, MathContext.DECIMAL128)
                .setScale(MetricTerm.SCALE, RoundingMode.HALF_UP), m));
        builder.add(statistic(MetricTerm.STD, values -> variance(values, MathContext.DECIMAL128)
                .sqrt(MathContext.DECIMAL128).setScale(MetricTerm.SCALE, RoundingMode.HALF_UP), m));

        for (String fn : List.of(MetricTerm.SUM, MetricTerm.AVG, MetricTerm.MIN, MetricTerm.MAX, MetricTerm.MEDIAN)) {
            builder.add(RewriteRule.builder(fn + "-singleton", Domain.METRICS)
                    .pattern(aggregate(fn))
                    .when(b -> args(b.get("a")).size() == 1)
                    .replacement(b -> args(b.get("a")).get(0))
                    .measure(m)
                    .description(fn + "(x) -> x")
                    .build());
        }
        for (String fn : List.of(MetricTerm.STD, MetricTerm.VARIANCE)) {
            builder.add(RewriteRule.builder(fn + "-singleton", Domain.METRICS)
                    .pattern(aggregate(fn))
                    .when(b -> args(b.get("a")).size() == 1)
                    .replacement(b -> NumberLiteral.ZERO)
                    .measure(m)
                    .description(fn + "(x) -> 0")
                    .build());
        }

        builder.add(RewriteRule.builder("weight-literal", Domain.METRICS)
                .pattern(new Weighted(N, K))
                .replacement(b -> new NumberLiteral(value(b.get("n")).multiply(value(b.get("k")))))
                .measure(m)
                .description("k*n -> the product")
                .build());
        builder.add(RewriteRule.builder("weight-zero", Domain.METRICS)
                .pattern(new Weighted(E, K))
                .when(b -> isZero(b.get("k")))
                .replacement(b -> NumberLiteral.ZERO)
                .measure(m)
                .description("0*e -> 0")
                .build());
        builder.add(RewriteRule.builder("weight-one", Domain.METRICS)
                .pattern(new Weighted(E, K))
                .when(b -> ((NumberLiteral) b.get("k")).isOne())
                .template(E)
                .measure(m)
                .description("1*e -> e")
                .build());
        builder.add(RewriteRule.builder("weight-compose", Domain.METRICS)
                .pattern(new Weighted(new Weighted(E, N), K))
                .replacement(b -> new Weighted(b.get("e"),
                        new NumberLiteral(value(b.get("k")).multiply(value(b.get("n"))))))
                .measure(m)
                .description("k*(n*e) -> (k*n)*e")
                .build());
        builder.add(RewriteRule.builder("weight-swap", Domain.METRICS)
                .pattern(new Weighted(N, V))
                .template(new Weighted(V, N))
                .measure(m)
                .description("v*n -> n*v, keeping literal weights outermost")
                .build());

        for (String fn : List.of(MetricTerm.SUM, MetricTerm.AVG, MetricTerm.MIN, MetricTerm.MAX, MetricTerm.COUNT,
                MetricTerm.MEDIAN, MetricTerm.STD, MetricTerm.VARIANCE)) {
            builder.add(RewriteRule.builder(fn + "-sort", Domain.METRICS)
                    .pattern(aggregate(fn))
                    .when(b -> !TermOrdering.isSorted(args(b.get("a")), TermOrdering.INSTANCE))
                    .replacement(b -> {
                        List<Term> sorted = new ArrayList<>(args(b.get("a")));
                        sorted.sort(TermOrdering.INSTANCE);
                        return new Aggregate(fn, sorted);
                    })
                    .measure(m)
                    .description("orders the arguments of " + fn)
                    .build());
        }
        return builder.build();
    }

    private static MetaVariable aggregate(String fn) {
        return MetaVariable.sorted("a", fn);
    }

    /**
     * Replaces two or more literal arguments by their combination; a zero sum next to
     * symbolic arguments disappears.
     */
    private static RewriteRule fold(String fn, BinaryOperator<BigDecimal> combine, WellFoundedMeasure m) {
        return RewriteRule.builder(fn + "-fold", Domain.METRICS)
                .pattern(aggregate(fn))
                .when(b -> args(b.get("a")).stream().filter(arg -> arg instanceof NumberLiteral).count() > 1)
                .replacement(b -> {
                    List<Term> kept = new ArrayList<>();
                    BigDecimal folded = null;
                    for (Term arg : args(b.get("a"))) {
                        if (arg instanceof NumberLiteral literal) {
                            folded = folded == null ? literal.value() : combine.apply(folded, literal.value());
                        } else {
                            kept.add(arg);
                        }
                    }
                    if (!(MetricTerm.SUM.equals(fn) && folded.signum() == 0 && !kept.isEmpty())) {
                        kept.add(new NumberLiteral(folded));
                    }
                    return new Aggregate(fn, kept);
                })
                .measure(m)
                .description("combines the literal arguments of " + fn)
                .build();
    }

    /**
     * Evaluates a statistic of two or more literals. Repeated arguments carry weight here,
     * so these functions have no dedupe rule.
     */
    private static RewriteRule statistic(String fn, Function<List<BigDecimal>, BigDecimal> evaluate,
                                         WellFoundedMeasure m) {
        return RewriteRule.builder(fn + "-fold", Domain.METRICS)
                .pattern(aggregate(fn))
                .when(b -> args(b.get("a")).size() > 1 && allLiterals(args(b.get("a"))))
                .replacement(b -> {
                    List<BigDecimal> values = new ArrayList<>();
                    for (Term arg : args(b.get("a"))) {
                        values.add(value(arg));
                    }
                    return new NumberLiteral(evaluate.apply(values));
                })
                .measure(m)
                .description("evaluates the " + fn + " of literals")
                .build();
    }

    static BigDecimal median(List<BigDecimal> values) {
        List<BigDecimal> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int middle = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(middle);
        }
        return sorted.get(middle - 1).add(sorted.get(middle)).divide(BigDecimal.valueOf(2));
    }

    /**
     * Sample variance, zero for fewer than two values.
     */
    static BigDecimal variance(List<BigDecimal> values, MathContext context) {
        if (values.size() < 2) {
            return BigDecimal.ZERO;
        }
        BigDecimal total = BigDecimal.ZERO;
        for (BigDecimal value : values) {
            total = total.add(value);
        }
        BigDecimal mean = total.divide(BigDecimal.valueOf(values.size()), context);
        BigDecimal squares = BigDecimal.ZERO;
        for (BigDecimal value : values) {
            BigDecimal deviation = value.subtract(mean);
            squares = squares.add(deviation.multiply(deviation));
        }
        return squares.divide(BigDecimal.valueOf(values.size() - 1L), context);
    }

    private static Term flatten(String fn, List<Term> args) {
        List<Term> flat = new ArrayList<>();
        for (Term arg : args) {
            if (fn.equals(arg.operator())) {
                flat.addAll(arg.arguments());
            } else {
                flat.add(arg);
            }
        }
        return new Aggregate(fn, flat);
    }

    private static List<Term> args(Term aggregate) {
        return aggregate.arguments();
    }

    private static List<Term> distinct(List<Term> args) {
        return new ArrayList<>(new LinkedHashSet<>(args));
    }

    private static boolean allLiterals(List<Term> args) {
        return args.stream().allMatch(arg -> arg instanceof NumberLiteral);
    }

    private static boolean isZero(Term term) {
        return term instanceof NumberLiteral literal && literal.isZero();
    }

    private static BigDecimal value(Term term) {
        return ((NumberLiteral) term).value();
    }
}
