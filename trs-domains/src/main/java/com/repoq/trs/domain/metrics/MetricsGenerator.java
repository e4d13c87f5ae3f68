/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.metrics;

import com.repoq.trs.api.TermGenerator;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.domain.metrics.MetricTerm.Aggregate;
import com.repoq.trs.domain.metrics.MetricTerm.NumberLiteral;
import com.repoq.trs.domain.metrics.MetricTerm.Variable;
import com.repoq.trs.domain.metrics.MetricTerm.Weighted;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public final class MetricsGenerator implements TermGenerator {

    private static final List<String> FUNCTIONS = List.of(
            MetricTerm.SUM, MetricTerm.AVG, MetricTerm.MIN, MetricTerm.MAX, MetricTerm.COUNT,
            MetricTerm.MEDIAN, MetricTerm.STD, MetricTerm.VARIANCE);
    private static final List<String> VARIABLES = List.of("a", "b", "churn", "loc");
    private static final List<String> LITERALS = List.of("0", "1", "2", "3", "0.5", "-1");
    private static final List<String> WEIGHTS = List.of("0", "1", "2", "0.25", "-1", "w1", "w2");

    private static final List<String> CURATED = List.of(
            "avg([w1*sum(a), w2*sum(b)])",
            "sum(b, a, sum(c, 1), 2)",
            "max(a, max(b, a), 3, 1)",
            "min(x)",
            "0.5*(2*cpu)",
            "2*3",
            "1*churn",
            "0*sum(a, b)",
            "a + b - c",
            "avg(1, 2, 4)",
            "count(a, 0, 1)",
            "count(0, 2, 3)",
            "sum(a, -1*a)",
            "complexity/4",
            "3*w",
            "sum(a, 0)",
            "max(min(a, b), min(b, a))",
            "1.23456789 + x",
            "w1*(0.5*(4*loc))",
            "median(b, a, 3)",
            "median(4, 1, 3, 2)",
            "std(churn)",
            "std(2, 4, 4, 4, 5, 5, 7, 9)",
            "variance(loc, 2*loc)",
            "variance(1, 2, 3, 4)",
            "median(a, a, b) + variance(x)");

    @Override
    public List<String> curatedSources() {
        return CURATED;
    }

    @Override
    public List<Term> generate(int count, int maxDepth, long seed) {
        Random random = new Random(seed);
        List<Term> terms = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            terms.add(randomTerm(random, maxDepth));
        }
        return terms;
    }

    // depth is bounded by maxDepth, so recursion is safe here
    private Term randomTerm(Random random, int depth) {
        int roll = random.nextInt(10);
        if (depth <= 1 || roll < 3) {
            return roll % 2 == 0
                    ? NumberLiteral.of(pick(random, LITERALS))
                    : new Variable(pick(random, VARIABLES));
        }
        if (roll < 5) {
            String weight = pick(random, WEIGHTS);
            Term w = Character.isLetter(weight.charAt(0)) ? new Variable(weight) : NumberLiteral.of(weight);
            return new Weighted(randomTerm(random, depth - 1), w);
        }
        int arity = 1 + random.nextInt(3);
        List<Term> args = new ArrayList<>(arity);
        for (int i = 0; i < arity; i++) {
            args.add(randomTerm(random, depth - 1));
        }
        return new Aggregate(pick(random, FUNCTIONS), args);
    }

    private static String pick(Random random, List<String> values) {
        return values.get(random.nextInt(values.size()));
    }

    /**
     * Every aggregate rule fires on at least one sample of its function. The list stays
     * under 29 terms so that {@code k*(n*e)} has at most 256 instances.
     */
    @Override
    public List<Term> groundSamples(String sort) {
        Term a = new Variable("a");
        Term b = new Variable("b");
        Term zero = NumberLiteral.ZERO;
        Term one = NumberLiteral.ONE;
        Term two = NumberLiteral.of("2");
        List<Term> all = List.of(
                two,
                zero,
                one,
                a,
                new Variable("w1"),
                Aggregate.of(MetricTerm.SUM, b, a, Aggregate.of(MetricTerm.SUM, one, two)),
                Aggregate.of(MetricTerm.SUM, a, two, one),
                Aggregate.of(MetricTerm.SUM, a, zero),
                Aggregate.of(MetricTerm.SUM, a),
                Aggregate.of(MetricTerm.AVG, two, one),
                Aggregate.of(MetricTerm.AVG, a),
                Aggregate.of(MetricTerm.MIN, a, a, two, one),
                Aggregate.of(MetricTerm.MIN, a, Aggregate.of(MetricTerm.MIN, b, one)),
                Aggregate.of(MetricTerm.MIN, b),
                Aggregate.of(MetricTerm.MAX, Aggregate.of(MetricTerm.MAX, b, a), two),
                Aggregate.of(MetricTerm.MAX, a, a, two, one),
                Aggregate.of(MetricTerm.MAX, b),
                Aggregate.of(MetricTerm.COUNT, two, zero),
                Aggregate.of(MetricTerm.COUNT, b, a),
                Aggregate.of(MetricTerm.MEDIAN, two, one),
                Aggregate.of(MetricTerm.MEDIAN, a),
                Aggregate.of(MetricTerm.STD, two, one),
                Aggregate.of(MetricTerm.STD, b),
                Aggregate.of(MetricTerm.VARIANCE, two, one),
                Aggregate.of(MetricTerm.VARIANCE, a),
                new Weighted(a, two),
                new Weighted(two, new Variable("w1")));
        if (sort == null) {
            return all;
        }
        return all.stream().filter(t -> t.operator().equals(sort)).toList();
    }
}
