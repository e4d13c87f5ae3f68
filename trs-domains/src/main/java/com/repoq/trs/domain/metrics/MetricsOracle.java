/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.metrics;

import com.repoq.trs.api.SemanticOracle;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.core.term.Terms;
import com.repoq.trs.domain.metrics.MetricTerm.Aggregate;
import com.repoq.trs.domain.metrics.MetricTerm.NumberLiteral;
import com.repoq.trs.domain.metrics.MetricTerm.Variable;
import com.repoq.trs.domain.metrics.MetricTerm.Weighted;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Numeric evaluation under seeded variable assignments. Values agree when they differ by at
 * most {@value #TOLERANCE} relative to their magnitude (at least 1), which absorbs the
 * rounding of folded averages.
 */
public final class MetricsOracle implements SemanticOracle {

    static final double TOLERANCE = 1e-4;
    private static final int ASSIGNMENTS = 32;
    private static final long SEED = 0x2545F491L;

    @Override
    public String name() {
        return "metrics-numeric-evaluation";
    }

    @Override
    public Optional<String> findDifference(Term original, Term normalized) {
        Object2IntMap<String> variables = new Object2IntLinkedOpenHashMap<>();
        collect(original, variables);
        collect(normalized, variables);

        Random random = new Random(SEED);
        double[] assignment = new double[variables.size()];
        for (int round = 0; round < ASSIGNMENTS; round++) {
            for (int v = 0; v < assignment.length; v++) {
                assignment[v] = round == 0 ? 0.0 : (random.nextInt(41) - 20) / 2.0;
            }
            double a = evaluate(original, assignment, variables);
            double b = evaluate(normalized, assignment, variables);
            if (!Double.isFinite(a) || !Double.isFinite(b)) {
                continue;
            }
            double scale = Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
            if (Math.abs(a - b) > TOLERANCE * scale) {
                StringBuilder sb = new StringBuilder("assignment {");
                int i = 0;
                for (String name : variables.keySet()) {
                    if (i > 0) {
                        sb.append(", ");
                    }
                    sb.append(name).append('=').append(assignment[i++]);
                }
                return Optional.of(sb.append("} gives original=").append(a)
                        .append(", normalized=").append(b).toString());
            }
        }
        return Optional.empty();
    }

    private static void collect(Term term, Object2IntMap<String> variables) {
        Terms.walk(term, (node, parent, index) -> {
            if (node instanceof Variable variable && !variables.containsKey(variable.name())) {
                variables.put(variable.name(), variables.size());
            }
        });
    }

    private record Combine(String function, int arity) {
    }

    /**
     * Post-order evaluation with an explicit work stack.
     */
    static double evaluate(Term term, double[] assignment, Object2IntMap<String> variables) {
        DoubleArrayList values = new DoubleArrayList();
        Deque<Object> work = new ArrayDeque<>();
        work.push(term);
        while (!work.isEmpty()) {
            Object item = work.pop();
            if (item instanceof Combine combine) {
                int from = values.size() - combine.arity();
                double result = combine(combine.function(), values.subList(from, values.size()));
                values.size(from);
                values.add(result);
            } else if (item instanceof NumberLiteral literal) {
                values.add(literal.value().doubleValue());
            } else if (item instanceof Variable variable) {
                values.add(assignment[variables.getInt(variable.name())]);
            } else if (item instanceof Aggregate || item instanceof Weighted) {
                Term node = (Term) item;
                List<Term> args = node.arguments();
                work.push(new Combine(node.operator(), args.size()));
                for (int i = args.size() - 1; i >= 0; i--) {
                    work.push(args.get(i));
                }
            } else {
                throw new IllegalArgumentException("Cannot evaluate " + item);
            }
        }
        return values.getDouble(0);
    }

    private static double combine(String function, List<Double> args) {
        switch (function) {
            case MetricTerm.OP_WEIGHTED:
                return args.get(0) * args.get(1);
            case MetricTerm.SUM:
                return args.stream().mapToDouble(Double::doubleValue).sum();
            case MetricTerm.AVG:
                return args.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            case MetricTerm.MIN:
                return args.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
            case MetricTerm.MAX:
                return args.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
            case MetricTerm.COUNT:
                return args.stream().filter(v -> v != 0.0).count();
            case MetricTerm.MEDIAN:
                return median(args);
            case MetricTerm.VARIANCE:
                return variance(args);
            case MetricTerm.STD:
                return Math.sqrt(variance(args));
            default:
                throw new IllegalArgumentException("Unknown function " + function);
        }
    }

    private static double median(List<Double> args) {
        double[] sorted = args.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        int middle = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[middle] : (sorted[middle - 1] + sorted[middle]) / 2.0;
    }

    private static double variance(List<Double> args) {
        if (args.size() < 2) {
            return 0.0;
        }
        double mean = args.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double squares = 0.0;
        for (double value : args) {
            squares += (value - mean) * (value - mean);
        }
        return squares / (args.size() - 1);
    }
}
