/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.metrics;

import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.Term;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Metric aggregation formula. Aggregates are variadic and use the function name as their
 * operator, so a sorted metavariable {@code ?a:sum} selects exactly the {@code sum} nodes.
 */
public sealed interface MetricTerm extends Term
        permits MetricTerm.NumberLiteral, MetricTerm.Variable, MetricTerm.Aggregate, MetricTerm.Weighted {

    String OP_NUMBER = "num";
    String OP_VARIABLE = "var";
    String OP_WEIGHTED = "weighted";

    String SUM = "sum";
    String AVG = "avg";
    String MIN = "min";
    String MAX = "max";
    String COUNT = "count";
    String MEDIAN = "median";
    String STD = "std";
    String VARIANCE = "variance";

    Set<String> FUNCTIONS = Set.of(SUM, AVG, MIN, MAX, COUNT, MEDIAN, STD, VARIANCE);

    /**
     * Fraction digits kept by a division; every other operation on literals is exact.
     */
    int SCALE = 6;

    @Override
    default Domain domain() {
        return Domain.METRICS;
    }

    @Override
    default List<Term> arguments() {
        return List.of();
    }

    @Override
    default Term withArguments(List<Term> arguments) {
        return this;
    }

    /**
     * Decimal constant with trailing zeros stripped, so equal values are equal records.
     */
    record NumberLiteral(BigDecimal value) implements MetricTerm {
        public static final NumberLiteral ZERO = new NumberLiteral(BigDecimal.ZERO);
        public static final NumberLiteral ONE = new NumberLiteral(BigDecimal.ONE);

        public NumberLiteral {
            Objects.requireNonNull(value, "value must not be null");
            value = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
        }

        /**
         * {@code dividend / divisor} rounded half-up to {@value #SCALE} places.
         */
        public static NumberLiteral quotient(BigDecimal dividend, BigDecimal divisor) {
            return new NumberLiteral(dividend.divide(divisor, SCALE, RoundingMode.HALF_UP));
        }

        public static NumberLiteral of(String text) {
            return new NumberLiteral(new BigDecimal(text));
        }

        public boolean isZero() {
            return value.signum() == 0;
        }

        public boolean isOne() {
            return value.compareTo(BigDecimal.ONE) == 0;
        }

        @Override
        public String operator() {
            return OP_NUMBER;
        }

        @Override
        public Object payload() {
            return value.toPlainString();
        }

        @Override
        public String toString() {
            return value.toPlainString();
        }
    }

    record Variable(String name) implements MetricTerm {
        public Variable {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String operator() {
            return OP_VARIABLE;
        }

        @Override
        public Object payload() {
            return name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * {@code fn(args)} for one of {@link #FUNCTIONS}. {@code count} counts the non-zero
     * arguments; {@code std} and {@code variance} are the sample statistics and are zero for a
     * single argument; {@code median} of an even number of arguments is the mean of the two
     * middle ones.
     */
    record Aggregate(String function, List<Term> args) implements MetricTerm {
        public Aggregate {
            Objects.requireNonNull(function, "function must not be null");
            if (!FUNCTIONS.contains(function)) {
                throw new IllegalArgumentException("Unknown aggregate function: " + function);
            }
            args = List.copyOf(args);
        }

        public static Aggregate of(String function, Term... args) {
            return new Aggregate(function, List.of(args));
        }

        @Override
        public String operator() {
            return function;
        }

        @Override
        public List<Term> arguments() {
            return args;
        }

        @Override
        public Term withArguments(List<Term> arguments) {
            return new Aggregate(function, arguments);
        }
    }

    /**
     * {@code weight * expr}. The weight is a number or a variable.
     */
    record Weighted(Term expr, Term weight) implements MetricTerm {
        public Weighted {
            Objects.requireNonNull(expr, "expr must not be null");
            Objects.requireNonNull(weight, "weight must not be null");
        }

        @Override
        public String operator() {
            return OP_WEIGHTED;
        }

        @Override
        public List<Term> arguments() {
            return List.of(expr, weight);
        }

        @Override
        public Term withArguments(List<Term> arguments) {
            return new Weighted(arguments.get(0), arguments.get(1));
        }
    }
}
