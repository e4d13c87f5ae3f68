/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.fixtures;

import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.MetaVariable;
import com.repoq.trs.api.model.RewriteRule;
import com.repoq.trs.api.model.RuleSet;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.api.model.WellFoundedMeasure;
import com.repoq.trs.core.term.Terms;
import com.repoq.trs.runtime.measure.Measures;

import java.util.List;

/**
 * Peano numerals with addition, a small rewrite system for engine and algorithm tests.
 */
public final class Peano {

    public static final Domain DOMAIN = Domain.METRICS;

    private Peano() {
    }

    public sealed interface Nat extends Term permits Zero, Succ, Add {
        @Override
        default Domain domain() {
            return DOMAIN;
        }
    }

    public record Zero() implements Nat {
        @Override
        public String operator() {
            return "0";
        }

        @Override
        public List<Term> arguments() {
            return List.of();
        }

        @Override
        public Term withArguments(List<Term> arguments) {
            return this;
        }
    }

    public record Succ(Term arg) implements Nat {
        @Override
        public String operator() {
            return "s";
        }

        @Override
        public List<Term> arguments() {
            return List.of(arg);
        }

        @Override
        public Term withArguments(List<Term> arguments) {
            return new Succ(arguments.get(0));
        }
    }

    public record Add(Term left, Term right) implements Nat {
        @Override
        public String operator() {
            return "+";
        }

        @Override
        public List<Term> arguments() {
            return List.of(left, right);
        }

        @Override
        public Term withArguments(List<Term> arguments) {
            return new Add(arguments.get(0), arguments.get(1));
        }
    }

    public static Term zero() {
        return new Zero();
    }

    public static Term s(Term arg) {
        return new Succ(arg);
    }

    public static Term add(Term left, Term right) {
        return new Add(left, right);
    }

    public static Term num(int n) {
        Term result = zero();
        for (int i = 0; i < n; i++) {
            result = s(result);
        }
        return result;
    }

    public static MetaVariable var(String name) {
        return MetaVariable.of(name);
    }

    /**
     * Sum of the sizes of the left operands of every addition.
     */
    public static WellFoundedMeasure leftOperandWeight() {
        return WellFoundedMeasure.of("left-operand-weight", term -> {
            long[] total = {0};
            Terms.walk(term, (node, parent, index) -> {
                if (node instanceof Add addition) {
                    total[0] += Terms.size(addition.left());
                }
            });
            return total[0];
        });
    }

    public static RewriteRule addZero() {
        return RewriteRule.builder("add-zero", DOMAIN)
                .pattern(add(zero(), var("x")))
                .template(var("x"))
                .measure(Measures.nodeCount())
                .build();
    }

    public static RewriteRule addSucc() {
        return RewriteRule.builder("add-succ", DOMAIN)
                .pattern(add(s(var("x")), var("y")))
                .template(s(add(var("x"), var("y"))))
                .measure(leftOperandWeight())
                .build();
    }

    public static RuleSet addition() {
        return RuleSet.builder(DOMAIN, "peano", "1.0.0")
                .add(addZero())
                .add(addSucc())
                .build();
    }

    /**
     * {@code s(x) -> s(s(x))}: applies forever.
     */
    public static RuleSet diverging() {
        return RuleSet.builder(DOMAIN, "peano-diverging", "1.0.0")
                .add(RewriteRule.builder("grow", DOMAIN)
                        .pattern(s(var("x")))
                        .template(s(s(var("x"))))
                        .build())
                .build();
    }
}
