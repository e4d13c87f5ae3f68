/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.verifier.fixtures;

import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.MetaVariable;
import com.repoq.trs.api.model.RewriteRule;
import com.repoq.trs.api.model.RuleSet;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.api.model.WellFoundedMeasure;
import com.repoq.trs.core.term.Terms;
import com.repoq.trs.runtime.measure.Measures;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Unary arithmetic ({@code 0}, {@code s(t)}, {@code +(a,b)}) with one well-behaved rule set
 * and several broken ones, each breaking a different property.
 */
public final class Arith {

    public static final Domain DOMAIN = Domain.METRICS;

    private Arith() {
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

    /**
     * Numeric value of a ground term.
     */
    public static long value(Term term) {
        if (term instanceof Zero) {
            return 0;
        }
        if (term instanceof Succ succ) {
            return value(succ.arg()) + 1;
        }
        if (term instanceof Add addition) {
            return value(addition.left()) + value(addition.right());
        }
        throw new IllegalArgumentException("Not a ground arithmetic term: " + term);
    }

    private static MetaVariable var(String name) {
        return MetaVariable.of(name);
    }

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

    public static RewriteRule addZeroRight() {
        return RewriteRule.builder("add-zero-right", DOMAIN)
                .pattern(add(var("x"), zero()))
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

    /**
     * {@code +(0,x) -> x}, {@code +(s(x),y) -> s(+(x,y))}: terminating, confluent, sound.
     */
    public static RuleSet addition() {
        return RuleSet.builder(DOMAIN, "arith", "1.0.0")
                .add(addZero())
                .add(addSucc())
                .build();
    }

    /**
     * Both zero laws; they overlap on {@code +(0,0)} and the pair is joinable.
     */
    public static RuleSet zeroLaws() {
        return RuleSet.builder(DOMAIN, "arith-zero", "1.0.0")
                .add(addZero())
                .add(addZeroRight())
                .build();
    }

    /**
     * Addition plus {@code +(x,s(y)) -> x}, declared first so it wins at the root.
     */
    public static RuleSet unsound() {
        return RuleSet.builder(DOMAIN, "arith-unsound", "1.0.0")
                .add(RewriteRule.builder("add-drop", DOMAIN)
                        .pattern(add(var("x"), s(var("y"))))
                        .template(var("x"))
                        .measure(Measures.nodeCount())
                        .build())
                .add(addZero())
                .add(addSucc())
                .build();
    }

    /**
     * {@code s(x) -> s(s(x))} without a measure.
     */
    public static RuleSet diverging() {
        return RuleSet.builder(DOMAIN, "arith-diverging", "1.0.0")
                .add(RewriteRule.builder("grow", DOMAIN)
                        .pattern(s(var("x")))
                        .template(s(s(var("x"))))
                        .build())
                .build();
    }

    /**
     * {@code s(x) -> s(s(x))} with a measure it does not decrease.
     */
    public static RuleSet growingUnderNodeCount() {
        return RuleSet.builder(DOMAIN, "arith-growing", "1.0.0")
                .add(RewriteRule.builder("grow", DOMAIN)
                        .pattern(s(var("x")))
                        .template(s(s(var("x"))))
                        .measure(Measures.nodeCount())
                        .build())
                .build();
    }

    /**
     * {@code +(x,y) -> x} and {@code +(x,y) -> y}: every addition is a non-joinable overlap.
     */
    public static RuleSet projections() {
        return RuleSet.builder(DOMAIN, "arith-projections", "1.0.0")
                .add(RewriteRule.builder("pick-left", DOMAIN)
                        .pattern(add(var("x"), var("y")))
                        .template(var("x"))
                        .measure(Measures.nodeCount())
                        .build())
                .add(RewriteRule.builder("pick-right", DOMAIN)
                        .pattern(add(var("x"), var("y")))
                        .template(var("y"))
                        .measure(Measures.nodeCount())
                        .build())
                .build();
    }

    /**
     * {@code +(0,x) -> x} and a right zero law that only fires above 100; they overlap on
     * {@code +(0,0)} alone, where the guard fails.
     */
    public static RuleSet guardedZeroLaws() {
        return RuleSet.builder(DOMAIN, "arith-guarded-zero", "1.0.0")
                .add(addZero())
                .add(RewriteRule.builder("add-zero-right-large", DOMAIN)
                        .pattern(add(var("x"), zero()))
                        .when(bindings -> value(bindings.get("x")) > 100)
                        .template(var("x"))
                        .measure(Measures.nodeCount())
                        .build())
                .build();
    }

    /**
     * Addition plus a copy of {@code add-succ} that only fires when the right operand exceeds
     * 100, which no ground sample does.
     */
    public static RuleSet unsampledGuard() {
        return RuleSet.builder(DOMAIN, "arith-unsampled", "1.0.0")
                .add(addSucc())
                .add(RewriteRule.builder("add-succ-large", DOMAIN)
                        .pattern(add(s(var("x")), var("y")))
                        .when(bindings -> value(bindings.get("y")) > 100)
                        .template(s(add(var("x"), var("y"))))
                        .measure(leftOperandWeight())
                        .build())
                .build();
    }

    /**
     * A zero law whose side condition holds on every other evaluation.
     */
    public static RuleSet flaky() {
        AtomicInteger calls = new AtomicInteger();
        return RuleSet.builder(DOMAIN, "arith-flaky", "1.0.0")
                .add(RewriteRule.builder("add-zero-sometimes", DOMAIN)
                        .pattern(add(zero(), var("x")))
                        .template(var("x"))
                        .when(bindings -> calls.incrementAndGet() % 2 == 0)
                        .measure(Measures.nodeCount())
                        .build())
                .build();
    }
}
