/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.verifier.termination;

import com.repoq.trs.api.model.MetaVariable;
import com.repoq.trs.api.model.PropertyStatus;
import com.repoq.trs.api.model.RewriteRule;
import com.repoq.trs.api.model.RuleSet;
import com.repoq.trs.runtime.measure.Measures;
import com.repoq.trs.verifier.fixtures.Arith;
import com.repoq.trs.verifier.fixtures.ArithGenerator;
import com.repoq.trs.verifier.fixtures.ArithModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.repoq.trs.verifier.fixtures.Arith.add;
import static com.repoq.trs.verifier.fixtures.Arith.num;
import static com.repoq.trs.verifier.fixtures.Arith.s;
import static com.repoq.trs.verifier.fixtures.Arith.zero;
import static org.assertj.core.api.Assertions.assertThat;

class TerminationCheckerTest {

    private static TerminationChecker checkerFor(RuleSet ruleSet, int budget) {
        return new TerminationChecker(ruleSet, new ArithModel(), new ArithGenerator(), budget);
    }

    @Nested
    @DisplayName("checkRule")
    class CheckRule {

        @Test
        @DisplayName("Should pass every addition rule on exhaustive samples")
        void shouldPassAdditionRules() {
            List<TerminationChecker.RuleVerdict> verdicts = checkerFor(Arith.addition(), 256).checkRules();

            assertThat(verdicts).extracting(TerminationChecker.RuleVerdict::status)
                    .containsExactly(PropertyStatus.PASS, PropertyStatus.PASS);
            assertThat(verdicts.get(0).checked()).isEqualTo(4);
            assertThat(verdicts.get(1).checked()).isEqualTo(16);
        }

        @Test
        @DisplayName("Should fail a rule without a measure")
        void shouldFailWithoutMeasure() {
            TerminationChecker.RuleVerdict verdict = checkerFor(Arith.diverging(), 256).checkRules().get(0);

            assertThat(verdict.status()).isEqualTo(PropertyStatus.FAIL);
            assertThat(verdict.message()).isEqualTo("no well-founded measure declared");
        }

        @Test
        @DisplayName("Should fail a rule whose measure grows, with the redex as witness")
        void shouldFailOnIncreasingMeasure() {
            TerminationChecker.RuleVerdict verdict = checkerFor(Arith.growingUnderNodeCount(), 256).checkRules().get(0);

            assertThat(verdict.status()).isEqualTo(PropertyStatus.FAIL);
            assertThat(verdict.witness()).isNotNull();
            assertThat(verdict.message()).startsWith("node-count goes from");
        }

        @Test
        @DisplayName("Should be inconclusive when no sample satisfies the side condition")
        void shouldBeUnknownWhenNothingApplies() {
            RewriteRule never = RewriteRule.builder("never", Arith.DOMAIN)
                    .pattern(add(zero(), MetaVariable.of("x")))
                    .template(MetaVariable.of("x"))
                    .when(bindings -> false)
                    .measure(Measures.nodeCount())
                    .build();
            RuleSet ruleSet = RuleSet.builder(Arith.DOMAIN, "never", "1").add(never).build();

            TerminationChecker.RuleVerdict verdict = checkerFor(ruleSet, 256).checkRules().get(0);

            assertThat(verdict.status()).isEqualTo(PropertyStatus.UNKNOWN);
            assertThat(verdict.message()).isEqualTo("no ground sample satisfies the rule");
        }

        @Test
        @DisplayName("Should be inconclusive when sampling is cut off")
        void shouldBeUnknownWhenTruncated() {
            TerminationChecker.RuleVerdict verdict = checkerFor(Arith.addition(), 2)
                    .checkRule(Arith.addSucc(), Arith.leftOperandWeight());

            assertThat(verdict.status()).isEqualTo(PropertyStatus.UNKNOWN);
            assertThat(verdict.message()).isEqualTo("sample enumeration cut off at 2 instances");
        }
    }

    @Nested
    @DisplayName("checkTrace")
    class CheckTrace {

        @Test
        @DisplayName("Should count rule applications on a decreasing trace")
        void shouldCountApplications() {
            TerminationChecker.TraceReport report = checkerFor(Arith.addition(), 256)
                    .checkTrace(List.of(add(num(2), num(1)), add(zero(), zero())), 100);

            assertThat(report.violations()).isEmpty();
            assertThat(report.checked()).isEqualTo(2);
            assertThat(report.applications()).containsEntry("add-succ", 2).containsEntry("add-zero", 2);
        }

        @Test
        @DisplayName("Should report a run that hits the step bound")
        void shouldReportNonTermination() {
            TerminationChecker.TraceReport report = checkerFor(Arith.diverging(), 256)
                    .checkTrace(List.of(num(1), zero()), 10);

            assertThat(report.violations()).hasSize(1);
            assertThat(report.violations().get(0).rule()).isNull();
            assertThat(report.violations().get(0).message()).contains("STEP_LIMIT");
        }

        @Test
        @DisplayName("Should report a step on which the declared measure does not decrease")
        void shouldReportNonDecreasingStep() {
            RewriteRule swap = RewriteRule.builder("swap", Arith.DOMAIN)
                    .pattern(add(s(MetaVariable.of("x")), zero()))
                    .template(add(zero(), s(MetaVariable.of("x"))))
                    .measure(Measures.nodeCount())
                    .build();
            RuleSet ruleSet = RuleSet.builder(Arith.DOMAIN, "swap", "1").add(swap).build();

            TerminationChecker.TraceReport report = checkerFor(ruleSet, 256)
                    .checkTrace(List.of(add(num(1), zero())), 10);

            assertThat(report.violations()).hasSize(1);
            assertThat(report.violations().get(0).rule()).isEqualTo("swap");
            assertThat(report.violations().get(0).message()).contains("on +(s(0),0)");
            assertThat(report.applications()).containsEntry("swap", 1);
        }
    }
}
