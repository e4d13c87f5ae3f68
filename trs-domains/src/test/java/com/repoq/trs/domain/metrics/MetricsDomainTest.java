/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.metrics;

import com.repoq.trs.api.exceptions.ParseException;
import com.repoq.trs.api.model.NormalizationResult;
import com.repoq.trs.api.model.RewriteRule;
import com.repoq.trs.api.model.RewriteStep;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.api.model.TraceLevel;
import com.repoq.trs.domain.metrics.MetricTerm.Aggregate;
import com.repoq.trs.domain.metrics.MetricTerm.NumberLiteral;
import com.repoq.trs.domain.metrics.MetricTerm.Variable;
import com.repoq.trs.domain.metrics.MetricTerm.Weighted;
import com.repoq.trs.runtime.EngineConfig;
import com.repoq.trs.runtime.RewriteEngine;
import com.repoq.trs.service.NormalizationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricsDomainTest {

    private MetricsDomain domain;
    private RewriteEngine engine;
    private NormalizationService service;

    @BeforeEach
    void setUp() {
        domain = new MetricsDomain();
        engine = new RewriteEngine(domain.ruleSet(), EngineConfig.builder().traceLevel(TraceLevel.BASIC).build());
        service = new NormalizationService(domain.model(), engine);
    }

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        @DisplayName("Should reach a fixpoint on a weighted average")
        void shouldNormalizeWeightedAverage() {
            Term once = service.normalize("avg([w1*sum(a), w2*sum(b)])").normalForm();
            NormalizationResult twice = engine.normalize(once);

            assertThat(domain.model().serialize(once)).isEqualTo("avg(w1*a, w2*b)");
            assertThat(twice.stepsTaken()).isZero();
            assertThat(twice.normalForm()).isEqualTo(once);
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = ';', value = {
                "sum(b, a, sum(c, 1), 2); sum(3, a, b, c)",
                "max(a, max(b, a), 3, 1); max(3, a, b)",
                "min(x); x",
                "0.5*(2*cpu); cpu",
                "0*sum(a, b); 0",
                "1*churn; churn",
                "a + b - c; sum(a, b, -1*c)",
                "avg(1, 2, 4); 2.333333",
                "count(0, 2, 3); 2",
                "count(a, 0, 1); count(0, 1, a)",
                "3*w; 3*w",
                "w*3; 3*w",
                "complexity/4; 0.25*complexity",
                "w1*(0.5*(4*loc)); w1*(2*loc)",
                "sum(1, -1, a); a",
                "1.23456789 + x; sum(1.23456789, x)",
                "0.0001*(0.0001*x); 0.00000001*x",
                "median(x); x",
                "median(b, a, 3); median(3, a, b)",
                "median(4, 1, 3, 2); 2.5",
                "std(churn); 0",
                "std(2, 4, 4, 4, 5, 5, 7, 9); 2.13809",
                "variance(1, 2, 3, 4); 1.666667",
                "variance(loc, 2*loc); variance(loc, 2*loc)",
                "median(a, a, b) + variance(x); median(a, a, b)"
        })
        @DisplayName("Should canonicalize formulas")
        void shouldCanonicalize(String source, String expected) {
            assertThat(service.canonicalize(source)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should fold a literal product in one step")
        void shouldTraceFold() {
            NormalizationResult result = service.normalize("2*3");

            assertThat(result.normalForm()).isEqualTo(NumberLiteral.of("6"));
            assertThat(result.trace()).extracting(RewriteStep::ruleName).containsExactly("weight-literal");
        }

        @Test
        @DisplayName("Should give equal hashes to reordered aggregates")
        void shouldIdentifyReorderedAggregates() {
            assertThat(service.canonicalHash("max(b, a, 2)")).isEqualTo(service.canonicalHash("max(2, a, max(b))"));
        }

        @Test
        @DisplayName("Should leave a normal form untouched")
        void shouldBeIdempotent() {
            for (String source : domain.generator().curatedSources()) {
                Term once = service.normalize(source).normalForm();
                NormalizationResult twice = engine.normalize(once);

                assertThat(twice.stepsTaken()).as(source).isZero();
                assertThat(twice.normalForm()).as(source).isEqualTo(once);
            }
        }

        @Test
        @DisplayName("Should preserve the value of generated formulas")
        void shouldPreserveMeaning() {
            for (Term term : domain.generator().generate(300, 4, 3L)) {
                NormalizationResult result = engine.normalize(term);

                assertThat(result.terminated()).isTrue();
                assertThat(domain.oracle().findDifference(term, result.normalForm())).as(term.toString()).isEmpty();
            }
        }
    }

    @Nested
    @DisplayName("Ground samples")
    class GroundSamples {

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {
                "sum-flatten", "sum-fold", "sum-zero", "sum-singleton", "sum-sort",
                "min-flatten", "min-dedupe", "min-fold", "min-singleton",
                "max-flatten", "max-dedupe", "max-fold", "max-singleton",
                "avg-fold", "avg-singleton", "count-fold", "count-sort",
                "median-fold", "median-singleton", "median-sort",
                "std-fold", "std-singleton", "variance-fold", "variance-singleton"
        })
        @DisplayName("Should offer a sample that each aggregate rule rewrites")
        void shouldFireEveryAggregateRule(String ruleName) {
            RewriteRule rule = domain.ruleSet().rules().stream()
                    .filter(r -> r.name().equals(ruleName))
                    .findFirst()
                    .orElseThrow();
            String function = ruleName.substring(0, ruleName.indexOf('-'));

            assertThat(domain.generator().groundSamples(function))
                    .anySatisfy(sample -> assertThat(RewriteEngine.applyAtRoot(rule, sample)).isPresent());
        }

        @Test
        @DisplayName("Should keep the weight composition within the instance budget")
        void shouldStayWithinBudget() {
            int terms = domain.generator().groundSamples(null).size();
            int numbers = domain.generator().groundSamples(MetricTerm.OP_NUMBER).size();

            assertThat(terms * numbers * numbers).isLessThanOrEqualTo(256);
        }
    }

    @Nested
    @DisplayName("Surface syntax")
    class SurfaceSyntax {

        @Test
        @DisplayName("Should read weights on either side of a product")
        void shouldParseWeights() {
            Term expected = new Weighted(Aggregate.of(MetricTerm.SUM, new Variable("a")), new Variable("w"));

            assertThat(domain.model().parse("w*sum(a)")).isEqualTo(expected);
            assertThat(domain.model().parse("sum([a]) * w")).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should strip trailing zeros from literals")
        void shouldNormalizeLiterals() {
            assertThat(domain.model().parse("2.500")).isEqualTo(NumberLiteral.of("2.5"));
            assertThat(domain.model().serialize(NumberLiteral.of("100.0"))).isEqualTo("100");
        }

        @Test
        @DisplayName("Should round-trip canonical forms")
        void shouldRoundTrip() {
            for (Term term : domain.generator().generate(100, 4, 8L)) {
                Term normal = engine.normalize(term).normalForm();
                String text = domain.model().serialize(normal);

                assertThat(domain.model().parse(text)).as(text).isEqualTo(normal);
            }
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "sum(", "sum()", "foo(a)", "a *", "sum(a b)", "a / b", "a / 0",
                "(a + b", "a + b)", "1.", "sum([a, b)", "sum(a)*sum(b)", "#"})
        @DisplayName("Should reject malformed formulas")
        void shouldRejectMalformed(String source) {
            assertThatThrownBy(() -> domain.model().parse(source))
                    .isInstanceOf(ParseException.class)
                    .hasMessageStartingWith("[metrics]");
        }

        @Test
        @DisplayName("Should report an unknown function at its offset")
        void shouldReportUnknownFunction() {
            assertThatThrownBy(() -> domain.model().parse("sum(a, mode(b))"))
                    .isInstanceOf(ParseException.class)
                    .satisfies(e -> assertThat(((ParseException) e).offset()).isEqualTo(7))
                    .hasMessageContaining("Unknown aggregate function 'mode'");
        }

        @Test
        @DisplayName("Should bound nesting depth")
        void shouldBoundNesting() {
            String deep = "(".repeat(MetricsModel.MAX_DEPTH + 1) + "a" + ")".repeat(MetricsModel.MAX_DEPTH + 1);

            assertThatThrownBy(() -> domain.model().parse(deep))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Nesting deeper than");
        }
    }

    @Nested
    @DisplayName("Oracle")
    class Oracle {

        @Test
        @DisplayName("Should find an assignment that separates different formulas")
        void shouldFindWitness() {
            Term original = domain.model().parse("avg(a, b)");
            Term normalized = domain.model().parse("sum(a, b)");

            assertThat(domain.oracle().findDifference(original, normalized))
                    .hasValueSatisfying(witness -> assertThat(witness).contains("original=").contains("normalized="));
        }

        @Test
        @DisplayName("Should accept equal formulas")
        void shouldAcceptEquivalent() {
            Term original = domain.model().parse("2*(3*max(a, b, a))");
            Term normalized = domain.model().parse("6*max(a, b)");

            assertThat(domain.oracle().findDifference(original, normalized)).isEmpty();
        }
    }
}
