/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.spdx;

import com.repoq.trs.api.exceptions.ParseException;
import com.repoq.trs.api.model.NormalizationResult;
import com.repoq.trs.api.model.RewriteStep;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.api.model.TraceLevel;
import com.repoq.trs.core.term.Chains;
import com.repoq.trs.domain.spdx.SpdxTerm.And;
import com.repoq.trs.domain.spdx.SpdxTerm.LicenseId;
import com.repoq.trs.domain.spdx.SpdxTerm.Or;
import com.repoq.trs.domain.spdx.SpdxTerm.With;
import com.repoq.trs.runtime.EngineConfig;
import com.repoq.trs.runtime.RewriteEngine;
import com.repoq.trs.service.NormalizationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeout;

class SpdxDomainTest {

    private SpdxDomain domain;
    private RewriteEngine engine;
    private NormalizationService service;

    @BeforeEach
    void setUp() {
        domain = new SpdxDomain();
        engine = new RewriteEngine(domain.ruleSet(), EngineConfig.builder().traceLevel(TraceLevel.BASIC).build());
        service = new NormalizationService(domain.model(), engine);
    }

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        @DisplayName("Should collapse a duplicated license")
        void shouldCollapseDuplicate() {
            NormalizationResult result = service.normalize("Apache-2.0 OR Apache-2.0");

            assertThat(domain.model().serialize(result.normalForm())).isEqualTo("Apache-2.0");
            assertThat(result.trace()).extracting(RewriteStep::ruleName).containsExactly("or-idempotent");
        }

        @Test
        @DisplayName("Should absorb a disjunction that contains a conjunct")
        void shouldAbsorb() {
            NormalizationResult result = service.normalize("MIT AND (MIT OR Apache-2.0)");

            assertThat(domain.model().serialize(result.normalForm())).isEqualTo("MIT");
            assertThat(result.trace()).extracting(RewriteStep::ruleName).containsExactly("and-absorb");
        }

        @Test
        @DisplayName("Should sort chain operands into canonical order")
        void shouldSortOperands() {
            assertThat(service.canonicalize("GPL-2.0-only OR MIT OR Apache-2.0"))
                    .isEqualTo("Apache-2.0 OR GPL-2.0-only OR MIT");
        }

        @Test
        @DisplayName("Should right-nest parenthesized chains")
        void shouldReassociate() {
            assertThat(service.canonicalize("((MIT OR BSD-3-Clause) OR Apache-2.0)"))
                    .isEqualTo("Apache-2.0 OR BSD-3-Clause OR MIT");
        }

        @Test
        @DisplayName("Should absorb a conjunction under a disjunction")
        void shouldAbsorbConjunction() {
            assertThat(service.canonicalize("(MIT AND Apache-2.0) OR MIT")).isEqualTo("MIT");
        }

        @Test
        @DisplayName("Should give commuted conjunctions the same canonical form")
        void shouldIdentifyCommutedConjunctions() {
            assertThat(service.canonicalize("(MIT AND Apache-2.0) OR (Apache-2.0 AND MIT)"))
                    .isEqualTo("Apache-2.0 AND MIT");
            assertThat(service.canonicalHash("MIT AND Apache-2.0"))
                    .isEqualTo(service.canonicalHash("Apache-2.0 AND MIT"));
        }

        @Test
        @DisplayName("Should keep an exception attached to its license")
        void shouldKeepException() {
            assertThat(service.canonicalize("MIT OR GPL-2.0-or-later WITH Classpath-exception-2.0 OR MIT"))
                    .isEqualTo("MIT OR GPL-2.0-or-later WITH Classpath-exception-2.0");
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
        @DisplayName("Should preserve meaning on generated expressions")
        void shouldPreserveMeaning() {
            for (Term term : domain.generator().generate(200, 5, 42L)) {
                NormalizationResult result = engine.normalize(term);

                assertThat(result.terminated()).isTrue();
                assertThat(domain.oracle().findDifference(term, result.normalForm())).as(term.toString()).isEmpty();
            }
        }
    }

    @Nested
    @DisplayName("Absorption")
    class Absorption {

        private final SpdxRules.Connective or = new SpdxRules.Connective("or", SpdxTerm.OP_OR, Or::new, SpdxTerm.OP_AND);

        private Term id(String name) {
            return new LicenseId(name);
        }

        @Test
        @DisplayName("Should find the first operand that another operand absorbs")
        void shouldLocateAbsorbedOperand() {
            Term mit = id("MIT");
            Term apache = id("Apache-2.0");
            Term both = new And(mit, apache);

            assertThat(SpdxRules.absorbedIndex(or, List.of(mit, both))).isEqualTo(1);
            assertThat(SpdxRules.absorbedIndex(or, List.of(both, mit))).isZero();
            assertThat(SpdxRules.absorbedIndex(or, List.of(both, new And(both, id("BSD-3-Clause"))))).isEqualTo(1);
            assertThat(SpdxRules.absorbedIndex(or, List.of(mit, apache))).isEqualTo(-1);
            assertThat(SpdxRules.absorbedIndex(or, List.of(both, new And(apache, mit)))).isEqualTo(-1);
            assertThat(SpdxRules.absorbedIndex(or, List.of(mit, new And(mit, mit)))).isEqualTo(-1);
        }

        @Test
        @DisplayName("Should normalize a long conjunction in one absorbing step")
        void shouldAbsorbInLongChain() {
            List<Term> ids = new ArrayList<>();
            for (int i = 0; i < 400; i++) {
                ids.add(id(String.format("LicenseRef-%03d", i)));
            }
            List<Term> operands = new ArrayList<>(ids);
            operands.add(new Or(ids.get(0), id("MIT")));
            Term chain = Chains.build(operands, And::new);

            NormalizationResult result = assertTimeout(Duration.ofSeconds(3), () -> engine.normalize(chain));

            assertThat(result.normalForm()).isEqualTo(Chains.build(ids, And::new));
            assertThat(result.trace()).extracting(RewriteStep::ruleName).containsExactly("and-absorb");
        }
    }

    @Nested
    @DisplayName("Surface syntax")
    class SurfaceSyntax {

        @Test
        @DisplayName("Should honour precedence and case-insensitive operators")
        void shouldParsePrecedence() {
            Term term = domain.model().parse("MIT or Apache-2.0 and GPL-2.0-only WITH Classpath-exception-2.0");

            assertThat(term).isEqualTo(new Or(new LicenseId("MIT"),
                    new And(new LicenseId("Apache-2.0"),
                            new With(new LicenseId("GPL-2.0-only"), "Classpath-exception-2.0"))));
        }

        @Test
        @DisplayName("Should parenthesize only where needed")
        void shouldSerializeMinimally() {
            Term term = new And(new Or(new LicenseId("A"), new LicenseId("B")), new LicenseId("C"));

            assertThat(domain.model().serialize(term)).isEqualTo("(A OR B) AND C");
            assertThat(domain.model().parse("(A OR B) AND C")).isEqualTo(term);
        }

        @Test
        @DisplayName("Should round-trip canonical forms")
        void shouldRoundTrip() {
            for (Term term : domain.generator().generate(100, 5, 7L)) {
                Term normal = engine.normalize(term).normalForm();
                String text = domain.model().serialize(normal);

                assertThat(domain.model().parse(text)).as(text).isEqualTo(normal);
            }
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "MIT AND", "(MIT", "MIT)", "MIT Apache-2.0", "WITH MIT",
                "MIT WITH", "MIT WITH A WITH B", "MIT $ Apache-2.0", "()", "OR MIT"})
        @DisplayName("Should reject malformed expressions")
        void shouldRejectMalformed(String source) {
            assertThatThrownBy(() -> domain.model().parse(source))
                    .isInstanceOf(ParseException.class)
                    .hasMessageStartingWith("[spdx]");
        }

        @Test
        @DisplayName("Should report the offset of an unbalanced parenthesis")
        void shouldReportOffset() {
            assertThatThrownBy(() -> domain.model().parse("MIT AND (Apache-2.0"))
                    .isInstanceOf(ParseException.class)
                    .satisfies(e -> assertThat(((ParseException) e).offset()).isEqualTo(8))
                    .hasMessageContaining("Unbalanced '('");
        }
    }

    @Nested
    @DisplayName("Oracle")
    class Oracle {

        @Test
        @DisplayName("Should find an assignment that separates different expressions")
        void shouldFindWitness() {
            Term or = domain.model().parse("MIT OR Apache-2.0");
            Term and = domain.model().parse("MIT AND Apache-2.0");

            assertThat(domain.oracle().findDifference(or, and)).hasValueSatisfying(
                    witness -> assertThat(witness).contains("original=true", "normalized=false"));
        }

        @Test
        @DisplayName("Should accept equivalent expressions")
        void shouldAcceptEquivalent() {
            Term left = domain.model().parse("MIT AND (MIT OR Apache-2.0)");
            Term right = domain.model().parse("MIT");

            assertThat(domain.oracle().findDifference(left, right)).isEmpty();
        }
    }
}
