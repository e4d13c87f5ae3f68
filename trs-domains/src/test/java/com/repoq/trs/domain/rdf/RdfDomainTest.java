/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.rdf;

import com.repoq.trs.api.exceptions.ParseException;
import com.repoq.trs.api.model.NormalizationResult;
import com.repoq.trs.api.model.RewriteStep;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.api.model.TraceLevel;
import com.repoq.trs.runtime.EngineConfig;
import com.repoq.trs.runtime.RewriteEngine;
import com.repoq.trs.service.NormalizationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RdfDomainTest {

    private static final String P = "<http://example.org/p>";
    private static final String O = "<http://example.org/o>";
    private static final String K = "<http://example.org/knows>";

    private RdfDomain domain;
    private RewriteEngine engine;
    private NormalizationService service;

    @BeforeEach
    void setUp() {
        domain = new RdfDomain();
        engine = new RewriteEngine(domain.ruleSet(), EngineConfig.builder().traceLevel(TraceLevel.BASIC).build());
        service = new NormalizationService(domain.model(), engine);
    }

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        @DisplayName("Should give identical output for statements that differ only in blank labels")
        void shouldIgnoreBlankLabels() {
            String first = service.canonicalize("_:x " + P + " " + O + " .");
            String second = service.canonicalize("_:y " + P + " " + O + " .");

            assertThat(first).isEqualTo("_:b0 " + P + " " + O + " .\n").isEqualTo(second);
            assertThat(service.canonicalHash("_:x " + P + " " + O + " ."))
                    .isEqualTo(service.canonicalHash("_:y " + P + " " + O + " ."));
        }

        @Test
        @DisplayName("Should drop repeated statements")
        void shouldDedupe() {
            NormalizationResult result = service.normalize(
                    "<http://example.org/s> " + P + " " + O + " .\n<http://example.org/s> " + P + " " + O + " .");

            assertThat(domain.model().serialize(result.normalForm()))
                    .isEqualTo("<http://example.org/s> " + P + " " + O + " .\n");
            assertThat(result.trace()).extracting(RewriteStep::ruleName).containsExactly("graph-dedupe");
        }

        @Test
        @DisplayName("Should treat an xsd:string literal as a plain literal")
        void shouldDropStringDatatype() {
            String canonical = service.canonicalize(
                    "<http://example.org/s> " + P + " \"x\"^^<http://www.w3.org/2001/XMLSchema#string> .\n"
                            + "<http://example.org/s> " + P + " \"x\" .");

            assertThat(canonical).isEqualTo("<http://example.org/s> " + P + " \"x\" .\n");
        }

        @Test
        @DisplayName("Should expand Turtle prefixes and 'a', lower-case language tags and sort statements")
        void shouldCanonicalizeTurtle() {
            String canonical = service.canonicalize("@prefix ex: <http://example.org/> .\n"
                    + "ex:s a ex:Thing .\n"
                    + "ex:s ex:label \"Thing\"@EN .");

            assertThat(canonical).isEqualTo(
                    "<http://example.org/s> <http://example.org/label> \"Thing\"@en .\n"
                            + "<http://example.org/s> <http://www.w3.org/1999/02/22-rdf-syntax-ns#type> <http://example.org/Thing> .\n");
        }

        @Test
        @DisplayName("Should label a symmetric cycle and stay in normal form")
        void shouldLabelSymmetricCycle() {
            String canonical = service.canonicalize("_:a " + K + " _:b .\n_:b " + K + " _:a .");

            assertThat(canonical).isEqualTo("_:b0 " + K + " _:b1 .\n_:b1 " + K + " _:b0 .\n");
            assertThat(engine.normalize(domain.model().parse(canonical)).stepsTaken()).isZero();
        }

        @Test
        @DisplayName("Should not depend on statement order or blank labels")
        void shouldBeLabelAndOrderInvariant() {
            String typed = "\"5\"^^<http://www.w3.org/2001/XMLSchema#integer>";
            String first = "_:y " + P + " " + typed + " .\n_:x " + P + " " + typed + " .\n_:x " + K + " _:y .";
            String second = "_:m " + K + " _:n .\n_:n " + P + " " + typed + " .\n_:m " + P + " " + typed + " .";

            assertThat(service.canonicalize(first)).isEqualTo(service.canonicalize(second));
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
        @DisplayName("Should keep generated graphs isomorphic")
        void shouldPreserveMeaning() {
            for (Term term : domain.generator().generate(200, 3, 5L)) {
                NormalizationResult result = engine.normalize(term);

                assertThat(result.terminated()).isTrue();
                assertThat(domain.oracle().findDifference(term, result.normalForm())).as(term.toString()).isEmpty();
            }
        }
    }

    @Nested
    @DisplayName("Surface syntax")
    class SurfaceSyntax {

        @Test
        @DisplayName("Should round-trip canonical graphs through N-Triples")
        void shouldRoundTrip() {
            for (Term term : domain.generator().generate(100, 3, 9L)) {
                Term normal = engine.normalize(term).normalForm();
                String text = domain.model().serialize(normal);

                assertThat(domain.model().parse(text)).as(text).isEqualTo(normal);
            }
        }

        @Test
        @DisplayName("Should keep escapes in literals")
        void shouldKeepEscapes() {
            String source = "<http://example.org/s> " + P + " \"line\\nbreak \\\"quoted\\\"\" .";

            assertThat(service.canonicalize(source)).isEqualTo(source + "\n");
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "<http://a> <http://b> .", "\"lit\" <http://p> <http://o> .",
                "<http://s> _:p <http://o> .", "<http://s> <http://p> <http://o>", "ex:s ex:p ex:o .",
                "<http://s> <http://p> \"open .", "<http://s> <http://p> \"x\"@1bad .",
                "<> <http://p> <http://o> .", "@prefix ex: <http://example.org/> ."})
        @DisplayName("Should reject malformed documents")
        void shouldRejectMalformed(String source) {
            assertThatThrownBy(() -> domain.model().parse(source))
                    .isInstanceOf(ParseException.class)
                    .hasMessageStartingWith("[rdf]");
        }
    }

    @Nested
    @DisplayName("Oracle")
    class Oracle {

        @Test
        @DisplayName("Should report a lost statement")
        void shouldReportLostStatement() {
            Term original = domain.model().parse("<http://example.org/s> " + P + " " + O + " .\n"
                    + "<http://example.org/s> " + P + " \"v\" .");
            Term normalized = domain.model().parse("<http://example.org/s> " + P + " " + O + " .");

            assertThat(domain.oracle().findDifference(original, normalized)).isPresent();
        }

        @Test
        @DisplayName("Should reject a graph with a different blank-node structure")
        void shouldRejectNonIsomorphic() {
            Term original = domain.model().parse("_:a " + K + " _:b .\n_:b " + K + " _:a .");
            Term normalized = domain.model().parse("_:a " + K + " _:b .\n_:b " + K + " _:c .");

            assertThat(domain.oracle().findDifference(original, normalized)).isPresent();
        }

        @Test
        @DisplayName("Should accept a relabelled and reordered graph")
        void shouldAcceptIsomorphic() {
            Term original = domain.model().parse("_:a " + K + " _:b .\n_:b " + P + " \"x\"@EN .");
            Term normalized = domain.model().parse("_:q " + P + " \"x\"@en .\n_:r " + K + " _:q .");

            assertThat(domain.oracle().findDifference(original, normalized)).isEmpty();
        }
    }
}
