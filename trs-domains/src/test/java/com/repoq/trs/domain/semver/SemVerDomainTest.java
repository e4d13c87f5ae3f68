/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.semver;

import com.repoq.trs.api.exceptions.ParseException;
import com.repoq.trs.api.model.NormalizationResult;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.domain.semver.SemVerTerm.Caret;
import com.repoq.trs.domain.semver.SemVerTerm.Hyphen;
import com.repoq.trs.domain.semver.SemVerTerm.Op;
import com.repoq.trs.domain.semver.SemVerTerm.PartialVersion;
import com.repoq.trs.domain.semver.SemVerTerm.Range;
import com.repoq.trs.domain.semver.SemVerTerm.Union;
import com.repoq.trs.domain.semver.SemVerTerm.Version;
import com.repoq.trs.domain.semver.SemVerTerm.VersionComparator;
import com.repoq.trs.domain.semver.SemVerTerm.XRange;
import com.repoq.trs.runtime.RewriteEngine;
import com.repoq.trs.service.NormalizationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SemVerDomainTest {

    private SemVerDomain domain;
    private RewriteEngine engine;
    private NormalizationService service;

    @BeforeEach
    void setUp() {
        domain = new SemVerDomain();
        engine = new RewriteEngine(domain.ruleSet());
        service = new NormalizationService(domain.model(), engine);
    }

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = ';', value = {
                "1.0.0 - 2.0.0;          >=1.0.0 <=2.0.0",
                "^1.2.3;                 >=1.2.3 <2.0.0-0",
                "^0.2.3;                 >=0.2.3 <0.3.0-0",
                "^0.0.3;                 >=0.0.3 <0.0.4-0",
                "^0;                     >=0.0.0 <1.0.0-0",
                "~1.2.3;                 >=1.2.3 <1.3.0-0",
                "~1;                     >=1.0.0 <2.0.0-0",
                "1.x;                    >=1.0.0 <2.0.0-0",
                "1.2.*;                  >=1.2.0 <1.3.0-0",
                "1.2.3 - 2;              >=1.2.3 <3.0.0-0",
                ">1.2;                   >=1.3.0",
                "<=1.2;                  <1.3.0-0",
                ">= 1.2.3;               >=1.2.3",
                "=1.2.3;                 1.2.3",
                "v1.2.3+build.5;         1.2.3"
        })
        @DisplayName("Should expand sugar into comparators")
        void shouldDesugar(String source, String expected) {
            assertThat(service.canonicalize(source)).isEqualTo(expected);
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = ';', value = {
                ">=1.0.0 <2.0.0 >=1.5.0;  >=1.5.0 <2.0.0",
                "<2.0.0 >=1.0.0;          >=1.0.0 <2.0.0",
                ">=2.0.0 <1.0.0;          <0.0.0-0",
                ">=1.0.0 <=1.0.0;         1.0.0",
                "1.5.0 >=1.0.0 <2.0.0;    1.5.0",
                "* >1.0.0;                >1.0.0",
                ">1.0.0 >=1.0.0;          >1.0.0"
        })
        @DisplayName("Should intersect comparator sets")
        void shouldIntersect(String source, String expected) {
            assertThat(service.canonicalize(source)).isEqualTo(expected);
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = ';', value = {
                "^1.2.3 || ^1.5.0;        >=1.2.3 <2.0.0-0",
                ">=3.0.0 || <1.0.0;       <1.0.0 || >=3.0.0",
                "<1.0.0 || >=1.0.0;       *",
                "* || 1.2.3;              *",
                "1.2.3 || 1.2.3;          1.2.3",
                "<0.0.0-0 || 1.0.0;       1.0.0",
                "^2.0.0 || ^1.0.0;        >=1.0.0 <2.0.0-0 || >=2.0.0 <3.0.0-0",
                "^1.0.0 || >=2.0.0-0 <3.0.0;  >=1.0.0 <3.0.0"
        })
        @DisplayName("Should merge and order alternatives")
        void shouldMergeUnions(String source, String expected) {
            assertThat(service.canonicalize(source)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should be stable on its own output")
        void shouldBeIdempotent() {
            for (String source : domain.generator().curatedSources()) {
                String once = service.canonicalize(source);

                assertThat(service.canonicalize(once)).as(source).isEqualTo(once);
            }
        }

        @Test
        @DisplayName("Should preserve the admitted versions of generated ranges")
        void shouldPreserveMeaning() {
            for (Term term : domain.generator().generate(300, 3, 11L)) {
                NormalizationResult result = engine.normalize(term);

                assertThat(result.terminated()).as(term.toString()).isTrue();
                assertThat(domain.oracle().findDifference(term, result.normalForm())).as(term.toString()).isEmpty();
                Term reparsed = domain.model().parse(domain.model().serialize(result.normalForm()));
                assertThat(reparsed).as(term.toString()).isEqualTo(result.normalForm());
            }
        }
    }

    @Nested
    @DisplayName("Surface syntax")
    class SurfaceSyntax {

        @Test
        @DisplayName("Should parse sugar without expanding it")
        void shouldParseSugar() {
            assertThat(domain.model().parse("1.0.0 - 2.x"))
                    .isEqualTo(new Hyphen(Version.of(1, 0, 0), new PartialVersion(2, null)));
            assertThat(domain.model().parse("^1.2")).isEqualTo(new Caret(new PartialVersion(1, 2L)));
            assertThat(domain.model().parse("1.2.x")).isEqualTo(new XRange(new PartialVersion(1, 2L)));
            assertThat(domain.model().parse(">=1.0.0 <2.0.0")).isEqualTo(new Range(
                    VersionComparator.of(Op.GTE, Version.of(1, 0, 0)),
                    VersionComparator.of(Op.LT, Version.of(2, 0, 0))));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "1.2.3 ||", "|| 1.2.3", "1.2.3 | 2.0.0", "01.2.3", "1.2.3.4", "1.x.3",
                "1.2.3-", "1.2.3-01", "^", ">=", "1.0.0 -", "1.0.0 - 2.0.0 - 3.0.0", "abc", "^*",
                "1.2.3-beta!", "99999999999999999.0.0"})
        @DisplayName("Should reject malformed ranges")
        void shouldRejectMalformed(String source) {
            assertThatThrownBy(() -> domain.model().parse(source))
                    .isInstanceOf(ParseException.class)
                    .hasMessageStartingWith("[semver]");
        }
    }

    @Nested
    @DisplayName("Printing")
    class Printing {

        @Test
        @DisplayName("Should refuse a bare version where a range is expected")
        void shouldRejectBareVersions() {
            Term union = new Union(VersionComparator.of(Op.GTE, Version.of(1, 0, 0)), Version.of(1, 0, 0));

            assertThatThrownBy(() -> domain.model().serialize(union))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("A bare version is not a range");
            assertThatThrownBy(() -> domain.model().serialize(new PartialVersion(1, 2L)))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should print versions under sugar and comparators")
        void shouldPrintOperands() {
            assertThat(domain.model().serialize(new Caret(new PartialVersion(1, 2L)))).isEqualTo("^1.2");
            assertThat(domain.model().serialize(new Hyphen(Version.of(1, 0, 0), new PartialVersion(2, null))))
                    .isEqualTo("1.0.0 - 2");
            assertThat(domain.model().serialize(VersionComparator.of(Op.EQ, Version.of(1, 2, 3))))
                    .isEqualTo("1.2.3");
        }

        @Test
        @DisplayName("Should offer only printable ground samples outside sugar")
        void shouldSampleWithinBudget() {
            List<Term> unsorted = domain.generator().groundSamples(null);

            assertThat(unsorted).hasSize(6);
            assertThat(domain.generator().groundSamples(SemVerTerm.OP_COMPARATOR))
                    .allMatch(term -> term instanceof VersionComparator);
            assertThat(unsorted).filteredOn(term -> !(term instanceof Version || term instanceof PartialVersion))
                    .allSatisfy(term -> assertThat(domain.model().serialize(term)).isNotBlank());
        }
    }

    @Nested
    @DisplayName("Version precedence")
    class Precedence {

        @Test
        @DisplayName("Should order versions by semver precedence")
        void shouldOrderVersions() {
            List<Version> expected = List.of(
                    new Version(1, 0, 0, "alpha"),
                    new Version(1, 0, 0, "alpha.1"),
                    new Version(1, 0, 0, "alpha.beta"),
                    new Version(1, 0, 0, "beta"),
                    new Version(1, 0, 0, "beta.2"),
                    new Version(1, 0, 0, "beta.11"),
                    new Version(1, 0, 0, "rc.1"),
                    Version.of(1, 0, 0),
                    Version.of(1, 0, 10),
                    Version.of(1, 10, 0));
            List<Version> shuffled = new ArrayList<>(expected);
            Collections.reverse(shuffled);
            Collections.sort(shuffled);

            assertThat(shuffled).containsExactlyElementsOf(expected);
        }
    }

    @Nested
    @DisplayName("Oracle")
    class Oracle {

        @Test
        @DisplayName("Should accept a faithful expansion")
        void shouldAcceptExpansion() {
            Term caret = domain.model().parse("^1.2.3");

            assertThat(domain.oracle().findDifference(caret, domain.model().parse(">=1.2.3 <2.0.0-0"))).isEmpty();
        }

        @Test
        @DisplayName("Should catch a bound that admits prereleases of the next major")
        void shouldCatchLooseBound() {
            Term caret = domain.model().parse("^1.2.3");

            assertThat(domain.oracle().findDifference(caret, domain.model().parse(">=1.2.3 <2.0.0")))
                    .hasValueSatisfying(witness -> assertThat(witness).contains("2.0.0-0"));
        }

        @Test
        @DisplayName("Should decide release versions the npm way")
        void shouldDecideReleases() {
            Term exact = domain.model().parse("=1.2.3");

            assertThat(domain.oracle().findDifference(exact, domain.model().parse("1.2.4")))
                    .contains("version 1.2.3 gives original=true, normalized=false");
        }

        @Test
        @DisplayName("Should accept the expansion of a union of sugar")
        void shouldAcceptSugarUnion() {
            Term sugar = domain.model().parse("1.x || ~2.1");
            Term expanded = domain.model().parse(">=1.0.0 <2.0.0-0 || >=2.1.0 <2.2.0-0");

            assertThat(domain.oracle().findDifference(sugar, expanded)).isEmpty();
            assertThat(domain.oracle().findDifference(sugar, engine.normalize(sugar).normalForm())).isEmpty();
        }
    }
}
