/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.filter;

import com.repoq.trs.api.exceptions.ParseException;
import com.repoq.trs.api.model.NormalizationResult;
import com.repoq.trs.api.model.RewriteStep;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.api.model.TraceLevel;
import com.repoq.trs.domain.filter.FilterTerm.Glob;
import com.repoq.trs.domain.filter.FilterTerm.Intersect;
import com.repoq.trs.domain.filter.FilterTerm.MatchAll;
import com.repoq.trs.domain.filter.FilterTerm.MatchNone;
import com.repoq.trs.domain.filter.FilterTerm.Negate;
import com.repoq.trs.domain.filter.FilterTerm.PathLiteral;
import com.repoq.trs.domain.filter.FilterTerm.Union;
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

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterDomainTest {

    private FilterDomain domain;
    private RewriteEngine engine;
    private NormalizationService service;

    @BeforeEach
    void setUp() {
        domain = new FilterDomain();
        engine = new RewriteEngine(domain.ruleSet(), EngineConfig.builder().traceLevel(TraceLevel.BASIC).build());
        service = new NormalizationService(domain.model(), engine);
    }

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = ';', value = {
                "*.md | *.md; *.md",
                "!!src/**; src/**",
                "!(*.md | docs/**); !*.md & !docs/**",
                "*.md | README.md; *.md",
                "README.md & *.md; README.md",
                "README.md & docs/**; {}",
                "a | !a; **",
                "b.txt & !b.txt; {}",
                "src/**** | **/**; **",
                "[cab].txt & {}; {}",
                "[cab].txt; [abc].txt",
                "docs/guide.md | (docs/guide.md & *.md); docs/guide.md",
                "(*.md | *.txt) | **/*.java; **/*.java | *.md | *.txt",
                "!** | src/Main.java; src/Main.java",
                "src//**/*.java & ./src/**; src/**/*.java",
                "./docs//guide.md/; docs/guide.md",
                "*.md | (*.md & src/**); *.md",
                "!(README.md | *.md); !*.md",
                "README.md & *.md & (*.md | src/**/*.java); README.md",
                "!(README.md & src/**/*.java); **",
                "src/** | src/main/**; src/**",
                "**/*.java | src/**/*.java; **/*.java",
                "src/** & src/main/**; src/main/**",
                "!src/** | !src/main/**; !src/main/**",
                "a//b/./c/; a/b/c"
        })
        @DisplayName("Should canonicalize filters")
        void shouldCanonicalize(String source, String expected) {
            assertThat(service.canonicalize(source)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should collapse a duplicate in one step")
        void shouldTraceIdempotence() {
            NormalizationResult result = service.normalize("*.md | *.md");

            assertThat(result.normalForm()).isEqualTo(new Glob("*.md"));
            assertThat(result.trace()).extracting(RewriteStep::ruleName).containsExactly("union-idempotent");
        }

        @Test
        @DisplayName("Should give equal hashes to reordered spellings")
        void shouldIdentifyReorderedFilters() {
            assertThat(service.canonicalHash("*.md | src/**")).isEqualTo(service.canonicalHash("./src/** | ./*.md"));
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
        @DisplayName("Should preserve the matched paths of generated filters")
        void shouldPreserveMeaning() {
            for (Term term : domain.generator().generate(300, 4, 11L)) {
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
        @DisplayName("Should bind ! tighter than & and & tighter than |")
        void shouldApplyPrecedence() {
            Term parsed = domain.model().parse("*.md | !src/** & docs/*");

            assertThat(parsed).isEqualTo(new Union(new Glob("*.md"),
                    new Intersect(new Negate(new Glob("src/**")), new Glob("docs/*"))));
        }

        @Test
        @DisplayName("Should classify operands")
        void shouldClassifyOperands() {
            assertThat(domain.model().parse("**")).isEqualTo(new MatchAll());
            assertThat(domain.model().parse("{}")).isEqualTo(new MatchNone());
            assertThat(domain.model().parse("src/Main.java")).isEqualTo(new PathLiteral("src/Main.java"));
            assertThat(domain.model().parse("[!a]*")).isEqualTo(new Glob("[!a]*"));
        }

        @Test
        @DisplayName("Should print only the parentheses the grammar needs")
        void shouldSerializeMinimally() {
            Term term = new Intersect(new Union(new Glob("*.md"), new PathLiteral("a")),
                    new Negate(new Union(new PathLiteral("b"), new PathLiteral("c"))));

            assertThat(domain.model().serialize(term)).isEqualTo("(*.md | a) & !(b | c)");
        }

        @Test
        @DisplayName("Should round-trip canonical forms")
        void shouldRoundTrip() {
            for (Term term : domain.generator().generate(100, 4, 21L)) {
                Term normal = engine.normalize(term).normalForm();
                String text = domain.model().serialize(normal);

                assertThat(domain.model().parse(text)).as(text).isEqualTo(normal);
            }
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "src/[a", "*.{md", "[]", "a |", "(a | b", "a)", "a b", "!", "{a,{b}}",
                "[z-a]", "a]*"})
        @DisplayName("Should reject malformed filters")
        void shouldRejectMalformed(String source) {
            assertThatThrownBy(() -> domain.model().parse(source))
                    .isInstanceOf(ParseException.class)
                    .hasMessageStartingWith("[filter]");
        }

        @Test
        @DisplayName("Should report a glob error at its offset in the whole filter")
        void shouldReportGlobOffset() {
            assertThatThrownBy(() -> domain.model().parse("*.md | src/[a"))
                    .isInstanceOf(ParseException.class)
                    .satisfies(e -> assertThat(((ParseException) e).offset()).isEqualTo(11))
                    .hasMessageContaining("Unbalanced '['");
        }
    }

    @Nested
    @DisplayName("Globs")
    class GlobMatching {

        @ParameterizedTest(name = "{0} matches {1}: {2}")
        @CsvSource({
                "*.md, README.md, true",
                "*.md, docs/guide.md, false",
                "**/*.md, README.md, true",
                "**/*.md, docs/api/index.md, true",
                "src/**, src/util/a.txt, true",
                "src/*/a.txt, src/util/a.txt, true",
                "src/*/a.txt, src/a.txt, false",
                "?, a, true",
                "[!a]*, b.txt, true",
                "[!a]*, a, false",
                "'*.{md,txt}', b.txt, true",
                "./docs//*.md, docs/guide.md, true"
        })
        @DisplayName("Should match paths segment-wise")
        void shouldMatch(String pattern, String path, boolean expected) {
            assertThat(Globs.matches(pattern, path)).isEqualTo(expected);
        }

        @ParameterizedTest(name = "{0} contains {1}: {2}")
        @CsvSource({
                "src/**, src/main/**, true",
                "src/**, src/*.java, true",
                "**/*.java, src/**/*.java, true",
                "**/*.java, *.java, true",
                "**/*.java, src/Main.java, true",
                "src/main/**, src/**, false",
                "src/**, srcx/**, false",
                "**/*.java, src/**/*.md, false",
                "**/x, a**/x, false",
                "'**/*.{md,txt}', docs/*.md, false"
        })
        @DisplayName("Should prove glob inclusion from prefixes and last segments")
        void shouldProveSubsumption(String outer, String inner, boolean expected) {
            assertThat(Globs.subsumes(outer, inner)).isEqualTo(expected);
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "a//b/./c/, a/b/c",
                "./docs//guide.md/, docs/guide.md",
                "./, .",
                "/etc//hosts, /etc/hosts",
                "../x, ../x"
        })
        @DisplayName("Should drop empty and dot segments of paths")
        void shouldNormalizePaths(String path, String expected) {
            assertThat(Globs.normalizePath(path)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should spell equivalent patterns alike")
        void shouldCanonicalizePatterns() {
            assertThat(Globs.canonical("./src//***/[cba]*/")).isEqualTo("src/**/[abc]*");
            assertThat(Globs.canonical("a/**/**/b")).isEqualTo("a/**/b");
        }
    }

    @Nested
    @DisplayName("Path space")
    class Containment {

        private Term parse(String source) {
            return domain.model().parse(source);
        }

        @Test
        @DisplayName("Should decide containment by meaning rather than by shape")
        void shouldDecideByMeaning() {
            Term negatedUnion = parse("!(README.md | *.md)");
            Term negatedGlob = parse("!*.md");
            PathSpace space = PathSpace.of(List.of(negatedUnion, negatedGlob)).orElseThrow();

            assertThat(space.contains(negatedUnion, negatedGlob)).isTrue();
            assertThat(space.contains(negatedGlob, negatedUnion)).isTrue();
        }

        @Test
        @DisplayName("Should use proven glob inclusions and literal membership")
        void shouldUseLeafRelations() {
            Term sources = parse("src/**");
            Term main = parse("src/main/**");
            Term readme = parse("README.md");
            PathSpace space = PathSpace.of(List.of(sources, main, readme)).orElseThrow();

            assertThat(space.contains(sources, main)).isTrue();
            assertThat(space.contains(main, sources)).isFalse();
            assertThat(space.isEmpty(parse("README.md & src/**"))).isFalse();
        }

        @Test
        @DisplayName("Should recognize filters that cover or exclude every path")
        void shouldDecideExtremes() {
            Term cover = parse("!README.md | !src/**/*.java");
            Term disjoint = parse("README.md & src/**/*.java");
            PathSpace space = PathSpace.of(List.of(cover, disjoint)).orElseThrow();

            assertThat(space.isEverything(cover)).isTrue();
            assertThat(space.isEmpty(disjoint)).isTrue();
            assertThat(space.isEverything(parse("*.md | src/**"))).isFalse();
        }

        @Test
        @DisplayName("Should decline when the leaves name too many globs")
        void shouldDeclineLargeSpaces() {
            StringBuilder source = new StringBuilder("d0/*.md");
            for (int i = 1; i <= PathSpace.MAX_GLOBS; i++) {
                source.append(" | d").append(i).append("/*.md");
            }

            assertThat(PathSpace.of(List.of(parse(source.toString())))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Oracle")
    class Oracle {

        @Test
        @DisplayName("Should name a path that separates different filters")
        void shouldFindWitness() {
            Term original = domain.model().parse("*.md");
            Term normalized = domain.model().parse("README.md");

            assertThat(domain.oracle().findDifference(original, normalized))
                    .hasValueSatisfying(witness -> assertThat(witness).startsWith("path CHANGELOG.md"));
        }

        @Test
        @DisplayName("Should accept De Morgan duals")
        void shouldAcceptEquivalent() {
            Term original = domain.model().parse("!(*.md | src/**)");
            Term normalized = domain.model().parse("!*.md & !src/**");

            assertThat(domain.oracle().findDifference(original, normalized)).isEmpty();
        }
    }
}
