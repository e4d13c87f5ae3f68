/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain;

import com.repoq.trs.api.NormalizationDomain;
import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.NormalizationResult;
import com.repoq.trs.api.model.RewriteRule;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.runtime.RewriteEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainsTest {

    @Nested
    @DisplayName("Selection")
    class Selection {

        @Test
        @DisplayName("Should build every domain in declaration order")
        void shouldBuildAll() {
            assertThat(Domains.all()).extracting(NormalizationDomain::domain).containsExactly(Domain.values());
        }

        @Test
        @DisplayName("Should select domains by id, ignoring case and duplicates")
        void shouldSelectByIds() {
            assertThat(Domains.select(" SPDX, filter,spdx ")).extracting(NormalizationDomain::domain)
                    .containsExactly(Domain.SPDX, Domain.FILTER);
        }

        @Test
        @DisplayName("Should treat a blank selection as all domains")
        void shouldSelectAllWhenBlank() {
            assertThat(Domains.select("")).hasSize(Domain.values().length);
            assertThat(Domains.select("all")).hasSize(Domain.values().length);
        }

        @Test
        @DisplayName("Should parse ids in selection order without building domains")
        void shouldParseIds() {
            assertThat(Domains.parse("rdf,semver,rdf")).containsExactly(Domain.RDF, Domain.SEMVER);
            assertThat(Domains.parse(null)).containsExactly(Domain.values());
        }

        @Test
        @DisplayName("Should reject an unknown id")
        void shouldRejectUnknownId() {
            assertThatThrownBy(() -> Domains.select("spdx,cobol"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("cobol");
        }

        @Test
        @DisplayName("Should build a fresh rule set on every call")
        void shouldNotShareRuleSets() {
            assertThat(Domains.create(Domain.RDF).ruleSet()).isNotSameAs(Domains.create(Domain.RDF).ruleSet());
        }
    }

    @Nested
    @DisplayName("Contracts")
    class Contracts {

        @ParameterizedTest
        @EnumSource(Domain.class)
        @DisplayName("Should tag every rule with its domain and give it a measure")
        void shouldDeclareMeasures(Domain id) {
            NormalizationDomain domain = Domains.create(id);

            assertThat(domain.ruleSet().domain()).isEqualTo(id);
            assertThat(domain.ruleSet().rules()).allMatch(RewriteRule::hasMeasure);
        }

        @ParameterizedTest
        @EnumSource(Domain.class)
        @DisplayName("Should parse and normalize every curated source")
        void shouldNormalizeCuratedSources(Domain id) {
            NormalizationDomain domain = Domains.create(id);
            RewriteEngine engine = new RewriteEngine(domain.ruleSet());

            for (String source : domain.generator().curatedSources()) {
                Term term = domain.model().parse(source);
                NormalizationResult result = engine.normalize(term);

                assertThat(result.terminated()).as(source).isTrue();
                assertThat(domain.oracle().findDifference(term, result.normalForm())).as(source).isEmpty();
            }
        }

        @ParameterizedTest
        @EnumSource(Domain.class)
        @DisplayName("Should generate the same corpus for the same seed")
        void shouldGenerateDeterministically(Domain id) {
            NormalizationDomain domain = Domains.create(id);

            assertThat(domain.generator().generate(20, 3, 42L)).isEqualTo(domain.generator().generate(20, 3, 42L));
        }
    }
}
