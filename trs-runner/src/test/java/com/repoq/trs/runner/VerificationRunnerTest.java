/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.runner;

import com.repoq.trs.api.NormalizationDomain;
import com.repoq.trs.api.SemanticOracle;
import com.repoq.trs.api.TermGenerator;
import com.repoq.trs.api.TermModel;
import com.repoq.trs.api.exceptions.RuleDefinitionException;
import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.PropertyResult;
import com.repoq.trs.api.model.PropertyStatus;
import com.repoq.trs.api.model.RuleSet;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.api.model.TrsProperty;
import com.repoq.trs.api.model.VerificationReport;
import com.repoq.trs.domain.Domains;
import com.repoq.trs.verifier.VerificationConfig;
import com.repoq.trs.verifier.report.VerificationReportWriter;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class VerificationRunnerTest {

    private static final VerificationConfig CONFIG = VerificationConfig.builder()
            .corpusSize(10)
            .corpusDepth(2)
            .seed(9L)
            .parallelism(2)
            .instanceBudget(16)
            .shrinkBudget(20)
            .build();

    @TempDir
    Path dir;

    private ByteArrayOutputStream buffer;
    private PrintStream out;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    private VerificationRunner runner(Function<Domain, NormalizationDomain> factory) {
        return new VerificationRunner(CONFIG, OpenTelemetry.noop().getTracer("test"), out, factory);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should verify a real domain and write its report")
    void shouldVerifyAndWriteReport() throws Exception {
        Path file = dir.resolve("trs-verification.json");

        int exitCode = runner(Domains::create).run("filter", file);

        assertThat(exitCode).isEqualTo(VerificationRunner.EXIT_OK);
        List<VerificationReport> reports = new VerificationReportWriter().read(file);
        assertThat(reports).hasSize(1);
        assertThat(reports.get(0).domain()).isEqualTo(Domain.FILTER);
        assertThat(reports.get(0).results()).hasSize(TrsProperty.values().length);
        assertThat(output()).contains("[filter] 1/6 TERMINATION").contains("Report written to");
    }

    @Test
    @DisplayName("Should exit 0 for every shipped rule set")
    void shouldPassShippedRuleSets() throws Exception {
        Path file = dir.resolve("all.json");

        int exitCode = runner(Domains::create).run("all", file);

        assertThat(exitCode).isEqualTo(VerificationRunner.EXIT_OK);
        List<VerificationReport> reports = new VerificationReportWriter().read(file);
        assertThat(reports).extracting(VerificationReport::domain).containsExactly(Domain.values());
        assertThat(reports).noneMatch(VerificationReport::hasFailures);
    }

    @Test
    @DisplayName("Should exit 1 when a property fails")
    void shouldExitOneOnFailure() {
        int exitCode = runner(domain -> withOracle(Domains.create(domain), alwaysDifferent()))
                .run("filter", dir.resolve("report.json"));

        assertThat(exitCode).isEqualTo(VerificationRunner.EXIT_FAILURES);
        assertThat(output()).contains("SOUNDNESS: always-different: never equal");
    }

    @Test
    @DisplayName("Should exit 2 for an unknown domain without writing a report")
    void shouldRejectUnknownDomain() {
        Path file = dir.resolve("report.json");

        int exitCode = runner(Domains::create).run("filter,cobol", file);

        assertThat(exitCode).isEqualTo(VerificationRunner.EXIT_SETUP_ERROR);
        assertThat(Files.exists(file)).isFalse();
        assertThat(output()).contains("Unknown domain: cobol");
    }

    @Test
    @DisplayName("Should record a setup failure and still verify the other domains")
    void shouldIsolateSetupFailures() throws Exception {
        Path file = dir.resolve("report.json");
        Function<Domain, NormalizationDomain> factory = domain -> {
            if (domain == Domain.SEMVER) {
                throw new RuleDefinitionException("Rule 'broken' has no pattern");
            }
            return Domains.create(domain);
        };

        int exitCode = runner(factory).run("semver,filter", file);

        assertThat(exitCode).isEqualTo(VerificationRunner.EXIT_SETUP_ERROR);
        List<VerificationReport> reports = new VerificationReportWriter().read(file);
        assertThat(reports).extracting(VerificationReport::domain).containsExactly(Domain.SEMVER, Domain.FILTER);
        assertThat(reports.get(0).results()).extracting(PropertyResult::note)
                .allMatch(note -> note.contains("Rule 'broken' has no pattern"));
        assertThat(reports.get(1).ruleSetName()).isEqualTo("filter");
    }

    @Test
    @DisplayName("Should build a setup-failure entry with every property UNKNOWN")
    void shouldBuildSetupFailureEntry() {
        VerificationReport report = VerificationRunner.setupFailure(Domain.RDF, new IllegalStateException("boom"));

        assertThat(report.ruleSetName()).isEqualTo("rdf");
        assertThat(report.results()).extracting(PropertyResult::status).containsOnly(PropertyStatus.UNKNOWN);
        assertThat(report.hasFailures()).isFalse();
    }

    private static SemanticOracle alwaysDifferent() {
        return new SemanticOracle() {
            @Override
            public String name() {
                return "always-different";
            }

            @Override
            public Optional<String> findDifference(Term original, Term normalized) {
                return Optional.of("never equal");
            }
        };
    }

    private static NormalizationDomain withOracle(NormalizationDomain delegate, SemanticOracle oracle) {
        return new NormalizationDomain() {
            @Override
            public Domain domain() {
                return delegate.domain();
            }

            @Override
            public TermModel model() {
                return delegate.model();
            }

            @Override
            public RuleSet ruleSet() {
                return delegate.ruleSet();
            }

            @Override
            public TermGenerator generator() {
                return delegate.generator();
            }

            @Override
            public SemanticOracle oracle() {
                return oracle;
            }
        };
    }
}
