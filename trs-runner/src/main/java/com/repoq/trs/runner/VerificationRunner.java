/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.runner;

import com.repoq.trs.api.IPropertyVerifier;
import com.repoq.trs.api.NormalizationDomain;
import com.repoq.trs.api.VerificationListener;
import com.repoq.trs.api.model.CriticalPairSummary;
import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.PropertyResult;
import com.repoq.trs.api.model.PropertyStatus;
import com.repoq.trs.api.model.TrsProperty;
import com.repoq.trs.api.model.VerificationReport;
import com.repoq.trs.domain.Domains;
import com.repoq.trs.runner.telemetry.TracingService;
import com.repoq.trs.verifier.PropertyVerifier;
import com.repoq.trs.verifier.VerificationConfig;
import com.repoq.trs.verifier.report.VerificationReportWriter;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * CI gate: verifies the selected domains, writes the JSON report and exits non-zero when a
 * property fails.
 *
 * <pre>
 * java -Dtrs.domains=spdx,semver -Dtrs.report.file=target/trs.json \
 *      -cp ... com.repoq.trs.runner.VerificationRunner
 * </pre>
 *
 * <p>Exit codes: {@value #EXIT_OK} when nothing failed, {@value #EXIT_FAILURES} when any
 * property is {@code FAIL}, {@value #EXIT_SETUP_ERROR} when a domain could not be set up or
 * the report could not be written. A setup error wins over property failures.
 */
public final class VerificationRunner {

    private static final Logger logger = LoggerFactory.getLogger(VerificationRunner.class);

    public static final String DOMAINS_PROPERTY = "trs.domains";
    public static final String REPORT_FILE_PROPERTY = "trs.report.file";
    public static final String DEFAULT_REPORT_FILE = "trs-verification.json";

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURES = 1;
    public static final int EXIT_SETUP_ERROR = 2;

    private final VerificationConfig config;
    private final Tracer tracer;
    private final PrintStream out;
    private final Function<Domain, NormalizationDomain> domainFactory;
    private final VerificationReportWriter writer = new VerificationReportWriter();

    public VerificationRunner(VerificationConfig config, Tracer tracer, PrintStream out) {
        this(config, tracer, out, Domains::create);
    }

    VerificationRunner(VerificationConfig config, Tracer tracer, PrintStream out,
                       Function<Domain, NormalizationDomain> domainFactory) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.domainFactory = Objects.requireNonNull(domainFactory, "domainFactory must not be null");
    }

    public static void main(String[] args) {
        TracingService tracing = TracingService.getInstance();
        int exitCode;
        try {
            VerificationRunner runner = new VerificationRunner(VerificationConfig.fromEnvironment(),
                    tracing.getTracer(), System.out);
            exitCode = runner.run(System.getProperty(DOMAINS_PROPERTY, ""),
                    Path.of(System.getProperty(REPORT_FILE_PROPERTY, DEFAULT_REPORT_FILE)));
        } finally {
            tracing.shutdown();
        }
        System.exit(exitCode);
    }

    /**
     * Verifies each selected domain independently and writes one report per domain.
     *
     * @param domainIds  comma-separated domain ids, blank or {@code "all"} for every domain
     * @param reportFile JSON output
     * @return the process exit code
     */
    public int run(String domainIds, Path reportFile) {
        List<Domain> selected;
        try {
            selected = Domains.parse(domainIds);
        } catch (IllegalArgumentException e) {
            logger.error("Invalid domain selection '{}': {}", domainIds, e.getMessage());
            out.println("ERROR: " + e.getMessage());
            return EXIT_SETUP_ERROR;
        }

        List<VerificationReport> reports = new ArrayList<>(selected.size());
        Set<Domain> setupFailures = EnumSet.noneOf(Domain.class);
        for (Domain domain : selected) {
            try {
                IPropertyVerifier verifier = new PropertyVerifier(domainFactory.apply(domain), config, tracer);
                verifier.setVerificationListener(new ProgressListener(domain));
                reports.add(verifier.verify());
            } catch (RuntimeException e) {
                logger.error("Verification of domain {} could not run", domain.id(), e);
                setupFailures.add(domain);
                reports.add(setupFailure(domain, e));
            }
        }

        try {
            writer.write(reports, reportFile);
        } catch (IOException e) {
            logger.error("Cannot write report to {}", reportFile, e);
            out.println("ERROR: cannot write " + reportFile + ": " + e.getMessage());
            return EXIT_SETUP_ERROR;
        }

        printSummary(reports, reportFile);
        if (!setupFailures.isEmpty()) {
            return EXIT_SETUP_ERROR;
        }
        return reports.stream().anyMatch(VerificationReport::hasFailures) ? EXIT_FAILURES : EXIT_OK;
    }

    /**
     * Report entry for a domain whose rule set or model could not be built.
     */
    static VerificationReport setupFailure(Domain domain, Exception error) {
        List<PropertyResult> results = new ArrayList<>();
        for (TrsProperty property : TrsProperty.values()) {
            results.add(new PropertyResult(property, PropertyStatus.UNKNOWN, 0, List.of(),
                    "setup failed: " + error, 0));
        }
        return new VerificationReport(domain, domain.id(), "unknown", results, CriticalPairSummary.empty(),
                Instant.now(), 0);
    }

    private void printSummary(List<VerificationReport> reports, Path reportFile) {
        out.println();
        out.printf("%-8s %-20s", "DOMAIN", "RULE SET");
        for (TrsProperty property : TrsProperty.values()) {
            out.printf(" %-12s", property);
        }
        out.println();
        for (VerificationReport report : reports) {
            out.printf("%-8s %-20s", report.domain().id(), report.ruleSetName() + "@" + report.ruleSetVersion());
            for (TrsProperty property : TrsProperty.values()) {
                out.printf(" %-12s", report.status(property));
            }
            out.println();
            for (PropertyResult result : report.results()) {
                if (result.failed()) {
                    result.violations().stream().limit(3).forEach(violation -> out.println(
                            "    " + result.property() + ": " + violation.message() + " [" + violation.minimalExample()
                                    + "]"));
                }
            }
        }
        out.println();
        out.println("Report written to " + reportFile.toAbsolutePath());
    }

    private final class ProgressListener implements VerificationListener {
        private final Domain domain;

        ProgressListener(Domain domain) {
            this.domain = domain;
        }

        @Override
        public void onPropertyStart(TrsProperty property, int index, int total) {
            out.printf("[%s] %d/%d %s ...%n", domain.id(), index, total, property);
        }

        @Override
        public void onPropertyComplete(PropertyResult result) {
            out.printf("[%s] %s %s (%d checked, %d ms)%n", domain.id(), result.property(), result.status(),
                    result.checked(), result.durationMillis());
        }

        @Override
        public void onError(TrsProperty property, Exception error) {
            logger.warn("[{}] {} aborted: {}", domain.id(), property, error.toString());
        }
    }
}
