/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.verifier;

import com.repoq.trs.api.IPropertyVerifier;
import com.repoq.trs.api.NormalizationDomain;
import com.repoq.trs.api.VerificationListener;
import com.repoq.trs.api.exceptions.ParseException;
import com.repoq.trs.api.model.CriticalPairSummary;
import com.repoq.trs.api.model.NormalizationResult;
import com.repoq.trs.api.model.PropertyResult;
import com.repoq.trs.api.model.PropertyStatus;
import com.repoq.trs.api.model.RewriteStep;
import com.repoq.trs.api.model.RuleSet;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.api.model.TraceLevel;
import com.repoq.trs.api.model.TrsProperty;
import com.repoq.trs.api.model.VerificationReport;
import com.repoq.trs.api.model.Violation;
import com.repoq.trs.core.term.Terms;
import com.repoq.trs.runtime.EngineConfig;
import com.repoq.trs.runtime.RewriteEngine;
import com.repoq.trs.verifier.analysis.CriticalPair;
import com.repoq.trs.verifier.analysis.CriticalPairAnalyzer;
import com.repoq.trs.verifier.termination.TerminationChecker;
import com.repoq.trs.verifier.termination.TerminationChecker.RuleVerdict;
import com.repoq.trs.verifier.termination.TerminationChecker.TraceReport;
import com.repoq.trs.verifier.termination.TerminationChecker.TraceViolation;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Checks the six rewriting properties of one domain's rule set and collects the verdicts in
 * a {@link VerificationReport}.
 *
 * <h2>Corpus</h2>
 * <p>The generator's curated sources followed by {@code corpusSize} seeded random terms.
 *
 * <h2>Plan</h2>
 * <p>Termination runs first because the confluence verdict depends on it (Newman's lemma):
 * local confluence plus termination gives confluence. The report lists results in
 * {@link TrsProperty} order regardless.
 *
 * <h2>Failure semantics</h2>
 * <p>Findings are data. An exception thrown by domain code on a corpus term is recorded as a
 * violation of the property being checked; an exception that aborts a whole check turns the
 * property {@code UNKNOWN} and is passed to {@link VerificationListener#onError}. Every
 * violation found on a corpus term is shrunk to a smaller term that still violates.
 */
public final class PropertyVerifier implements IPropertyVerifier {

    private static final Logger logger = LoggerFactory.getLogger(PropertyVerifier.class);

    static final List<TrsProperty> PLAN = List.of(
            TrsProperty.TERMINATION,
            TrsProperty.CONFLUENCE,
            TrsProperty.IDEMPOTENCE,
            TrsProperty.DETERMINISM,
            TrsProperty.SOUNDNESS,
            TrsProperty.ROUND_TRIP);

    static final int MAX_VIOLATIONS = 20;

    private static final VerificationListener SILENT = new VerificationListener() {
        @Override
        public void onPropertyStart(TrsProperty property, int index, int total) {
        }

        @Override
        public void onPropertyComplete(PropertyResult result) {
        }
    };

    private final NormalizationDomain domain;
    private final RuleSet ruleSet;
    private final VerificationConfig config;
    private final Tracer tracer;
    private final RewriteEngine engine;
    private final Shrinker shrinker;
    private volatile VerificationListener listener = SILENT;

    public PropertyVerifier(NormalizationDomain domain, VerificationConfig config) {
        this(domain, config, OpenTelemetry.noop().getTracer("trs-verifier"));
    }

    public PropertyVerifier(NormalizationDomain domain, VerificationConfig config, Tracer tracer) {
        this.domain = Objects.requireNonNull(domain, "domain must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.ruleSet = Objects.requireNonNull(domain.ruleSet(), "domain rule set must not be null");
        this.engine = new RewriteEngine(ruleSet,
                EngineConfig.builder().maxSteps(config.maxSteps()).traceLevel(TraceLevel.BASIC).build(), tracer);
        this.shrinker = new Shrinker(config.shrinkBudget());
    }

    @Override
    public void setVerificationListener(VerificationListener listener) {
        this.listener = listener == null ? SILENT : listener;
    }

    @Override
    public VerificationReport verify() {
        Span span = tracer.spanBuilder("trs.verify")
                .setAttribute("trs.domain", ruleSet.domain().id())
                .setAttribute("trs.ruleset", ruleSet.id())
                .startSpan();
        long start = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            logger.info("Verifying {} with {}", ruleSet.id(), config);
            Run run = new Run(buildCorpus());
            Map<TrsProperty, PropertyResult> results = new EnumMap<>(TrsProperty.class);
            for (int i = 0; i < PLAN.size(); i++) {
                TrsProperty property = PLAN.get(i);
                if (Thread.currentThread().isInterrupted()) {
                    results.put(property, new PropertyResult(property, PropertyStatus.UNKNOWN, 0, List.of(),
                            "verification interrupted", 0));
                    continue;
                }
                listener.onPropertyStart(property, i + 1, PLAN.size());
                PropertyResult result = runCheck(property, run);
                results.put(property, result);
                listener.onPropertyComplete(result);
            }

            VerificationReport report = new VerificationReport(ruleSet.domain(), ruleSet.name(), ruleSet.version(),
                    new ArrayList<>(results.values()), run.criticalPairs, Instant.now(),
                    (System.nanoTime() - start) / 1_000_000);
            span.setAttribute("trs.all_passed", report.allPassed());
            if (report.hasFailures()) {
                span.setStatus(StatusCode.ERROR, "verification failures");
            }
            logger.info("Verified {} in {} ms: {}", ruleSet.id(), report.durationMillis(), summarize(report));
            return report;
        } finally {
            span.end();
        }
    }

    private PropertyResult runCheck(TrsProperty property, Run run) {
        Span span = tracer.spanBuilder("trs.verify." + property.name().toLowerCase(Locale.ROOT))
                .startSpan();
        long start = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            Check check = switch (property) {
                case TERMINATION -> termination(run);
                case CONFLUENCE -> confluence(run);
                case IDEMPOTENCE -> overCorpus(property, run, this::idempotence);
                case DETERMINISM -> overCorpus(property, run, this::determinism);
                case SOUNDNESS -> overCorpus(property, run, this::soundness);
                case ROUND_TRIP -> roundTrip(run);
            };
            if (property == TrsProperty.TERMINATION) {
                run.termination = check.status;
            }
            span.setAttribute("trs.status", check.status.name());
            span.setAttribute("trs.violations", check.violations.size());
            return new PropertyResult(property, check.status, check.checked, check.violations, check.note,
                    (System.nanoTime() - start) / 1_000_000);
        } catch (RuntimeException e) {
            logger.warn("Check {} of {} aborted", property, ruleSet.id(), e);
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "check aborted");
            listener.onError(property, e);
            return new PropertyResult(property, PropertyStatus.UNKNOWN, 0, List.of(), "check aborted: " + e,
                    (System.nanoTime() - start) / 1_000_000);
        } finally {
            span.end();
        }
    }

    // ---------------------------------------------------------------- corpus

    private Corpus buildCorpus() {
        List<Term> terms = new ArrayList<>();
        List<Violation> unparsable = new ArrayList<>();
        for (String source : domain.generator().curatedSources()) {
            try {
                terms.add(domain.model().parse(source));
            } catch (ParseException e) {
                unparsable.add(Violation.of(TrsProperty.ROUND_TRIP, source, "curated source does not parse: "
                        + e.getMessage()));
            }
        }
        terms.addAll(domain.generator().generate(config.corpusSize(), config.corpusDepth(), config.seed()));
        logger.debug("Corpus for {}: {} terms, {} unparsable curated sources", ruleSet.id(), terms.size(),
                unparsable.size());
        return new Corpus(terms, unparsable);
    }

    // ---------------------------------------------------------------- termination and confluence

    private Check termination(Run run) {
        TerminationChecker checker = new TerminationChecker(ruleSet, domain.model(), domain.generator(),
                config.instanceBudget());
        List<RuleVerdict> verdicts = checker.checkRules();
        TraceReport traces = checker.checkTrace(run.corpus.terms, config.maxSteps());

        List<Violation> violations = new ArrayList<>();
        List<String> inconclusive = new ArrayList<>();
        int tracedInconclusive = 0;
        for (RuleVerdict verdict : verdicts) {
            if (verdict.status() == PropertyStatus.FAIL) {
                String input = verdict.witness() == null ? verdict.rule() : render(verdict.witness());
                violations.add(new Violation(TrsProperty.TERMINATION, input, input,
                        "rule " + verdict.rule() + ": " + verdict.message(), Map.of("rule", verdict.rule())));
            } else if (verdict.status() == PropertyStatus.UNKNOWN) {
                inconclusive.add(verdict.rule());
                if (traces.applications().getOrDefault(verdict.rule(), 0) > 0) {
                    tracedInconclusive++;
                }
            }
        }
        for (TraceViolation traced : traces.violations()) {
            if (violations.size() >= MAX_VIOLATIONS) {
                break;
            }
            Term minimal = shrink(traced.input(),
                    t -> !checker.checkTrace(List.of(t), config.maxSteps()).violations().isEmpty());
            Map<String, String> details = traced.rule() == null ? Map.of() : Map.of("rule", traced.rule());
            violations.add(new Violation(TrsProperty.TERMINATION, render(traced.input()), render(minimal),
                    traced.message(), details));
        }

        PropertyStatus status;
        String note = null;
        if (!violations.isEmpty()) {
            status = PropertyStatus.FAIL;
        } else if (!inconclusive.isEmpty()) {
            status = PropertyStatus.UNKNOWN;
            note = inconclusive.size() + " rule(s) without conclusive evidence: " + String.join(", ", inconclusive);
            if (tracedInconclusive > 0) {
                note += "; " + tracedInconclusive + " of them decreased their measure on every corpus trace";
            }
        } else {
            status = PropertyStatus.PASS;
        }
        return new Check(status, verdicts.size() + traces.checked(), violations, note);
    }

    private Check confluence(Run run) {
        CriticalPairAnalyzer analyzer = new CriticalPairAnalyzer(ruleSet, domain.model(), domain.generator(), engine,
                config.instanceBudget(), config.parallelism(), tracer);
        CriticalPairAnalyzer.Analysis analysis = analyzer.analyze();
        CriticalPairSummary summary = analysis.summary();
        run.criticalPairs = summary;

        List<Violation> violations = new ArrayList<>();
        for (CriticalPair pair : analysis.notJoinable()) {
            if (violations.size() >= MAX_VIOLATIONS) {
                break;
            }
            Map<String, String> details = new LinkedHashMap<>();
            details.put("outer_rule", pair.outerRule());
            details.put("inner_rule", pair.innerRule());
            details.put("position", pair.position().toString());
            details.put("normal_form_1", render(pair.reduct1()));
            details.put("normal_form_2", render(pair.reduct2()));
            String witness = render(pair.witness());
            violations.add(new Violation(TrsProperty.CONFLUENCE, witness, witness,
                    "critical pair " + pair.describe() + " is not joinable", details));
        }

        if (!violations.isEmpty()) {
            return new Check(PropertyStatus.FAIL, summary.total(), violations, null);
        }
        List<String> reasons = new ArrayList<>();
        if (summary.undecided() > 0) {
            reasons.add(summary.undecided() + " undecided pair(s)");
        }
        if (summary.nonExhaustive() > 0) {
            reasons.add(summary.nonExhaustive() + " pair(s) sampled non-exhaustively");
        }
        if (run.termination != PropertyStatus.PASS) {
            reasons.add("termination is " + run.termination);
        }
        if (reasons.isEmpty()) {
            return new Check(PropertyStatus.PASS, summary.total(), List.of(), null);
        }
        return new Check(PropertyStatus.UNKNOWN, summary.total(), List.of(), "local confluence holds on samples; "
                + String.join(", ", reasons));
    }

    // ---------------------------------------------------------------- corpus properties

    private Finding idempotence(Term term) {
        NormalizationResult once = engine.normalize(term);
        if (!once.terminated()) {
            return unfinished(once);
        }
        NormalizationResult twice = engine.normalize(once.normalForm());
        if (twice.stepsTaken() == 0 && Terms.structuralEquals(once.normalForm(), twice.normalForm())) {
            return Finding.OK;
        }
        String rule = twice.trace().isEmpty() ? "?" : twice.trace().get(0).ruleName();
        return Finding.violation("normal form is rewritten again by " + rule,
                Map.of("normal_form", render(once.normalForm()), "renormalized", render(twice.normalForm())));
    }

    private Finding determinism(Term term) {
        NormalizationResult first = engine.normalize(term);
        String expected = fingerprint(first);
        for (int run = 1; run < config.determinismRuns(); run++) {
            String actual = fingerprint(engine.normalize(term));
            if (!expected.equals(actual)) {
                return Finding.violation("run " + (run + 1) + " differs from run 1",
                        Map.of("run_1", expected, "run_" + (run + 1), actual));
            }
        }
        return Finding.OK;
    }

    private static String fingerprint(NormalizationResult result) {
        StringBuilder sb = new StringBuilder(Terms.canonicalKey(result.normalForm()))
                .append(" | ").append(result.outcome()).append(" | ").append(result.stepsTaken());
        for (RewriteStep step : result.trace()) {
            sb.append(" | ").append(step.ruleName()).append('@').append(step.position());
        }
        return sb.toString();
    }

    private Finding soundness(Term term) {
        NormalizationResult result = engine.normalize(term);
        if (!result.terminated()) {
            return unfinished(result);
        }
        Optional<String> difference = domain.oracle().findDifference(term, result.normalForm());
        return difference.map(witness -> Finding.violation(domain.oracle().name() + ": " + witness,
                        Map.of("normal_form", render(result.normalForm()))))
                .orElse(Finding.OK);
    }

    private Finding roundTripOf(Term term) {
        NormalizationResult result = engine.normalize(term);
        if (!result.terminated()) {
            return unfinished(result);
        }
        String text = domain.model().serialize(result.normalForm());
        Term reparsed;
        try {
            reparsed = domain.model().parse(text);
        } catch (ParseException e) {
            return Finding.violation("serialized normal form does not parse: " + e.getMessage(),
                    Map.of("serialized", text));
        }
        if (Terms.structuralEquals(reparsed, result.normalForm())) {
            return Finding.OK;
        }
        return Finding.violation("serialized normal form parses to a different term",
                Map.of("serialized", text, "reparsed", render(reparsed)));
    }

    /**
     * A rule that throws is a defect of the rule set; running out of steps or time only makes
     * the term unusable as evidence.
     */
    private static Finding unfinished(NormalizationResult result) {
        if (result.outcome() == NormalizationResult.Outcome.RULE_FAILURE) {
            return Finding.violation("a rule failed after " + result.stepsTaken() + " steps", Map.of());
        }
        return Finding.INCONCLUSIVE;
    }

    private Check roundTrip(Run run) {
        Check check = overCorpus(TrsProperty.ROUND_TRIP, run, this::roundTripOf);
        if (run.corpus.unparsable.isEmpty()) {
            return check;
        }
        List<Violation> violations = new ArrayList<>(run.corpus.unparsable);
        violations.addAll(check.violations);
        return new Check(PropertyStatus.FAIL, check.checked + run.corpus.unparsable.size(), violations, check.note);
    }

    private Check overCorpus(TrsProperty property, Run run, Function<Term, Finding> check) {
        List<Violation> violations = new ArrayList<>();
        int inconclusive = 0;
        int failures = 0;
        for (Term term : run.corpus.terms) {
            Finding finding = evaluate(check, term);
            if (finding.kind == Finding.Kind.INCONCLUSIVE) {
                inconclusive++;
            } else if (finding.kind == Finding.Kind.VIOLATION) {
                failures++;
                if (violations.size() < MAX_VIOLATIONS) {
                    Term minimal = shrink(term, t -> evaluate(check, t).kind == Finding.Kind.VIOLATION);
                    violations.add(new Violation(property, render(term), render(minimal), finding.message,
                            finding.details));
                }
            }
        }

        String note = null;
        if (failures > violations.size()) {
            note = failures + " violations, first " + violations.size() + " reported";
        }
        if (!violations.isEmpty()) {
            return new Check(PropertyStatus.FAIL, run.corpus.terms.size(), violations, note);
        }
        if (inconclusive > 0) {
            return new Check(PropertyStatus.UNKNOWN, run.corpus.terms.size(), List.of(),
                    inconclusive + " term(s) did not reach a normal form");
        }
        return new Check(PropertyStatus.PASS, run.corpus.terms.size(), List.of(), null);
    }

    /**
     * Exceptions from domain code are findings, not aborts.
     */
    private static Finding evaluate(Function<Term, Finding> check, Term term) {
        try {
            return check.apply(term);
        } catch (RuntimeException e) {
            return Finding.violation("exception: " + e, Map.of());
        }
    }

    // ---------------------------------------------------------------- helpers

    private Term shrink(Term input, Predicate<Term> stillViolates) {
        if (Terms.size(input) <= 1) {
            return input;
        }
        return shrinker.shrink(input, candidate -> printable(candidate) && stillViolates.test(candidate));
    }

    private boolean printable(Term term) {
        try {
            domain.model().serialize(term);
            return true;
        } catch (RuntimeException e) {
            return false;
        }
    }

    private String render(Term term) {
        if (term == null) {
            return "";
        }
        try {
            return domain.model().serialize(term);
        } catch (RuntimeException e) {
            return term.toString();
        }
    }

    private static String summarize(VerificationReport report) {
        StringBuilder sb = new StringBuilder();
        for (PropertyResult result : report.results()) {
            sb.append(sb.length() == 0 ? "" : ", ").append(result.property()).append('=').append(result.status());
        }
        return sb.toString();
    }

    private record Corpus(List<Term> terms, List<Violation> unparsable) {
    }

    /**
     * State shared between the checks of one {@link #verify()} call.
     */
    private static final class Run {
        final Corpus corpus;
        PropertyStatus termination = PropertyStatus.UNKNOWN;
        CriticalPairSummary criticalPairs = CriticalPairSummary.empty();

        Run(Corpus corpus) {
            this.corpus = corpus;
        }
    }

    private record Check(PropertyStatus status, int checked, List<Violation> violations, String note) {
    }

    private record Finding(Kind kind, String message, Map<String, String> details) {
        static final Finding OK = new Finding(Kind.OK, null, Map.of());
        static final Finding INCONCLUSIVE = new Finding(Kind.INCONCLUSIVE, null, Map.of());

        static Finding violation(String message, Map<String, String> details) {
            return new Finding(Kind.VIOLATION, message, details);
        }

        enum Kind { OK, VIOLATION, INCONCLUSIVE }
    }
}
