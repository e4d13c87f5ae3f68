/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.verifier.termination;

import com.repoq.trs.api.IRewriteEngine;
import com.repoq.trs.api.TermGenerator;
import com.repoq.trs.api.TermModel;
import com.repoq.trs.api.model.MeasureValue;
import com.repoq.trs.api.model.NormalizationResult;
import com.repoq.trs.api.model.PropertyStatus;
import com.repoq.trs.api.model.RewriteRule;
import com.repoq.trs.api.model.RewriteStep;
import com.repoq.trs.api.model.RuleSet;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.api.model.TraceLevel;
import com.repoq.trs.api.model.WellFoundedMeasure;
import com.repoq.trs.core.term.Terms;
import com.repoq.trs.runtime.EngineConfig;
import com.repoq.trs.runtime.RewriteEngine;
import com.repoq.trs.verifier.analysis.GroundInstances;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks the termination argument of every rule: the rule's well-founded measure must be
 * strictly larger on the redex than on the contractum.
 *
 * <p>{@link #checkRule} samples ground instances of the pattern; {@link #checkTrace} looks at
 * the steps actually taken while normalizing a corpus. Sampling can only refute: a rule
 * whose samples all decrease is {@code PASS} only if the enumeration was complete.
 */
public final class TerminationChecker {

    private static final Logger logger = LoggerFactory.getLogger(TerminationChecker.class);

    private final RuleSet ruleSet;
    private final TermModel model;
    private final TermGenerator generator;
    private final int instanceBudget;

    public TerminationChecker(RuleSet ruleSet, TermModel model, TermGenerator generator, int instanceBudget) {
        this.ruleSet = Objects.requireNonNull(ruleSet, "ruleSet must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        if (instanceBudget <= 0) {
            throw new IllegalArgumentException("instanceBudget must be positive: " + instanceBudget);
        }
        this.instanceBudget = instanceBudget;
    }

    /**
     * Verdict for one rule and one measure.
     *
     * @param rule     rule name
     * @param status   {@code FAIL} without a measure or on a counterexample, {@code UNKNOWN}
     *                 when no sample applied or the enumeration was cut off
     * @param checked  number of applications examined
     * @param witness  redex on which the measure did not decrease, or {@code null}
     * @param message  explanation for {@code FAIL} and {@code UNKNOWN}
     */
    public record RuleVerdict(String rule, PropertyStatus status, int checked, Term witness, String message) {
    }

    /**
     * Violation found in a normalization trace.
     *
     * @param input   corpus term being normalized
     * @param rule    rule applied in the offending step, or {@code null} if the run did not halt
     * @param message what went wrong
     */
    public record TraceViolation(Term input, String rule, String message) {
    }

    /**
     * Applications seen in the traces: how many per rule, and the violations.
     */
    public record TraceReport(Map<String, Integer> applications, List<TraceViolation> violations, int checked) {
        public TraceReport {
            applications = Map.copyOf(applications);
            violations = List.copyOf(violations);
        }
    }

    public List<RuleVerdict> checkRules() {
        List<RuleVerdict> verdicts = new ArrayList<>(ruleSet.size());
        for (RewriteRule rule : ruleSet.rules()) {
            verdicts.add(checkRule(rule, rule.measure()));
        }
        return verdicts;
    }

    public RuleVerdict checkRule(RewriteRule rule, WellFoundedMeasure measure) {
        Objects.requireNonNull(rule, "rule must not be null");
        if (measure == null) {
            return new RuleVerdict(rule.name(), PropertyStatus.FAIL, 0, null, "no well-founded measure declared");
        }
        GroundInstances ground = GroundInstances.of(rule.pattern(), generator, instanceBudget);
        int applied = 0;
        for (Term instance : ground.instances()) {
            Optional<Term> contractum = contract(rule, instance);
            if (contractum.isEmpty()) {
                continue;
            }
            applied++;
            MeasureValue before = measure.apply(instance);
            MeasureValue after = measure.apply(contractum.get());
            if (!before.isGreaterThan(after)) {
                logger.debug("Measure {} does not decrease for {}: {} -> {}", measure.name(), rule.name(), before, after);
                return new RuleVerdict(rule.name(), PropertyStatus.FAIL, applied, instance,
                        measure.name() + " goes from " + before + " to " + after);
            }
        }
        if (applied == 0) {
            return new RuleVerdict(rule.name(), PropertyStatus.UNKNOWN, 0, null, "no ground sample satisfies the rule");
        }
        if (!ground.exhaustive()) {
            return new RuleVerdict(rule.name(), PropertyStatus.UNKNOWN, applied, null,
                    "sample enumeration cut off at " + instanceBudget + " instances");
        }
        return new RuleVerdict(rule.name(), PropertyStatus.PASS, applied, null, null);
    }

    /**
     * Normalizes every corpus term with a full trace. Each run must halt within the engine's
     * step bound and each step must strictly decrease the applied rule's measure from redex to
     * contractum.
     *
     * @param maxSteps step bound per term
     */
    public TraceReport checkTrace(List<Term> corpus, int maxSteps) {
        Objects.requireNonNull(corpus, "corpus must not be null");
        IRewriteEngine engine = new RewriteEngine(ruleSet,
                EngineConfig.builder().maxSteps(maxSteps).traceLevel(TraceLevel.FULL).build());
        Map<String, Integer> applications = new LinkedHashMap<>();
        List<TraceViolation> violations = new ArrayList<>();
        for (Term term : corpus) {
            NormalizationResult result = engine.normalize(term);
            if (!result.terminated()) {
                violations.add(new TraceViolation(term, null,
                        "normalization stopped with " + result.outcome() + " after " + result.stepsTaken() + " steps"));
                continue;
            }
            for (RewriteStep step : result.trace()) {
                applications.merge(step.ruleName(), 1, Integer::sum);
                WellFoundedMeasure measure = ruleSet.rule(step.ruleName()).map(RewriteRule::measure).orElse(null);
                if (measure == null) {
                    continue;
                }
                MeasureValue before = measure.apply(step.redex());
                MeasureValue after = measure.apply(step.contractum());
                if (!before.isGreaterThan(after)) {
                    violations.add(new TraceViolation(term, step.ruleName(), measure.name() + " goes from " + before
                            + " to " + after + " on " + render(step.redex())));
                    break;
                }
            }
        }
        return new TraceReport(applications, violations, corpus.size());
    }

    private static Optional<Term> contract(RewriteRule rule, Term instance) {
        try {
            return RewriteEngine.applyAtRoot(rule, instance);
        } catch (RuntimeException e) {
            logger.debug("Rule {} rejects sample {}: {}", rule.name(), instance, e.toString());
            return Optional.empty();
        }
    }

    private String render(Term term) {
        try {
            return model.serialize(term);
        } catch (RuntimeException e) {
            return term.toString() + " (size " + Terms.size(term) + ")";
        }
    }
}
