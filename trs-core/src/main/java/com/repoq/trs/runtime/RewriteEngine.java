/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.runtime;

import com.repoq.trs.api.IRewriteEngine;
import com.repoq.trs.api.model.Bindings;
import com.repoq.trs.api.model.NormalizationResult;
import com.repoq.trs.api.model.NormalizationResult.Outcome;
import com.repoq.trs.api.model.Position;
import com.repoq.trs.api.model.RewriteRule;
import com.repoq.trs.api.model.RewriteStep;
import com.repoq.trs.api.model.RuleSet;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.api.model.TraceLevel;
import com.repoq.trs.core.term.Terms;
import com.repoq.trs.core.unify.Matcher;
import com.repoq.trs.infra.metrics.MetricsRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Leftmost-outermost rewrite engine over one immutable {@link RuleSet}.
 *
 * <h2>Strategy</h2>
 * <p>Each step searches positions in pre-order with an explicit stack. At a position, the
 * rules whose pattern root fits the node are tried in declaration order: the first rule that
 * matches, whose side condition holds and whose contractum differs from the redex is applied.
 * The loop ends at a normal form, after {@code maxSteps} contractions or when the optional
 * deadline passes; the last two cases return the partial term with
 * {@code terminated == false}.
 *
 * <h2>Determinism</h2>
 * <p>No hashing, clock or thread state influences redex selection, so a fixed term and rule
 * set always produce the same trace.
 *
 * <h2>Thread Safety</h2>
 * <p>Stateless apart from immutable configuration; one engine may serve any number of threads.
 */
public final class RewriteEngine implements IRewriteEngine {

    private static final Logger logger = LoggerFactory.getLogger(RewriteEngine.class);

    private final RuleSet ruleSet;
    private final EngineConfig config;
    private final Tracer tracer;
    private final EngineMetrics metrics;

    public RewriteEngine(RuleSet ruleSet) {
        this(ruleSet, EngineConfig.defaults());
    }

    public RewriteEngine(RuleSet ruleSet, EngineConfig config) {
        this(ruleSet, config, OpenTelemetry.noop().getTracer("trs-engine"));
    }

    public RewriteEngine(RuleSet ruleSet, EngineConfig config, Tracer tracer) {
        this(ruleSet, config, tracer, MetricsRegistry.getInstance());
    }

    public RewriteEngine(RuleSet ruleSet, EngineConfig config, Tracer tracer, MetricsRegistry metricsRegistry) {
        this.ruleSet = Objects.requireNonNull(ruleSet, "ruleSet must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.metrics = new EngineMetrics(Objects.requireNonNull(metricsRegistry, "metricsRegistry must not be null"),
                ruleSet.domain().id(), ruleSet.id());
        logger.debug("RewriteEngine initialized for {} ({} rules, {})", ruleSet.id(), ruleSet.size(), config);
    }

    @Override
    public RuleSet ruleSet() {
        return ruleSet;
    }

    public EngineConfig config() {
        return config;
    }

    @Override
    public NormalizationResult normalize(Term term) {
        return normalize(term, config.maxSteps());
    }

    @Override
    public NormalizationResult normalize(Term term, int maxSteps) {
        Objects.requireNonNull(term, "term must not be null");
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive: " + maxSteps);
        }

        Span span = tracer.spanBuilder("trs.normalize")
                .setAttribute("trs.domain", ruleSet.domain().id())
                .setAttribute("trs.ruleset", ruleSet.id())
                .startSpan();
        long start = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            NormalizationResult result = run(term, maxSteps, start, span);
            span.setAttribute("trs.steps", result.stepsTaken());
            span.setAttribute("trs.outcome", result.outcome().name());
            metrics.record(result, System.nanoTime() - start);
            return result;
        } finally {
            span.end();
        }
    }

    private NormalizationResult run(Term term, int maxSteps, long startNanos, Span span) {
        TraceLevel traceLevel = config.traceLevel();
        List<RewriteStep> trace = traceLevel == TraceLevel.NONE ? null : new ArrayList<>();
        boolean bounded = config.deadline() != null;
        long deadlineNanos = bounded ? startNanos + config.deadline().toNanos() : 0L;

        Term current = term;
        int steps = 0;
        while (true) {
            Optional<Redex> redex;
            try {
                redex = locate(current);
            } catch (RuleApplicationException e) {
                logger.warn("Rule '{}' failed at {} in {}; returning partial result after {} steps",
                        e.ruleName, e.position, ruleSet.id(), steps, e.getCause());
                span.recordException(e.getCause());
                span.setStatus(StatusCode.ERROR, "rule failure: " + e.ruleName);
                return new NormalizationResult(term, current, steps, Outcome.RULE_FAILURE, trace);
            }
            if (redex.isEmpty()) {
                return new NormalizationResult(term, current, steps, Outcome.NORMAL_FORM, trace);
            }
            if (steps >= maxSteps) {
                logger.warn("Non-termination suspected in {}: {} steps exhausted, last rule '{}'",
                        ruleSet.id(), maxSteps, redex.get().rule.name());
                return new NormalizationResult(term, current, steps, Outcome.STEP_LIMIT, trace);
            }
            if (bounded && System.nanoTime() - deadlineNanos > 0) {
                logger.warn("Deadline {} passed in {} after {} steps", config.deadline(), ruleSet.id(), steps);
                return new NormalizationResult(term, current, steps, Outcome.DEADLINE, trace);
            }

            Redex found = redex.get();
            steps++;
            current = Terms.replaceAt(current, found.position, found.contractum);
            if (trace != null) {
                RewriteStep step = new RewriteStep(steps, found.rule.name(), found.position, found.redex, found.contractum);
                trace.add(traceLevel == TraceLevel.FULL ? step : step.withoutTerms());
            }
        }
    }

    @Override
    public Optional<RewriteStep> findRedex(Term term) {
        Objects.requireNonNull(term, "term must not be null");
        return locateOrThrow(term).map(r -> new RewriteStep(1, r.rule.name(), r.position, r.redex, r.contractum));
    }

    @Override
    public Optional<Term> applyStep(Term term) {
        Objects.requireNonNull(term, "term must not be null");
        return locateOrThrow(term).map(r -> Terms.replaceAt(term, r.position, r.contractum));
    }

    /**
     * Single-step entry points surface the rule's own exception to the caller.
     */
    private Optional<Redex> locateOrThrow(Term term) {
        try {
            return locate(term);
        } catch (RuleApplicationException e) {
            throw (RuntimeException) e.getCause();
        }
    }

    /**
     * Applies one specific rule at the root of {@code term}, ignoring every other rule.
     *
     * @return the contractum, or empty if the rule does not match, its condition is false, or
     * it would leave the term unchanged
     */
    public static Optional<Term> applyAtRoot(RewriteRule rule, Term term) {
        if (!rule.fitsRoot(term)) {
            return Optional.empty();
        }
        Optional<Bindings> bindings = Matcher.match(rule.pattern(), term);
        if (bindings.isEmpty() || !rule.condition().test(bindings.get())) {
            return Optional.empty();
        }
        Term contractum = rule.replacement().build(bindings.get());
        return Terms.structuralEquals(contractum, term) ? Optional.empty() : Optional.of(contractum);
    }

    /**
     * Pre-order search for the first applicable (position, rule).
     */
    private Optional<Redex> locate(Term root) {
        Deque<Object[]> stack = new ArrayDeque<>();
        stack.push(new Object[]{root, Position.ROOT});
        while (!stack.isEmpty()) {
            Object[] entry = stack.pop();
            Term node = (Term) entry[0];
            Position position = (Position) entry[1];

            for (RewriteRule rule : ruleSet.candidatesFor(node)) {
                Optional<Term> contractum;
                try {
                    contractum = applyAtRoot(rule, node);
                } catch (RuntimeException e) {
                    throw new RuleApplicationException(rule.name(), position, e);
                }
                if (contractum.isPresent()) {
                    return Optional.of(new Redex(rule, position, node, contractum.get()));
                }
            }

            List<Term> args = node.arguments();
            for (int i = args.size() - 1; i >= 0; i--) {
                stack.push(new Object[]{args.get(i), position.child(i)});
            }
        }
        return Optional.empty();
    }

    private record Redex(RewriteRule rule, Position position, Term redex, Term contractum) {
    }

    /**
     * Carries the failing rule out of the search loop. Never escapes {@link #normalize}.
     */
    private static final class RuleApplicationException extends RuntimeException {
        private final String ruleName;
        private final Position position;

        RuleApplicationException(String ruleName, Position position, RuntimeException cause) {
            super("Rule '" + ruleName + "' failed at " + position, cause);
            this.ruleName = ruleName;
            this.position = position;
        }
    }
}
