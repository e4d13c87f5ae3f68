/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.verifier.analysis;

import com.repoq.trs.api.IRewriteEngine;
import com.repoq.trs.api.TermGenerator;
import com.repoq.trs.api.TermModel;
import com.repoq.trs.api.model.Bindings;
import com.repoq.trs.api.model.CriticalPairSummary;
import com.repoq.trs.api.model.NormalizationResult;
import com.repoq.trs.api.model.Position;
import com.repoq.trs.api.model.RewriteRule;
import com.repoq.trs.api.model.RuleSet;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.core.term.Terms;
import com.repoq.trs.core.unify.Unifier;
import com.repoq.trs.runtime.RewriteEngine;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Computes the critical pairs of a rule set and checks them for joinability on ground
 * instances.
 *
 * <h2>Overlaps</h2>
 * <p>For every ordered pair of rules (outer, inner), both patterns are renamed apart and the
 * inner pattern is unified with every function position of the outer pattern. A rule is
 * overlapped with itself only below the root.
 *
 * <h2>Joinability</h2>
 * <p>The variables left in each overlap are instantiated with the generator's ground samples,
 * up to the instance budget. Instances that the term model cannot print are skipped. For
 * every instance where both rules apply, both contractions are normalized and compared
 * structurally. Overlaps whose sample space exceeded the budget are marked non-exhaustive.
 *
 * <h2>Usage</h2>
 * <pre>
 * CriticalPairAnalyzer analyzer = new CriticalPairAnalyzer(ruleSet, model, generator, engine, 256, 4);
 * CriticalPairAnalyzer.Analysis analysis = analyzer.analyze();
 * analysis.notJoinable().forEach(pair -> System.out.println(pair.describe()));
 * </pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Outer rules are sharded over a fixed pool of daemon threads; each {@link #analyze()}
 * call owns its pool. Results are sorted by (outer rule, inner rule, position) so the report
 * does not depend on scheduling.
 */
public final class CriticalPairAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(CriticalPairAnalyzer.class);
    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final RuleSet ruleSet;
    private final TermModel model;
    private final TermGenerator generator;
    private final IRewriteEngine engine;
    private final int instanceBudget;
    private final int parallelism;
    private final Tracer tracer;

    public CriticalPairAnalyzer(RuleSet ruleSet, TermModel model, TermGenerator generator, IRewriteEngine engine,
                                int instanceBudget, int parallelism) {
        this(ruleSet, model, generator, engine, instanceBudget, parallelism,
                OpenTelemetry.noop().getTracer("trs-verifier"));
    }

    public CriticalPairAnalyzer(RuleSet ruleSet, TermModel model, TermGenerator generator, IRewriteEngine engine,
                                int instanceBudget, int parallelism, Tracer tracer) {
        this.ruleSet = Objects.requireNonNull(ruleSet, "ruleSet must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        if (instanceBudget <= 0) {
            throw new IllegalArgumentException("instanceBudget must be positive: " + instanceBudget);
        }
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        }
        this.instanceBudget = instanceBudget;
        this.parallelism = parallelism;
    }

    /**
     * All critical pairs with their verdicts, sorted for a stable report.
     *
     * @throws IllegalStateException if the calling thread is interrupted while waiting
     */
    public Analysis analyze() {
        Span span = tracer.spanBuilder("trs.critical-pairs")
                .setAttribute("trs.ruleset", ruleSet.id())
                .setAttribute("trs.rules", ruleSet.size())
                .startSpan();
        long start = System.nanoTime();
        ExecutorService pool = Executors.newFixedThreadPool(parallelism, runnable -> {
            Thread thread = new Thread(runnable, "trs-critical-pairs-" + POOL_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        try (Scope scope = span.makeCurrent()) {
            List<Future<List<CriticalPair>>> shards = new ArrayList<>();
            for (RewriteRule outer : ruleSet.rules()) {
                shards.add(pool.submit(() -> pairsWithOuter(outer)));
            }
            List<CriticalPair> pairs = new ArrayList<>();
            for (Future<List<CriticalPair>> shard : shards) {
                pairs.addAll(shard.get());
            }
            pairs.sort(ORDER);
            Analysis analysis = new Analysis(pairs);
            span.setAttribute("trs.critical_pairs", pairs.size());
            span.setAttribute("trs.not_joinable", analysis.summary().notJoinable());
            logger.info("Critical pairs of {}: {} in {} ms", ruleSet.id(), analysis.summary(),
                    (System.nanoTime() - start) / 1_000_000);
            return analysis;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            span.recordException(e);
            throw new IllegalStateException("Critical pair analysis of " + ruleSet.id() + " was interrupted", e);
        } catch (ExecutionException e) {
            span.recordException(e.getCause());
            throw new IllegalStateException("Critical pair analysis of " + ruleSet.id() + " failed", e.getCause());
        } finally {
            pool.shutdownNow();
            span.end();
        }
    }

    private static final Comparator<CriticalPair> ORDER = Comparator
            .comparing(CriticalPair::outerRule)
            .thenComparing(CriticalPair::innerRule)
            .thenComparing(CriticalPair::position);

    private List<CriticalPair> pairsWithOuter(RewriteRule outer) {
        List<CriticalPair> pairs = new ArrayList<>();
        for (RewriteRule inner : ruleSet.rules()) {
            for (Overlap overlap : overlaps(outer, inner)) {
                pairs.add(check(overlap));
            }
        }
        return pairs;
    }

    /**
     * Most general overlaps of {@code inner}'s left-hand side into {@code outer}'s.
     */
    public static List<Overlap> overlaps(RewriteRule outer, RewriteRule inner) {
        Term outerPattern = Terms.renameApart(outer.pattern(), 1);
        Term innerPattern = Terms.renameApart(inner.pattern(), 2);
        List<Overlap> overlaps = new ArrayList<>();
        for (Position position : Terms.functionPositions(outerPattern)) {
            if (position.isRoot() && outer.name().equals(inner.name())) {
                continue;
            }
            Optional<Bindings> unifier = Unifier.unify(Terms.subtermAt(outerPattern, position), innerPattern);
            if (unifier.isPresent()) {
                overlaps.add(new Overlap(outer, inner, position, unifier.get().substitute(outerPattern)));
            }
        }
        return overlaps;
    }

    private CriticalPair check(Overlap overlap) {
        GroundInstances ground = GroundInstances.of(overlap.term(), generator, instanceBudget);
        int applicable = 0;
        boolean undecided = false;
        Term witness = null;
        Term witnessLeft = null;
        Term witnessRight = null;

        for (Term instance : ground.instances()) {
            if (!printable(instance)) {
                continue;
            }
            Optional<Term[]> reducts = contract(overlap, instance);
            if (reducts.isEmpty()) {
                continue;
            }
            applicable++;
            NormalizationResult left = engine.normalize(reducts.get()[0]);
            NormalizationResult right = engine.normalize(reducts.get()[1]);
            if (!left.terminated() || !right.terminated()) {
                undecided = true;
                continue;
            }
            if (!Terms.structuralEquals(left.normalForm(), right.normalForm())
                    && (witness == null || Terms.size(instance) < Terms.size(witness))) {
                witness = instance;
                witnessLeft = left.normalForm();
                witnessRight = right.normalForm();
            }
        }

        CriticalPair.Status status;
        if (witness != null) {
            status = CriticalPair.Status.NOT_JOINABLE;
        } else if (undecided) {
            status = CriticalPair.Status.UNDECIDED;
        } else if (applicable == 0) {
            // a ground overlap is its own only instance; otherwise the samples may just miss
            status = Terms.isGround(overlap.term()) ? CriticalPair.Status.INFEASIBLE : CriticalPair.Status.UNDECIDED;
        } else {
            status = CriticalPair.Status.JOINABLE;
        }
        if (status == CriticalPair.Status.NOT_JOINABLE) {
            logger.debug("Not joinable: {} / {} @{} on {}", overlap.outer().name(), overlap.inner().name(),
                    overlap.position(), witness);
        }
        return new CriticalPair(overlap.outer().name(), overlap.inner().name(), overlap.position(), overlap.term(),
                status, applicable, ground.exhaustive(), witness, witnessLeft, witnessRight);
    }

    /**
     * Both one-step contractions of {@code instance}, or empty unless both rules apply.
     * An instance on which a rule throws is one the rule was not written for.
     */
    private Optional<Term[]> contract(Overlap overlap, Term instance) {
        try {
            Optional<Term> outer = RewriteEngine.applyAtRoot(overlap.outer(), instance);
            if (outer.isEmpty()) {
                return Optional.empty();
            }
            Optional<Term> inner = RewriteEngine.applyAtRoot(overlap.inner(),
                    Terms.subtermAt(instance, overlap.position()));
            if (inner.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new Term[]{outer.get(), Terms.replaceAt(instance, overlap.position(), inner.get())});
        } catch (RuntimeException e) {
            logger.debug("Skipping instance {} of {} / {}: {}", instance, overlap.outer().name(),
                    overlap.inner().name(), e.toString());
            return Optional.empty();
        }
    }

    /**
     * Instances outside the surface language, such as a version where a range is expected,
     * are not meaningful inputs for any rule.
     */
    private boolean printable(Term instance) {
        try {
            model.serialize(instance);
            return true;
        } catch (RuntimeException e) {
            return false;
        }
    }

    /**
     * An overlap before instantiation.
     */
    public record Overlap(RewriteRule outer, RewriteRule inner, Position position, Term term) {
    }

    /**
     * Critical pairs in report order and their per-status counts.
     */
    public record Analysis(List<CriticalPair> pairs) {

        public Analysis {
            pairs = List.copyOf(pairs);
        }

        public CriticalPairSummary summary() {
            int joinable = 0;
            int notJoinable = 0;
            int infeasible = 0;
            int undecided = 0;
            int nonExhaustive = 0;
            for (CriticalPair pair : pairs) {
                switch (pair.status()) {
                    case JOINABLE -> joinable++;
                    case NOT_JOINABLE -> notJoinable++;
                    case INFEASIBLE -> infeasible++;
                    case UNDECIDED -> undecided++;
                    default -> throw new IllegalStateException("Unhandled status " + pair.status());
                }
                if (!pair.exhaustive()) {
                    nonExhaustive++;
                }
            }
            return new CriticalPairSummary(pairs.size(), joinable, notJoinable, infeasible, undecided, nonExhaustive);
        }

        public List<CriticalPair> notJoinable() {
            return pairs.stream().filter(p -> p.status() == CriticalPair.Status.NOT_JOINABLE).toList();
        }
    }
}
