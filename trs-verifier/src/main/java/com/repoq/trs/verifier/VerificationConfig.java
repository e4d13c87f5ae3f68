/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.verifier;

import com.repoq.trs.infra.config.EnvironmentSettings;
import com.repoq.trs.runtime.EngineConfig;

/**
 * Verification budgets.
 *
 * <p>Environment overrides: {@code TRS_CORPUS_SIZE}, {@code TRS_CORPUS_DEPTH},
 * {@code TRS_SEED}, {@code TRS_DETERMINISM_RUNS}, {@code TRS_INSTANCE_BUDGET},
 * {@code TRS_SHRINK_BUDGET}, {@code TRS_PARALLELISM}, {@code TRS_MAX_STEPS} (or the
 * matching {@code trs.corpus.size}-style system properties).
 */
public final class VerificationConfig {

    public static final int DEFAULT_CORPUS_SIZE = 200;
    public static final int DEFAULT_CORPUS_DEPTH = 4;
    public static final long DEFAULT_SEED = 42L;
    public static final int DEFAULT_DETERMINISM_RUNS = 3;
    public static final int DEFAULT_INSTANCE_BUDGET = 256;
    public static final int DEFAULT_SHRINK_BUDGET = 500;

    private final int corpusSize;
    private final int corpusDepth;
    private final long seed;
    private final int determinismRuns;
    private final int instanceBudget;
    private final int shrinkBudget;
    private final int parallelism;
    private final int maxSteps;

    private VerificationConfig(Builder builder) {
        this.corpusSize = requireAtLeast("corpusSize", builder.corpusSize, 0);
        this.corpusDepth = requireAtLeast("corpusDepth", builder.corpusDepth, 1);
        this.seed = builder.seed;
        this.determinismRuns = requireAtLeast("determinismRuns", builder.determinismRuns, 3);
        this.instanceBudget = requireAtLeast("instanceBudget", builder.instanceBudget, 1);
        this.shrinkBudget = requireAtLeast("shrinkBudget", builder.shrinkBudget, 0);
        this.parallelism = requireAtLeast("parallelism", builder.parallelism, 1);
        this.maxSteps = requireAtLeast("maxSteps", builder.maxSteps, 1);
    }

    private static int requireAtLeast(String name, int value, int minimum) {
        if (value < minimum) {
            throw new IllegalArgumentException(name + " must be >= " + minimum + ": " + value);
        }
        return value;
    }

    public static VerificationConfig defaults() {
        return builder().build();
    }

    public static VerificationConfig fromEnvironment() {
        return builder()
                .corpusSize(EnvironmentSettings.getInt("TRS_CORPUS_SIZE", DEFAULT_CORPUS_SIZE))
                .corpusDepth(EnvironmentSettings.getInt("TRS_CORPUS_DEPTH", DEFAULT_CORPUS_DEPTH))
                .seed(EnvironmentSettings.getLong("TRS_SEED", DEFAULT_SEED))
                .determinismRuns(EnvironmentSettings.getInt("TRS_DETERMINISM_RUNS", DEFAULT_DETERMINISM_RUNS))
                .instanceBudget(EnvironmentSettings.getInt("TRS_INSTANCE_BUDGET", DEFAULT_INSTANCE_BUDGET))
                .shrinkBudget(EnvironmentSettings.getInt("TRS_SHRINK_BUDGET", DEFAULT_SHRINK_BUDGET))
                .parallelism(EnvironmentSettings.getInt("TRS_PARALLELISM", Runtime.getRuntime().availableProcessors()))
                .maxSteps(EnvironmentSettings.getInt("TRS_MAX_STEPS", EngineConfig.DEFAULT_MAX_STEPS))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Number of generated terms added to the curated sources.
     */
    public int corpusSize() {
        return corpusSize;
    }

    public int corpusDepth() {
        return corpusDepth;
    }

    public long seed() {
        return seed;
    }

    public int determinismRuns() {
        return determinismRuns;
    }

    /**
     * Maximum number of ground instances tried per overlap and per rule.
     */
    public int instanceBudget() {
        return instanceBudget;
    }

    /**
     * Maximum number of candidate terms the shrinker evaluates per violation.
     */
    public int shrinkBudget() {
        return shrinkBudget;
    }

    public int parallelism() {
        return parallelism;
    }

    public int maxSteps() {
        return maxSteps;
    }

    @Override
    public String toString() {
        return "VerificationConfig{corpusSize=" + corpusSize + ", corpusDepth=" + corpusDepth + ", seed=" + seed
                + ", determinismRuns=" + determinismRuns + ", instanceBudget=" + instanceBudget
                + ", shrinkBudget=" + shrinkBudget + ", parallelism=" + parallelism + ", maxSteps=" + maxSteps + "}";
    }

    public static final class Builder {
        private int corpusSize = DEFAULT_CORPUS_SIZE;
        private int corpusDepth = DEFAULT_CORPUS_DEPTH;
        private long seed = DEFAULT_SEED;
        private int determinismRuns = DEFAULT_DETERMINISM_RUNS;
        private int instanceBudget = DEFAULT_INSTANCE_BUDGET;
        private int shrinkBudget = DEFAULT_SHRINK_BUDGET;
        private int parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());
        private int maxSteps = EngineConfig.DEFAULT_MAX_STEPS;

        public Builder corpusSize(int corpusSize) {
            this.corpusSize = corpusSize;
            return this;
        }

        public Builder corpusDepth(int corpusDepth) {
            this.corpusDepth = corpusDepth;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder determinismRuns(int determinismRuns) {
            this.determinismRuns = determinismRuns;
            return this;
        }

        public Builder instanceBudget(int instanceBudget) {
            this.instanceBudget = instanceBudget;
            return this;
        }

        public Builder shrinkBudget(int shrinkBudget) {
            this.shrinkBudget = shrinkBudget;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder maxSteps(int maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public VerificationConfig build() {
            return new VerificationConfig(this);
        }
    }
}
