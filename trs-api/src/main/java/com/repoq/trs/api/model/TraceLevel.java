/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api.model;

/**
 * Detail level of the rewrite trace kept in a {@link NormalizationResult}.
 */
public enum TraceLevel {
    /**
     * No trace. The result carries only the step count.
     */
    NONE,

    /**
     * Rule name and position of every step.
     */
    BASIC,

    /**
     * Rule name, position, redex and contractum of every step.
     */
    FULL
}
