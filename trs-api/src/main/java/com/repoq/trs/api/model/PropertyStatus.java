/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api.model;

/**
 * Verdict for one property. {@code UNKNOWN} is never silently promoted to {@code PASS}.
 */
public enum PropertyStatus {
    PASS,
    FAIL,
    UNKNOWN;

    /**
     * Combines two verdicts: any failure wins, then any unknown.
     */
    public PropertyStatus and(PropertyStatus other) {
        if (this == FAIL || other == FAIL) {
            return FAIL;
        }
        if (this == UNKNOWN || other == UNKNOWN) {
            return UNKNOWN;
        }
        return PASS;
    }
}
