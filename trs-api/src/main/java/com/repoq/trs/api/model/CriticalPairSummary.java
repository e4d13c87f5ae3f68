/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Counts of critical pairs by status, for the report header.
 */
public record CriticalPairSummary(
        @JsonProperty("total") int total,
        @JsonProperty("joinable") int joinable,
        @JsonProperty("not_joinable") int notJoinable,
        @JsonProperty("infeasible") int infeasible,
        @JsonProperty("undecided") int undecided,
        @JsonProperty("non_exhaustive") int nonExhaustive
) implements Serializable {

    public static CriticalPairSummary empty() {
        return new CriticalPairSummary(0, 0, 0, 0, 0, 0);
    }
}
