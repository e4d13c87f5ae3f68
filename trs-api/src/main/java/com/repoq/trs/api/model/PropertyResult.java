/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Verdict for one property of one rule set.
 *
 * @param property       property checked
 * @param status         verdict
 * @param checked        number of corpus terms, rules or overlaps examined
 * @param violations     counterexamples (empty on {@code PASS})
 * @param note           why the verdict is {@code UNKNOWN}, or other context
 * @param durationMillis wall-clock time spent on the check
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record PropertyResult(
        @JsonProperty("property") TrsProperty property,
        @JsonProperty("status") PropertyStatus status,
        @JsonProperty("checked") int checked,
        @JsonProperty("violations") List<Violation> violations,
        @JsonProperty("note") String note,
        @JsonProperty("duration_ms") long durationMillis
) implements Serializable {

    public PropertyResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public boolean passed() {
        return status == PropertyStatus.PASS;
    }

    public boolean failed() {
        return status == PropertyStatus.FAIL;
    }
}
