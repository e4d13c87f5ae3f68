/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Verification verdicts for one rule-set version.
 *
 * <p>Findings are data: a failing property never raises an exception. The CI gate decides
 * what to do with {@link #hasFailures()}.
 */
@JsonIgnoreProperties(value = "all_passed", allowGetters = true)
public record VerificationReport(
        @JsonProperty("domain") Domain domain,
        @JsonProperty("rule_set") String ruleSetName,
        @JsonProperty("rule_set_version") String ruleSetVersion,
        @JsonProperty("results") List<PropertyResult> results,
        @JsonProperty("critical_pairs") CriticalPairSummary criticalPairs,
        @JsonProperty("generated_at") Instant generatedAt,
        @JsonProperty("duration_ms") long durationMillis
) implements Serializable {

    public VerificationReport {
        results = results == null ? List.of() : List.copyOf(results);
        if (criticalPairs == null) {
            criticalPairs = CriticalPairSummary.empty();
        }
    }

    public Optional<PropertyResult> result(TrsProperty property) {
        return results.stream().filter(r -> r.property() == property).findFirst();
    }

    /**
     * Status of one property; {@code UNKNOWN} when the property was not checked.
     */
    public PropertyStatus status(TrsProperty property) {
        return result(property).map(PropertyResult::status).orElse(PropertyStatus.UNKNOWN);
    }

    @JsonIgnore
    public boolean hasFailures() {
        return results.stream().anyMatch(PropertyResult::failed);
    }

    @JsonProperty("all_passed")
    public boolean allPassed() {
        return !results.isEmpty() && results.stream().allMatch(PropertyResult::passed);
    }

    public List<Violation> violations() {
        return results.stream().flatMap(r -> r.violations().stream()).toList();
    }
}
