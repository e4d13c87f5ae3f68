/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Map;

/**
 * A counterexample found during verification. Terms are stored in serialized surface syntax
 * so the record stays meaningful outside the process.
 *
 * @param property        property that was violated
 * @param input           corpus entry (or overlap term) that exposed the violation
 * @param minimalExample  shrunk input that still reproduces the violation
 * @param message         what went wrong
 * @param details         extra key/value context, such as the two diverging normal forms
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Violation(
        @JsonProperty("property") TrsProperty property,
        @JsonProperty("input") String input,
        @JsonProperty("minimal_example") String minimalExample,
        @JsonProperty("message") String message,
        @JsonProperty("details") Map<String, String> details
) implements Serializable {

    public Violation {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static Violation of(TrsProperty property, String input, String message) {
        return new Violation(property, input, input, message, Map.of());
    }

    public Violation withMinimalExample(String example) {
        return new Violation(property, input, example, message, details);
    }
}
