/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api.model;

/**
 * Normalization domains. Every term and every rule set is tagged with exactly one.
 */
public enum Domain {
    SPDX("spdx"),
    SEMVER("semver"),
    RDF("rdf"),
    METRICS("metrics"),
    FILTER("filter");

    private final String id;

    Domain(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Resolves a domain from its short id (case-insensitive).
     *
     * @throws IllegalArgumentException if no domain has that id
     */
    public static Domain fromId(String id) {
        for (Domain domain : values()) {
            if (domain.id.equalsIgnoreCase(id.trim())) {
                return domain;
            }
        }
        throw new IllegalArgumentException("Unknown domain: " + id);
    }
}
