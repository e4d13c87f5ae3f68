/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain;

import com.repoq.trs.api.NormalizationDomain;
import com.repoq.trs.api.model.Domain;
import com.repoq.trs.domain.filter.FilterDomain;
import com.repoq.trs.domain.metrics.MetricsDomain;
import com.repoq.trs.domain.rdf.RdfDomain;
import com.repoq.trs.domain.semver.SemVerDomain;
import com.repoq.trs.domain.spdx.SpdxDomain;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Factory for the built-in domains. Every call builds fresh rule sets; nothing is cached
 * or registered globally.
 */
public final class Domains {

    private Domains() {
        throw new AssertionError("No instances");
    }

    public static NormalizationDomain create(Domain domain) {
        Objects.requireNonNull(domain, "domain must not be null");
        switch (domain) {
            case SPDX:
                return new SpdxDomain();
            case SEMVER:
                return new SemVerDomain();
            case RDF:
                return new RdfDomain();
            case METRICS:
                return new MetricsDomain();
            case FILTER:
                return new FilterDomain();
            default:
                throw new IllegalArgumentException("No implementation for domain " + domain);
        }
    }

    /**
     * All domains in declaration order of {@link Domain}.
     */
    public static List<NormalizationDomain> all() {
        List<NormalizationDomain> domains = new ArrayList<>();
        for (Domain domain : Domain.values()) {
            domains.add(create(domain));
        }
        return domains;
    }

    /**
     * Domains named in a comma-separated list of ids such as {@code "spdx,semver"}. A blank
     * selection or {@code "all"} selects every domain; duplicates are ignored.
     *
     * @throws IllegalArgumentException for an unknown id
     */
    public static List<NormalizationDomain> select(String ids) {
        List<Domain> selected = parse(ids);
        List<NormalizationDomain> domains = new ArrayList<>(selected.size());
        for (Domain domain : selected) {
            domains.add(create(domain));
        }
        return domains;
    }

    /**
     * Ids of {@link #select(String)} without building the domains, in selection order.
     *
     * @throws IllegalArgumentException for an unknown id
     */
    public static List<Domain> parse(String ids) {
        if (ids == null || ids.isBlank() || ids.trim().equalsIgnoreCase("all")) {
            return List.of(Domain.values());
        }
        Set<Domain> selected = new LinkedHashSet<>();
        for (String id : ids.split(",")) {
            if (!id.isBlank()) {
                selected.add(Domain.fromId(id));
            }
        }
        return List.copyOf(selected);
    }
}
