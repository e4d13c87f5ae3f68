/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api.model;

import com.repoq.trs.api.exceptions.RuleDefinitionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, versioned, domain-tagged collection of rewrite rules.
 *
 * <p>A rule set is built once from a static definition and never changes afterwards. Engines,
 * analyzers and verifiers receive it through their constructors; there is no global registry.
 * Declaration order is significant: at a given position the engine tries rules in this order.
 *
 * <h2>Thread Safety</h2>
 * <p>Immutable and safe to share between threads.
 */
public final class RuleSet {

    private final Domain domain;
    private final String name;
    private final String version;
    private final List<RewriteRule> rules;
    private final Map<String, List<RewriteRule>> rulesByRootOperator;
    private final Map<String, RewriteRule> rulesByName;

    private RuleSet(Builder builder) {
        this.domain = builder.domain;
        this.name = builder.name;
        this.version = builder.version;
        this.rules = List.copyOf(builder.rules);
        validate();

        Map<String, List<RewriteRule>> byOperator = new HashMap<>();
        Map<String, RewriteRule> byName = new HashMap<>();
        for (RewriteRule rule : rules) {
            byOperator.computeIfAbsent(rule.rootOperator(), k -> new ArrayList<>()).add(rule);
            byName.put(rule.name(), rule);
        }
        byOperator.replaceAll((k, v) -> List.copyOf(v));
        this.rulesByRootOperator = Collections.unmodifiableMap(byOperator);
        this.rulesByName = Collections.unmodifiableMap(byName);
    }

    public static Builder builder(Domain domain, String name, String version) {
        return new Builder(domain, name, version);
    }

    private void validate() {
        if (rules.isEmpty()) {
            throw new RuleDefinitionException("Rule set '" + name + "' must contain at least one rule");
        }
        Set<String> seen = new HashSet<>();
        for (RewriteRule rule : rules) {
            if (!seen.add(rule.name())) {
                throw new RuleDefinitionException("Duplicate rule name in '" + name + "': " + rule.name());
            }
            if (rule.domain() != domain) {
                throw new RuleDefinitionException("Rule '" + rule.name() + "' belongs to " + rule.domain()
                        + " but rule set '" + name + "' is " + domain);
            }
        }
    }

    public Domain domain() {
        return domain;
    }

    public String name() {
        return name;
    }

    public String version() {
        return version;
    }

    /**
     * {@code name@version}, the identity used in cache keys and reports.
     */
    public String id() {
        return name + "@" + version;
    }

    public List<RewriteRule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public Optional<RewriteRule> rule(String ruleName) {
        return Optional.ofNullable(rulesByName.get(ruleName));
    }

    /**
     * Rules whose pattern root can match {@code node}, in declaration order.
     */
    public List<RewriteRule> candidatesFor(Term node) {
        List<RewriteRule> byOperator = rulesByRootOperator.get(node.operator());
        if (byOperator == null) {
            return List.of();
        }
        List<RewriteRule> candidates = new ArrayList<>(byOperator.size());
        for (RewriteRule rule : byOperator) {
            if (rule.fitsRoot(node)) {
                candidates.add(rule);
            }
        }
        return candidates;
    }

    @Override
    public String toString() {
        return "RuleSet{" + id() + ", domain=" + domain + ", rules=" + rules.size() + "}";
    }

    public static final class Builder {
        private final Domain domain;
        private final String name;
        private final String version;
        private final List<RewriteRule> rules = new ArrayList<>();

        private Builder(Domain domain, String name, String version) {
            this.domain = Objects.requireNonNull(domain, "domain must not be null");
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.version = Objects.requireNonNull(version, "version must not be null");
        }

        public Builder add(RewriteRule rule) {
            rules.add(Objects.requireNonNull(rule, "rule must not be null"));
            return this;
        }

        public Builder addAll(List<RewriteRule> more) {
            more.forEach(this::add);
            return this;
        }

        public RuleSet build() {
            return new RuleSet(this);
        }
    }
}
