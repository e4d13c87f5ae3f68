/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api.model;

import com.repoq.trs.api.exceptions.RuleDefinitionException;

import java.util.Objects;

/**
 * One rewrite rule: {@code pattern -> replacement if condition}.
 *
 * @param name        unique name within the rule set, used in traces and reports
 * @param domain      domain of the terms this rule rewrites
 * @param pattern     left-hand side; its root must not be an unsorted variable
 * @param replacement right-hand side
 * @param condition   side condition on the match bindings
 * @param measure     termination argument, or {@code null} if none was supplied
 * @param description one-line human description
 */
public record RewriteRule(
        String name,
        Domain domain,
        Term pattern,
        Replacement replacement,
        SideCondition condition,
        WellFoundedMeasure measure,
        String description
) {

    public RewriteRule {
        if (name == null || name.isBlank()) {
            throw new RuleDefinitionException("Rule name must not be blank");
        }
        Objects.requireNonNull(domain, "domain must not be null");
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(replacement, "replacement must not be null");
        if (condition == null) {
            condition = SideCondition.ALWAYS;
        }
        if (description == null) {
            description = "";
        }
        if (pattern instanceof MetaVariable variable && !variable.isSorted()) {
            throw new RuleDefinitionException(
                    "Rule '" + name + "' has an unsorted variable as its pattern; it would match every term");
        }
    }

    public static Builder builder(String name, Domain domain) {
        return new Builder(name, domain);
    }

    /**
     * Head operator of the pattern root: the operator itself, or the sort of a sorted variable.
     */
    public String rootOperator() {
        return pattern instanceof MetaVariable variable ? variable.sort() : pattern.operator();
    }

    /**
     * Cheap pre-filter: can the pattern root possibly match {@code node}?
     */
    public boolean fitsRoot(Term node) {
        if (node.isVariable()) {
            return false;
        }
        if (pattern instanceof MetaVariable variable) {
            return variable.admits(node);
        }
        return pattern.getClass() == node.getClass()
                && pattern.operator().equals(node.operator())
                && pattern.arguments().size() == node.arguments().size();
    }

    public boolean hasMeasure() {
        return measure != null;
    }

    public boolean isConditional() {
        return condition != SideCondition.ALWAYS;
    }

    @Override
    public String toString() {
        return name;
    }

    public static final class Builder {
        private final String name;
        private final Domain domain;
        private Term pattern;
        private Replacement replacement;
        private SideCondition condition = SideCondition.ALWAYS;
        private WellFoundedMeasure measure;
        private String description = "";

        private Builder(String name, Domain domain) {
            this.name = name;
            this.domain = domain;
        }

        public Builder pattern(Term pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder template(Term template) {
            this.replacement = Replacement.template(template);
            return this;
        }

        public Builder replacement(Replacement replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder when(SideCondition condition) {
            this.condition = condition;
            return this;
        }

        public Builder measure(WellFoundedMeasure measure) {
            this.measure = measure;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public RewriteRule build() {
            if (pattern == null) {
                throw new RuleDefinitionException("Rule '" + name + "' has no pattern");
            }
            if (replacement == null) {
                throw new RuleDefinitionException("Rule '" + name + "' has no replacement");
            }
            return new RewriteRule(name, domain, pattern, replacement, condition, measure, description);
        }
    }
}
