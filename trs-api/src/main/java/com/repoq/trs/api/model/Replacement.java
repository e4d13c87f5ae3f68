/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api.model;

import java.util.Objects;

/**
 * Right-hand side of a rewrite rule: builds the contractum from the match bindings.
 *
 * <p>Most rules use {@link #template(Term)}. Rules that reorder, flatten or merge operands
 * compute their result in code.
 */
@FunctionalInterface
public interface Replacement {

    Term build(Bindings bindings);

    static Replacement template(Term template) {
        return new Template(template);
    }

    /**
     * Substitution template.
     */
    record Template(Term term) implements Replacement {

        public Template {
            Objects.requireNonNull(term, "term must not be null");
        }

        @Override
        public Term build(Bindings bindings) {
            return bindings.substitute(term);
        }
    }
}
