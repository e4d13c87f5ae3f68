/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api;

import com.repoq.trs.api.exceptions.ParseException;
import com.repoq.trs.api.model.Bindings;
import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.Term;

import java.util.Optional;

/**
 * Surface syntax and term algebra of one domain.
 *
 * <h2>Round-trip law</h2>
 * <p>For every normal form {@code nf}, {@code parse(serialize(nf))} is structurally equal
 * to {@code nf}. Terms that are not in normal form may serialize to text that parses
 * differently (for example, a left-nested chain).
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations are stateless and thread-safe.
 */
public interface TermModel {

    Domain domain();

    /**
     * Parses surface syntax.
     *
     * @throws ParseException on malformed input, including empty or blank input
     */
    Term parse(String source);

    /**
     * Canonical text of a term.
     *
     * @throws IllegalArgumentException if the term contains metavariables or nodes of
     *                                  another domain
     */
    String serialize(Term term);

    /**
     * Deep structural equality.
     */
    boolean structuralEquals(Term a, Term b);

    /**
     * Matches a pattern against a subject. An empty result is normal control flow.
     */
    Optional<Bindings> match(Term pattern, Term subject);

    /**
     * Instantiates a template.
     */
    default Term substitute(Term template, Bindings bindings) {
        return bindings.substitute(template);
    }
}
