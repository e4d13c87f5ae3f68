/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.core.term;

import com.repoq.trs.api.TermModel;
import com.repoq.trs.api.exceptions.ParseException;
import com.repoq.trs.api.model.Bindings;
import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.core.unify.Matcher;

import java.util.Optional;

/**
 * Base for domain term models: generic equality and matching, plus input checks shared by
 * every parser and serializer.
 */
public abstract class AbstractTermModel implements TermModel {

    private final Domain domain;

    protected AbstractTermModel(Domain domain) {
        this.domain = domain;
    }

    @Override
    public final Domain domain() {
        return domain;
    }

    @Override
    public final Term parse(String source) {
        if (source == null || source.isBlank()) {
            throw new ParseException(domain, source, 0, "Empty input");
        }
        return doParse(source);
    }

    @Override
    public final String serialize(Term term) {
        if (!Terms.isGround(term)) {
            throw new IllegalArgumentException("Cannot serialize a term with metavariables: " + term);
        }
        return doSerialize(term);
    }

    @Override
    public boolean structuralEquals(Term a, Term b) {
        return Terms.structuralEquals(a, b);
    }

    @Override
    public Optional<Bindings> match(Term pattern, Term subject) {
        return Matcher.match(pattern, subject);
    }

    protected abstract Term doParse(String source);

    protected abstract String doSerialize(Term term);

    protected ParseException error(String source, int offset, String message) {
        return new ParseException(domain, source, offset, message);
    }

    protected IllegalArgumentException foreign(Term term) {
        return new IllegalArgumentException("Not a " + domain.id() + " term: " + term);
    }
}
