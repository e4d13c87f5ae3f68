/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.core.unify;

import com.repoq.trs.api.model.Bindings;
import com.repoq.trs.api.model.MetaVariable;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.core.term.Terms;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One-sided unification: finds bindings for the variables of a pattern that make it equal
 * to a subject. Variables in the subject are treated as constants.
 *
 * <p>Patterns may be non-linear; every occurrence of a variable must bind a structurally
 * equal subterm.
 */
public final class Matcher {

    private Matcher() {
        throw new AssertionError("No instances");
    }

    public static Optional<Bindings> match(Term pattern, Term subject) {
        Map<String, Term> bound = new LinkedHashMap<>();
        Map<MetaVariable, Term> ordered = new LinkedHashMap<>();
        Deque<Term> patterns = new ArrayDeque<>();
        Deque<Term> subjects = new ArrayDeque<>();
        patterns.push(pattern);
        subjects.push(subject);

        while (!patterns.isEmpty()) {
            Term p = patterns.pop();
            Term s = subjects.pop();
            if (p instanceof MetaVariable variable) {
                if (!variable.admits(s)) {
                    return Optional.empty();
                }
                Term previous = bound.get(variable.key());
                if (previous == null) {
                    bound.put(variable.key(), s);
                    ordered.put(variable, s);
                } else if (!Terms.structuralEquals(previous, s)) {
                    return Optional.empty();
                }
                continue;
            }
            if (!p.sameHead(s)) {
                return Optional.empty();
            }
            List<Term> ps = p.arguments();
            List<Term> ss = s.arguments();
            for (int i = ps.size() - 1; i >= 0; i--) {
                patterns.push(ps.get(i));
                subjects.push(ss.get(i));
            }
        }
        return Optional.of(Bindings.of(ordered));
    }

    public static boolean matches(Term pattern, Term subject) {
        return match(pattern, subject).isPresent();
    }
}
