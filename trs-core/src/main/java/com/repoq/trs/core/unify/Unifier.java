/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.core.unify;

import com.repoq.trs.api.model.Bindings;
import com.repoq.trs.api.model.MetaVariable;
import com.repoq.trs.api.model.Term;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Syntactic unification with occurs check and sorted variables.
 *
 * <p>Returns the most general unifier as idempotent {@link Bindings}: applying it once with
 * {@link Bindings#substitute(Term)} yields the common instance. Binding two variables with
 * different sorts fails; binding an unsorted variable to a sorted one keeps the sort.
 */
public final class Unifier {

    private Unifier() {
        throw new AssertionError("No instances");
    }

    public static Optional<Bindings> unify(Term a, Term b) {
        Map<String, Term> solved = new LinkedHashMap<>();
        Map<String, MetaVariable> variables = new HashMap<>();
        Deque<Term> lefts = new ArrayDeque<>();
        Deque<Term> rights = new ArrayDeque<>();
        lefts.push(a);
        rights.push(b);

        while (!lefts.isEmpty()) {
            Term s = walk(lefts.pop(), solved);
            Term t = walk(rights.pop(), solved);
            if (s == t) {
                continue;
            }
            if (s instanceof MetaVariable vs && t instanceof MetaVariable vt) {
                if (vs.key().equals(vt.key())) {
                    continue;
                }
                if (vs.isSorted() && vt.isSorted() && !vs.sort().equals(vt.sort())) {
                    return Optional.empty();
                }
                // keep the sorted one as representative
                if (vs.isSorted()) {
                    bind(vt, vs, solved, variables);
                } else {
                    bind(vs, vt, solved, variables);
                }
                continue;
            }
            if (s instanceof MetaVariable vs) {
                if (!vs.admits(t) || occurs(vs, t, solved)) {
                    return Optional.empty();
                }
                bind(vs, t, solved, variables);
                continue;
            }
            if (t instanceof MetaVariable vt) {
                if (!vt.admits(s) || occurs(vt, s, solved)) {
                    return Optional.empty();
                }
                bind(vt, s, solved, variables);
                continue;
            }
            if (!s.sameHead(t)) {
                return Optional.empty();
            }
            List<Term> ss = s.arguments();
            List<Term> ts = t.arguments();
            for (int i = ss.size() - 1; i >= 0; i--) {
                lefts.push(ss.get(i));
                rights.push(ts.get(i));
            }
        }

        Map<MetaVariable, Term> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, Term> entry : solved.entrySet()) {
            resolved.put(variables.get(entry.getKey()), resolve(entry.getValue(), solved));
        }
        return Optional.of(Bindings.of(resolved));
    }

    private static void bind(MetaVariable variable, Term term, Map<String, Term> solved,
                             Map<String, MetaVariable> variables) {
        solved.put(variable.key(), term);
        variables.put(variable.key(), variable);
    }

    private static Term walk(Term term, Map<String, Term> solved) {
        Term current = term;
        while (current instanceof MetaVariable variable) {
            Term next = solved.get(variable.key());
            if (next == null) {
                return current;
            }
            current = next;
        }
        return current;
    }

    private static boolean occurs(MetaVariable variable, Term term, Map<String, Term> solved) {
        Deque<Term> stack = new ArrayDeque<>();
        stack.push(term);
        while (!stack.isEmpty()) {
            Term node = walk(stack.pop(), solved);
            if (node instanceof MetaVariable other) {
                if (other.key().equals(variable.key())) {
                    return true;
                }
                continue;
            }
            node.arguments().forEach(stack::push);
        }
        return false;
    }

    /**
     * Applies the triangular solution until no solved variable remains. Terminates because
     * the occurs check rules out cycles.
     */
    private static Term resolve(Term term, Map<String, Term> solved) {
        Term current = term;
        while (mentionsSolved(current, solved)) {
            current = Bindings.replaceVariables(current, variable -> solved.get(variable.key()));
        }
        return current;
    }

    private static boolean mentionsSolved(Term term, Map<String, Term> solved) {
        Deque<Term> stack = new ArrayDeque<>();
        stack.push(term);
        while (!stack.isEmpty()) {
            Term node = stack.pop();
            if (node instanceof MetaVariable variable) {
                if (solved.containsKey(variable.key())) {
                    return true;
                }
                continue;
            }
            node.arguments().forEach(stack::push);
        }
        return false;
    }
}
