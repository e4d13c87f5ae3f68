/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Immutable assignment of metavariables to terms, produced by matching and unification.
 *
 * <p>Keys are {@link MetaVariable#key()} values, so a sort constraint never splits one
 * variable into two bindings. Insertion order is preserved, which keeps traces and reports
 * deterministic.
 */
public final class Bindings {

    private static final Bindings EMPTY = new Bindings(Collections.emptyMap());

    private final Map<String, Term> values;

    private Bindings(Map<String, Term> values) {
        this.values = values;
    }

    public static Bindings empty() {
        return EMPTY;
    }

    public static Bindings of(Map<MetaVariable, Term> assignments) {
        Map<String, Term> copy = new LinkedHashMap<>();
        assignments.forEach((variable, term) -> copy.put(variable.key(), Objects.requireNonNull(term)));
        return new Bindings(Collections.unmodifiableMap(copy));
    }

    public Bindings bind(MetaVariable variable, Term term) {
        Objects.requireNonNull(variable, "variable must not be null");
        Objects.requireNonNull(term, "term must not be null");
        Map<String, Term> copy = new LinkedHashMap<>(values);
        copy.put(variable.key(), term);
        return new Bindings(Collections.unmodifiableMap(copy));
    }

    public Optional<Term> lookup(MetaVariable variable) {
        return Optional.ofNullable(values.get(variable.key()));
    }

    /**
     * Bound term of a generation-0 variable, for use inside replacements and side conditions.
     *
     * @throws IllegalStateException if the variable is unbound, which means the rule
     *                               references a variable its pattern does not contain
     */
    public Term get(String name) {
        Term term = values.get(name);
        if (term == null) {
            throw new IllegalStateException("Unbound metavariable: " + name);
        }
        return term;
    }

    public boolean contains(MetaVariable variable) {
        return values.containsKey(variable.key());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public Map<String, Term> asMap() {
        return values;
    }

    /**
     * Instantiates a template. Unbound variables are left in place.
     */
    public Term substitute(Term template) {
        Objects.requireNonNull(template, "template must not be null");
        if (values.isEmpty()) {
            return template;
        }
        return replaceVariables(template, variable -> values.get(variable.key()));
    }

    /**
     * Rebuilds {@code root} with every metavariable replaced by {@code replacer}'s result.
     * A {@code null} result keeps the variable. Subtrees without variables are shared, not
     * copied. Traversal uses an explicit stack.
     */
    public static Term replaceVariables(Term root, Function<MetaVariable, Term> replacer) {
        if (root instanceof MetaVariable variable) {
            Term replaced = replacer.apply(variable);
            return replaced != null ? replaced : variable;
        }
        if (root.isLeaf()) {
            return root;
        }
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root));
        while (true) {
            Frame top = stack.peek();
            List<Term> args = top.term.arguments();
            if (top.next < args.size()) {
                Term child = args.get(top.next);
                if (child instanceof MetaVariable variable) {
                    Term replaced = replacer.apply(variable);
                    top.accept(replaced != null ? replaced : variable);
                } else if (child.isLeaf()) {
                    top.accept(child);
                } else {
                    stack.push(new Frame(child));
                }
                continue;
            }
            stack.pop();
            Term built = top.changed ? top.term.withArguments(top.rebuilt) : top.term;
            if (stack.isEmpty()) {
                return built;
            }
            stack.peek().accept(built);
        }
    }

    private static final class Frame {
        final Term term;
        final List<Term> rebuilt;
        int next;
        boolean changed;

        Frame(Term term) {
            this.term = term;
            this.rebuilt = new ArrayList<>(term.arguments().size());
        }

        void accept(Term child) {
            if (child != term.arguments().get(next)) {
                changed = true;
            }
            rebuilt.add(child);
            next++;
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Bindings other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
