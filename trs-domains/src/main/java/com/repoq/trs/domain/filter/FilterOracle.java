/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.filter;

import com.repoq.trs.api.SemanticOracle;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.core.term.Terms;
import com.repoq.trs.domain.filter.FilterTerm.Glob;
import com.repoq.trs.domain.filter.FilterTerm.Intersect;
import com.repoq.trs.domain.filter.FilterTerm.MatchAll;
import com.repoq.trs.domain.filter.FilterTerm.MatchNone;
import com.repoq.trs.domain.filter.FilterTerm.Negate;
import com.repoq.trs.domain.filter.FilterTerm.PathLiteral;
import com.repoq.trs.domain.filter.FilterTerm.Union;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Set-membership equivalence over a fixed sample of repository paths plus every path literal
 * either filter mentions.
 */
public final class FilterOracle implements SemanticOracle {

    static final List<String> SAMPLE_PATHS = List.of(
            "README.md",
            "CHANGELOG.md",
            "a",
            "b.txt",
            ".gitignore",
            "src/Main.java",
            "src/util/Strings.java",
            "src/util/a.txt",
            "src/main/resources/app.yml",
            "test/MainTest.java",
            "docs/guide.md",
            "docs/api/index.md",
            "build/out.class");

    @Override
    public String name() {
        return "filter-path-membership";
    }

    @Override
    public Optional<String> findDifference(Term original, Term normalized) {
        Set<String> paths = new LinkedHashSet<>(SAMPLE_PATHS);
        collectLiterals(original, paths);
        collectLiterals(normalized, paths);
        for (String path : paths) {
            boolean a = evaluate(original, path);
            boolean b = evaluate(normalized, path);
            if (a != b) {
                return Optional.of("path " + path + " gives original=" + a + ", normalized=" + b);
            }
        }
        return Optional.empty();
    }

    private static void collectLiterals(Term term, Set<String> paths) {
        Terms.walk(term, (node, parent, index) -> {
            if (node instanceof PathLiteral literal) {
                paths.add(Globs.normalizePath(literal.path()));
            }
        });
    }

    /**
     * Post-order evaluation with an explicit stack.
     */
    static boolean evaluate(Term term, String path) {
        Deque<Object[]> work = new ArrayDeque<>();
        Deque<Boolean> values = new ArrayDeque<>();
        work.push(new Object[]{term, Boolean.FALSE});
        while (!work.isEmpty()) {
            Object[] entry = work.pop();
            Term node = (Term) entry[0];
            boolean expanded = (Boolean) entry[1];
            if (node instanceof PathLiteral literal) {
                values.push(Globs.normalizePath(literal.path()).equals(Globs.normalizePath(path)));
            } else if (node instanceof Glob glob) {
                values.push(Globs.matches(glob.pattern(), path));
            } else if (node instanceof MatchAll) {
                values.push(Boolean.TRUE);
            } else if (node instanceof MatchNone) {
                values.push(Boolean.FALSE);
            } else if (node instanceof Negate || node instanceof Union || node instanceof Intersect) {
                if (expanded) {
                    if (node instanceof Negate) {
                        values.push(!values.pop());
                    } else {
                        boolean right = values.pop();
                        boolean left = values.pop();
                        values.push(node instanceof Union ? left || right : left && right);
                    }
                } else {
                    work.push(new Object[]{node, Boolean.TRUE});
                    List<Term> arguments = node.arguments();
                    for (int i = arguments.size() - 1; i >= 0; i--) {
                        work.push(new Object[]{arguments.get(i), Boolean.FALSE});
                    }
                }
            } else {
                throw new IllegalArgumentException("Not a filter term: " + node);
            }
        }
        return values.pop();
    }
}
