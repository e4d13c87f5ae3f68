/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.verifier;

import com.repoq.trs.api.model.Position;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.core.term.Terms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Greedy counterexample minimizer.
 *
 * <p>Candidates are the proper subterms of the current term and the terms obtained by
 * deleting one argument of a node. The smallest candidate that still violates replaces the
 * current term, and the search restarts from it. The result is never larger than the input
 * and always satisfies the predicate if the input did.
 */
public final class Shrinker {

    private static final Logger logger = LoggerFactory.getLogger(Shrinker.class);

    private final int budget;

    /**
     * @param budget maximum number of predicate evaluations per call
     */
    public Shrinker(int budget) {
        if (budget < 0) {
            throw new IllegalArgumentException("budget must be >= 0: " + budget);
        }
        this.budget = budget;
    }

    public Term shrink(Term input, Predicate<Term> stillViolates) {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(stillViolates, "stillViolates must not be null");
        Term current = input;
        int evaluations = 0;
        boolean improved = true;
        while (improved && evaluations < budget) {
            improved = false;
            int currentSize = Terms.size(current);
            for (Term candidate : candidates(current)) {
                if (evaluations >= budget) {
                    break;
                }
                if (Terms.size(candidate) >= currentSize) {
                    continue;
                }
                evaluations++;
                if (violates(stillViolates, candidate)) {
                    current = candidate;
                    improved = true;
                    break;
                }
            }
        }
        logger.debug("Shrunk a term of size {} to size {} in {} evaluations",
                Terms.size(input), Terms.size(current), evaluations);
        return current;
    }

    /**
     * A candidate on which the check itself throws does not reproduce the original violation.
     */
    private static boolean violates(Predicate<Term> stillViolates, Term candidate) {
        try {
            return stillViolates.test(candidate);
        } catch (RuntimeException e) {
            logger.trace("Shrink candidate {} rejected: {}", candidate, e.toString());
            return false;
        }
    }

    /**
     * Proper subterms and single-argument deletions, smallest first.
     */
    static List<Term> candidates(Term term) {
        List<Term> result = new ArrayList<>();
        for (Position position : Terms.positions(term)) {
            Term sub = Terms.subtermAt(term, position);
            if (!position.isRoot()) {
                result.add(sub);
            }
            List<Term> args = sub.arguments();
            if (args.size() < 2) {
                continue;
            }
            for (int i = 0; i < args.size(); i++) {
                List<Term> fewer = new ArrayList<>(args);
                fewer.remove(i);
                Term deleted = withFewerArguments(sub, fewer);
                if (deleted != null) {
                    result.add(Terms.replaceAt(term, position, deleted));
                }
            }
        }
        result.sort(Comparator.comparingInt(Terms::size));
        return result;
    }

    /**
     * Fixed-arity variants reject a shorter argument list; only variadic nodes shrink this way.
     */
    private static Term withFewerArguments(Term node, List<Term> fewer) {
        try {
            Term rebuilt = node.withArguments(fewer);
            return rebuilt.arguments().size() == fewer.size() ? rebuilt : null;
        } catch (IndexOutOfBoundsException | IllegalArgumentException e) {
            return null;
        }
    }
}
