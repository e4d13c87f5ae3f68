/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.core.term;

import com.repoq.trs.api.model.Term;

import java.util.Comparator;
import java.util.List;

/**
 * Total order on terms by {@link Terms#canonicalKey(Term)}. Two terms compare equal iff they
 * are structurally equal, which makes sorting-based normal forms unique.
 */
public final class TermOrdering implements Comparator<Term> {

    public static final TermOrdering INSTANCE = new TermOrdering();

    private TermOrdering() {
    }

    @Override
    public int compare(Term a, Term b) {
        return Terms.compare(a, b);
    }

    public static boolean isSorted(List<? extends Term> terms, Comparator<? super Term> order) {
        for (int i = 1; i < terms.size(); i++) {
            if (order.compare(terms.get(i - 1), terms.get(i)) > 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Number of pairs {@code i < j} with {@code terms[i] > terms[j]}.
     */
    public static long inversions(List<? extends Term> terms, Comparator<? super Term> order) {
        long count = 0;
        for (int i = 0; i < terms.size(); i++) {
            for (int j = i + 1; j < terms.size(); j++) {
                if (order.compare(terms.get(i), terms.get(j)) > 0) {
                    count++;
                }
            }
        }
        return count;
    }
}
