/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.semver;

import com.repoq.trs.api.model.Term;
import com.repoq.trs.domain.semver.SemVerTerm.AnyVersion;
import com.repoq.trs.domain.semver.SemVerTerm.EmptyRange;
import com.repoq.trs.domain.semver.SemVerTerm.Op;
import com.repoq.trs.domain.semver.SemVerTerm.Range;
import com.repoq.trs.domain.semver.SemVerTerm.Version;
import com.repoq.trs.domain.semver.SemVerTerm.VersionComparator;

import java.util.Comparator;
import java.util.Optional;

/**
 * Version interval view of a normalized comparator set. A {@code null} bound is unbounded.
 */
final class Interval {

    record Bound(Version version, boolean inclusive) {
    }

    /**
     * Orders intervals by lower bound, then by upper bound; terms that are not normalized
     * intervals compare equal to everything.
     */
    static final Comparator<Term> TERM_ORDER = (a, b) -> {
        Optional<Interval> x = of(a);
        Optional<Interval> y = of(b);
        return x.isPresent() && y.isPresent() ? x.get().compareTo(y.get()) : 0;
    };

    /**
     * {@code 0} for lower bounds and equalities, {@code 1} for upper bounds.
     */
    static final Comparator<Term> SIDE_ORDER = Comparator.comparingInt(Interval::side);

    private final Bound lower;
    private final Bound upper;

    Interval(Bound lower, Bound upper) {
        this.lower = lower;
        this.upper = upper;
    }

    Bound lower() {
        return lower;
    }

    Bound upper() {
        return upper;
    }

    /**
     * The interval a term denotes, if the term is a single comparator or a
     * {@code lower upper} pair that no range rule would rewrite any further.
     */
    static Optional<Interval> of(Term term) {
        if (isComparator(term)) {
            VersionComparator c = (VersionComparator) term;
            if (isDegenerate(c)) {
                return Optional.empty();
            }
            Bound bound = new Bound(c.ground(), c.op().isInclusive());
            if (c.op() == Op.EQ) {
                return Optional.of(new Interval(bound, bound));
            }
            return Optional.of(c.op().isLower() ? new Interval(bound, null) : new Interval(null, bound));
        }
        if (term instanceof Range range && isComparator(range.left()) && isComparator(range.right())) {
            VersionComparator low = (VersionComparator) range.left();
            VersionComparator high = (VersionComparator) range.right();
            if (low.op().isLower() && high.op().isUpper() && !isDegenerate(low) && !isDegenerate(high)
                    && !combinable(low, high)) {
                return Optional.of(new Interval(new Bound(low.ground(), low.op().isInclusive()),
                        new Bound(high.ground(), high.op().isInclusive())));
            }
        }
        return Optional.empty();
    }

    static boolean isComparator(Term term) {
        return term instanceof VersionComparator c && c.version() instanceof Version;
    }

    /**
     * {@code >=0.0.0-0} (everything) and {@code <0.0.0-0} (nothing).
     */
    static boolean isDegenerate(VersionComparator c) {
        return Version.MIN.equals(c.version()) && (c.op() == Op.GTE || c.op() == Op.LT);
    }

    static int side(Term term) {
        return isComparator(term) && ((VersionComparator) term).op().isUpper() ? 1 : 0;
    }

    /**
     * Whether two comparators collapse into one: either is an equality, both bound the same
     * side, or a lower and an upper bound that leave at most one version.
     */
    static boolean combinable(VersionComparator a, VersionComparator b) {
        if (a.op() == Op.EQ || b.op() == Op.EQ || a.op().isLower() == b.op().isLower()) {
            return true;
        }
        VersionComparator low = a.op().isLower() ? a : b;
        VersionComparator high = a.op().isLower() ? b : a;
        int cmp = low.ground().compareTo(high.ground());
        return cmp >= 0;
    }

    /**
     * Intersection of two {@link #combinable} comparators.
     */
    static Term combine(VersionComparator a, VersionComparator b) {
        if (a.op() == Op.EQ) {
            return b.admits(a.ground()) ? a : new EmptyRange();
        }
        if (b.op() == Op.EQ) {
            return a.admits(b.ground()) ? b : new EmptyRange();
        }
        int cmp = a.ground().compareTo(b.ground());
        if (a.op().isLower() && b.op().isLower()) {
            return cmp > 0 ? a : cmp < 0 ? b : (a.op() == Op.GT ? a : b);
        }
        if (a.op().isUpper() && b.op().isUpper()) {
            return cmp < 0 ? a : cmp > 0 ? b : (a.op() == Op.LT ? a : b);
        }
        VersionComparator low = a.op().isLower() ? a : b;
        VersionComparator high = a.op().isLower() ? b : a;
        if (low.ground().equals(high.ground()) && low.op() == Op.GTE && high.op() == Op.LTE) {
            return VersionComparator.of(Op.EQ, low.ground());
        }
        return new EmptyRange();
    }

    /**
     * Whether the union of two intervals is an interval: they overlap or touch at a bound
     * that one of them includes.
     */
    boolean mergeableWith(Interval other) {
        return !below(this, other) && !below(other, this);
    }

    private static boolean below(Interval a, Interval b) {
        if (a.upper == null || b.lower == null) {
            return false;
        }
        int cmp = a.upper.version.compareTo(b.lower.version);
        return cmp < 0 || (cmp == 0 && !a.upper.inclusive && !b.lower.inclusive);
    }

    Interval hull(Interval other) {
        Bound low = lower == null || other.lower == null ? null : minLower(lower, other.lower);
        Bound high = upper == null || other.upper == null ? null : maxUpper(upper, other.upper);
        return new Interval(low, high);
    }

    private static Bound minLower(Bound a, Bound b) {
        int cmp = a.version.compareTo(b.version);
        if (cmp != 0) {
            return cmp < 0 ? a : b;
        }
        return a.inclusive ? a : b;
    }

    private static Bound maxUpper(Bound a, Bound b) {
        int cmp = a.version.compareTo(b.version);
        if (cmp != 0) {
            return cmp > 0 ? a : b;
        }
        return a.inclusive ? a : b;
    }

    Term toTerm() {
        if (lower == null && upper == null) {
            return new AnyVersion();
        }
        if (upper == null) {
            return VersionComparator.of(lower.inclusive ? Op.GTE : Op.GT, lower.version);
        }
        if (lower == null) {
            return VersionComparator.of(upper.inclusive ? Op.LTE : Op.LT, upper.version);
        }
        if (lower.equals(upper) && lower.inclusive) {
            return VersionComparator.of(Op.EQ, lower.version);
        }
        return new Range(VersionComparator.of(lower.inclusive ? Op.GTE : Op.GT, lower.version),
                VersionComparator.of(upper.inclusive ? Op.LTE : Op.LT, upper.version));
    }

    int compareTo(Interval other) {
        int cmp = compareLower(lower, other.lower);
        return cmp != 0 ? cmp : compareUpper(upper, other.upper);
    }

    private static int compareLower(Bound a, Bound b) {
        if (a == null || b == null) {
            return a == b ? 0 : a == null ? -1 : 1;
        }
        int cmp = a.version.compareTo(b.version);
        return cmp != 0 ? cmp : Boolean.compare(b.inclusive, a.inclusive);
    }

    private static int compareUpper(Bound a, Bound b) {
        if (a == null || b == null) {
            return a == b ? 0 : a == null ? 1 : -1;
        }
        int cmp = a.version.compareTo(b.version);
        return cmp != 0 ? cmp : Boolean.compare(a.inclusive, b.inclusive);
    }

    @Override
    public String toString() {
        return (lower == null ? "(-inf" : (lower.inclusive ? "[" : "(") + lower.version)
                + ", " + (upper == null ? "+inf)" : upper.version + (upper.inclusive ? "]" : ")"));
    }
}
