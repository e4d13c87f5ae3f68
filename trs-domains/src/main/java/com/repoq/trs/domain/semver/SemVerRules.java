/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.semver;

import com.repoq.trs.api.model.Bindings;
import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.MetaVariable;
import com.repoq.trs.api.model.RewriteRule;
import com.repoq.trs.api.model.RuleSet;
import com.repoq.trs.api.model.SideCondition;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.api.model.WellFoundedMeasure;
import com.repoq.trs.domain.semver.SemVerTerm.AnyVersion;
import com.repoq.trs.domain.semver.SemVerTerm.Caret;
import com.repoq.trs.domain.semver.SemVerTerm.EmptyRange;
import com.repoq.trs.domain.semver.SemVerTerm.Hyphen;
import com.repoq.trs.domain.semver.SemVerTerm.Op;
import com.repoq.trs.domain.semver.SemVerTerm.PartialVersion;
import com.repoq.trs.domain.semver.SemVerTerm.Range;
import com.repoq.trs.domain.semver.SemVerTerm.Tilde;
import com.repoq.trs.domain.semver.SemVerTerm.Union;
import com.repoq.trs.domain.semver.SemVerTerm.Version;
import com.repoq.trs.domain.semver.SemVerTerm.VersionComparator;
import com.repoq.trs.domain.semver.SemVerTerm.XRange;
import com.repoq.trs.runtime.measure.Measures;

import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Rule set for version ranges.
 *
 * <p>Sugar ({@code ^}, {@code ~}, hyphen and x-ranges) is first rewritten into comparator
 * pairs. Inside a comparator set, comparators are merged until at most one lower and one
 * upper bound remain, in that order; a contradictory set becomes the empty range. Inside a
 * union, overlapping or touching intervals are replaced by their hull and the rest are
 * ordered by lower bound.
 */
public final class SemVerRules {

    public static final String NAME = "semver";
    public static final String VERSION = "1.0.0";

    private static final long SUGAR_WEIGHT = 10;
    private static final Set<String> CHAIN_OPERATORS = Set.of(SemVerTerm.OP_RANGE, SemVerTerm.OP_UNION);

    private static final MetaVariable X = MetaVariable.of("x");
    private static final MetaVariable Y = MetaVariable.of("y");
    private static final MetaVariable Z = MetaVariable.of("z");
    private static final MetaVariable CX = MetaVariable.sorted("x", SemVerTerm.OP_COMPARATOR);
    private static final MetaVariable CY = MetaVariable.sorted("y", SemVerTerm.OP_COMPARATOR);

    private SemVerRules() {
        throw new AssertionError("No instances");
    }

    /**
     * {@code (weighted size, left nesting, bound-side inversions, interval inversions)}; sugar
     * nodes weigh {@value #SUGAR_WEIGHT}, every other node one.
     */
    public static WellFoundedMeasure measure() {
        return WellFoundedMeasure.lexicographic(
                Measures.weightedSize("weighted-size", node -> isSugar(node) ? SUGAR_WEIGHT : 1),
                Measures.leftNesting(CHAIN_OPERATORS),
                Measures.chainInversions(Set.of(SemVerTerm.OP_RANGE), Interval.SIDE_ORDER),
                Measures.chainInversions(Set.of(SemVerTerm.OP_UNION), Interval.TERM_ORDER));
    }

    private static boolean isSugar(Term node) {
        return node instanceof Caret || node instanceof Tilde || node instanceof Hyphen || node instanceof XRange;
    }

    public static RuleSet create() {
        WellFoundedMeasure m = measure();
        RuleSet.Builder builder = RuleSet.builder(Domain.SEMVER, NAME, VERSION);

        builder.add(template("range-assoc", m, new Range(new Range(X, Y), Z), new Range(X, new Range(Y, Z)),
                "right-nests comparator sets"));
        builder.add(template("union-assoc", m, new Union(new Union(X, Y), Z), new Union(X, new Union(Y, Z)),
                "right-nests unions"));

        builder.add(desugar("caret", m, new Caret(X), b -> caret(b.get("x")), "^v to a comparator pair"));
        builder.add(desugar("tilde", m, new Tilde(X), b -> tilde(b.get("x")), "~v to a comparator pair"));
        builder.add(desugar("hyphen", m, new Hyphen(X, Y), b -> hyphen(b.get("x"), b.get("y")),
                "a - b to >=a <=b"));
        builder.add(desugar("xrange", m, new XRange(X), b -> xRange(b.get("x")), "1.2.x to a comparator pair"));

        builder.add(template("cmp-universal", m, VersionComparator.of(Op.GTE, Version.MIN), new AnyVersion(),
                ">=0.0.0-0 admits every version"));
        builder.add(template("cmp-unsatisfiable", m, VersionComparator.of(Op.LT, Version.MIN), new EmptyRange(),
                "<0.0.0-0 admits nothing"));

        builder.add(template("range-any-left", m, new Range(new AnyVersion(), X), X, "* is the identity of a set"));
        builder.add(template("range-any-right", m, new Range(X, new AnyVersion()), X, "* is the identity of a set"));
        builder.add(template("range-empty-left", m, new Range(new EmptyRange(), X), new EmptyRange(),
                "an empty member empties the set"));
        builder.add(template("range-empty-right", m, new Range(X, new EmptyRange()), new EmptyRange(),
                "an empty member empties the set"));

        SideCondition combinable = b -> comparators(b) && Interval.combinable(cmp(b, "x"), cmp(b, "y"));
        builder.add(RewriteRule.builder("range-merge", Domain.SEMVER)
                .pattern(new Range(CX, CY))
                .when(combinable)
                .replacement(b -> Interval.combine(cmp(b, "x"), cmp(b, "y")))
                .measure(m)
                .description("intersects two comparators into one")
                .build());
        builder.add(RewriteRule.builder("range-merge-chain", Domain.SEMVER)
                .pattern(new Range(CX, new Range(CY, Z)))
                .when(combinable)
                .replacement(b -> new Range(Interval.combine(cmp(b, "x"), cmp(b, "y")), b.get("z")))
                .measure(m)
                .description("intersects the two leading comparators of a set")
                .build());

        SideCondition outOfOrder = b -> comparators(b) && cmp(b, "x").op().isUpper() && cmp(b, "y").op().isLower()
                && !Interval.combinable(cmp(b, "x"), cmp(b, "y"));
        builder.add(RewriteRule.builder("range-order", Domain.SEMVER)
                .pattern(new Range(CX, CY))
                .when(outOfOrder)
                .template(new Range(CY, CX))
                .measure(m)
                .description("lower bound before upper bound")
                .build());
        builder.add(RewriteRule.builder("range-order-chain", Domain.SEMVER)
                .pattern(new Range(CX, new Range(CY, Z)))
                .when(outOfOrder)
                .template(new Range(CY, new Range(CX, Z)))
                .measure(m)
                .description("moves a lower bound ahead of an upper bound")
                .build());

        builder.add(template("union-any-left", m, new Union(new AnyVersion(), X), new AnyVersion(),
                "* absorbs every alternative"));
        builder.add(template("union-any-right", m, new Union(X, new AnyVersion()), new AnyVersion(),
                "* absorbs every alternative"));
        builder.add(template("union-empty-left", m, new Union(new EmptyRange(), X), X,
                "the empty range is the identity of ||"));
        builder.add(template("union-empty-right", m, new Union(X, new EmptyRange()), X,
                "the empty range is the identity of ||"));
        builder.add(template("union-idempotent", m, new Union(X, X), X, "a || a -> a"));
        builder.add(template("union-idempotent-chain", m, new Union(X, new Union(X, Y)), new Union(X, Y),
                "drops a repeated leading alternative"));

        SideCondition mergeable = b -> mergeable(b.get("x"), b.get("y"));
        builder.add(RewriteRule.builder("union-merge", Domain.SEMVER)
                .pattern(new Union(X, Y))
                .when(mergeable)
                .replacement(b -> hull(b.get("x"), b.get("y")))
                .measure(m)
                .description("replaces two overlapping or touching intervals by their hull")
                .build());
        builder.add(RewriteRule.builder("union-merge-chain", Domain.SEMVER)
                .pattern(new Union(X, new Union(Y, Z)))
                .when(mergeable)
                .replacement(b -> new Union(hull(b.get("x"), b.get("y")), b.get("z")))
                .measure(m)
                .description("merges the two leading alternatives of a union")
                .build());

        SideCondition unionOutOfOrder = b -> disjointOutOfOrder(b.get("x"), b.get("y"));
        builder.add(RewriteRule.builder("union-order", Domain.SEMVER)
                .pattern(new Union(X, Y))
                .when(unionOutOfOrder)
                .template(new Union(Y, X))
                .measure(m)
                .description("orders disjoint alternatives by lower bound")
                .build());
        builder.add(RewriteRule.builder("union-order-chain", Domain.SEMVER)
                .pattern(new Union(X, new Union(Y, Z)))
                .when(unionOutOfOrder)
                .template(new Union(Y, new Union(X, Z)))
                .measure(m)
                .description("swaps two adjacent disjoint alternatives")
                .build());

        return builder.build();
    }

    private static RewriteRule template(String name, WellFoundedMeasure measure, Term pattern, Term template,
                                        String description) {
        return RewriteRule.builder(name, Domain.SEMVER)
                .pattern(pattern)
                .template(template)
                .measure(measure)
                .description(description)
                .build();
    }

    private static RewriteRule desugar(String name, WellFoundedMeasure measure, Term pattern,
                                       Function<Bindings, Term> expand, String description) {
        return RewriteRule.builder(name, Domain.SEMVER)
                .pattern(pattern)
                .when(b -> b.asMap().values().stream().allMatch(SemVerRules::isVersionLike))
                .replacement(expand::apply)
                .measure(measure)
                .description(description)
                .build();
    }

    private static boolean isVersionLike(Term term) {
        return term instanceof Version || term instanceof PartialVersion;
    }

    private static boolean comparators(Bindings bindings) {
        return Interval.isComparator(bindings.get("x")) && Interval.isComparator(bindings.get("y"));
    }

    private static VersionComparator cmp(Bindings bindings, String name) {
        return (VersionComparator) bindings.get(name);
    }

    private static boolean mergeable(Term x, Term y) {
        Optional<Interval> a = Interval.of(x);
        Optional<Interval> b = Interval.of(y);
        return a.isPresent() && b.isPresent() && a.get().mergeableWith(b.get());
    }

    private static Term hull(Term x, Term y) {
        return Interval.of(x).orElseThrow().hull(Interval.of(y).orElseThrow()).toTerm();
    }

    private static boolean disjointOutOfOrder(Term x, Term y) {
        Optional<Interval> a = Interval.of(x);
        Optional<Interval> b = Interval.of(y);
        return a.isPresent() && b.isPresent() && !a.get().mergeableWith(b.get()) && b.get().compareTo(a.get()) < 0;
    }

    static Term caret(Term operand) {
        if (operand instanceof Version v) {
            Version upper;
            if (v.major() > 0) {
                upper = Version.of(v.major() + 1, 0, 0);
            } else if (v.minor() > 0) {
                upper = Version.of(0, v.minor() + 1, 0);
            } else {
                upper = Version.of(0, 0, v.patch() + 1);
            }
            return between(v, upper);
        }
        PartialVersion p = (PartialVersion) operand;
        Version upper = p.major() > 0 || p.minor() == null
                ? Version.of(p.major() + 1, 0, 0)
                : Version.of(0, p.minor() + 1, 0);
        return between(SemVerModel.start(p), upper);
    }

    static Term tilde(Term operand) {
        if (operand instanceof Version v) {
            return between(v, Version.of(v.major(), v.minor() + 1, 0));
        }
        return xRange(operand);
    }

    static Term xRange(Term operand) {
        PartialVersion p = (PartialVersion) operand;
        return between(SemVerModel.start(p), SemVerModel.next(p));
    }

    static Term hyphen(Term low, Term high) {
        Version from = low instanceof Version v ? v : SemVerModel.start((PartialVersion) low);
        Term upper = high instanceof Version v
                ? VersionComparator.of(Op.LTE, v)
                : VersionComparator.of(Op.LT, SemVerModel.next((PartialVersion) high).floor());
        return new Range(VersionComparator.of(Op.GTE, from), upper);
    }

    /**
     * {@code >=from <upper-0}: the exclusive bound sits below every prerelease of {@code upper}.
     */
    private static Term between(Version from, Version upper) {
        return new Range(VersionComparator.of(Op.GTE, from), VersionComparator.of(Op.LT, upper.floor()));
    }
}
