/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.semver;

import com.repoq.trs.api.TermGenerator;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.core.term.Chains;
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

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public final class SemVerGenerator implements TermGenerator {

    private static final List<Version> VERSIONS = List.of(
            Version.of(0, 0, 3),
            Version.of(0, 2, 3),
            Version.of(1, 0, 0),
            Version.of(1, 2, 3),
            new Version(1, 2, 3, "beta.1"),
            Version.of(1, 5, 0),
            Version.of(2, 0, 0),
            Version.of(2, 1, 0));

    private static final List<PartialVersion> PARTIALS = List.of(
            new PartialVersion(0, null),
            new PartialVersion(1, null),
            new PartialVersion(1, 2L),
            new PartialVersion(0, 0L));

    private static final List<String> CURATED = List.of(
            "1.0.0 - 2.0.0",
            "^1.2.3",
            "^0.2.3",
            "^0.0.3",
            "~1.2.3",
            "~1",
            "^0",
            "1.x",
            "1.2.*",
            "1.2",
            ">=1.0.0 <2.0.0 >=1.5.0",
            "<2.0.0 >=1.0.0",
            ">=2.0.0 <1.0.0",
            ">=1.0.0 <=1.0.0",
            ">1.2",
            "<=1.2",
            ">= 1.2.3",
            "=1.2.3",
            "v1.2.3+build.5",
            "1.0.0-alpha.1 - 1.0.0",
            "^1.2.3 || ^1.5.0",
            ">=3.0.0 || <1.0.0",
            "<1.0.0 || >=1.0.0",
            "* || 1.2.3",
            "1.2.3 || 1.2.3",
            "<0.0.0-0 || 1.0.0",
            "1.x || 2.x - 3");

    @Override
    public List<String> curatedSources() {
        return CURATED;
    }

    @Override
    public List<Term> generate(int count, int maxDepth, long seed) {
        Random random = new Random(seed);
        int width = Math.max(1, Math.min(maxDepth, 4));
        List<Term> terms = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int alternatives = 1 + random.nextInt(width);
            List<Term> sets = new ArrayList<>(alternatives);
            for (int a = 0; a < alternatives; a++) {
                sets.add(randomSet(random, width));
            }
            terms.add(Chains.build(sets, Union::new));
        }
        return terms;
    }

    private Term randomSet(Random random, int width) {
        if (random.nextInt(10) == 0) {
            Version low = pick(random, VERSIONS);
            Version high = pick(random, VERSIONS);
            return new Hyphen(low, random.nextBoolean() ? high : pick(random, PARTIALS));
        }
        int size = 1 + random.nextInt(width);
        List<Term> items = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            items.add(randomSimple(random));
        }
        return Chains.build(items, Range::new);
    }

    private Term randomSimple(Random random) {
        switch (random.nextInt(8)) {
            case 0:
                return new Caret(random.nextBoolean() ? pick(random, VERSIONS) : pick(random, PARTIALS));
            case 1:
                return new Tilde(random.nextBoolean() ? pick(random, VERSIONS) : pick(random, PARTIALS));
            case 2:
                return new XRange(pick(random, PARTIALS));
            case 3:
                return random.nextInt(4) == 0 ? new AnyVersion() : VersionComparator.of(Op.EQ, pick(random, VERSIONS));
            default:
                Op[] bounds = {Op.GT, Op.GTE, Op.LT, Op.LTE};
                return VersionComparator.of(bounds[random.nextInt(bounds.length)], pick(random, VERSIONS));
        }
    }

    private static <T> T pick(Random random, List<T> values) {
        return values.get(random.nextInt(values.size()));
    }

    /**
     * Comparators for the comparator sort; otherwise six terms, so that rules with three
     * free variables stay within a 256-instance budget. The bare versions only make sense
     * under sugar and cannot be printed as ranges of their own.
     */
    @Override
    public List<Term> groundSamples(String sort) {
        Version one = Version.of(1, 0, 0);
        List<Term> comparators = List.of(
                VersionComparator.of(Op.GTE, one),
                VersionComparator.of(Op.GT, one),
                VersionComparator.of(Op.LTE, one),
                VersionComparator.of(Op.LT, Version.of(2, 0, 0).floor()),
                VersionComparator.of(Op.EQ, Version.of(1, 5, 0)));
        if (SemVerTerm.OP_COMPARATOR.equals(sort)) {
            return comparators;
        }
        List<Term> unsorted = List.of(
                VersionComparator.of(Op.LTE, one),
                new Range(VersionComparator.of(Op.GTE, Version.of(3, 0, 0)),
                        VersionComparator.of(Op.LT, Version.of(4, 0, 0).floor())),
                new AnyVersion(),
                new EmptyRange(),
                one,
                new PartialVersion(1, 2L));
        if (sort == null) {
            return unsorted;
        }
        List<Term> all = new ArrayList<>(comparators);
        all.addAll(unsorted);
        return all.stream().filter(t -> t.operator().equals(sort)).distinct().toList();
    }
}
