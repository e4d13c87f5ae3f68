/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.semver;

import com.repoq.trs.api.SemanticOracle;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.core.term.Chains;
import com.repoq.trs.core.term.Terms;
import com.repoq.trs.domain.semver.SemVerTerm.AnyVersion;
import com.repoq.trs.domain.semver.SemVerTerm.Caret;
import com.repoq.trs.domain.semver.SemVerTerm.EmptyRange;
import com.repoq.trs.domain.semver.SemVerTerm.Hyphen;
import com.repoq.trs.domain.semver.SemVerTerm.PartialVersion;
import com.repoq.trs.domain.semver.SemVerTerm.Range;
import com.repoq.trs.domain.semver.SemVerTerm.Tilde;
import com.repoq.trs.domain.semver.SemVerTerm.Union;
import com.repoq.trs.domain.semver.SemVerTerm.Version;
import com.repoq.trs.domain.semver.SemVerTerm.VersionComparator;
import com.repoq.trs.domain.semver.SemVerTerm.XRange;
import org.semver4j.Semver;
import org.semver4j.SemverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Compares the version sets of two ranges on every boundary version either range mentions,
 * plus the neighbours of those versions.
 *
 * <p>Release candidates are decided by semver4j on the printed ranges, so the npm reading
 * of sugar is the reference. npm keeps prereleases out of ranges that do not name one,
 * while the rule set orders prereleases by plain precedence; prerelease candidates are
 * therefore evaluated from the definitions (same major, same minor) instead.
 */
public final class SemVerOracle implements SemanticOracle {

    private static final Logger logger = LoggerFactory.getLogger(SemVerOracle.class);

    private final SemVerModel model;

    public SemVerOracle(SemVerModel model) {
        this.model = Objects.requireNonNull(model, "model must not be null");
    }

    @Override
    public String name() {
        return "semver-boundary-versions";
    }

    @Override
    public Optional<String> findDifference(Term original, Term normalized) {
        TreeSet<Version> candidates = new TreeSet<>();
        candidates.add(Version.MIN);
        candidates.add(Version.of(0, 0, 0));
        collect(original, candidates);
        collect(normalized, candidates);
        Optional<String> originalText = print(original);
        Optional<String> normalizedText = print(normalized);
        for (Version candidate : candidates) {
            boolean a = admits(original, originalText, candidate);
            boolean b = admits(normalized, normalizedText, candidate);
            if (a != b) {
                return Optional.of("version " + candidate + " gives original=" + a + ", normalized=" + b);
            }
        }
        return Optional.empty();
    }

    private Optional<String> print(Term range) {
        try {
            return Optional.of(model.serialize(range));
        } catch (IllegalArgumentException e) {
            logger.debug("Range has no surface form, evaluating by definition: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean admits(Term range, Optional<String> text, Version candidate) {
        if (candidate.isPrerelease() || text.isEmpty()) {
            return satisfies(range, candidate);
        }
        try {
            return new Semver(candidate.toString()).satisfies(text.get());
        } catch (SemverException e) {
            logger.debug("semver4j cannot evaluate {} against '{}': {}", candidate, text.get(), e.getMessage());
            return satisfies(range, candidate);
        }
    }

    private static void collect(Term term, TreeSet<Version> into) {
        Terms.walk(term, (node, parent, index) -> {
            if (node instanceof Version v) {
                addNeighbours(v, into);
            } else if (node instanceof PartialVersion p) {
                addNeighbours(Version.of(p.major(), p.minor() == null ? 0 : p.minor(), 0), into);
            }
        });
    }

    private static void addNeighbours(Version v, TreeSet<Version> into) {
        into.add(v);
        into.add(v.floor());
        if (v.isPrerelease()) {
            into.add(new Version(v.major(), v.minor(), v.patch(), v.prerelease() + ".0"));
            into.add(Version.of(v.major(), v.minor(), v.patch()));
        }
        if (v.patch() > 0) {
            into.add(Version.of(v.major(), v.minor(), v.patch() - 1));
        }
        Version nextPatch = Version.of(v.major(), v.minor(), v.patch() + 1);
        Version nextMinor = Version.of(v.major(), v.minor() + 1, 0);
        Version nextMajor = Version.of(v.major() + 1, 0, 0);
        for (Version next : new Version[]{nextPatch, nextMinor, nextMajor}) {
            into.add(next);
            into.add(next.floor());
        }
    }

    static boolean satisfies(Term range, Version x) {
        if (range instanceof Union) {
            for (Term alternative : Chains.flatOperands(range)) {
                if (satisfies(alternative, x)) {
                    return true;
                }
            }
            return false;
        }
        if (range instanceof Range) {
            for (Term member : Chains.flatOperands(range)) {
                if (!satisfies(member, x)) {
                    return false;
                }
            }
            return true;
        }
        if (range instanceof AnyVersion) {
            return true;
        }
        if (range instanceof EmptyRange) {
            return false;
        }
        if (range instanceof VersionComparator c) {
            return c.admits(x);
        }
        if (range instanceof Caret caret) {
            return caret(caret.version(), x);
        }
        if (range instanceof Tilde tilde) {
            return tilde(tilde.version(), x);
        }
        if (range instanceof XRange xRange) {
            return tilde(xRange.partial(), x);
        }
        if (range instanceof Hyphen hyphen) {
            return x.compareTo(lowest(hyphen.low())) >= 0 && notAbove(hyphen.high(), x);
        }
        throw new IllegalArgumentException("Not a version range: " + range);
    }

    private static boolean caret(Term operand, Version x) {
        if (x.compareTo(lowest(operand)) < 0) {
            return false;
        }
        if (operand instanceof Version v) {
            if (v.major() > 0) {
                return x.major() == v.major();
            }
            if (v.minor() > 0) {
                return x.major() == 0 && x.minor() == v.minor();
            }
            return x.major() == 0 && x.minor() == 0 && x.patch() == v.patch();
        }
        PartialVersion p = (PartialVersion) operand;
        if (p.major() > 0 || p.minor() == null) {
            return x.major() == p.major();
        }
        return x.major() == 0 && x.minor() == p.minor();
    }

    private static boolean tilde(Term operand, Version x) {
        if (x.compareTo(lowest(operand)) < 0) {
            return false;
        }
        if (operand instanceof Version v) {
            return x.major() == v.major() && x.minor() == v.minor();
        }
        PartialVersion p = (PartialVersion) operand;
        return x.major() == p.major() && (p.minor() == null || x.minor() == p.minor());
    }

    private static boolean notAbove(Term high, Version x) {
        if (high instanceof Version v) {
            return x.compareTo(v) <= 0;
        }
        PartialVersion p = (PartialVersion) high;
        if (x.major() != p.major()) {
            return x.major() < p.major();
        }
        return p.minor() == null || x.minor() <= p.minor();
    }

    private static Version lowest(Term operand) {
        if (operand instanceof Version v) {
            return v;
        }
        PartialVersion p = (PartialVersion) operand;
        return Version.of(p.major(), p.minor() == null ? 0 : p.minor(), 0);
    }
}
