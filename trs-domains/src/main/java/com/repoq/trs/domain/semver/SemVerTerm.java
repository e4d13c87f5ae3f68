/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.semver;

import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.Term;

import java.util.List;
import java.util.Objects;

/**
 * Semantic-version range expression.
 *
 * <p>{@link Range} is the intersection of a right-nested chain of comparators and
 * {@link Union} a right-nested chain of ranges. {@link Caret}, {@link Tilde}, {@link Hyphen}
 * and {@link XRange} are surface sugar that the rule set rewrites into comparators.
 */
public sealed interface SemVerTerm extends Term permits
        SemVerTerm.Version, SemVerTerm.PartialVersion, SemVerTerm.VersionComparator, SemVerTerm.Range,
        SemVerTerm.Union, SemVerTerm.Caret, SemVerTerm.Tilde, SemVerTerm.Hyphen, SemVerTerm.XRange,
        SemVerTerm.AnyVersion, SemVerTerm.EmptyRange {

    String OP_VERSION = "version";
    String OP_PARTIAL = "partial";
    String OP_COMPARATOR = "cmp";
    String OP_RANGE = "range";
    String OP_UNION = "union";
    String OP_CARET = "caret";
    String OP_TILDE = "tilde";
    String OP_HYPHEN = "hyphen";
    String OP_XRANGE = "xrange";
    String OP_ANY = "any";
    String OP_EMPTY = "empty";

    @Override
    default Domain domain() {
        return Domain.SEMVER;
    }

    @Override
    default Term withArguments(List<Term> arguments) {
        return this;
    }

    @Override
    default List<Term> arguments() {
        return List.of();
    }

    /**
     * {@code major.minor.patch[-prerelease]}; build metadata is dropped by the parser.
     * Ordered by semver precedence.
     */
    record Version(long major, long minor, long patch, String prerelease)
            implements SemVerTerm, Comparable<Version> {

        public static final Version MIN = new Version(0, 0, 0, "0");

        public Version {
            if (major < 0 || minor < 0 || patch < 0) {
                throw new IllegalArgumentException("Version components must be >= 0");
            }
            prerelease = prerelease == null ? "" : prerelease;
        }

        public static Version of(long major, long minor, long patch) {
            return new Version(major, minor, patch, "");
        }

        public boolean isPrerelease() {
            return !prerelease.isEmpty();
        }

        /**
         * Smallest version with this version's major, minor and patch.
         */
        public Version floor() {
            return new Version(major, minor, patch, "0");
        }

        @Override
        public String operator() {
            return OP_VERSION;
        }

        @Override
        public Object payload() {
            return toString();
        }

        @Override
        public int compareTo(Version other) {
            int cmp = Long.compare(major, other.major);
            if (cmp == 0) {
                cmp = Long.compare(minor, other.minor);
            }
            if (cmp == 0) {
                cmp = Long.compare(patch, other.patch);
            }
            if (cmp == 0) {
                cmp = comparePrerelease(prerelease, other.prerelease);
            }
            return cmp;
        }

        static int comparePrerelease(String a, String b) {
            if (a.equals(b)) {
                return 0;
            }
            if (a.isEmpty()) {
                return 1;
            }
            if (b.isEmpty()) {
                return -1;
            }
            String[] as = a.split("\\.");
            String[] bs = b.split("\\.");
            for (int i = 0; i < Math.min(as.length, bs.length); i++) {
                int cmp = compareIdentifier(as[i], bs[i]);
                if (cmp != 0) {
                    return cmp;
                }
            }
            return Integer.compare(as.length, bs.length);
        }

        private static int compareIdentifier(String a, String b) {
            boolean numericA = isNumeric(a);
            boolean numericB = isNumeric(b);
            if (numericA && numericB) {
                return a.length() != b.length() ? Integer.compare(a.length(), b.length()) : a.compareTo(b);
            }
            if (numericA != numericB) {
                return numericA ? -1 : 1;
            }
            return a.compareTo(b);
        }

        static boolean isNumeric(String identifier) {
            for (int i = 0; i < identifier.length(); i++) {
                if (!Character.isDigit(identifier.charAt(i))) {
                    return false;
                }
            }
            return !identifier.isEmpty();
        }

        @Override
        public String toString() {
            String core = major + "." + minor + "." + patch;
            return prerelease.isEmpty() ? core : core + "-" + prerelease;
        }
    }

    /**
     * {@code major} or {@code major.minor}; {@code minor} is {@code null} when absent or
     * a wildcard.
     */
    record PartialVersion(long major, Long minor) implements SemVerTerm {
        public PartialVersion {
            if (major < 0 || (minor != null && minor < 0)) {
                throw new IllegalArgumentException("Version components must be >= 0");
            }
        }

        @Override
        public String operator() {
            return OP_PARTIAL;
        }

        @Override
        public Object payload() {
            return toString();
        }

        @Override
        public String toString() {
            return minor == null ? Long.toString(major) : major + "." + minor;
        }
    }

    enum Op {
        GT(">"), GTE(">="), LT("<"), LTE("<="), EQ("=");

        private final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isLower() {
            return this == GT || this == GTE;
        }

        public boolean isUpper() {
            return this == LT || this == LTE;
        }

        public boolean isInclusive() {
            return this == GTE || this == LTE || this == EQ;
        }

        public boolean test(int comparison) {
            switch (this) {
                case GT:
                    return comparison > 0;
                case GTE:
                    return comparison >= 0;
                case LT:
                    return comparison < 0;
                case LTE:
                    return comparison <= 0;
                default:
                    return comparison == 0;
            }
        }
    }

    /**
     * {@code op version}; the operator symbol is the payload.
     */
    record VersionComparator(Op op, Term version) implements SemVerTerm {
        public VersionComparator {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(version, "version must not be null");
        }

        public static VersionComparator of(Op op, Version version) {
            return new VersionComparator(op, version);
        }

        /**
         * @throws ClassCastException on a pattern whose version is a metavariable
         */
        public Version ground() {
            return (Version) version;
        }

        public boolean admits(Version candidate) {
            return op.test(candidate.compareTo(ground()));
        }

        @Override
        public String operator() {
            return OP_COMPARATOR;
        }

        @Override
        public List<Term> arguments() {
            return List.of(version);
        }

        @Override
        public Term withArguments(List<Term> arguments) {
            return new VersionComparator(op, arguments.get(0));
        }

        @Override
        public Object payload() {
            return op.symbol();
        }
    }

    record Range(Term left, Term right) implements SemVerTerm {
        public Range {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public String operator() {
            return OP_RANGE;
        }

        @Override
        public List<Term> arguments() {
            return List.of(left, right);
        }

        @Override
        public Term withArguments(List<Term> arguments) {
            return new Range(arguments.get(0), arguments.get(1));
        }
    }

    record Union(Term left, Term right) implements SemVerTerm {
        public Union {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public String operator() {
            return OP_UNION;
        }

        @Override
        public List<Term> arguments() {
            return List.of(left, right);
        }

        @Override
        public Term withArguments(List<Term> arguments) {
            return new Union(arguments.get(0), arguments.get(1));
        }
    }

    /**
     * {@code ^v}: changes that do not modify the left-most non-zero component.
     */
    record Caret(Term version) implements SemVerTerm {
        public Caret {
            Objects.requireNonNull(version, "version must not be null");
        }

        @Override
        public String operator() {
            return OP_CARET;
        }

        @Override
        public List<Term> arguments() {
            return List.of(version);
        }

        @Override
        public Term withArguments(List<Term> arguments) {
            return new Caret(arguments.get(0));
        }
    }

    /**
     * {@code ~v}: patch-level changes if a minor version is given, minor-level otherwise.
     */
    record Tilde(Term version) implements SemVerTerm {
        public Tilde {
            Objects.requireNonNull(version, "version must not be null");
        }

        @Override
        public String operator() {
            return OP_TILDE;
        }

        @Override
        public List<Term> arguments() {
            return List.of(version);
        }

        @Override
        public Term withArguments(List<Term> arguments) {
            return new Tilde(arguments.get(0));
        }
    }

    /**
     * {@code lo - hi}, inclusive; a partial upper bound covers its whole series.
     */
    record Hyphen(Term low, Term high) implements SemVerTerm {
        public Hyphen {
            Objects.requireNonNull(low, "low must not be null");
            Objects.requireNonNull(high, "high must not be null");
        }

        @Override
        public String operator() {
            return OP_HYPHEN;
        }

        @Override
        public List<Term> arguments() {
            return List.of(low, high);
        }

        @Override
        public Term withArguments(List<Term> arguments) {
            return new Hyphen(arguments.get(0), arguments.get(1));
        }
    }

    /**
     * {@code 1.x}, {@code 1.2.*}, {@code 1.2}: every version in the series.
     */
    record XRange(Term partial) implements SemVerTerm {
        public XRange {
            Objects.requireNonNull(partial, "partial must not be null");
        }

        @Override
        public String operator() {
            return OP_XRANGE;
        }

        @Override
        public List<Term> arguments() {
            return List.of(partial);
        }

        @Override
        public Term withArguments(List<Term> arguments) {
            return new XRange(arguments.get(0));
        }
    }

    /**
     * {@code *}.
     */
    record AnyVersion() implements SemVerTerm {
        @Override
        public String operator() {
            return OP_ANY;
        }
    }

    /**
     * {@code <0.0.0-0}: no version satisfies it.
     */
    record EmptyRange() implements SemVerTerm {
        @Override
        public String operator() {
            return OP_EMPTY;
        }
    }
}
