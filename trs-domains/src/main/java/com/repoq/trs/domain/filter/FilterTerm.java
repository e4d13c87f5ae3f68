/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.filter;

import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.Term;

import java.util.List;
import java.util.Objects;

/**
 * Path filter: a set of repository paths built from literals and globs with union,
 * intersection and complement.
 */
public sealed interface FilterTerm extends Term permits FilterTerm.PathLiteral, FilterTerm.Glob,
        FilterTerm.Union, FilterTerm.Intersect, FilterTerm.Negate, FilterTerm.MatchAll, FilterTerm.MatchNone {

    String OP_PATH = "path";
    String OP_GLOB = "glob";
    String OP_UNION = "|";
    String OP_INTERSECT = "&";
    String OP_NEGATE = "!";
    String OP_ALL = "all";
    String OP_NONE = "none";

    @Override
    default Domain domain() {
        return Domain.FILTER;
    }

    @Override
    default List<Term> arguments() {
        return List.of();
    }

    @Override
    default Term withArguments(List<Term> arguments) {
        return this;
    }

    /**
     * Exactly one path.
     */
    record PathLiteral(String path) implements FilterTerm {
        public PathLiteral {
            Objects.requireNonNull(path, "path must not be null");
        }

        @Override
        public String operator() {
            return OP_PATH;
        }

        @Override
        public Object payload() {
            return path;
        }

        @Override
        public String toString() {
            return path;
        }
    }

    record Glob(String pattern) implements FilterTerm {
        public Glob {
            Objects.requireNonNull(pattern, "pattern must not be null");
        }

        @Override
        public String operator() {
            return OP_GLOB;
        }

        @Override
        public Object payload() {
            return pattern;
        }

        @Override
        public String toString() {
            return pattern;
        }
    }

    record Union(Term left, Term right) implements FilterTerm {
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

    record Intersect(Term left, Term right) implements FilterTerm {
        public Intersect {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public String operator() {
            return OP_INTERSECT;
        }

        @Override
        public List<Term> arguments() {
            return List.of(left, right);
        }

        @Override
        public Term withArguments(List<Term> arguments) {
            return new Intersect(arguments.get(0), arguments.get(1));
        }
    }

    record Negate(Term operand) implements FilterTerm {
        public Negate {
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public String operator() {
            return OP_NEGATE;
        }

        @Override
        public List<Term> arguments() {
            return List.of(operand);
        }

        @Override
        public Term withArguments(List<Term> arguments) {
            return new Negate(arguments.get(0));
        }
    }

    /**
     * {@code **}: every path.
     */
    record MatchAll() implements FilterTerm {
        @Override
        public String operator() {
            return OP_ALL;
        }

        @Override
        public String toString() {
            return "**";
        }
    }

    /**
     * {@code {}}: no path.
     */
    record MatchNone() implements FilterTerm {
        @Override
        public String operator() {
            return OP_NONE;
        }

        @Override
        public String toString() {
            return "{}";
        }
    }
}
