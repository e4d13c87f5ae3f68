/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.spdx;

import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.Term;

import java.util.List;
import java.util.Objects;

/**
 * SPDX license expression. {@code AND} and {@code OR} are binary; a flat
 * {@code a OR b OR c} is the right-nested chain {@code Or(a, Or(b, c))}.
 */
public sealed interface SpdxTerm extends Term
        permits SpdxTerm.LicenseId, SpdxTerm.And, SpdxTerm.Or, SpdxTerm.With {

    String OP_ID = "id";
    String OP_AND = "AND";
    String OP_OR = "OR";
    String OP_WITH = "WITH";

    @Override
    default Domain domain() {
        return Domain.SPDX;
    }

    /**
     * License identifier such as {@code MIT}, {@code GPL-2.0+} or {@code LicenseRef-Custom}.
     */
    record LicenseId(String id) implements SpdxTerm {
        public LicenseId {
            Objects.requireNonNull(id, "id must not be null");
        }

        @Override
        public String operator() {
            return OP_ID;
        }

        @Override
        public List<Term> arguments() {
            return List.of();
        }

        @Override
        public Term withArguments(List<Term> arguments) {
            return this;
        }

        @Override
        public Object payload() {
            return id;
        }

        @Override
        public String toString() {
            return id;
        }
    }

    record And(Term left, Term right) implements SpdxTerm {
        public And {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public String operator() {
            return OP_AND;
        }

        @Override
        public List<Term> arguments() {
            return List.of(left, right);
        }

        @Override
        public Term withArguments(List<Term> arguments) {
            return new And(arguments.get(0), arguments.get(1));
        }
    }

    record Or(Term left, Term right) implements SpdxTerm {
        public Or {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public String operator() {
            return OP_OR;
        }

        @Override
        public List<Term> arguments() {
            return List.of(left, right);
        }

        @Override
        public Term withArguments(List<Term> arguments) {
            return new Or(arguments.get(0), arguments.get(1));
        }
    }

    /**
     * {@code license WITH exception}. The exception id is the payload, so two {@code With}
     * nodes share a head only when their exceptions are equal.
     */
    record With(Term license, String exception) implements SpdxTerm {
        public With {
            Objects.requireNonNull(license, "license must not be null");
            Objects.requireNonNull(exception, "exception must not be null");
        }

        @Override
        public String operator() {
            return OP_WITH;
        }

        @Override
        public List<Term> arguments() {
            return List.of(license);
        }

        @Override
        public Term withArguments(List<Term> arguments) {
            return new With(arguments.get(0), exception);
        }

        @Override
        public Object payload() {
            return exception;
        }
    }
}
