/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.rdf;

import com.repoq.trs.api.model.Term;
import com.repoq.trs.core.term.Terms;
import com.repoq.trs.domain.rdf.RdfTerm.BlankNode;
import com.repoq.trs.domain.rdf.RdfTerm.Iri;
import com.repoq.trs.domain.rdf.RdfTerm.RdfLiteral;
import com.repoq.trs.domain.rdf.RdfTerm.Triple;

import java.util.Comparator;

/**
 * Canonical statement order: subject, then predicate, then object, with IRIs before blank
 * nodes before literals.
 */
final class RdfOrdering {

    static final Comparator<Term> NODE_ORDER = RdfOrdering::compareNodes;

    static final Comparator<Term> TRIPLE_ORDER = (a, b) -> {
        if (!(a instanceof Triple x) || !(b instanceof Triple y)) {
            return Terms.compare(a, b);
        }
        int cmp = compareNodes(x.subject(), y.subject());
        if (cmp == 0) {
            cmp = compareNodes(x.predicate(), y.predicate());
        }
        if (cmp == 0) {
            cmp = compareNodes(x.object(), y.object());
        }
        return cmp;
    };

    private RdfOrdering() {
    }

    private static int compareNodes(Term a, Term b) {
        int cmp = Integer.compare(rank(a), rank(b));
        if (cmp != 0) {
            return cmp;
        }
        if (a instanceof RdfLiteral x && b instanceof RdfLiteral y) {
            cmp = x.lexical().compareTo(y.lexical());
            if (cmp == 0) {
                cmp = nullToEmpty(x.language()).compareTo(nullToEmpty(y.language()));
            }
            if (cmp == 0) {
                cmp = nullToEmpty(x.datatype()).compareTo(nullToEmpty(y.datatype()));
            }
            return cmp;
        }
        return Terms.compare(a, b);
    }

    private static int rank(Term node) {
        if (node instanceof Iri) {
            return 0;
        }
        if (node instanceof BlankNode) {
            return 1;
        }
        return node instanceof RdfLiteral ? 2 : 3;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
