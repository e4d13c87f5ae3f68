/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.rdf;

import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.Term;

import java.util.List;
import java.util.Objects;

/**
 * RDF graph fragment: a variadic {@link Graph} of {@link Triple}s over IRIs, blank nodes
 * and literals.
 */
public sealed interface RdfTerm extends Term permits
        RdfTerm.Iri, RdfTerm.BlankNode, RdfTerm.RdfLiteral, RdfTerm.Triple, RdfTerm.Graph {

    String OP_IRI = "iri";
    String OP_BLANK = "bnode";
    String OP_LITERAL = "literal";
    String OP_TRIPLE = "triple";
    String OP_GRAPH = "graph";

    String RDF_TYPE = "http://www.w3.org/1999/02/22-rdf-syntax-ns#type";
    String XSD_STRING = "http://www.w3.org/2001/XMLSchema#string";

    @Override
    default Domain domain() {
        return Domain.RDF;
    }

    @Override
    default List<Term> arguments() {
        return List.of();
    }

    @Override
    default Term withArguments(List<Term> arguments) {
        return this;
    }

    record Iri(String value) implements RdfTerm {
        public Iri {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String operator() {
            return OP_IRI;
        }

        @Override
        public Object payload() {
            return value;
        }

        @Override
        public String toString() {
            return "<" + value + ">";
        }
    }

    record BlankNode(String label) implements RdfTerm {
        public BlankNode {
            Objects.requireNonNull(label, "label must not be null");
        }

        @Override
        public String operator() {
            return OP_BLANK;
        }

        @Override
        public Object payload() {
            return label;
        }

        @Override
        public String toString() {
            return "_:" + label;
        }
    }

    /**
     * A literal; {@code language} and {@code datatype} are {@code null} when absent. A
     * language-tagged literal never carries a datatype.
     */
    record RdfLiteral(String lexical, String language, String datatype) implements RdfTerm {
        public RdfLiteral {
            Objects.requireNonNull(lexical, "lexical must not be null");
            if (language != null && datatype != null) {
                throw new IllegalArgumentException("A literal has either a language tag or a datatype");
            }
        }

        public static RdfLiteral plain(String lexical) {
            return new RdfLiteral(lexical, null, null);
        }

        @Override
        public String operator() {
            return OP_LITERAL;
        }

        /**
         * The N-Triples form, which identifies the literal.
         */
        @Override
        public Object payload() {
            return toString();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("\"");
            for (int i = 0; i < lexical.length(); i++) {
                char c = lexical.charAt(i);
                switch (c) {
                    case '"' -> sb.append("\\\"");
                    case '\\' -> sb.append("\\\\");
                    case '\n' -> sb.append("\\n");
                    case '\r' -> sb.append("\\r");
                    case '\t' -> sb.append("\\t");
                    default -> sb.append(c);
                }
            }
            sb.append('"');
            if (language != null) {
                sb.append('@').append(language);
            } else if (datatype != null) {
                sb.append("^^<").append(datatype).append('>');
            }
            return sb.toString();
        }
    }

    record Triple(Term subject, Term predicate, Term object) implements RdfTerm {
        public Triple {
            Objects.requireNonNull(subject, "subject must not be null");
            Objects.requireNonNull(predicate, "predicate must not be null");
            Objects.requireNonNull(object, "object must not be null");
        }

        @Override
        public String operator() {
            return OP_TRIPLE;
        }

        @Override
        public List<Term> arguments() {
            return List.of(subject, predicate, object);
        }

        @Override
        public Term withArguments(List<Term> arguments) {
            return new Triple(arguments.get(0), arguments.get(1), arguments.get(2));
        }

        @Override
        public String toString() {
            return subject + " " + predicate + " " + object + " .";
        }
    }

    record Graph(List<Term> triples) implements RdfTerm {
        public Graph {
            triples = List.copyOf(triples);
        }

        @Override
        public String operator() {
            return OP_GRAPH;
        }

        @Override
        public List<Term> arguments() {
            return triples;
        }

        @Override
        public Term withArguments(List<Term> arguments) {
            return new Graph(arguments);
        }
    }
}
