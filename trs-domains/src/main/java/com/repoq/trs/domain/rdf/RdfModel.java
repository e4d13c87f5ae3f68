/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.rdf;

import com.repoq.trs.api.exceptions.ParseException;
import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.core.term.AbstractTermModel;
import com.repoq.trs.domain.rdf.RdfTerm.BlankNode;
import com.repoq.trs.domain.rdf.RdfTerm.Graph;
import com.repoq.trs.domain.rdf.RdfTerm.Iri;
import com.repoq.trs.domain.rdf.RdfTerm.RdfLiteral;
import com.repoq.trs.domain.rdf.RdfTerm.Triple;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * N-Triples reader with a small Turtle extension ({@code @prefix}, prefixed names and the
 * {@code a} keyword). Writes canonical N-Quads for the default graph: one
 * {@code s p o .} statement per line.
 */
public final class RdfModel extends AbstractTermModel {

    public RdfModel() {
        super(Domain.RDF);
    }

    @Override
    protected Term doParse(String source) {
        return new Reader(source).document();
    }

    @Override
    protected String doSerialize(Term term) {
        if (term instanceof Triple) {
            return term + "\n";
        }
        if (!(term instanceof Graph graph)) {
            throw foreign(term);
        }
        StringBuilder sb = new StringBuilder();
        for (Term triple : graph.triples()) {
            if (!(triple instanceof Triple)) {
                throw foreign(triple);
            }
            sb.append(triple).append('\n');
        }
        return sb.toString();
    }

    /**
     * One-shot cursor over the source text.
     */
    private final class Reader {
        private final String source;
        private final Map<String, String> prefixes = new HashMap<>();
        private int pos;

        Reader(String source) {
            this.source = source;
        }

        Graph document() {
            List<Term> triples = new ArrayList<>();
            skipTrivia();
            while (pos < source.length()) {
                if (source.startsWith("@prefix", pos)) {
                    prefixDirective();
                } else {
                    triples.add(statement());
                }
                skipTrivia();
            }
            if (triples.isEmpty()) {
                throw error(source, pos, "No triples");
            }
            return new Graph(triples);
        }

        private void prefixDirective() {
            pos += "@prefix".length();
            skipTrivia();
            int start = pos;
            while (pos < source.length() && source.charAt(pos) != ':' && isNameChar(source.charAt(pos))) {
                pos++;
            }
            expect(':');
            String name = source.substring(start, pos - 1);
            skipTrivia();
            String namespace = iriRef();
            skipTrivia();
            expect('.');
            prefixes.put(name, namespace);
        }

        private Triple statement() {
            Term subject = term();
            if (subject instanceof RdfLiteral) {
                throw error(source, pos, "A literal cannot be a subject");
            }
            skipTrivia();
            Term predicate;
            if (source.startsWith("a", pos) && pos + 1 < source.length() && Character.isWhitespace(source.charAt(pos + 1))) {
                pos++;
                predicate = new Iri(RdfTerm.RDF_TYPE);
            } else {
                predicate = term();
                if (!(predicate instanceof Iri)) {
                    throw error(source, pos, "Predicate must be an IRI");
                }
            }
            skipTrivia();
            Term object = term();
            skipTrivia();
            expect('.');
            return new Triple(subject, predicate, object);
        }

        private Term term() {
            if (pos >= source.length()) {
                throw error(source, pos, "Unexpected end of input");
            }
            char c = source.charAt(pos);
            if (c == '<') {
                return new Iri(iriRef());
            }
            if (c == '_' && source.startsWith("_:", pos)) {
                return blankNode();
            }
            if (c == '"') {
                return literal();
            }
            return new Iri(prefixedName());
        }

        private String iriRef() {
            int start = pos;
            expect('<');
            StringBuilder sb = new StringBuilder();
            while (true) {
                if (pos >= source.length()) {
                    throw error(source, start, "Unterminated IRI");
                }
                char c = source.charAt(pos++);
                if (c == '>') {
                    break;
                }
                if (c == '\\') {
                    c = unicodeEscape(start);
                }
                if (c <= ' ' || "<>\"{}|^`\\".indexOf(c) >= 0) {
                    throw error(source, pos - 1, "Illegal character in IRI");
                }
                sb.append(c);
            }
            if (sb.length() == 0) {
                throw error(source, start, "Empty IRI");
            }
            return sb.toString();
        }

        private char unicodeEscape(int start) {
            if (pos >= source.length()) {
                throw error(source, start, "Unterminated escape");
            }
            char kind = source.charAt(pos++);
            int digits = kind == 'u' ? 4 : kind == 'U' ? 8 : -1;
            if (digits < 0 || pos + digits > source.length()) {
                throw error(source, pos - 1, "Bad escape sequence");
            }
            int code;
            try {
                code = Integer.parseInt(source.substring(pos, pos + digits), 16);
            } catch (NumberFormatException e) {
                throw new ParseException(Domain.RDF, source, pos, "Bad hex escape", e);
            }
            if (code > Character.MAX_VALUE) {
                throw error(source, pos, "Escape outside the basic multilingual plane");
            }
            pos += digits;
            return (char) code;
        }

        private BlankNode blankNode() {
            int start = pos;
            pos += 2;
            while (pos < source.length() && isNameChar(source.charAt(pos))) {
                pos++;
            }
            while (pos > start + 2 && source.charAt(pos - 1) == '.') {
                pos--;
            }
            if (pos == start + 2) {
                throw error(source, start, "Empty blank node label");
            }
            return new BlankNode(source.substring(start + 2, pos));
        }

        private RdfLiteral literal() {
            int start = pos;
            pos++;
            StringBuilder sb = new StringBuilder();
            while (true) {
                if (pos >= source.length()) {
                    throw error(source, start, "Unterminated literal");
                }
                char c = source.charAt(pos++);
                if (c == '"') {
                    break;
                }
                if (c == '\n' || c == '\r') {
                    throw error(source, pos - 1, "Line break inside literal");
                }
                if (c == '\\') {
                    if (pos >= source.length()) {
                        throw error(source, start, "Unterminated literal");
                    }
                    char e = source.charAt(pos++);
                    switch (e) {
                        case 't' -> sb.append('\t');
                        case 'b' -> sb.append('\b');
                        case 'n' -> sb.append('\n');
                        case 'r' -> sb.append('\r');
                        case 'f' -> sb.append('\f');
                        case '"' -> sb.append('"');
                        case '\'' -> sb.append('\'');
                        case '\\' -> sb.append('\\');
                        case 'u', 'U' -> {
                            pos--;
                            sb.append(unicodeEscape(start));
                        }
                        default -> throw error(source, pos - 1, "Bad escape sequence '\\" + e + "'");
                    }
                } else {
                    sb.append(c);
                }
            }
            String lexical = sb.toString();
            if (source.startsWith("@", pos)) {
                int tagStart = ++pos;
                while (pos < source.length() && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '-')) {
                    pos++;
                }
                String tag = source.substring(tagStart, pos);
                if (!tag.matches("[a-zA-Z]+(-[a-zA-Z0-9]+)*")) {
                    throw error(source, tagStart, "Malformed language tag '" + tag + "'");
                }
                return new RdfLiteral(lexical, tag, null);
            }
            if (source.startsWith("^^", pos)) {
                pos += 2;
                String datatype = pos < source.length() && source.charAt(pos) == '<' ? iriRef() : prefixedName();
                return new RdfLiteral(lexical, null, datatype);
            }
            return RdfLiteral.plain(lexical);
        }

        private String prefixedName() {
            int start = pos;
            while (pos < source.length() && source.charAt(pos) != ':' && isNameChar(source.charAt(pos))) {
                pos++;
            }
            if (pos >= source.length() || source.charAt(pos) != ':') {
                throw error(source, start, "Expected an IRI, blank node or literal");
            }
            String prefix = source.substring(start, pos);
            String namespace = prefixes.get(prefix);
            if (namespace == null) {
                throw error(source, start, "Undeclared prefix '" + prefix + ":'");
            }
            int localStart = ++pos;
            while (pos < source.length() && isNameChar(source.charAt(pos))) {
                pos++;
            }
            while (pos > localStart && source.charAt(pos - 1) == '.') {
                pos--;
            }
            return namespace + source.substring(localStart, pos);
        }

        private void expect(char c) {
            if (pos >= source.length() || source.charAt(pos) != c) {
                throw error(source, pos, "Expected '" + c + "'");
            }
            pos++;
        }

        private void skipTrivia() {
            while (pos < source.length()) {
                char c = source.charAt(pos);
                if (Character.isWhitespace(c)) {
                    pos++;
                } else if (c == '#') {
                    while (pos < source.length() && source.charAt(pos) != '\n') {
                        pos++;
                    }
                } else {
                    return;
                }
            }
        }
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
    }
}
