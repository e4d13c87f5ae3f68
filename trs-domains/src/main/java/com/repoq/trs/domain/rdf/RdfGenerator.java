/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.rdf;

import com.repoq.trs.api.TermGenerator;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.domain.rdf.RdfTerm.BlankNode;
import com.repoq.trs.domain.rdf.RdfTerm.Graph;
import com.repoq.trs.domain.rdf.RdfTerm.Iri;
import com.repoq.trs.domain.rdf.RdfTerm.RdfLiteral;
import com.repoq.trs.domain.rdf.RdfTerm.Triple;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public final class RdfGenerator implements TermGenerator {

    private static final String EX = "http://example.org/";
    private static final String XSD_INTEGER = "http://www.w3.org/2001/XMLSchema#integer";

    private static final List<String> CURATED = List.of(
            "_:a <http://example.org/p> <http://example.org/o> .",
            "_:z <http://example.org/p> <http://example.org/o> .",
            "<http://example.org/s> <http://example.org/p> <http://example.org/o> .\n"
                    + "<http://example.org/s> <http://example.org/p> <http://example.org/o> .",
            "<http://example.org/s> <http://example.org/name> \"x\"^^<http://www.w3.org/2001/XMLSchema#string> .\n"
                    + "<http://example.org/s> <http://example.org/name> \"x\" .",
            "@prefix ex: <http://example.org/> .\n"
                    + "ex:s a ex:Thing .\n"
                    + "ex:s ex:label \"Thing\"@EN .",
            "_:a <http://example.org/knows> _:b .\n_:b <http://example.org/knows> _:a .",
            "_:a <http://example.org/p> \"1\" .\n_:b <http://example.org/p> \"1\" .",
            "<http://example.org/s> <http://example.org/label> \"line\\nbreak \\\"quoted\\\"\" .",
            "# comment\n"
                    + "<http://example.org/b> <http://example.org/p> _:n1 .\n"
                    + "_:n1 <http://example.org/q> <http://example.org/a> .",
            "_:y <http://example.org/p> \"5\"^^<http://www.w3.org/2001/XMLSchema#integer> .\n"
                    + "_:x <http://example.org/p> \"5\"^^<http://www.w3.org/2001/XMLSchema#integer> .\n"
                    + "_:x <http://example.org/q> _:y .");

    @Override
    public List<String> curatedSources() {
        return CURATED;
    }

    /**
     * Graphs of up to {@code 2 * maxDepth} statements over a small vocabulary, so that
     * duplicates and shared blank nodes are frequent.
     */
    @Override
    public List<Term> generate(int count, int maxDepth, long seed) {
        Random random = new Random(seed);
        int maxStatements = Math.max(1, 2 * maxDepth);
        List<Term> graphs = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int size = 1 + random.nextInt(maxStatements);
            List<Term> triples = new ArrayList<>(size);
            for (int t = 0; t < size; t++) {
                triples.add(new Triple(subject(random), new Iri(EX + "p" + random.nextInt(2)), object(random)));
            }
            graphs.add(new Graph(triples));
        }
        return graphs;
    }

    private static Term subject(Random random) {
        return random.nextBoolean()
                ? new Iri(EX + "s" + random.nextInt(3))
                : new BlankNode("n" + random.nextInt(4));
    }

    private static Term object(Random random) {
        return switch (random.nextInt(6)) {
            case 0 -> new Iri(EX + "o" + random.nextInt(3));
            case 1, 2 -> new BlankNode("n" + random.nextInt(4));
            case 3 -> RdfLiteral.plain("v" + random.nextInt(2));
            case 4 -> new RdfLiteral("v" + random.nextInt(2), null, RdfTerm.XSD_STRING);
            default -> new RdfLiteral("hello", random.nextBoolean() ? "en" : "EN-gb", null);
        };
    }

    @Override
    public List<Term> groundSamples(String sort) {
        Term s = new Iri(EX + "s");
        Term p = new Iri(EX + "p");
        Term typed = new RdfLiteral("x", null, RdfTerm.XSD_STRING);
        Term tagged = new RdfLiteral("chat", "FR", null);
        Term integer = new RdfLiteral("7", null, XSD_INTEGER);
        Term blankA = new BlankNode("a");
        Term blankB = new BlankNode("b");
        Triple first = new Triple(blankA, p, typed);
        Triple second = new Triple(s, p, blankB);
        List<Term> all = List.of(
                s,
                blankA,
                typed,
                tagged,
                integer,
                first,
                new Graph(List.of(first)),
                new Graph(List.of(second, first, second)),
                new Graph(List.of(new Triple(blankA, p, blankB), new Triple(blankB, p, blankA))),
                new Graph(List.of(new Triple(s, p, tagged), new Triple(s, p, integer))));
        if (sort == null) {
            return all;
        }
        return all.stream().filter(t -> t.operator().equals(sort)).toList();
    }
}
