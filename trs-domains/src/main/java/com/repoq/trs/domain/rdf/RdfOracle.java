/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.rdf;

import com.repoq.trs.api.SemanticOracle;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.domain.rdf.RdfTerm.BlankNode;
import com.repoq.trs.domain.rdf.RdfTerm.Graph;
import com.repoq.trs.domain.rdf.RdfTerm.RdfLiteral;
import com.repoq.trs.domain.rdf.RdfTerm.Triple;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Graph isomorphism by backtracking over blank-node bijections. Both graphs are first
 * reduced to sets of statements with literals compared by value ({@code "x"} equals
 * {@code "x"^^xsd:string}, language tags ignore case).
 */
public final class RdfOracle implements SemanticOracle {

    private static final Logger logger = LoggerFactory.getLogger(RdfOracle.class);

    private static final long SEARCH_BUDGET = 1_000_000L;

    @Override
    public String name() {
        return "rdf-isomorphism";
    }

    @Override
    public Optional<String> findDifference(Term original, Term normalized) {
        List<Triple> a = statements(original);
        List<Triple> b = statements(normalized);
        if (a.size() != b.size()) {
            return Optional.of("distinct statements: original=" + a.size() + ", normalized=" + b.size());
        }
        Set<String> groundB = new HashSet<>();
        for (Triple triple : b) {
            if (!hasBlank(triple)) {
                groundB.add(triple.toString());
            }
        }
        for (Triple triple : a) {
            if (!hasBlank(triple) && !groundB.contains(triple.toString())) {
                return Optional.of("statement missing after normalization: " + triple);
            }
        }
        return isomorphic(a, b) ? Optional.empty() : Optional.of("no blank-node bijection maps the original onto the normalized graph");
    }

    private static List<Triple> statements(Term term) {
        List<Term> source = term instanceof Graph graph ? graph.triples() : List.of(term);
        Set<Triple> unique = new LinkedHashSet<>();
        for (Term node : source) {
            Triple triple = (Triple) node;
            unique.add(new Triple(triple.subject(), triple.predicate(), byValue(triple.object())));
        }
        return new ArrayList<>(unique);
    }

    private static Term byValue(Term node) {
        if (node instanceof RdfLiteral literal) {
            if (literal.language() != null) {
                return new RdfLiteral(literal.lexical(), literal.language().toLowerCase(Locale.ROOT), null);
            }
            if (RdfTerm.XSD_STRING.equals(literal.datatype())) {
                return RdfLiteral.plain(literal.lexical());
            }
        }
        return node;
    }

    private static boolean hasBlank(Triple triple) {
        return triple.subject() instanceof BlankNode || triple.object() instanceof BlankNode;
    }

    /**
     * Assigns original blank nodes, in first-occurrence order, to unused normalized blank
     * nodes of equal degree; after each assignment, every statement whose blank nodes are
     * all assigned must appear in the normalized graph.
     */
    private static boolean isomorphic(List<Triple> a, List<Triple> b) {
        Object2IntMap<String> blanksA = blankIndex(a);
        Object2IntMap<String> blanksB = blankIndex(b);
        int n = blanksA.size();
        if (n != blanksB.size()) {
            return false;
        }
        if (n == 0) {
            return true;
        }
        int[] degreeA = degrees(a, blanksA);
        int[] degreeB = degrees(b, blanksB);
        String[] labelsB = blanksB.keySet().toArray(new String[0]);
        String[] labelsA = blanksA.keySet().toArray(new String[0]);

        List<IntArrayList> closing = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            closing.add(new IntArrayList());
        }
        for (int t = 0; t < a.size(); t++) {
            Triple triple = a.get(t);
            if (hasBlank(triple)) {
                int last = Math.max(blankOrder(triple.subject(), blanksA), blankOrder(triple.object(), blanksA));
                closing.get(last).add(t);
            }
        }
        Set<String> targets = new HashSet<>();
        for (Triple triple : b) {
            targets.add(triple.toString());
        }

        int[] choice = new int[n];
        Arrays.fill(choice, -1);
        boolean[] used = new boolean[n];
        String[] mapping = new String[n];
        long steps = 0;
        int depth = 0;
        while (depth >= 0 && depth < n) {
            if (++steps > SEARCH_BUDGET) {
                logger.debug("Isomorphism search for {} blank nodes exceeded its budget", n);
                return true;
            }
            if (choice[depth] >= 0) {
                used[choice[depth]] = false;
            }
            boolean placed = false;
            for (int next = choice[depth] + 1; next < n; next++) {
                if (used[next] || degreeA[depth] != degreeB[next]) {
                    continue;
                }
                choice[depth] = next;
                mapping[depth] = labelsB[next];
                if (closes(a, closing.get(depth), blanksA, mapping, targets)) {
                    used[next] = true;
                    placed = true;
                    break;
                }
            }
            if (placed) {
                depth++;
                if (depth < n) {
                    choice[depth] = -1;
                }
            } else {
                choice[depth] = -1;
                depth--;
            }
        }
        if (depth == n) {
            return true;
        }
        logger.trace("No bijection for blank nodes {}", (Object) labelsA);
        return false;
    }

    private static boolean closes(List<Triple> a, IntArrayList statements, Object2IntMap<String> blanksA,
                                  String[] mapping, Set<String> targets) {
        for (int i = 0; i < statements.size(); i++) {
            Triple triple = a.get(statements.getInt(i));
            Triple mapped = new Triple(map(triple.subject(), blanksA, mapping), triple.predicate(),
                    map(triple.object(), blanksA, mapping));
            if (!targets.contains(mapped.toString())) {
                return false;
            }
        }
        return true;
    }

    private static Term map(Term node, Object2IntMap<String> blanks, String[] mapping) {
        return node instanceof BlankNode blank ? new BlankNode(mapping[blanks.getInt(blank.label())]) : node;
    }

    private static int blankOrder(Term node, Object2IntMap<String> blanks) {
        return node instanceof BlankNode blank ? blanks.getInt(blank.label()) : -1;
    }

    private static Object2IntMap<String> blankIndex(List<Triple> triples) {
        Object2IntMap<String> index = new Object2IntLinkedOpenHashMap<>();
        for (Triple triple : triples) {
            for (Term node : List.of(triple.subject(), triple.object())) {
                if (node instanceof BlankNode blank && !index.containsKey(blank.label())) {
                    index.put(blank.label(), index.size());
                }
            }
        }
        return index;
    }

    private static int[] degrees(List<Triple> triples, Object2IntMap<String> index) {
        int[] degree = new int[index.size()];
        for (Triple triple : triples) {
            for (Term node : List.of(triple.subject(), triple.object())) {
                if (node instanceof BlankNode blank) {
                    degree[index.getInt(blank.label())]++;
                }
            }
        }
        return degree;
    }
}
