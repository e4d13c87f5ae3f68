/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.rdf;

import com.repoq.trs.api.model.Term;
import com.repoq.trs.domain.rdf.RdfTerm.BlankNode;
import com.repoq.trs.domain.rdf.RdfTerm.Triple;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical blank-node labels {@code b0, b1, ...}.
 *
 * <p>Blank nodes are coloured by iterated refinement over the statements they occur in;
 * the colour of a node never depends on its original label or on statement order. While
 * some colour class has several members, each member is individualized in turn and the
 * labelling whose relabelled, sorted graph serializes smallest wins. The search visits at
 * most {@value #MAX_LEAVES} complete labellings.
 */
final class BlankNodeLabeler {

    private static final Logger logger = LoggerFactory.getLogger(BlankNodeLabeler.class);

    static final int MAX_LEAVES = 4096;

    private final List<Triple> triples;
    private final Object2IntMap<String> index = new Object2IntLinkedOpenHashMap<>();
    private final List<String> labels = new ArrayList<>();
    /**
     * For each blank node, the (statement, position) pairs it occurs at, packed as
     * {@code statement * 3 + position}.
     */
    private final List<IntArrayList> occurrences = new ArrayList<>();

    private String bestCertificate;
    private int[] bestColours;
    private int leaves;

    private BlankNodeLabeler(List<Term> statements) {
        this.triples = new ArrayList<>(statements.size());
        for (Term statement : statements) {
            Triple triple = (Triple) statement;
            int t = triples.size();
            triples.add(triple);
            List<Term> nodes = triple.arguments();
            for (int k = 0; k < 3; k++) {
                if (nodes.get(k) instanceof BlankNode blank) {
                    if (!index.containsKey(blank.label())) {
                        index.put(blank.label(), labels.size());
                        labels.add(blank.label());
                        occurrences.add(new IntArrayList());
                    }
                    occurrences.get(index.getInt(blank.label())).add(t * 3 + k);
                }
            }
        }
    }

    /**
     * Old label to canonical label, for every blank node in {@code statements}.
     */
    static Map<String, String> canonicalLabels(List<Term> statements) {
        BlankNodeLabeler labeler = new BlankNodeLabeler(statements);
        return labeler.run();
    }

    /**
     * True when relabelling yields the same statements up to order. Label mappings of a
     * graph with automorphisms are not unique, so the mapping itself is not compared.
     */
    static boolean isCanonical(List<Term> statements) {
        Map<String, String> mapping = canonicalLabels(statements);
        if (mapping.isEmpty()) {
            return true;
        }
        List<Term> current = new ArrayList<>(statements);
        current.sort(RdfOrdering.TRIPLE_ORDER);
        List<Term> renamed = relabel(statements, mapping);
        renamed.sort(RdfOrdering.TRIPLE_ORDER);
        return renamed.equals(current);
    }

    static List<Term> relabel(List<Term> statements, Map<String, String> mapping) {
        List<Term> result = new ArrayList<>(statements.size());
        for (Term statement : statements) {
            List<Term> nodes = statement.arguments();
            List<Term> renamed = new ArrayList<>(3);
            for (Term node : nodes) {
                renamed.add(node instanceof BlankNode blank ? new BlankNode(mapping.get(blank.label())) : node);
            }
            result.add(statement.withArguments(renamed));
        }
        return result;
    }

    private Map<String, String> run() {
        int n = labels.size();
        if (n == 0) {
            return Map.of();
        }
        search(new int[n]);
        if (leaves > MAX_LEAVES) {
            logger.debug("Blank-node search stopped after {} labellings for {} nodes", MAX_LEAVES, n);
        }
        Map<String, String> mapping = new LinkedHashMap<>();
        for (int b = 0; b < n; b++) {
            mapping.put(labels.get(b), "b" + bestColours[b]);
        }
        return mapping;
    }

    private void search(int[] colours) {
        int[] refined = refine(colours);
        int target = smallestNonSingletonColour(refined);
        if (target < 0) {
            leaves++;
            String certificate = certificate(refined);
            if (bestCertificate == null || certificate.compareTo(bestCertificate) < 0) {
                bestCertificate = certificate;
                bestColours = refined;
            }
            return;
        }
        for (int b = 0; b < refined.length && leaves < MAX_LEAVES; b++) {
            if (refined[b] != target) {
                continue;
            }
            int[] individualized = new int[refined.length];
            for (int other = 0; other < refined.length; other++) {
                individualized[other] = refined[other] * 2 + 1;
            }
            individualized[b] = refined[b] * 2;
            search(individualized);
        }
    }

    /**
     * Splits colour classes by the multiset of statements each node occurs in, until the
     * number of classes stops growing. Returns dense colours {@code 0..k-1}.
     */
    private int[] refine(int[] colours) {
        int[] current = colours.clone();
        int classes = -1;
        while (true) {
            String[] signatures = new String[current.length];
            for (int b = 0; b < current.length; b++) {
                signatures[b] = signature(b, current);
            }
            TreeMap<String, Integer> ranks = new TreeMap<>();
            for (String signature : signatures) {
                ranks.put(signature, 0);
            }
            int rank = 0;
            for (Map.Entry<String, Integer> entry : ranks.entrySet()) {
                entry.setValue(rank++);
            }
            int[] next = new int[current.length];
            for (int b = 0; b < current.length; b++) {
                next[b] = ranks.get(signatures[b]);
            }
            if (ranks.size() == classes) {
                return next;
            }
            classes = ranks.size();
            current = next;
        }
    }

    private String signature(int b, int[] colours) {
        IntArrayList at = occurrences.get(b);
        String[] parts = new String[at.size()];
        for (int i = 0; i < at.size(); i++) {
            int packed = at.getInt(i);
            Triple triple = triples.get(packed / 3);
            StringBuilder sb = new StringBuilder().append(packed % 3).append('|');
            for (Term node : triple.arguments()) {
                if (node instanceof BlankNode blank) {
                    int other = index.getInt(blank.label());
                    sb.append(other == b ? "@" : "_" + colours[other]);
                } else {
                    sb.append(node);
                }
                sb.append(' ');
            }
            parts[i] = sb.toString();
        }
        Arrays.sort(parts);
        return String.format("%08d#", colours[b]) + String.join(";", parts);
    }

    private static int smallestNonSingletonColour(int[] colours) {
        int[] counts = new int[colours.length];
        for (int colour : colours) {
            counts[colour]++;
        }
        for (int colour = 0; colour < counts.length; colour++) {
            if (counts[colour] > 1) {
                return colour;
            }
        }
        return -1;
    }

    private String certificate(int[] colours) {
        Map<String, String> mapping = new LinkedHashMap<>();
        for (int b = 0; b < colours.length; b++) {
            mapping.put(labels.get(b), "b" + colours[b]);
        }
        List<Term> renamed = relabel(new ArrayList<>(triples), mapping);
        renamed.sort(RdfOrdering.TRIPLE_ORDER);
        StringBuilder sb = new StringBuilder();
        for (Term triple : renamed) {
            sb.append(triple).append('\n');
        }
        return sb.toString();
    }
}
