/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.rdf;

import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.MetaVariable;
import com.repoq.trs.api.model.RewriteRule;
import com.repoq.trs.api.model.RuleSet;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.api.model.WellFoundedMeasure;
import com.repoq.trs.core.term.TermOrdering;
import com.repoq.trs.domain.rdf.RdfTerm.Graph;
import com.repoq.trs.domain.rdf.RdfTerm.RdfLiteral;
import com.repoq.trs.domain.rdf.RdfTerm.Triple;
import com.repoq.trs.runtime.measure.Measures;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Rule set for RDF graphs: canonical literals, no duplicate statements, blank nodes
 * labelled {@code b0, b1, ...} by {@link BlankNodeLabeler}, statements in
 * {@link RdfOrdering} order.
 *
 * <p>The graph rules address the whole statement list through the sorted variable
 * {@code ?g:graph}.
 */
public final class RdfRules {

    public static final String NAME = "rdf";
    public static final String VERSION = "1.0.0";

    private static final MetaVariable G = MetaVariable.sorted("g", RdfTerm.OP_GRAPH);
    private static final MetaVariable L = MetaVariable.sorted("l", RdfTerm.OP_LITERAL);

    private RdfRules() {
        throw new AssertionError("No instances");
    }

    /**
     * {@code (node count, non-canonical literals, graphs with non-canonical labels,
     * statement inversions)}.
     */
    public static WellFoundedMeasure measure() {
        return WellFoundedMeasure.lexicographic(
                Measures.nodeCount(),
                Measures.count("non-canonical-literals",
                        node -> node instanceof RdfLiteral literal && !literal.equals(canonical(literal))),
                Measures.count("non-canonical-blank-labels",
                        node -> node instanceof Graph graph && onlyTriples(graph)
                                && !BlankNodeLabeler.isCanonical(graph.triples())),
                Measures.argumentInversions(Set.of(RdfTerm.OP_GRAPH), RdfOrdering.TRIPLE_ORDER));
    }

    public static RuleSet create() {
        WellFoundedMeasure m = measure();
        return RuleSet.builder(Domain.RDF, NAME, VERSION)
                .add(RewriteRule.builder("literal-canonical", Domain.RDF)
                        .pattern(L)
                        .when(b -> !b.get("l").equals(canonical((RdfLiteral) b.get("l"))))
                        .replacement(b -> canonical((RdfLiteral) b.get("l")))
                        .measure(m)
                        .description("drops an xsd:string datatype and lower-cases language tags")
                        .build())
                .add(RewriteRule.builder("graph-dedupe", Domain.RDF)
                        .pattern(G)
                        .when(b -> graph(b.get("g")).triples().size() != distinct(graph(b.get("g"))).size())
                        .replacement(b -> new Graph(distinct(graph(b.get("g")))))
                        .measure(m)
                        .description("removes repeated statements")
                        .build())
                .add(RewriteRule.builder("graph-canonical-blanks", Domain.RDF)
                        .pattern(G)
                        .when(b -> onlyTriples(graph(b.get("g"))) && !BlankNodeLabeler.isCanonical(graph(b.get("g")).triples()))
                        .replacement(b -> {
                            List<Term> triples = graph(b.get("g")).triples();
                            return new Graph(BlankNodeLabeler.relabel(triples, BlankNodeLabeler.canonicalLabels(triples)));
                        })
                        .measure(m)
                        .description("relabels blank nodes canonically")
                        .build())
                .add(RewriteRule.builder("graph-sort", Domain.RDF)
                        .pattern(G)
                        .when(b -> !TermOrdering.isSorted(graph(b.get("g")).triples(), RdfOrdering.TRIPLE_ORDER))
                        .replacement(b -> {
                            List<Term> sorted = new ArrayList<>(graph(b.get("g")).triples());
                            sorted.sort(RdfOrdering.TRIPLE_ORDER);
                            return new Graph(sorted);
                        })
                        .measure(m)
                        .description("orders statements canonically")
                        .build())
                .build();
    }

    static RdfLiteral canonical(RdfLiteral literal) {
        if (literal.language() != null) {
            return new RdfLiteral(literal.lexical(), literal.language().toLowerCase(Locale.ROOT), null);
        }
        if (RdfTerm.XSD_STRING.equals(literal.datatype())) {
            return RdfLiteral.plain(literal.lexical());
        }
        return literal;
    }

    private static Graph graph(Term term) {
        return (Graph) term;
    }

    private static boolean onlyTriples(Graph graph) {
        for (Term triple : graph.triples()) {
            if (!(triple instanceof Triple)) {
                return false;
            }
        }
        return true;
    }

    private static List<Term> distinct(Graph graph) {
        return new ArrayList<>(new LinkedHashSet<>(graph.triples()));
    }
}
