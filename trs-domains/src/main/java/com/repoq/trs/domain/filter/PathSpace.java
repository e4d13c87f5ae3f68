/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.filter;

import com.repoq.trs.api.model.Term;
import com.repoq.trs.core.term.Terms;
import com.repoq.trs.domain.filter.FilterTerm.Glob;
import com.repoq.trs.domain.filter.FilterTerm.Intersect;
import com.repoq.trs.domain.filter.FilterTerm.MatchAll;
import com.repoq.trs.domain.filter.FilterTerm.MatchNone;
import com.repoq.trs.domain.filter.FilterTerm.Negate;
import com.repoq.trs.domain.filter.FilterTerm.PathLiteral;
import com.repoq.trs.domain.filter.FilterTerm.Union;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Finite partition of all paths induced by the leaves of some filters.
 *
 * <p>Each literal path is a cell of its own, and its membership in every glob is computed.
 * Every other path lies in some set of globs; only glob sets closed under the inclusions
 * {@link Globs#subsumes} proves are cells. A filter over these leaves denotes a set of cells,
 * so containment, emptiness and totality are decided by the leaves' meaning rather than by
 * the shape of the expression. The partition over-approximates the real one, so a
 * {@code true} answer is always sound, while glob relations nobody proved stay open.
 *
 * <p>Adding filters with further leaves refines the partition without changing any answer
 * about the earlier ones.
 */
final class PathSpace {

    static final int MAX_GLOBS = 12;

    private final Object2IntMap<String> literals;
    private final Object2IntMap<String> globs;
    private final boolean[][] literalInGlob;
    private final IntList globMasks;
    private final int cellCount;

    private PathSpace(Object2IntMap<String> literals, Object2IntMap<String> globs) {
        this.literals = literals;
        this.globs = globs;
        String[] literalPaths = literals.keySet().toArray(new String[0]);
        String[] patterns = globs.keySet().toArray(new String[0]);

        literalInGlob = new boolean[literalPaths.length][patterns.length];
        for (int l = 0; l < literalPaths.length; l++) {
            for (int g = 0; g < patterns.length; g++) {
                literalInGlob[l][g] = Globs.matches(patterns[g], literalPaths[l]);
            }
        }

        boolean[][] within = new boolean[patterns.length][patterns.length];
        for (int a = 0; a < patterns.length; a++) {
            for (int b = 0; b < patterns.length; b++) {
                within[a][b] = a == b || Globs.subsumes(patterns[b], patterns[a]);
            }
        }
        for (int k = 0; k < patterns.length; k++) {
            for (int a = 0; a < patterns.length; a++) {
                for (int b = 0; b < patterns.length; b++) {
                    within[a][b] |= within[a][k] && within[k][b];
                }
            }
        }

        globMasks = new IntArrayList();
        for (int mask = 0; mask < 1 << patterns.length; mask++) {
            if (closed(mask, within)) {
                globMasks.add(mask);
            }
        }
        cellCount = literalPaths.length + globMasks.size();
    }

    /**
     * The partition for the leaves of {@code filters}, or empty when they name more than
     * {@value #MAX_GLOBS} distinct globs or contain a term that is not a ground filter.
     */
    static Optional<PathSpace> of(Collection<? extends Term> filters) {
        Object2IntMap<String> literals = new Object2IntLinkedOpenHashMap<>();
        Object2IntMap<String> globs = new Object2IntLinkedOpenHashMap<>();
        boolean[] foreign = {false};
        for (Term filter : filters) {
            Terms.walk(filter, (node, parent, index) -> {
                Term leaf = FilterRules.canonicalLeaf(node);
                if (leaf instanceof PathLiteral literal) {
                    literals.putIfAbsent(literal.path(), literals.size());
                } else if (leaf instanceof Glob glob) {
                    globs.putIfAbsent(glob.pattern(), globs.size());
                } else if (!(leaf instanceof FilterTerm)) {
                    foreign[0] = true;
                }
            });
        }
        if (foreign[0] || globs.size() > MAX_GLOBS) {
            return Optional.empty();
        }
        return Optional.of(new PathSpace(literals, globs));
    }

    boolean contains(Term outer, Term inner) {
        BitSet outside = cells(inner);
        outside.andNot(cells(outer));
        return outside.isEmpty();
    }

    boolean isEmpty(Term filter) {
        return cells(filter).isEmpty();
    }

    boolean isEverything(Term filter) {
        return cells(filter).cardinality() == cellCount;
    }

    /**
     * Post-order evaluation with an explicit stack.
     */
    BitSet cells(Term filter) {
        Deque<Object[]> work = new ArrayDeque<>();
        Deque<BitSet> values = new ArrayDeque<>();
        work.push(new Object[]{filter, Boolean.FALSE});
        while (!work.isEmpty()) {
            Object[] entry = work.pop();
            Term node = (Term) entry[0];
            if (node instanceof Negate || node instanceof Union || node instanceof Intersect) {
                if ((Boolean) entry[1]) {
                    values.push(combine(node, values));
                } else {
                    work.push(new Object[]{node, Boolean.TRUE});
                    List<Term> arguments = node.arguments();
                    for (int i = arguments.size() - 1; i >= 0; i--) {
                        work.push(new Object[]{arguments.get(i), Boolean.FALSE});
                    }
                }
            } else {
                values.push(leafCells(FilterRules.canonicalLeaf(node)));
            }
        }
        return values.pop();
    }

    private BitSet combine(Term node, Deque<BitSet> values) {
        if (node instanceof Negate) {
            BitSet operand = values.pop();
            operand.flip(0, cellCount);
            return operand;
        }
        BitSet right = values.pop();
        BitSet left = values.pop();
        if (node instanceof Union) {
            left.or(right);
        } else {
            left.and(right);
        }
        return left;
    }

    private BitSet leafCells(Term leaf) {
        BitSet cells = new BitSet(cellCount);
        if (leaf instanceof MatchAll) {
            cells.set(0, cellCount);
        } else if (leaf instanceof PathLiteral literal) {
            cells.set(literals.getInt(literal.path()));
        } else if (leaf instanceof Glob glob) {
            int g = globs.getInt(glob.pattern());
            for (int l = 0; l < literalInGlob.length; l++) {
                if (literalInGlob[l][g]) {
                    cells.set(l);
                }
            }
            for (int m = 0; m < globMasks.size(); m++) {
                if ((globMasks.getInt(m) & (1 << g)) != 0) {
                    cells.set(literalInGlob.length + m);
                }
            }
        } else if (!(leaf instanceof MatchNone)) {
            throw new IllegalArgumentException("Not a filter term: " + leaf);
        }
        return cells;
    }

    private static boolean closed(int mask, boolean[][] within) {
        for (int a = 0; a < within.length; a++) {
            if ((mask & (1 << a)) == 0) {
                continue;
            }
            for (int b = 0; b < within.length; b++) {
                if (within[a][b] && (mask & (1 << b)) == 0) {
                    return false;
                }
            }
        }
        return true;
    }
}
