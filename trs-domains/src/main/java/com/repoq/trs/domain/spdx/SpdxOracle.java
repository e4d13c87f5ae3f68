/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.spdx;

import com.repoq.trs.api.SemanticOracle;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.domain.spdx.SpdxTerm.And;
import com.repoq.trs.domain.spdx.SpdxTerm.LicenseId;
import com.repoq.trs.domain.spdx.SpdxTerm.Or;
import com.repoq.trs.domain.spdx.SpdxTerm.With;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Propositional equivalence: every license identifier (or {@code id WITH exception} pair) is
 * a variable, {@code AND}/{@code OR} are conjunction and disjunction. Up to
 * {@value #EXHAUSTIVE_LIMIT} variables the full truth table is compared; above that a seeded
 * sample of assignments.
 */
public final class SpdxOracle implements SemanticOracle {

    static final int EXHAUSTIVE_LIMIT = 16;
    private static final int SAMPLED_ASSIGNMENTS = 4096;
    private static final long SEED = 0x5bd1e995L;

    @Override
    public String name() {
        return "spdx-truth-table";
    }

    @Override
    public Optional<String> findDifference(Term original, Term normalized) {
        Object2IntMap<String> variables = new Object2IntLinkedOpenHashMap<>();
        int[] left = compile(original, variables);
        int[] right = compile(normalized, variables);
        int n = variables.size();
        List<String> names = new ArrayList<>(variables.keySet());

        boolean[] assignment = new boolean[n];
        if (n <= EXHAUSTIVE_LIMIT) {
            for (long bits = 0; bits < (1L << n); bits++) {
                for (int v = 0; v < n; v++) {
                    assignment[v] = (bits >>> v & 1L) == 1L;
                }
                Optional<String> witness = compare(left, right, assignment, names);
                if (witness.isPresent()) {
                    return witness;
                }
            }
            return Optional.empty();
        }
        Random random = new Random(SEED);
        for (int sample = 0; sample < SAMPLED_ASSIGNMENTS; sample++) {
            for (int v = 0; v < n; v++) {
                assignment[v] = random.nextBoolean();
            }
            Optional<String> witness = compare(left, right, assignment, names);
            if (witness.isPresent()) {
                return witness;
            }
        }
        return Optional.empty();
    }

    private static Optional<String> compare(int[] left, int[] right, boolean[] assignment, List<String> names) {
        boolean a = evaluate(left, assignment);
        boolean b = evaluate(right, assignment);
        if (a == b) {
            return Optional.empty();
        }
        StringBuilder sb = new StringBuilder("assignment {");
        for (int v = 0; v < names.size(); v++) {
            sb.append(v == 0 ? "" : ", ").append(names.get(v)).append('=').append(assignment[v]);
        }
        return Optional.of(sb.append("} gives original=").append(a).append(", normalized=").append(b).toString());
    }

    private static final int AND = -1;
    private static final int OR = -2;

    /**
     * Post-order program: non-negative entries push a variable, {@code AND}/{@code OR} pop
     * two values.
     */
    static int[] compile(Term term, Object2IntMap<String> variables) {
        List<Integer> program = new ArrayList<>();
        Deque<Object[]> stack = new ArrayDeque<>();
        stack.push(new Object[]{term, Boolean.FALSE});
        while (!stack.isEmpty()) {
            Object[] entry = stack.pop();
            Term node = (Term) entry[0];
            boolean expanded = (Boolean) entry[1];
            if (node instanceof LicenseId || node instanceof With) {
                String key = node instanceof With with
                        ? with.license() + " WITH " + with.exception()
                        : ((LicenseId) node).id();
                if (!variables.containsKey(key)) {
                    variables.put(key, variables.size());
                }
                program.add(variables.getInt(key));
            } else if (node instanceof And || node instanceof Or) {
                if (expanded) {
                    program.add(node instanceof And ? AND : OR);
                } else {
                    stack.push(new Object[]{node, Boolean.TRUE});
                    stack.push(new Object[]{node.arguments().get(1), Boolean.FALSE});
                    stack.push(new Object[]{node.arguments().get(0), Boolean.FALSE});
                }
            } else {
                throw new IllegalArgumentException("Not an SPDX term: " + node);
            }
        }
        return program.stream().mapToInt(Integer::intValue).toArray();
    }

    static boolean evaluate(int[] program, boolean[] assignment) {
        boolean[] stack = new boolean[program.length];
        int top = 0;
        for (int instruction : program) {
            if (instruction >= 0) {
                stack[top++] = assignment[instruction];
            } else {
                boolean b = stack[--top];
                boolean a = stack[--top];
                stack[top++] = instruction == AND ? a && b : a || b;
            }
        }
        return stack[0];
    }
}
