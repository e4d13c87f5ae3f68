/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.core.term;

import com.repoq.trs.api.model.Term;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.BinaryOperator;

/**
 * Right-nested chains of one binary operator: {@code op(a, op(b, op(c, d)))} has the
 * operands {@code [a, b, c, d]}.
 */
public final class Chains {

    private Chains() {
        throw new AssertionError("No instances");
    }

    /**
     * Operands of the chain rooted at {@code root}, following right children that share the
     * root's class and operator.
     */
    public static List<Term> operands(Term root) {
        List<Term> operands = new ArrayList<>();
        Term current = root;
        while (continues(root, current)) {
            operands.add(current.arguments().get(0));
            current = current.arguments().get(1);
        }
        operands.add(current);
        return operands;
    }

    /**
     * Operands of a chain, descending into both children. Use on terms that may still be
     * left-nested.
     */
    public static List<Term> flatOperands(Term root) {
        List<Term> operands = new ArrayList<>();
        Deque<Term> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Term node = stack.pop();
            if (continues(root, node)) {
                stack.push(node.arguments().get(1));
                stack.push(node.arguments().get(0));
            } else {
                operands.add(node);
            }
        }
        return operands;
    }

    /**
     * Builds {@code op(t0, op(t1, ... op(tn-2, tn-1)))}; a single operand is returned as is.
     *
     * @throws IllegalArgumentException if {@code operands} is empty
     */
    public static Term build(List<? extends Term> operands, BinaryOperator<Term> constructor) {
        if (operands.isEmpty()) {
            throw new IllegalArgumentException("A chain needs at least one operand");
        }
        Term result = operands.get(operands.size() - 1);
        for (int i = operands.size() - 2; i >= 0; i--) {
            result = constructor.apply(operands.get(i), result);
        }
        return result;
    }

    private static boolean continues(Term root, Term node) {
        return node.getClass() == root.getClass()
                && node.operator().equals(root.operator())
                && node.arguments().size() == 2;
    }
}
