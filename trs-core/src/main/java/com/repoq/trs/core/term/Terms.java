/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.core.term;

import com.repoq.trs.api.model.Bindings;
import com.repoq.trs.api.model.MetaVariable;
import com.repoq.trs.api.model.Position;
import com.repoq.trs.api.model.Term;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Generic term algorithms over the {@link Term} view.
 *
 * <p>Every traversal here uses an explicit stack, so adversarially deep input cannot
 * overflow the call stack.
 */
public final class Terms {

    private Terms() {
        throw new AssertionError("No instances");
    }

    /**
     * Visitor for {@link #walk}. {@code parent} is {@code null} for the root and
     * {@code index} is -1.
     */
    @FunctionalInterface
    public interface NodeVisitor {
        void visit(Term node, Term parent, int index);
    }

    /**
     * Visits every node in pre-order (parents before children, left to right).
     */
    public static void walk(Term root, NodeVisitor visitor) {
        Deque<Object[]> stack = new ArrayDeque<>();
        stack.push(new Object[]{root, null, -1});
        while (!stack.isEmpty()) {
            Object[] entry = stack.pop();
            Term node = (Term) entry[0];
            visitor.visit(node, (Term) entry[1], (Integer) entry[2]);
            List<Term> args = node.arguments();
            for (int i = args.size() - 1; i >= 0; i--) {
                stack.push(new Object[]{args.get(i), node, i});
            }
        }
    }

    public static int size(Term term) {
        int[] count = {0};
        walk(term, (node, parent, index) -> count[0]++);
        return count[0];
    }

    public static int depth(Term term) {
        Deque<Object[]> stack = new ArrayDeque<>();
        stack.push(new Object[]{term, 1});
        int max = 0;
        while (!stack.isEmpty()) {
            Object[] entry = stack.pop();
            Term node = (Term) entry[0];
            int level = (Integer) entry[1];
            max = Math.max(max, level);
            for (Term child : node.arguments()) {
                stack.push(new Object[]{child, level + 1});
            }
        }
        return max;
    }

    /**
     * Deep equality: same head at every node.
     */
    public static boolean structuralEquals(Term a, Term b) {
        Objects.requireNonNull(a, "a must not be null");
        Objects.requireNonNull(b, "b must not be null");
        Deque<Term> left = new ArrayDeque<>();
        Deque<Term> right = new ArrayDeque<>();
        left.push(a);
        right.push(b);
        while (!left.isEmpty()) {
            Term x = left.pop();
            Term y = right.pop();
            if (x == y) {
                continue;
            }
            if (!x.sameHead(y)) {
                return false;
            }
            List<Term> xs = x.arguments();
            List<Term> ys = y.arguments();
            for (int i = xs.size() - 1; i >= 0; i--) {
                left.push(xs.get(i));
                right.push(ys.get(i));
            }
        }
        return true;
    }

    /**
     * Injective string encoding of a term, used as the canonical total order on terms.
     *
     * <p>Leaves start with {@code '0'} and inner nodes with {@code '1'}, so in every sorted
     * argument list the leaves come first.
     */
    public static String canonicalKey(Term term) {
        StringBuilder sb = new StringBuilder();
        Deque<Object> stack = new ArrayDeque<>();
        stack.push(term);
        while (!stack.isEmpty()) {
            Object item = stack.pop();
            if (item instanceof String text) {
                sb.append(text);
                continue;
            }
            Term node = (Term) item;
            if (node.isLeaf()) {
                sb.append('0').append(node.operator()).append(':');
                appendEscaped(sb, node.payload());
                continue;
            }
            sb.append('1').append(node.operator());
            if (node.payload() != null) {
                sb.append('[');
                appendEscaped(sb, node.payload());
                sb.append(']');
            }
            sb.append('(');
            stack.push(")");
            List<Term> args = node.arguments();
            for (int i = args.size() - 1; i >= 0; i--) {
                stack.push(args.get(i));
                if (i > 0) {
                    stack.push(",");
                }
            }
        }
        return sb.toString();
    }

    private static void appendEscaped(StringBuilder sb, Object payload) {
        if (payload == null) {
            return;
        }
        String text = payload.toString();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' || c == '(' || c == ')' || c == ',' || c == '[' || c == ']') {
                sb.append('\\');
            }
            sb.append(c);
        }
    }

    public static int compare(Term a, Term b) {
        return canonicalKey(a).compareTo(canonicalKey(b));
    }

    /**
     * Subterm at a position.
     *
     * @throws IllegalArgumentException if the position does not exist in {@code term}
     */
    public static Term subtermAt(Term term, Position position) {
        Term current = term;
        for (int level = 0; level < position.depth(); level++) {
            int index = position.index(level);
            List<Term> args = current.arguments();
            if (index >= args.size()) {
                throw new IllegalArgumentException("Position " + position + " does not exist in term");
            }
            current = args.get(index);
        }
        return current;
    }

    /**
     * Replaces the subterm at {@code position}, rebuilding only the spine above it.
     */
    public static Term replaceAt(Term term, Position position, Term replacement) {
        if (position.isRoot()) {
            return replacement;
        }
        Term[] spine = new Term[position.depth()];
        Term current = term;
        for (int level = 0; level < position.depth(); level++) {
            spine[level] = current;
            int index = position.index(level);
            if (index >= current.arguments().size()) {
                throw new IllegalArgumentException("Position " + position + " does not exist in term");
            }
            current = current.arguments().get(index);
        }
        Term rebuilt = replacement;
        for (int level = position.depth() - 1; level >= 0; level--) {
            List<Term> args = new ArrayList<>(spine[level].arguments());
            args.set(position.index(level), rebuilt);
            rebuilt = spine[level].withArguments(args);
        }
        return rebuilt;
    }

    /**
     * All positions in pre-order.
     */
    public static List<Position> positions(Term term) {
        List<Position> result = new ArrayList<>();
        Deque<Object[]> stack = new ArrayDeque<>();
        stack.push(new Object[]{term, Position.ROOT});
        while (!stack.isEmpty()) {
            Object[] entry = stack.pop();
            Term node = (Term) entry[0];
            Position position = (Position) entry[1];
            result.add(position);
            List<Term> args = node.arguments();
            for (int i = args.size() - 1; i >= 0; i--) {
                stack.push(new Object[]{args.get(i), position.child(i)});
            }
        }
        return result;
    }

    /**
     * Positions whose subterm is not an unsorted variable. Sorted variables constrain the
     * head symbol, so they count as function positions for overlap computation.
     */
    public static List<Position> functionPositions(Term pattern) {
        List<Position> result = new ArrayList<>();
        for (Position position : positions(pattern)) {
            Term sub = subtermAt(pattern, position);
            if (!(sub instanceof MetaVariable variable) || variable.isSorted()) {
                result.add(position);
            }
        }
        return result;
    }

    /**
     * Distinct variables in pre-order of first occurrence.
     */
    public static Set<MetaVariable> variables(Term term) {
        Set<MetaVariable> seen = new LinkedHashSet<>();
        walk(term, (node, parent, index) -> {
            if (node instanceof MetaVariable variable) {
                seen.add(variable);
            }
        });
        return seen;
    }

    public static boolean isGround(Term term) {
        Deque<Term> stack = new ArrayDeque<>();
        stack.push(term);
        while (!stack.isEmpty()) {
            Term node = stack.pop();
            if (node.isVariable()) {
                return false;
            }
            node.arguments().forEach(stack::push);
        }
        return true;
    }

    /**
     * Moves every variable of {@code term} to {@code generation}, so two patterns share no
     * variables before they are unified.
     */
    public static Term renameApart(Term term, int generation) {
        return Bindings.replaceVariables(term, variable -> variable.withGeneration(generation));
    }
}
