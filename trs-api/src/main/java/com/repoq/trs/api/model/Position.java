/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api.model;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.Arrays;

/**
 * Path from the root of a term to one of its subterms, as a sequence of child indexes.
 *
 * <p>Positions order in pre-order: a position precedes its extensions, and siblings order
 * left to right. That is exactly the leftmost-outermost order used by the rewrite engine.
 */
public final class Position implements Comparable<Position> {

    public static final Position ROOT = new Position(new int[0]);

    private final int[] path;

    private Position(int[] path) {
        this.path = path;
    }

    public static Position of(int... indexes) {
        for (int index : indexes) {
            if (index < 0) {
                throw new IllegalArgumentException("Child index must be >= 0: " + index);
            }
        }
        return indexes.length == 0 ? ROOT : new Position(indexes.clone());
    }

    public Position child(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Child index must be >= 0: " + index);
        }
        int[] extended = new int[path.length + 1];
        System.arraycopy(path, 0, extended, 0, path.length);
        extended[path.length] = index;
        return new Position(extended);
    }

    public Position parent() {
        if (isRoot()) {
            throw new IllegalStateException("Root position has no parent");
        }
        int[] shorter = new int[path.length - 1];
        System.arraycopy(path, 0, shorter, 0, shorter.length);
        return shorter.length == 0 ? ROOT : new Position(shorter);
    }

    public boolean isRoot() {
        return path.length == 0;
    }

    public int depth() {
        return path.length;
    }

    public int index(int level) {
        return path[level];
    }

    public boolean isPrefixOf(Position other) {
        if (path.length > other.path.length) {
            return false;
        }
        for (int i = 0; i < path.length; i++) {
            if (path[i] != other.path[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Read-only view of the child indexes.
     */
    public IntList path() {
        return IntLists.unmodifiable(IntArrayList.wrap(path.clone()));
    }

    @Override
    public int compareTo(Position other) {
        int common = Math.min(path.length, other.path.length);
        for (int i = 0; i < common; i++) {
            int cmp = Integer.compare(path[i], other.path[i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(path.length, other.path.length);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Position other && Arrays.equals(path, other.path);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(path);
    }

    /**
     * Dotted form, {@code "root"} for the empty path, e.g. {@code "1.0"}.
     */
    @Override
    public String toString() {
        if (path.length == 0) {
            return "root";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < path.length; i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append(path[i]);
        }
        return sb.toString();
    }
}
