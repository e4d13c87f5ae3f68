/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api.model;

import java.util.Arrays;

/**
 * Tuple of non-negative integers compared lexicographically.
 *
 * <p>Tuples of the same length over the naturals are well-ordered under lexicographic order,
 * so a rule whose right-hand side always has a strictly smaller value than its left-hand side
 * cannot be applied forever.
 */
public final class MeasureValue implements Comparable<MeasureValue> {

    private final long[] components;

    private MeasureValue(long[] components) {
        this.components = components;
    }

    public static MeasureValue of(long... components) {
        for (long component : components) {
            if (component < 0) {
                throw new IllegalArgumentException("Measure components must be non-negative: "
                        + Arrays.toString(components));
            }
        }
        return new MeasureValue(components.clone());
    }

    public MeasureValue concat(MeasureValue other) {
        long[] joined = Arrays.copyOf(components, components.length + other.components.length);
        System.arraycopy(other.components, 0, joined, components.length, other.components.length);
        return new MeasureValue(joined);
    }

    public int size() {
        return components.length;
    }

    public long component(int index) {
        return components[index];
    }

    public boolean isGreaterThan(MeasureValue other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(MeasureValue other) {
        int common = Math.min(components.length, other.components.length);
        for (int i = 0; i < common; i++) {
            int cmp = Long.compare(components[i], other.components[i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(components.length, other.components.length);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MeasureValue other && Arrays.equals(components, other.components);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(components);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < components.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(components[i]);
        }
        return sb.append(')').toString();
    }
}
