/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.verifier.fixtures;

import com.repoq.trs.api.TermGenerator;
import com.repoq.trs.api.model.Term;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public class ArithGenerator implements TermGenerator {

    private final List<String> curated;

    public ArithGenerator() {
        this(List.of("0", "s(0)", "+(s(s(0)),s(0))", "+(0,+(s(0),0))"));
    }

    public ArithGenerator(List<String> curated) {
        this.curated = List.copyOf(curated);
    }

    @Override
    public List<String> curatedSources() {
        return curated;
    }

    @Override
    public List<Term> generate(int count, int maxDepth, long seed) {
        Random random = new Random(seed);
        List<Term> terms = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            terms.add(random(random, maxDepth));
        }
        return terms;
    }

    private Term random(Random random, int depth) {
        if (depth <= 1) {
            return Arith.num(random.nextInt(3));
        }
        return switch (random.nextInt(3)) {
            case 0 -> Arith.num(random.nextInt(3));
            case 1 -> Arith.s(random(random, depth - 1));
            default -> Arith.add(random(random, depth - 1), random(random, depth - 1));
        };
    }

    /**
     * {@code 0}, {@code s(0)}, {@code s(s(0))} and {@code +(0,s(0))}, filtered by head operator
     * when a sort is given.
     */
    @Override
    public List<Term> groundSamples(String sort) {
        List<Term> samples = List.of(Arith.zero(), Arith.num(1), Arith.num(2), Arith.add(Arith.zero(), Arith.num(1)));
        if (sort == null) {
            return samples;
        }
        return samples.stream().filter(sample -> sample.operator().equals(sort)).toList();
    }
}
