/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.filter;

import com.repoq.trs.api.TermGenerator;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.domain.filter.FilterTerm.Glob;
import com.repoq.trs.domain.filter.FilterTerm.Intersect;
import com.repoq.trs.domain.filter.FilterTerm.MatchAll;
import com.repoq.trs.domain.filter.FilterTerm.MatchNone;
import com.repoq.trs.domain.filter.FilterTerm.Negate;
import com.repoq.trs.domain.filter.FilterTerm.PathLiteral;
import com.repoq.trs.domain.filter.FilterTerm.Union;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public final class FilterGenerator implements TermGenerator {

    private static final List<String> PATHS = List.of(
            "README.md", "src/Main.java", "src//util/a.txt", "./docs/guide.md", "docs/", "a", "b.txt", "a//b/./c/");

    private static final List<String> GLOBS = List.of(
            "*.md", "src/**", "src/**/*.java", "**/*.java", "src/***/a.txt", "[ba].txt", "{a,b.txt}",
            "docs/**/**", "?", "src/*/a.txt", "./*.md", "*.{md,txt}", "[!a]*", "**/**");

    private static final List<String> CURATED = List.of(
            "*.md | *.md",
            "!!src/**",
            "!(*.md | docs/**)",
            "src//**/*.java & ./src/**",
            "*.md | README.md",
            "README.md & *.md",
            "README.md & docs/**",
            "a | !a",
            "b.txt & !b.txt",
            "src/**** | **/**",
            "[cab].txt & {}",
            "docs/guide.md | (docs/guide.md & *.md)",
            "(*.md | *.txt) | **/*.java",
            "!** | src/Main.java",
            "src/Main.java",
            "!(README.md | *.md)",
            "README.md & *.md & (*.md | src/**/*.java)",
            "!(README.md & src/**/*.java)",
            "src/** | src/main/**",
            "**/*.java | src/**/*.java",
            "src/** & src/main/**",
            "a//b/./c/");

    @Override
    public List<String> curatedSources() {
        return CURATED;
    }

    @Override
    public List<Term> generate(int count, int maxDepth, long seed) {
        Random random = new Random(seed);
        List<Term> terms = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            terms.add(randomTerm(random, maxDepth));
        }
        return terms;
    }

    // depth is bounded by maxDepth
    private Term randomTerm(Random random, int depth) {
        if (depth <= 1 || random.nextInt(10) < 3) {
            return randomLeaf(random);
        }
        int shape = random.nextInt(5);
        if (shape == 0) {
            return new Negate(randomTerm(random, depth - 1));
        }
        Term left = randomTerm(random, depth - 1);
        Term right = randomTerm(random, depth - 1);
        return shape % 2 == 0 ? new Union(left, right) : new Intersect(left, right);
    }

    private Term randomLeaf(Random random) {
        int roll = random.nextInt(20);
        if (roll == 0) {
            return new MatchAll();
        }
        if (roll == 1) {
            return new MatchNone();
        }
        if (roll < 10) {
            return new PathLiteral(PATHS.get(random.nextInt(PATHS.size())));
        }
        return new Glob(GLOBS.get(random.nextInt(GLOBS.size())));
    }

    /**
     * Six samples, so a three-variable pattern has 216 instances and stays inside the default
     * instance budget. The non-canonical leaves let the spelling rules fire.
     */
    @Override
    public List<Term> groundSamples(String sort) {
        Term markdown = new Glob("*.md");
        List<Term> all = List.of(
                new PathLiteral("README.md"),
                markdown,
                new Glob("src/**/*.java"),
                new Negate(markdown),
                new Glob("./src//**"),
                new PathLiteral("./docs/./guide.md"));
        if (sort == null) {
            return all;
        }
        return all.stream().filter(t -> t.operator().equals(sort)).toList();
    }
}
