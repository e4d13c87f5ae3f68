/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.spdx;

import com.repoq.trs.api.TermGenerator;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.domain.spdx.SpdxTerm.And;
import com.repoq.trs.domain.spdx.SpdxTerm.LicenseId;
import com.repoq.trs.domain.spdx.SpdxTerm.Or;
import com.repoq.trs.domain.spdx.SpdxTerm.With;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public final class SpdxGenerator implements TermGenerator {

    private static final List<String> IDS = List.of(
            "MIT", "Apache-2.0", "GPL-2.0-only", "BSD-3-Clause", "LicenseRef-Internal");

    private static final List<String> CURATED = List.of(
            "Apache-2.0 OR Apache-2.0",
            "MIT AND (MIT OR Apache-2.0)",
            "(MIT AND Apache-2.0) OR MIT",
            "GPL-2.0-only OR MIT OR Apache-2.0",
            "((MIT OR BSD-3-Clause) OR Apache-2.0)",
            "MIT and Apache-2.0 AND mit",
            "(MIT AND Apache-2.0) OR (Apache-2.0 AND MIT)",
            "GPL-2.0-or-later WITH Classpath-exception-2.0 OR MIT",
            "MIT OR GPL-2.0-or-later WITH Classpath-exception-2.0 OR MIT",
            "LicenseRef-Internal AND DocumentRef-spdx-tool-1.2:LicenseRef-MIT-Style",
            "MIT AND Apache-2.0 OR BSD-3-Clause AND (GPL-2.0+ OR MIT)",
            "(((MIT)))",
            "BSD-2-Clause OR (BSD-2-Clause AND MIT) OR (MIT AND BSD-2-Clause AND Apache-2.0)");

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

    // depth is bounded by maxDepth, so recursion is safe here
    private Term randomTerm(Random random, int depth) {
        if (depth <= 1 || random.nextInt(10) < 3) {
            return randomLeaf(random);
        }
        Term left = randomTerm(random, depth - 1);
        Term right = randomTerm(random, depth - 1);
        return random.nextBoolean() ? new And(left, right) : new Or(left, right);
    }

    private Term randomLeaf(Random random) {
        if (random.nextInt(8) == 0) {
            return new With(new LicenseId("GPL-2.0-or-later"), "Classpath-exception-2.0");
        }
        return new LicenseId(IDS.get(random.nextInt(IDS.size())));
    }

    @Override
    public List<Term> groundSamples(String sort) {
        Term mit = new LicenseId("MIT");
        Term apache = new LicenseId("Apache-2.0");
        Term gpl = new LicenseId("GPL-2.0-only");
        List<Term> all = List.of(
                mit,
                apache,
                new And(mit, apache),
                new Or(apache, gpl),
                new With(new LicenseId("GPL-2.0-or-later"), "Classpath-exception-2.0"));
        if (sort == null) {
            return all;
        }
        return all.stream().filter(t -> t.operator().equals(sort)).toList();
    }
}
