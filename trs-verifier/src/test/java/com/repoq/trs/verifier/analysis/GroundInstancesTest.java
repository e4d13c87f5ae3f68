/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.verifier.analysis;

import com.repoq.trs.api.model.MetaVariable;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.core.term.Terms;
import com.repoq.trs.verifier.fixtures.ArithGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.repoq.trs.verifier.fixtures.Arith.add;
import static com.repoq.trs.verifier.fixtures.Arith.s;
import static com.repoq.trs.verifier.fixtures.Arith.zero;
import static org.assertj.core.api.Assertions.assertThat;

class GroundInstancesTest {

    private final ArithGenerator generator = new ArithGenerator();

    @Test
    @DisplayName("Should enumerate the full cartesian product within budget")
    void shouldEnumerateAllCombinations() {
        GroundInstances ground = GroundInstances.of(add(MetaVariable.of("x"), MetaVariable.of("y")), generator, 256);

        assertThat(ground.instances()).hasSize(16);
        assertThat(ground.exhaustive()).isTrue();
        assertThat(ground.instances()).allMatch(Terms::isGround);
    }

    @Test
    @DisplayName("Should cut off at the budget and report non-exhaustive")
    void shouldCutOffAtBudget() {
        GroundInstances ground = GroundInstances.of(add(MetaVariable.of("x"), MetaVariable.of("y")), generator, 5);

        assertThat(ground.instances()).hasSize(5);
        assertThat(ground.exhaustive()).isFalse();
    }

    @Test
    @DisplayName("Should vary the last variable fastest")
    void shouldEnumerateInOdometerOrder() {
        GroundInstances ground = GroundInstances.of(add(MetaVariable.of("x"), MetaVariable.of("y")), generator, 2);

        assertThat(Terms.structuralEquals(ground.instances().get(0), add(zero(), zero()))).isTrue();
        assertThat(Terms.structuralEquals(ground.instances().get(1), add(zero(), s(zero())))).isTrue();
    }

    @Test
    @DisplayName("Should draw sorted variables from samples of their sort")
    void shouldRespectSorts() {
        GroundInstances ground = GroundInstances.of(s(MetaVariable.sorted("x", "+")), generator, 256);

        assertThat(ground.instances()).hasSize(1);
        assertThat(Terms.structuralEquals(ground.instances().get(0), s(add(zero(), s(zero()))))).isTrue();
    }

    @Test
    @DisplayName("Should return a ground pattern as its only instance")
    void shouldReturnGroundPatternItself() {
        Term pattern = add(zero(), zero());

        GroundInstances ground = GroundInstances.of(pattern, generator, 256);

        assertThat(ground.instances()).containsExactly(pattern);
        assertThat(ground.exhaustive()).isTrue();
    }

    @Test
    @DisplayName("Should yield nothing when a sort has no samples")
    void shouldYieldNothingForEmptySort() {
        GroundInstances ground = GroundInstances.of(s(MetaVariable.sorted("x", "missing")), generator, 256);

        assertThat(ground.instances()).isEqualTo(List.of());
        assertThat(ground.exhaustive()).isTrue();
    }
}
