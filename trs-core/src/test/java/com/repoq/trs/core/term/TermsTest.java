/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.core.term;

import com.repoq.trs.api.model.MetaVariable;
import com.repoq.trs.api.model.Position;
import com.repoq.trs.api.model.Term;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.repoq.trs.fixtures.Peano.add;
import static com.repoq.trs.fixtures.Peano.num;
import static com.repoq.trs.fixtures.Peano.s;
import static com.repoq.trs.fixtures.Peano.var;
import static com.repoq.trs.fixtures.Peano.zero;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TermsTest {

    @Test
    @DisplayName("Should compare terms structurally")
    void shouldCompareStructurally() {
        assertThat(Terms.structuralEquals(add(num(1), zero()), add(num(1), zero()))).isTrue();
        assertThat(Terms.structuralEquals(add(num(1), zero()), add(zero(), num(1)))).isFalse();
        assertThat(Terms.structuralEquals(var("x"), var("x"))).isTrue();
        assertThat(Terms.structuralEquals(var("x"), var("x").withGeneration(1))).isFalse();
    }

    @Test
    @DisplayName("Should handle very deep terms without recursion")
    void shouldHandleDeepTerms() {
        Term deep = num(200_000);

        assertThat(Terms.size(deep)).isEqualTo(200_001);
        assertThat(Terms.depth(deep)).isEqualTo(200_001);
        assertThat(Terms.structuralEquals(deep, num(200_000))).isTrue();
        assertThat(Terms.canonicalKey(deep)).startsWith("1s(1s(");
    }

    @Test
    @DisplayName("Should list positions in pre-order")
    void shouldListPositionsInPreOrder() {
        List<Position> positions = Terms.positions(add(s(zero()), zero()));

        assertThat(positions).containsExactly(Position.ROOT, Position.of(0), Position.of(0, 0), Position.of(1));
        assertThat(positions).isSorted();
    }

    @Test
    @DisplayName("Should visit nodes with their parent and index")
    void shouldWalkWithParents() {
        Term term = add(zero(), s(zero()));
        List<String> visits = new ArrayList<>();

        Terms.walk(term, (node, parent, index) ->
                visits.add(node.operator() + "@" + (parent == null ? "-" : parent.operator()) + index));

        assertThat(visits).containsExactly("+@--1", "0@+0", "s@+1", "0@s0");
    }

    @Test
    @DisplayName("Should replace a subterm and rebuild only the spine")
    void shouldReplaceAtPosition() {
        Term right = num(2);
        Term term = add(s(zero()), right);

        Term replaced = Terms.replaceAt(term, Position.of(0, 0), num(1));

        assertThat(Terms.structuralEquals(replaced, add(num(2), num(2)))).isTrue();
        assertThat(replaced.arguments().get(1)).isSameAs(right);
        assertThat(Terms.subtermAt(replaced, Position.of(0, 0, 0))).isEqualTo(zero());
    }

    @Test
    @DisplayName("Should reject positions outside the term")
    void shouldRejectMissingPosition() {
        assertThatThrownBy(() -> Terms.subtermAt(zero(), Position.of(0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    @DisplayName("Should treat sorted variables as function positions")
    void shouldCountSortedVariablesAsFunctionPositions() {
        Term pattern = add(var("x"), MetaVariable.sorted("y", "s"));

        assertThat(Terms.functionPositions(pattern)).containsExactly(Position.ROOT, Position.of(1));
    }

    @Test
    @DisplayName("Should collect variables and rename them apart")
    void shouldRenameApart() {
        Term pattern = add(var("x"), s(var("x")));

        Term renamed = Terms.renameApart(pattern, 2);

        assertThat(Terms.variables(pattern)).containsExactly(var("x"));
        assertThat(Terms.variables(renamed)).containsExactly(var("x").withGeneration(2));
        assertThat(Terms.isGround(pattern)).isFalse();
        assertThat(Terms.isGround(num(3))).isTrue();
    }

    @Test
    @DisplayName("Should order leaves before compound terms")
    void shouldOrderLeavesFirst() {
        List<Term> terms = new ArrayList<>(List.of(num(2), add(zero(), zero()), zero(), num(1)));

        terms.sort(TermOrdering.INSTANCE);

        assertThat(terms.get(0)).isEqualTo(zero());
        assertThat(TermOrdering.isSorted(terms, TermOrdering.INSTANCE)).isTrue();
        assertThat(TermOrdering.inversions(List.of(num(2), num(1), zero()), TermOrdering.INSTANCE)).isEqualTo(3);
    }
}
