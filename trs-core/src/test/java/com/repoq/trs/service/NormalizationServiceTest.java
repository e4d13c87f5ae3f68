/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.service;

import com.repoq.trs.api.IRewriteEngine;
import com.repoq.trs.api.exceptions.ParseException;
import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.NormalizationResult;
import com.repoq.trs.api.model.NormalizationResult.Outcome;
import com.repoq.trs.api.model.RewriteRule;
import com.repoq.trs.api.model.RuleSet;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.fixtures.Peano;
import com.repoq.trs.fixtures.PeanoModel;
import com.repoq.trs.infra.cache.CacheKey;
import com.repoq.trs.infra.cache.CaffeineNormalizationCache;
import com.repoq.trs.infra.cache.NormalizationCache;
import com.repoq.trs.runtime.RewriteEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static com.repoq.trs.fixtures.Peano.num;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NormalizationServiceTest {

    @Mock
    private IRewriteEngine engine;

    @Mock
    private NormalizationCache cache;

    private final PeanoModel model = new PeanoModel();

    @Test
    @DisplayName("Should canonicalize through the real engine")
    void shouldCanonicalize() {
        NormalizationService service = new NormalizationService(model, new RewriteEngine(Peano.addition()));

        assertThat(service.canonicalize("+(s(s(0)),s(0))")).isEqualTo("s(s(s(0)))");
        assertThat(service.canonicalHash("+(s(0),s(0))")).isEqualTo(service.canonicalHash("s(s(0))")).hasSize(16);
    }

    @Test
    @DisplayName("Should propagate parse errors")
    void shouldPropagateParseErrors() {
        NormalizationService service = new NormalizationService(model, new RewriteEngine(Peano.addition()));

        assertThatThrownBy(() -> service.canonicalize("+(0"))
                .isInstanceOf(ParseException.class);
        assertThatThrownBy(() -> service.canonicalize("   "))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Empty input");
    }

    @Test
    @DisplayName("Should fall back to the original input when normalization stops early")
    void shouldFallBackOnStepLimit() {
        NormalizationService service = new NormalizationService(model,
                new RewriteEngine(Peano.diverging()), cache);
        when(cache.get(any())).thenReturn(Optional.empty());

        assertThat(service.canonicalize("s(0)")).isEqualTo("s(0)");
    }

    @Test
    @DisplayName("Should serve cached results without normalizing")
    void shouldUseCache() {
        when(engine.ruleSet()).thenReturn(Peano.addition());
        Term two = num(2);
        NormalizationResult cached = NormalizationResult.alreadyNormal(two);
        when(cache.get(CacheKey.of(Peano.addition(), "+(s(0),s(0))"))).thenReturn(Optional.of(cached));
        NormalizationService service = new NormalizationService(model, engine, cache);

        assertThat(service.canonicalize("+(s(0),s(0))")).isEqualTo("s(s(0))");
        verify(engine, never()).normalize(any());
    }

    @Test
    @DisplayName("Should store fresh results in the cache")
    void shouldStoreFreshResults() {
        when(engine.ruleSet()).thenReturn(Peano.addition());
        when(cache.get(any())).thenReturn(Optional.empty());
        NormalizationResult result = new NormalizationResult(num(1), num(1), 0, Outcome.NORMAL_FORM, List.of());
        when(engine.normalize(any(Term.class))).thenReturn(result);
        NormalizationService service = new NormalizationService(model, engine, cache);

        service.normalize("s(0)");

        verify(cache).put(CacheKey.of(Peano.addition(), "s(0)"), result);
    }

    @Test
    @DisplayName("Should reject a model from another domain")
    void shouldRejectDomainMismatch() {
        when(engine.ruleSet()).thenReturn(RuleSet.builder(Domain.SPDX, "other", "1")
                .add(RewriteRule.builder("r", Domain.SPDX).pattern(num(1)).template(num(0)).build())
                .build());

        assertThatThrownBy(() -> new NormalizationService(model, engine, cache))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not match");
    }
}
