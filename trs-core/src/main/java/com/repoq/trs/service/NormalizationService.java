/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.service;

import com.repoq.trs.api.IRewriteEngine;
import com.repoq.trs.api.TermModel;
import com.repoq.trs.api.exceptions.ParseException;
import com.repoq.trs.api.model.NormalizationResult;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.infra.cache.CacheKey;
import com.repoq.trs.infra.cache.NormalizationCache;
import com.repoq.trs.infra.cache.NoOpNormalizationCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * String-level facade: parse, cache lookup, normalize, serialize.
 *
 * <p>Malformed input is reported with {@link ParseException}. A term that parses but
 * does not reach a normal form is not an error for callers of {@link #canonicalize}: they
 * get the original input back and a warning is logged.
 */
public class NormalizationService {

    private static final Logger logger = LoggerFactory.getLogger(NormalizationService.class);
    private static final int HASH_LENGTH = 16;

    private final TermModel model;
    private final IRewriteEngine engine;
    private final NormalizationCache cache;

    public NormalizationService(TermModel model, IRewriteEngine engine) {
        this(model, engine, NoOpNormalizationCache.INSTANCE);
    }

    public NormalizationService(TermModel model, IRewriteEngine engine, NormalizationCache cache) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        if (model.domain() != engine.ruleSet().domain()) {
            throw new IllegalArgumentException("Model domain " + model.domain()
                    + " does not match rule set " + engine.ruleSet().id());
        }
    }

    /**
     * Parses and normalizes, consulting the cache first.
     *
     * @throws ParseException if {@code source} is malformed
     */
    public NormalizationResult normalize(String source) {
        Objects.requireNonNull(source, "source must not be null");
        CacheKey key = CacheKey.of(engine.ruleSet(), source);
        Optional<NormalizationResult> cached = cache.get(key);
        if (cached.isPresent()) {
            logger.debug("Cache hit for {}", key);
            return cached.get();
        }
        Term term = model.parse(source);
        NormalizationResult result = engine.normalize(term);
        cache.put(key, result);
        return result;
    }

    /**
     * Canonical string of {@code source}.
     *
     * @return the serialized normal form, or {@code source} unchanged if normalization
     * stopped early
     * @throws ParseException if {@code source} is malformed
     */
    public String canonicalize(String source) {
        NormalizationResult result = normalize(source);
        if (!result.terminated()) {
            logger.warn("Normalization of '{}' in {} stopped with {} after {} steps; keeping original input",
                    source, engine.ruleSet().id(), result.outcome(), result.stepsTaken());
            return source;
        }
        return model.serialize(result.normalForm());
    }

    /**
     * First 16 hex characters of the SHA-256 of the canonical string. Equivalent inputs
     * share a hash.
     */
    public String canonicalHash(String source) {
        return CacheKey.sha256Hex(canonicalize(source)).substring(0, HASH_LENGTH);
    }

    public TermModel model() {
        return model;
    }

    public IRewriteEngine engine() {
        return engine;
    }

    public NormalizationCache.CacheMetrics cacheMetrics() {
        return cache.getMetrics();
    }
}
