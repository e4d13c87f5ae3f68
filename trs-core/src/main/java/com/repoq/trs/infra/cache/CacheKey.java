/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.infra.cache;

import com.repoq.trs.api.model.RuleSet;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Cache key {@code (domain, ruleset_version, input_hash)}. A new rule-set version never sees
 * results computed by an older one.
 */
public record CacheKey(String domain, String ruleSetId, String inputHash) {

    public CacheKey {
        Objects.requireNonNull(domain, "domain must not be null");
        Objects.requireNonNull(ruleSetId, "ruleSetId must not be null");
        Objects.requireNonNull(inputHash, "inputHash must not be null");
    }

    public static CacheKey of(RuleSet ruleSet, String source) {
        return new CacheKey(ruleSet.domain().id(), ruleSet.id(), sha256Hex(source));
    }

    public static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return domain + ":" + ruleSetId + ":" + inputHash;
    }
}
