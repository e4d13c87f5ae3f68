/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api;

import com.repoq.trs.api.model.Term;

import java.util.Optional;

/**
 * Independent judge of meaning, used to check that normalization is sound.
 *
 * <p>An oracle must not reuse the rule set it judges.
 */
public interface SemanticOracle {

    String name();

    /**
     * Looks for evidence that two terms differ in meaning.
     *
     * @return a description of a distinguishing witness, or empty if none was found
     */
    Optional<String> findDifference(Term original, Term normalized);
}
