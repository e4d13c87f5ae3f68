/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api;

import com.repoq.trs.api.model.VerificationReport;

/**
 * Checks the rewriting properties of one rule set and reports them.
 *
 * <p>Findings are returned as data. Implementations throw only for setup failures, for
 * example a rule set that cannot be instantiated.
 */
public interface IPropertyVerifier {

    VerificationReport verify();

    /**
     * Registers a progress listener. Default: ignored.
     */
    default void setVerificationListener(VerificationListener listener) {
    }
}
