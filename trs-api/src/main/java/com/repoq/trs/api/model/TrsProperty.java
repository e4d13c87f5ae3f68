/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api.model;

/**
 * Properties checked for every rule set.
 */
public enum TrsProperty {
    IDEMPOTENCE,
    DETERMINISM,
    CONFLUENCE,
    TERMINATION,
    SOUNDNESS,
    ROUND_TRIP
}
