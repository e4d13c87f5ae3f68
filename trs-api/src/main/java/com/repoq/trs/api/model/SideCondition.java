/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api.model;

/**
 * Guard evaluated on the bindings of a successful match. A rule whose condition is false is
 * skipped and the next candidate rule is tried.
 */
@FunctionalInterface
public interface SideCondition {

    SideCondition ALWAYS = bindings -> true;

    boolean test(Bindings bindings);

    default SideCondition and(SideCondition other) {
        return bindings -> test(bindings) && other.test(bindings);
    }
}
