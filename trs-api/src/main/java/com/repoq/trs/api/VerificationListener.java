/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api;

import com.repoq.trs.api.model.PropertyResult;
import com.repoq.trs.api.model.TrsProperty;

/**
 * Callback for verification progress, e.g. for console output in the runner.
 *
 * <h2>Usage</h2>
 * <pre>
 * verifier.setVerificationListener(new VerificationListener() {
 *     {@literal @}Override
 *     public void onPropertyStart(TrsProperty property, int index, int total) {
 *         System.out.printf("Checking %s (%d/%d)%n", property, index, total);
 *     }
 *
 *     {@literal @}Override
 *     public void onPropertyComplete(PropertyResult result) {
 *         System.out.printf("%s: %s in %d ms%n",
 *             result.property(), result.status(), result.durationMillis());
 *     }
 * });
 * </pre>
 */
public interface VerificationListener {

    /**
     * @param property property about to be checked
     * @param index    1-based position in the verification plan
     * @param total    number of properties in the plan
     */
    void onPropertyStart(TrsProperty property, int index, int total);

    void onPropertyComplete(PropertyResult result);

    /**
     * Called when a check could not run to completion. The property is then reported
     * {@code UNKNOWN} or {@code FAIL}; this callback is informational.
     */
    default void onError(TrsProperty property, Exception error) {
    }
}
