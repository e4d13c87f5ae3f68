/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.infra.config;

import java.util.Locale;
import java.util.logging.Logger;

/**
 * Reads settings from environment variables, falling back to system properties.
 *
 * <p>Environment keys are upper-case with underscores ({@code TRS_MAX_STEPS}); the matching
 * system property is derived by lower-casing and replacing underscores with dots
 * ({@code trs.max.steps}).
 */
public final class EnvironmentSettings {

    private static final Logger logger = Logger.getLogger(EnvironmentSettings.class.getName());

    private EnvironmentSettings() {
        throw new AssertionError("No instances");
    }

    public static String getString(String envKey, String defaultValue) {
        String value = System.getenv(envKey);
        if (value == null || value.isBlank()) {
            value = System.getProperty(propertyKey(envKey));
        }
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    public static int getInt(String envKey, int defaultValue) {
        String value = getString(envKey, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            logger.warning("Ignoring non-integer value for " + envKey + ": " + value);
            return defaultValue;
        }
    }

    public static long getLong(String envKey, long defaultValue) {
        String value = getString(envKey, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            logger.warning("Ignoring non-numeric value for " + envKey + ": " + value);
            return defaultValue;
        }
    }

    public static boolean getBoolean(String envKey, boolean defaultValue) {
        String value = getString(envKey, null);
        return value == null ? defaultValue : Boolean.parseBoolean(value);
    }

    static String propertyKey(String envKey) {
        return envKey.toLowerCase(Locale.ROOT).replace('_', '.');
    }
}
