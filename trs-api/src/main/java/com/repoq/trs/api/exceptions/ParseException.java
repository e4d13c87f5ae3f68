/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.api.exceptions;

import com.repoq.trs.api.model.Domain;

/**
 * Malformed surface syntax. Raised by {@code TermModel.parse} and never retried.
 */
public class ParseException extends RuntimeException {

    private final Domain domain;
    private final String input;
    private final int offset;

    public ParseException(Domain domain, String input, int offset, String message) {
        super(format(domain, input, offset, message));
        this.domain = domain;
        this.input = input;
        this.offset = offset;
    }

    public ParseException(Domain domain, String input, int offset, String message, Throwable cause) {
        super(format(domain, input, offset, message), cause);
        this.domain = domain;
        this.input = input;
        this.offset = offset;
    }

    public Domain domain() {
        return domain;
    }

    public String input() {
        return input;
    }

    /**
     * Character offset of the error in the input, or -1 when not attributable.
     */
    public int offset() {
        return offset;
    }

    private static String format(Domain domain, String input, int offset, String message) {
        String where = offset >= 0 ? " at offset " + offset : "";
        return "[" + (domain == null ? "?" : domain.id()) + "] " + message + where
                + " in '" + excerpt(input) + "'";
    }

    private static String excerpt(String input) {
        if (input == null) {
            return "";
        }
        return input.length() <= 80 ? input : input.substring(0, 77) + "...";
    }
}
