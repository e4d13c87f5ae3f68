/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.verifier.fixtures;

import com.repoq.trs.api.model.Term;
import com.repoq.trs.core.term.AbstractTermModel;

/**
 * Prefix syntax for {@link Arith}: {@code 0}, {@code s(t)}, {@code +(a,b)}; no whitespace.
 */
public final class ArithModel extends AbstractTermModel {

    public ArithModel() {
        super(Arith.DOMAIN);
    }

    @Override
    protected Term doParse(String source) {
        String text = source.strip();
        int[] cursor = {0};
        Term term = parseTerm(text, cursor);
        if (cursor[0] != text.length()) {
            throw error(source, cursor[0], "Trailing input");
        }
        return term;
    }

    private Term parseTerm(String text, int[] cursor) {
        if (cursor[0] >= text.length()) {
            throw error(text, cursor[0], "Unexpected end of input");
        }
        char c = text.charAt(cursor[0]++);
        switch (c) {
            case '0':
                return Arith.zero();
            case 's': {
                expect(text, cursor, '(');
                Term arg = parseTerm(text, cursor);
                expect(text, cursor, ')');
                return Arith.s(arg);
            }
            case '+': {
                expect(text, cursor, '(');
                Term left = parseTerm(text, cursor);
                expect(text, cursor, ',');
                Term right = parseTerm(text, cursor);
                expect(text, cursor, ')');
                return Arith.add(left, right);
            }
            default:
                throw error(text, cursor[0] - 1, "Unexpected character '" + c + "'");
        }
    }

    private void expect(String text, int[] cursor, char expected) {
        if (cursor[0] >= text.length() || text.charAt(cursor[0]) != expected) {
            throw error(text, cursor[0], "Expected '" + expected + "'");
        }
        cursor[0]++;
    }

    @Override
    protected String doSerialize(Term term) {
        if (term instanceof Arith.Zero) {
            return "0";
        }
        if (term instanceof Arith.Succ succ) {
            return "s(" + doSerialize(succ.arg()) + ")";
        }
        if (term instanceof Arith.Add addition) {
            return "+(" + doSerialize(addition.left()) + "," + doSerialize(addition.right()) + ")";
        }
        throw foreign(term);
    }
}
