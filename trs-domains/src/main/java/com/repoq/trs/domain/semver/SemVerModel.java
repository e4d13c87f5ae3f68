/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.semver;

import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.core.term.AbstractTermModel;
import com.repoq.trs.core.term.Chains;
import com.repoq.trs.domain.semver.SemVerTerm.AnyVersion;
import com.repoq.trs.domain.semver.SemVerTerm.Caret;
import com.repoq.trs.domain.semver.SemVerTerm.EmptyRange;
import com.repoq.trs.domain.semver.SemVerTerm.Hyphen;
import com.repoq.trs.domain.semver.SemVerTerm.Op;
import com.repoq.trs.domain.semver.SemVerTerm.PartialVersion;
import com.repoq.trs.domain.semver.SemVerTerm.Range;
import com.repoq.trs.domain.semver.SemVerTerm.Tilde;
import com.repoq.trs.domain.semver.SemVerTerm.Union;
import com.repoq.trs.domain.semver.SemVerTerm.Version;
import com.repoq.trs.domain.semver.SemVerTerm.VersionComparator;
import com.repoq.trs.domain.semver.SemVerTerm.XRange;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Parser and serializer for npm-style version ranges.
 *
 * <p>Accepted syntax: {@code ||}-separated alternatives, each either a hyphen range
 * {@code a - b} or a whitespace-separated list of comparators ({@code >=1.2.3}), carets,
 * tildes, x-ranges ({@code 1.x}, {@code 1.2.*}, {@code 1.2}) and {@code *}. A leading
 * {@code v} and build metadata are dropped. Partial versions after an operator are widened
 * the npm way, e.g. {@code >1.2} becomes {@code >=1.3.0}.
 *
 * <p>{@code *} and {@code <0.0.0-0} are the surface forms of the universal and the empty range.
 */
public final class SemVerModel extends AbstractTermModel {

    /**
     * Largest accepted version component, the npm limit.
     */
    static final long MAX_COMPONENT = 9007199254740991L;

    private static final String EMPTY_FORM = "<0.0.0-0";

    public SemVerModel() {
        super(Domain.SEMVER);
    }

    private record Token(String text, int offset) {
    }

    @Override
    protected Term doParse(String source) {
        List<Term> alternatives = new ArrayList<>();
        int start = 0;
        while (true) {
            int bar = source.indexOf('|', start);
            int end = bar < 0 ? source.length() : bar;
            String alternative = source.substring(start, end);
            if (alternative.isBlank()) {
                throw error(source, start, bar < 0 ? "Dangling '||' at end of input" : "Empty alternative before '||'");
            }
            alternatives.add(parseSet(source, alternative, start));
            if (bar < 0) {
                break;
            }
            if (bar + 1 >= source.length() || source.charAt(bar + 1) != '|') {
                throw error(source, bar, "Expected '||'");
            }
            start = bar + 2;
        }
        return Chains.build(alternatives, Union::new);
    }

    private Term parseSet(String source, String text, int base) {
        List<Token> tokens = tokenize(source, text, base);
        if (tokens.size() == 3 && tokens.get(1).text.equals("-")) {
            return new Hyphen(hyphenEnd(source, tokens.get(0)), hyphenEnd(source, tokens.get(2)));
        }
        if (tokens.size() == 1 && tokens.get(0).text.equals(EMPTY_FORM)) {
            return new EmptyRange();
        }
        List<Term> items = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            if (token.text.equals("-")) {
                throw error(source, token.offset, "Hyphen range needs exactly one version on each side");
            }
            items.add(parseSimple(source, token));
        }
        return Chains.build(items, Range::new);
    }

    /**
     * Whitespace split that re-attaches a detached operator ({@code ">= 1.2.3"}).
     */
    private List<Token> tokenize(String source, String text, int base) {
        List<Token> raw = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            if (Character.isWhitespace(text.charAt(i))) {
                i++;
                continue;
            }
            int start = i;
            while (i < text.length() && !Character.isWhitespace(text.charAt(i))) {
                i++;
            }
            raw.add(new Token(text.substring(start, i), base + start));
        }
        List<Token> tokens = new ArrayList<>(raw.size());
        for (int k = 0; k < raw.size(); k++) {
            Token token = raw.get(k);
            if (isOperatorOnly(token.text)) {
                if (k + 1 >= raw.size()) {
                    throw error(source, token.offset, "Dangling operator '" + token.text + "'");
                }
                Token next = raw.get(++k);
                tokens.add(new Token(token.text + next.text, token.offset));
            } else {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static boolean isOperatorOnly(String text) {
        switch (text) {
            case ">":
            case ">=":
            case "<":
            case "<=":
            case "=":
            case "^":
            case "~":
            case "~>":
                return true;
            default:
                return false;
        }
    }

    private Term parseSimple(String source, Token token) {
        String text = token.text;
        if (text.startsWith("^")) {
            return new Caret(versionOperand(source, text.substring(1), token.offset + 1));
        }
        if (text.startsWith("~>")) {
            return new Tilde(versionOperand(source, text.substring(2), token.offset + 2));
        }
        if (text.startsWith("~")) {
            return new Tilde(versionOperand(source, text.substring(1), token.offset + 1));
        }
        Op op = null;
        int skip = 0;
        if (text.startsWith(">=")) {
            op = Op.GTE;
            skip = 2;
        } else if (text.startsWith("<=")) {
            op = Op.LTE;
            skip = 2;
        } else if (text.startsWith(">")) {
            op = Op.GT;
            skip = 1;
        } else if (text.startsWith("<")) {
            op = Op.LT;
            skip = 1;
        } else if (text.startsWith("=")) {
            op = Op.EQ;
            skip = 1;
        }
        String rest = text.substring(skip);
        int offset = token.offset + skip;
        if (isWildcard(rest)) {
            return op == Op.GT || op == Op.LT ? new EmptyRange() : new AnyVersion();
        }
        Term operand = parseVersion(source, rest, offset);
        if (operand instanceof Version version) {
            return new VersionComparator(op == null ? Op.EQ : op, version);
        }
        PartialVersion partial = (PartialVersion) operand;
        if (op == null || op == Op.EQ) {
            return new XRange(partial);
        }
        switch (op) {
            case GTE:
                return VersionComparator.of(Op.GTE, start(partial));
            case GT:
                return VersionComparator.of(Op.GTE, next(partial));
            case LT:
                return VersionComparator.of(Op.LT, start(partial).floor());
            default:
                return VersionComparator.of(Op.LT, next(partial).floor());
        }
    }

    private Term versionOperand(String source, String text, int offset) {
        if (text.isEmpty()) {
            throw error(source, offset, "Missing version");
        }
        if (isWildcard(text)) {
            throw error(source, offset, "Caret and tilde need a major version");
        }
        return parseVersion(source, text, offset);
    }

    private Term hyphenEnd(String source, Token token) {
        if (isWildcard(token.text)) {
            throw error(source, token.offset, "Hyphen range bounds must be versions");
        }
        return parseVersion(source, token.text, token.offset);
    }

    /**
     * First version of a partial's series.
     */
    static Version start(PartialVersion partial) {
        return Version.of(partial.major(), partial.minor() == null ? 0 : partial.minor(), 0);
    }

    /**
     * First version of the series after a partial's series.
     */
    static Version next(PartialVersion partial) {
        return partial.minor() == null
                ? Version.of(partial.major() + 1, 0, 0)
                : Version.of(partial.major(), partial.minor() + 1, 0);
    }

    private static boolean isWildcard(String text) {
        return text.equals("*") || text.equals("x") || text.equals("X");
    }

    /**
     * A full {@link Version} or, when minor or patch is missing or a wildcard, a
     * {@link PartialVersion}.
     */
    Term parseVersion(String source, String text, int offset) {
        String body = text;
        int at = offset;
        if (body.startsWith("v") || body.startsWith("V")) {
            body = body.substring(1);
            at++;
        }
        int plus = body.indexOf('+');
        if (plus >= 0) {
            checkIdentifiers(source, body.substring(plus + 1), at + plus + 1, "build metadata", false);
            body = body.substring(0, plus);
        }
        String prerelease = "";
        int dash = body.indexOf('-');
        if (dash >= 0) {
            prerelease = body.substring(dash + 1);
            checkIdentifiers(source, prerelease, at + dash + 1, "prerelease", true);
            body = body.substring(0, dash);
        }

        String[] parts = body.split("\\.", -1);
        if (parts.length > 3) {
            throw error(source, at, "Too many version components in '" + text + "'");
        }
        long[] numbers = new long[3];
        int given = 0;
        int partOffset = at;
        for (String part : parts) {
            if (isWildcard(part)) {
                break;
            }
            numbers[given++] = component(source, part, partOffset);
            partOffset += part.length() + 1;
        }
        for (int k = given; k < parts.length; k++) {
            if (!isWildcard(parts[k])) {
                throw error(source, at, "Version component after a wildcard in '" + text + "'");
            }
        }
        if (given == 3) {
            return new Version(numbers[0], numbers[1], numbers[2], prerelease);
        }
        if (given == 0) {
            throw error(source, at, "Missing major version in '" + text + "'");
        }
        if (!prerelease.isEmpty()) {
            throw error(source, at + dash, "Prerelease needs a full version");
        }
        return new PartialVersion(numbers[0], given == 2 ? numbers[1] : null);
    }

    private long component(String source, String part, int offset) {
        if (part.isEmpty()) {
            throw error(source, offset, "Empty version component");
        }
        for (int k = 0; k < part.length(); k++) {
            if (part.charAt(k) < '0' || part.charAt(k) > '9') {
                throw error(source, offset + k, "Non-numeric version component '" + part + "'");
            }
        }
        if (part.length() > 1 && part.charAt(0) == '0') {
            throw error(source, offset, "Leading zero in version component '" + part + "'");
        }
        if (part.length() > 16 || Long.parseLong(part) > MAX_COMPONENT) {
            throw error(source, offset, "Version component too large: " + part);
        }
        return Long.parseLong(part);
    }

    private void checkIdentifiers(String source, String text, int offset, String what, boolean numericRule) {
        int at = offset;
        for (String identifier : text.split("\\.", -1)) {
            if (identifier.isEmpty()) {
                throw error(source, at, "Empty " + what + " identifier");
            }
            for (int k = 0; k < identifier.length(); k++) {
                char c = identifier.charAt(k);
                if (!((c >= '0' && c <= '9') || (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '-')) {
                    throw error(source, at + k, "Illegal character '" + c + "' in " + what);
                }
            }
            if (numericRule && Version.isNumeric(identifier) && identifier.length() > 1 && identifier.charAt(0) == '0') {
                throw error(source, at, "Leading zero in numeric " + what + " identifier '" + identifier + "'");
            }
            at += identifier.length() + 1;
        }
    }

    @Override
    protected String doSerialize(Term term) {
        if (term instanceof Union) {
            StringJoiner joiner = new StringJoiner(" || ");
            for (Term alternative : Chains.flatOperands(term)) {
                joiner.add(serializeSet(alternative));
            }
            return joiner.toString();
        }
        return serializeSet(term);
    }

    private String serializeSet(Term term) {
        if (term instanceof Range) {
            StringJoiner joiner = new StringJoiner(" ");
            for (Term item : Chains.flatOperands(term)) {
                joiner.add(serializeSimple(item));
            }
            return joiner.toString();
        }
        return serializeSimple(term);
    }

    private String serializeSimple(Term term) {
        if (term instanceof VersionComparator comparator) {
            if (!(comparator.version() instanceof Version)) {
                throw new IllegalArgumentException("Comparator needs a full version: " + term);
            }
            String version = comparator.version().toString();
            return comparator.op() == Op.EQ ? version : comparator.op().symbol() + version;
        }
        if (term instanceof AnyVersion) {
            return "*";
        }
        if (term instanceof EmptyRange) {
            return EMPTY_FORM;
        }
        if (term instanceof Caret caret) {
            return "^" + serializeOperand(caret.version());
        }
        if (term instanceof Tilde tilde) {
            return "~" + serializeOperand(tilde.version());
        }
        if (term instanceof XRange xRange) {
            if (!(xRange.partial() instanceof PartialVersion)) {
                throw new IllegalArgumentException("X-range needs a partial version: " + term);
            }
            return xRange.partial() + ".x";
        }
        if (term instanceof Hyphen hyphen) {
            return serializeOperand(hyphen.low()) + " - " + serializeOperand(hyphen.high());
        }
        if (term instanceof Version || term instanceof PartialVersion) {
            // "1.2.3" reads back as "=1.2.3" and "1.2" as "1.2.x"
            throw new IllegalArgumentException("A bare version is not a range: " + term);
        }
        if (term instanceof Range || term instanceof Union) {
            throw new IllegalArgumentException("Nested range cannot be written in range syntax: " + term);
        }
        throw foreign(term);
    }

    private String serializeOperand(Term operand) {
        if (operand instanceof Version || operand instanceof PartialVersion) {
            return operand.toString();
        }
        throw new IllegalArgumentException("Expected a version, got: " + operand);
    }
}
