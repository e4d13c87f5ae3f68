/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.metrics;

import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.core.term.AbstractTermModel;
import com.repoq.trs.domain.metrics.MetricTerm.Aggregate;
import com.repoq.trs.domain.metrics.MetricTerm.NumberLiteral;
import com.repoq.trs.domain.metrics.MetricTerm.Variable;
import com.repoq.trs.domain.metrics.MetricTerm.Weighted;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/**
 * Parser and serializer for metric formulas.
 *
 * <pre>
 * expr   := term (('+' | '-') term)*
 * term   := factor (('*' | '/') factor)*
 * factor := number | '-' factor | name | fn '(' ['['] expr (',' expr)* [']'] ')' | '(' expr ')'
 * </pre>
 *
 * <p>{@code a + b - c} becomes {@code sum(a, b, -1*c)}. In a product one side must be a
 * number or a variable and becomes the weight; a divisor must be a non-zero number.
 */
public final class MetricsModel extends AbstractTermModel {

    static final int MAX_DEPTH = 200;

    private static final NumberLiteral MINUS_ONE = NumberLiteral.of("-1");

    public MetricsModel() {
        super(Domain.METRICS);
    }

    @Override
    protected Term doParse(String source) {
        Parser parser = new Parser(source);
        Term term = parser.expr();
        parser.skipSpace();
        if (parser.pos < source.length()) {
            throw error(source, parser.pos, "Unexpected '" + source.charAt(parser.pos) + "'");
        }
        return term;
    }

    private final class Parser {
        private final String source;
        private int pos;
        private int depth;

        Parser(String source) {
            this.source = source;
        }

        Term expr() {
            List<Term> terms = new ArrayList<>();
            terms.add(term());
            while (true) {
                skipSpace();
                if (peek('+')) {
                    pos++;
                    terms.add(term());
                } else if (peek('-')) {
                    pos++;
                    terms.add(negate(term()));
                } else {
                    break;
                }
            }
            return terms.size() == 1 ? terms.get(0) : new Aggregate(MetricTerm.SUM, terms);
        }

        private Term term() {
            Term left = factor();
            while (true) {
                skipSpace();
                int at = pos;
                if (peek('*')) {
                    pos++;
                    left = product(left, factor(), at);
                } else if (peek('/')) {
                    pos++;
                    Term divisor = factor();
                    if (!(divisor instanceof NumberLiteral number)) {
                        throw error(source, at, "Divisor must be a number");
                    }
                    if (number.isZero()) {
                        throw error(source, at, "Division by zero");
                    }
                    left = new Weighted(left, NumberLiteral.quotient(BigDecimal.ONE, number.value()));
                } else {
                    return left;
                }
            }
        }

        private Term product(Term left, Term right, int at) {
            if (left instanceof NumberLiteral) {
                return new Weighted(right, left);
            }
            if (right instanceof NumberLiteral) {
                return new Weighted(left, right);
            }
            if (left instanceof Variable) {
                return new Weighted(right, left);
            }
            if (right instanceof Variable) {
                return new Weighted(left, right);
            }
            throw error(source, at, "A weight must be a number or a variable");
        }

        private Term factor() {
            skipSpace();
            if (pos >= source.length()) {
                throw error(source, pos, "Unexpected end of input");
            }
            char c = source.charAt(pos);
            if (c == '-') {
                pos++;
                if (pos < source.length() && isDigit(source.charAt(pos))) {
                    return new NumberLiteral(number().value().negate());
                }
                return negate(nested(this::factor));
            }
            if (isDigit(c)) {
                return number();
            }
            if (c == '(') {
                int open = pos++;
                Term inner = nested(this::expr);
                skipSpace();
                if (!peek(')')) {
                    throw error(source, open, "Unbalanced '('");
                }
                pos++;
                return inner;
            }
            if (isNameStart(c)) {
                int start = pos;
                while (pos < source.length() && isNamePart(source.charAt(pos))) {
                    pos++;
                }
                String name = source.substring(start, pos);
                skipSpace();
                if (!peek('(')) {
                    return new Variable(name);
                }
                if (!MetricTerm.FUNCTIONS.contains(name)) {
                    throw error(source, start, "Unknown aggregate function '" + name + "'");
                }
                pos++;
                return new Aggregate(name, nested(() -> arguments(name, start)));
            }
            throw error(source, pos, "Unexpected '" + c + "'");
        }

        private List<Term> arguments(String function, int start) {
            skipSpace();
            boolean bracketed = peek('[');
            if (bracketed) {
                pos++;
                skipSpace();
            }
            if (peek(bracketed ? ']' : ')')) {
                throw error(source, start, function + "() needs at least one argument");
            }
            List<Term> args = new ArrayList<>();
            args.add(expr());
            skipSpace();
            while (peek(',')) {
                pos++;
                args.add(expr());
                skipSpace();
            }
            if (bracketed) {
                if (!peek(']')) {
                    throw error(source, pos, "Expected ']'");
                }
                pos++;
                skipSpace();
            }
            if (!peek(')')) {
                throw error(source, start, "Unbalanced '(' after " + function);
            }
            pos++;
            return args;
        }

        private <T> T nested(Supplier<T> body) {
            if (++depth > MAX_DEPTH) {
                throw error(source, pos, "Nesting deeper than " + MAX_DEPTH);
            }
            T result = body.get();
            depth--;
            return result;
        }

        private NumberLiteral number() {
            int start = pos;
            while (pos < source.length() && isDigit(source.charAt(pos))) {
                pos++;
            }
            if (peek('.')) {
                pos++;
                int fraction = pos;
                while (pos < source.length() && isDigit(source.charAt(pos))) {
                    pos++;
                }
                if (pos == fraction) {
                    throw error(source, start, "Malformed number '" + source.substring(start, pos) + "'");
                }
            }
            return NumberLiteral.of(source.substring(start, pos));
        }

        private boolean peek(char c) {
            return pos < source.length() && source.charAt(pos) == c;
        }

        void skipSpace() {
            while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
                pos++;
            }
        }
    }

    static Term negate(Term term) {
        if (term instanceof NumberLiteral number) {
            return new NumberLiteral(number.value().negate());
        }
        return new Weighted(term, MINUS_ONE);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isNameStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isNamePart(char c) {
        return isNameStart(c) || isDigit(c) || c == '.';
    }

    /**
     * {@code fn(a, b)} for aggregates, {@code w*expr} for weights, with parentheses only
     * around a weighted operand of a weight.
     */
    @Override
    protected String doSerialize(Term term) {
        StringBuilder sb = new StringBuilder();
        Deque<Object> stack = new ArrayDeque<>();
        stack.push(term);
        while (!stack.isEmpty()) {
            Object item = stack.pop();
            if (item instanceof String text) {
                sb.append(text);
            } else if (item instanceof NumberLiteral || item instanceof Variable) {
                sb.append(item);
            } else if (item instanceof Aggregate aggregate) {
                stack.push(")");
                List<Term> args = aggregate.args();
                for (int i = args.size() - 1; i >= 0; i--) {
                    stack.push(args.get(i));
                    if (i > 0) {
                        stack.push(", ");
                    }
                }
                stack.push(aggregate.function() + "(");
            } else if (item instanceof Weighted weighted) {
                if (!(weighted.weight() instanceof NumberLiteral) && !(weighted.weight() instanceof Variable)) {
                    throw foreign(weighted.weight());
                }
                if (weighted.expr() instanceof Weighted) {
                    stack.push(")");
                    stack.push(weighted.expr());
                    stack.push("(");
                } else {
                    stack.push(weighted.expr());
                }
                stack.push(weighted.weight() + "*");
            } else {
                throw foreign((Term) item);
            }
        }
        return sb.toString();
    }
}
