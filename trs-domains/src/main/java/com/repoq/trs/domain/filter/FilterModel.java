/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.filter;

import com.repoq.trs.api.exceptions.ParseException;
import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.core.term.AbstractTermModel;
import com.repoq.trs.domain.filter.FilterTerm.Glob;
import com.repoq.trs.domain.filter.FilterTerm.Intersect;
import com.repoq.trs.domain.filter.FilterTerm.MatchAll;
import com.repoq.trs.domain.filter.FilterTerm.MatchNone;
import com.repoq.trs.domain.filter.FilterTerm.Negate;
import com.repoq.trs.domain.filter.FilterTerm.PathLiteral;
import com.repoq.trs.domain.filter.FilterTerm.Union;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Parser and serializer for path filters.
 *
 * <p>Operands are whitespace-free tokens: {@code **} matches everything, {@code {}} nothing,
 * a token with {@code * ? [ {} is a glob and anything else a path literal. Operators are
 * {@code !} (complement), {@code &} (intersection) and {@code |} (union), in decreasing
 * precedence; chains nest to the right.
 */
public final class FilterModel extends AbstractTermModel {

    private static final String DELIMITERS = "()|&";

    public FilterModel() {
        super(Domain.FILTER);
    }

    private enum Kind { OPERAND, UNION, INTERSECT, NOT, LPAREN, RPAREN }

    private record Token(Kind kind, Term operand, int offset) {
    }

    @Override
    protected Term doParse(String source) {
        Deque<Term> operands = new ArrayDeque<>();
        Deque<Token> operators = new ArrayDeque<>();
        boolean expectOperand = true;

        for (Token token : tokenize(source)) {
            switch (token.kind) {
                case OPERAND -> {
                    if (!expectOperand) {
                        throw error(source, token.offset, "Missing operator before '" + token.operand + "'");
                    }
                    operands.push(token.operand);
                    expectOperand = false;
                    reduceNegations(operands, operators);
                }
                case NOT, LPAREN -> {
                    if (!expectOperand) {
                        throw error(source, token.offset, "Missing operator before '" + symbol(token.kind) + "'");
                    }
                    operators.push(token);
                }
                case RPAREN -> {
                    if (expectOperand) {
                        throw error(source, token.offset, "Expected a filter before ')'");
                    }
                    while (!operators.isEmpty() && operators.peek().kind != Kind.LPAREN) {
                        reduce(operands, operators.pop());
                    }
                    if (operators.isEmpty()) {
                        throw error(source, token.offset, "Unbalanced ')'");
                    }
                    operators.pop();
                    reduceNegations(operands, operators);
                }
                case UNION, INTERSECT -> {
                    if (expectOperand) {
                        throw error(source, token.offset, "Dangling operator '" + symbol(token.kind) + "'");
                    }
                    while (!operators.isEmpty() && operators.peek().kind != Kind.LPAREN
                            && precedence(operators.peek().kind) > precedence(token.kind)) {
                        reduce(operands, operators.pop());
                    }
                    operators.push(token);
                    expectOperand = true;
                }
                default -> throw new IllegalStateException("Unhandled token " + token.kind);
            }
        }

        if (expectOperand) {
            throw error(source, source.length(), "Dangling operator at end of input");
        }
        while (!operators.isEmpty()) {
            Token op = operators.pop();
            if (op.kind == Kind.LPAREN) {
                throw error(source, op.offset, "Unbalanced '('");
            }
            reduce(operands, op);
        }
        return operands.pop();
    }

    /**
     * A complete operand binds every {@code !} directly in front of it.
     */
    private static void reduceNegations(Deque<Term> operands, Deque<Token> operators) {
        while (!operators.isEmpty() && operators.peek().kind == Kind.NOT) {
            operators.pop();
            operands.push(new Negate(operands.pop()));
        }
    }

    private static int precedence(Kind kind) {
        return kind == Kind.INTERSECT ? 2 : 1;
    }

    private static void reduce(Deque<Term> operands, Token operator) {
        Term right = operands.pop();
        Term left = operands.pop();
        operands.push(operator.kind == Kind.INTERSECT ? new Intersect(left, right) : new Union(left, right));
    }

    private static String symbol(Kind kind) {
        switch (kind) {
            case UNION:
                return "|";
            case INTERSECT:
                return "&";
            case NOT:
                return "!";
            case LPAREN:
                return "(";
            default:
                return ")";
        }
    }

    private List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                tokens.add(new Token(Kind.LPAREN, null, i++));
            } else if (c == ')') {
                tokens.add(new Token(Kind.RPAREN, null, i++));
            } else if (c == '|') {
                tokens.add(new Token(Kind.UNION, null, i++));
            } else if (c == '&') {
                tokens.add(new Token(Kind.INTERSECT, null, i++));
            } else if (c == '!') {
                tokens.add(new Token(Kind.NOT, null, i++));
            } else {
                int start = i;
                boolean inClass = false;
                while (i < source.length()) {
                    char d = source.charAt(i);
                    if (Character.isWhitespace(d) || DELIMITERS.indexOf(d) >= 0 || (d == '!' && !inClass)) {
                        break;
                    }
                    if (d == '[') {
                        inClass = true;
                    } else if (d == ']') {
                        inClass = false;
                    }
                    i++;
                }
                tokens.add(new Token(Kind.OPERAND, operand(source, source.substring(start, i), start), start));
            }
        }
        return tokens;
    }

    private Term operand(String source, String word, int offset) {
        if (word.equals("**")) {
            return new MatchAll();
        }
        if (word.equals("{}")) {
            return new MatchNone();
        }
        if (!Globs.hasWildcard(word)) {
            return new PathLiteral(word);
        }
        try {
            Globs.validate(word);
        } catch (Globs.GlobException e) {
            throw new ParseException(Domain.FILTER, source, offset + e.offset(), e.getMessage(), e);
        }
        return new Glob(word);
    }

    /**
     * Minimal parentheses: a left operand with its parent's operator, a union under an
     * intersection, and any chain under a negation.
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
            } else if (item instanceof PathLiteral || item instanceof Glob
                    || item instanceof MatchAll || item instanceof MatchNone) {
                sb.append(item);
            } else if (item instanceof Negate negate) {
                Term operand = negate.operand();
                pushOperand(stack, operand, operand instanceof Union || operand instanceof Intersect);
                stack.push("!");
            } else if (item instanceof Intersect intersect) {
                pushOperand(stack, intersect.right(), intersect.right() instanceof Union);
                stack.push(" & ");
                pushOperand(stack, intersect.left(),
                        intersect.left() instanceof Intersect || intersect.left() instanceof Union);
            } else if (item instanceof Union union) {
                stack.push(union.right());
                stack.push(" | ");
                pushOperand(stack, union.left(), union.left() instanceof Union);
            } else {
                throw foreign((Term) item);
            }
        }
        return sb.toString();
    }

    private static void pushOperand(Deque<Object> stack, Term operand, boolean parenthesize) {
        if (parenthesize) {
            stack.push(")");
            stack.push(operand);
            stack.push("(");
        } else {
            stack.push(operand);
        }
    }
}
