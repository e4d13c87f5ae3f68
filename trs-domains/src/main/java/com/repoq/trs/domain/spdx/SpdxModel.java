/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.spdx;

import com.repoq.trs.api.model.Domain;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.core.term.AbstractTermModel;
import com.repoq.trs.domain.spdx.SpdxTerm.And;
import com.repoq.trs.domain.spdx.SpdxTerm.LicenseId;
import com.repoq.trs.domain.spdx.SpdxTerm.Or;
import com.repoq.trs.domain.spdx.SpdxTerm.With;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Parser and serializer for SPDX license expressions.
 *
 * <p>Operators are case-insensitive on input and upper-case on output. Precedence is
 * {@code WITH > AND > OR}; chains of the same operator nest to the right. Parsing uses an
 * operator stack, so nesting depth is bounded only by memory.
 */
public final class SpdxModel extends AbstractTermModel {

    public SpdxModel() {
        super(Domain.SPDX);
    }

    private enum Kind { ID, AND, OR, WITH, LPAREN, RPAREN }

    private record Token(Kind kind, String text, int offset) {
    }

    @Override
    protected Term doParse(String source) {
        List<Token> tokens = tokenize(source);
        Deque<Term> operands = new ArrayDeque<>();
        Deque<Token> operators = new ArrayDeque<>();
        boolean expectOperand = true;
        Token previous = null;

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            switch (token.kind) {
                case ID -> {
                    if (!expectOperand) {
                        throw error(source, token.offset, "Missing operator before '" + token.text + "'");
                    }
                    operands.push(new LicenseId(token.text));
                    expectOperand = false;
                }
                case LPAREN -> {
                    if (!expectOperand) {
                        throw error(source, token.offset, "Missing operator before '('");
                    }
                    operators.push(token);
                }
                case RPAREN -> {
                    if (expectOperand) {
                        throw error(source, token.offset, "Expected license expression before ')'");
                    }
                    while (!operators.isEmpty() && operators.peek().kind != Kind.LPAREN) {
                        reduce(operands, operators.pop());
                    }
                    if (operators.isEmpty()) {
                        throw error(source, token.offset, "Unbalanced ')'");
                    }
                    operators.pop();
                }
                case AND, OR -> {
                    if (expectOperand) {
                        throw error(source, token.offset, "Dangling operator " + token.kind);
                    }
                    while (!operators.isEmpty() && operators.peek().kind != Kind.LPAREN
                            && precedence(operators.peek().kind) > precedence(token.kind)) {
                        reduce(operands, operators.pop());
                    }
                    operators.push(token);
                    expectOperand = true;
                }
                case WITH -> {
                    if (previous == null || previous.kind != Kind.ID) {
                        throw error(source, token.offset, "WITH must follow a license identifier");
                    }
                    if (i + 1 >= tokens.size() || tokens.get(i + 1).kind != Kind.ID) {
                        throw error(source, token.offset, "WITH must be followed by an exception identifier");
                    }
                    Token exception = tokens.get(++i);
                    operands.push(new With(operands.pop(), exception.text));
                }
                default -> throw new IllegalStateException("Unhandled token " + token.kind);
            }
            previous = token;
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

    private static int precedence(Kind kind) {
        return kind == Kind.AND ? 2 : 1;
    }

    private static void reduce(Deque<Term> operands, Token operator) {
        Term right = operands.pop();
        Term left = operands.pop();
        operands.push(operator.kind == Kind.AND ? new And(left, right) : new Or(left, right));
    }

    private List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                tokens.add(new Token(Kind.LPAREN, "(", i++));
            } else if (c == ')') {
                tokens.add(new Token(Kind.RPAREN, ")", i++));
            } else if (isIdentifierChar(c)) {
                int start = i;
                while (i < source.length() && isIdentifierChar(source.charAt(i))) {
                    i++;
                }
                String word = source.substring(start, i);
                tokens.add(new Token(keyword(word), word, start));
            } else {
                throw error(source, i, "Illegal character '" + c + "'");
            }
        }
        return tokens;
    }

    private static Kind keyword(String word) {
        switch (word.toUpperCase(Locale.ROOT)) {
            case SpdxTerm.OP_AND:
                return Kind.AND;
            case SpdxTerm.OP_OR:
                return Kind.OR;
            case SpdxTerm.OP_WITH:
                return Kind.WITH;
            default:
                return Kind.ID;
        }
    }

    static boolean isIdentifierChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                || c == '.' || c == '-' || c == '+' || c == ':';
    }

    /**
     * Emits the minimal parenthesization that parses back to the same tree: a left operand
     * with its parent's operator, and an {@code OR} under an {@code AND}.
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
            } else if (item instanceof LicenseId id) {
                sb.append(id.id());
            } else if (item instanceof With with) {
                stack.push(" WITH " + with.exception());
                pushOperand(stack, with.license(), !(with.license() instanceof LicenseId));
            } else if (item instanceof And and) {
                pushOperand(stack, and.right(), and.right() instanceof Or);
                stack.push(" AND ");
                pushOperand(stack, and.left(), and.left() instanceof And || and.left() instanceof Or);
            } else if (item instanceof Or or) {
                stack.push(or.right());
                stack.push(" OR ");
                pushOperand(stack, or.left(), or.left() instanceof Or);
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
