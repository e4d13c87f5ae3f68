/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.domain.filter;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Glob syntax shared by the parser, the rules and the oracle.
 *
 * <ul>
 *   <li>{@code *} matches within one path segment, {@code ?} one character of a segment;</li>
 *   <li>a run of two or more stars matches anything; followed by {@code /} it matches zero
 *   or more leading directories;</li>
 *   <li>{@code [abc]}, {@code [a-z]} and {@code [!abc]} are character classes;</li>
 *   <li>{@code {a,b}} is an alternation of glob fragments, not nested.</li>
 * </ul>
 *
 * Patterns and paths are compared after {@link #normalizePath(String)}.
 */
public final class Globs {

    private static final String WILDCARDS = "*?[{";
    private static final LoadingCache<String, Pattern> COMPILED = Caffeine.newBuilder()
            .maximumSize(4_096)
            .build(pattern -> Pattern.compile(toRegex(pattern)));

    private Globs() {
        throw new AssertionError("No instances");
    }

    public static boolean hasWildcard(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (WILDCARDS.indexOf(text.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Drops empty and {@code .} segments, so repeated separators, {@code ./} anywhere and a
     * trailing {@code /} disappear. A leading {@code /} is kept; a path with no segment left
     * is {@code .}.
     */
    public static String normalizePath(String path) {
        boolean absolute = path.startsWith("/");
        StringBuilder sb = new StringBuilder(path.length());
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append('/');
            }
            sb.append(segment);
        }
        if (absolute) {
            return "/" + sb;
        }
        return sb.length() == 0 ? "." : sb.toString();
    }

    /**
     * Canonical spelling of a valid pattern: normalized separators, star runs of three or
     * more and {@code **}{@code /**} collapsed to {@code **}, character class members sorted
     * and deduplicated.
     */
    public static String canonical(String pattern) {
        String current = normalizePath(pattern);
        while (true) {
            String next = current.replaceAll("\\*{3,}", "**").replace("**/**", "**");
            if (next.equals(current)) {
                break;
            }
            current = next;
        }
        return sortClasses(current);
    }

    /**
     * Throws {@link IllegalArgumentException} naming the offending offset if the pattern is
     * not a valid glob.
     */
    public static void validate(String pattern) {
        toRegex(pattern);
    }

    /**
     * Whether every path matched by {@code inner} is matched by {@code outer}, as far as
     * prefix and suffix shapes prove it: {@code src/**} contains {@code src/main/**} and
     * {@code src/*.java}, {@code **}{@code /*.java} contains {@code src/**}{@code /*.java}.
     * A {@code false} answer means "not proven".
     */
    public static boolean subsumes(String outer, String inner) {
        String o = canonical(outer);
        String i = canonical(inner);
        if (o.equals(i) || o.equals("**")) {
            return true;
        }
        if (o.endsWith("/**")) {
            String prefix = o.substring(0, o.length() - 2);
            if (!hasWildcard(prefix) && i.length() > prefix.length() && i.startsWith(prefix)) {
                return true;
            }
        }
        if (o.startsWith("**/")) {
            String segment = o.substring(3);
            return isPlainSegment(segment) && lastSegmentIs(i, segment);
        }
        return false;
    }

    private static boolean isPlainSegment(String segment) {
        return !segment.isEmpty() && !segment.contains("/") && !segment.contains("**")
                && segment.indexOf('{') < 0 && segment.indexOf('[') < 0;
    }

    /**
     * Whether every path {@code pattern} matches ends in a segment matched by {@code segment}.
     */
    private static boolean lastSegmentIs(String pattern, String segment) {
        if (pattern.indexOf('{') >= 0 || pattern.indexOf('[') >= 0) {
            return false;
        }
        int slash = pattern.lastIndexOf('/');
        if (!pattern.substring(slash + 1).equals(segment)) {
            return false;
        }
        if (slash < 0) {
            return true;
        }
        String head = pattern.substring(0, slash);
        int run = head.length();
        while (run > 0 && head.charAt(run - 1) == '*') {
            run--;
        }
        // "a**/x" may match "ax": a star run before the last slash must start a segment
        return head.length() - run < 2 || run == 0 || head.charAt(run - 1) == '/';
    }

    public static boolean matches(String pattern, String path) {
        return COMPILED.get(normalizePath(pattern)).matcher(normalizePath(path)).matches();
    }

    static String toRegex(String pattern) {
        StringBuilder sb = new StringBuilder();
        int end = translate(pattern, 0, false, sb);
        if (end != pattern.length()) {
            throw new GlobException(end, "Unbalanced '" + pattern.charAt(end) + "'");
        }
        return sb.toString();
    }

    /**
     * Translates from {@code start} until the end, or inside braces until an unconsumed
     * {@code ,} or {@code }}. Returns the index where translation stopped.
     */
    private static int translate(String p, int start, boolean inBraces, StringBuilder sb) {
        int i = start;
        while (i < p.length()) {
            char c = p.charAt(i);
            switch (c) {
                case '*' -> {
                    int run = i;
                    while (i < p.length() && p.charAt(i) == '*') {
                        i++;
                    }
                    if (i - run == 1) {
                        sb.append("[^/]*");
                    } else if (i < p.length() && p.charAt(i) == '/') {
                        sb.append("(?:.*/)?");
                        i++;
                    } else {
                        sb.append(".*");
                    }
                }
                case '?' -> {
                    sb.append("[^/]");
                    i++;
                }
                case '[' -> i = characterClass(p, i, sb);
                case '{' -> {
                    if (inBraces) {
                        throw new GlobException(i, "Nested '{'");
                    }
                    int open = i++;
                    if (i < p.length() && p.charAt(i) == '}') {
                        throw new GlobException(open, "Empty alternation");
                    }
                    sb.append("(?:");
                    while (true) {
                        i = translate(p, i, true, sb);
                        if (i >= p.length()) {
                            throw new GlobException(open, "Unbalanced '{'");
                        }
                        char stop = p.charAt(i++);
                        if (stop == '}') {
                            break;
                        }
                        if (stop != ',') {
                            throw new GlobException(i - 1, "Unbalanced '" + stop + "'");
                        }
                        sb.append('|');
                    }
                    sb.append(')');
                }
                case ',' -> {
                    if (inBraces) {
                        return i;
                    }
                    sb.append(escape(c));
                    i++;
                }
                case '}', ']' -> {
                    return i;
                }
                default -> {
                    sb.append(escape(c));
                    i++;
                }
            }
        }
        return i;
    }

    private static int characterClass(String p, int open, StringBuilder sb) {
        int close = p.indexOf(']', open + 1);
        if (close < 0) {
            throw new GlobException(open, "Unbalanced '['");
        }
        String body = p.substring(open + 1, close);
        boolean negated = body.startsWith("!");
        List<String> items = classItems(negated ? body.substring(1) : body, open);
        if (items.isEmpty()) {
            throw new GlobException(open, "Empty character class");
        }
        sb.append(negated ? "[^" : "[");
        for (String item : items) {
            if (item.length() == 3) {
                sb.append(escape(item.charAt(0))).append('-').append(escape(item.charAt(2)));
            } else {
                sb.append(escape(item.charAt(0)));
            }
        }
        sb.append(negated ? "/]" : "]");
        return close + 1;
    }

    /**
     * Single characters and {@code x-y} ranges.
     */
    private static List<String> classItems(String body, int offset) {
        List<String> items = new ArrayList<>();
        int i = 0;
        while (i < body.length()) {
            if (i + 2 < body.length() && body.charAt(i + 1) == '-') {
                if (body.charAt(i) > body.charAt(i + 2) || body.charAt(i) == '-' || body.charAt(i + 2) == '-') {
                    throw new GlobException(offset, "Bad range '" + body.substring(i, i + 3) + "'");
                }
                items.add(body.substring(i, i + 3));
                i += 3;
            } else {
                items.add(String.valueOf(body.charAt(i)));
                i++;
            }
        }
        return items;
    }

    private static String sortClasses(String pattern) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i);
            int close = c == '[' ? pattern.indexOf(']', i + 1) : -1;
            if (close < 0) {
                sb.append(c);
                i++;
                continue;
            }
            String body = pattern.substring(i + 1, close);
            boolean negated = body.startsWith("!");
            TreeSet<String> sorted = new TreeSet<>(classItems(negated ? body.substring(1) : body, i));
            List<String> items = new ArrayList<>();
            if (sorted.remove("-")) {
                items.add("-");
            }
            items.addAll(sorted);
            if (!negated && items.get(0).startsWith("!")) {
                items.add(items.remove(0));
            }
            sb.append('[').append(negated ? "!" : "").append(String.join("", items)).append(']');
            i = close + 1;
        }
        return sb.toString();
    }

    private static String escape(char c) {
        if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '/') {
            return String.valueOf(c);
        }
        if (c > 0x7e) {
            return String.format("\\x{%x}", (int) c);
        }
        return "\\" + c;
    }

    /**
     * Invalid glob with the offset of the offending character.
     */
    static final class GlobException extends IllegalArgumentException {
        private final int offset;

        GlobException(int offset, String message) {
            super(message);
            this.offset = offset;
        }

        int offset() {
            return offset;
        }
    }
}
