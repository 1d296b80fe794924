package com.bko.delegation.orchestration.parsing;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Text-level repairs for JSON written by language models. Each method is pure and returns its input
 * unchanged when there is nothing to repair.
 */
final class JsonRepairs {

    private static final Pattern TRAILING_COMMA = Pattern.compile(",(\\s*[}\\]])");
    private static final Pattern BARE_KEY = Pattern.compile("([{,]\\s*)([A-Za-z_]\\w*)(\\s*:)");

    private JsonRepairs() {}

    /**
     * Complete top-level objects found in the text, largest first. Braces inside double-quoted strings are
     * ignored once an object has been entered.
     */
    static List<String> balancedObjects(String text) {
        List<String> objects = new ArrayList<>();
        scanObjects(text, objects);
        objects.sort(Comparator.comparingInt(String::length).reversed());
        return objects;
    }

    /**
     * The span worth repairing: the longest of the complete objects and a trailing unterminated object, or the
     * whole text when it holds no opening brace.
     */
    static String repairBase(String text) {
        List<String> objects = new ArrayList<>();
        int unterminated = scanObjects(text, objects);
        String base = unterminated >= 0 ? text.substring(unterminated) : null;
        for (String object : objects) {
            if (base == null || object.length() > base.length()) {
                base = object;
            }
        }
        return base == null ? text : base;
    }

    /**
     * Collects complete top-level objects and returns the start of a trailing unterminated one, or -1.
     */
    private static int scanObjects(String text, List<String> objects) {
        int depth = 0;
        int start = -1;
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (depth == 0) {
                if (c == '{') {
                    start = i;
                    depth = 1;
                }
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '{', '[' -> depth++;
                case '}', ']' -> {
                    depth--;
                    if (depth == 0) {
                        objects.add(text.substring(start, i + 1));
                        start = -1;
                    }
                }
                default -> {
                }
            }
        }
        return depth > 0 ? start : -1;
    }

    static String removeTrailingCommas(String text) {
        return TRAILING_COMMA.matcher(text).replaceAll("$1");
    }

    static String quoteBareKeys(String text) {
        return BARE_KEY.matcher(text).replaceAll("$1\"$2\"$3");
    }

    /**
     * Turns single-quoted strings into double-quoted ones. Apostrophes inside double-quoted strings are kept.
     */
    static String convertSingleQuotes(String text) {
        StringBuilder out = new StringBuilder(text.length());
        boolean inDouble = false;
        boolean inSingle = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (escaped) {
                out.append(c);
                escaped = false;
                continue;
            }
            if (c == '\\') {
                out.append(c);
                escaped = true;
                continue;
            }
            if (inSingle) {
                if (c == '\'') {
                    inSingle = false;
                    out.append('"');
                } else if (c == '"') {
                    out.append("\\\"");
                } else {
                    out.append(c);
                }
                continue;
            }
            if (c == '"') {
                inDouble = !inDouble;
            } else if (c == '\'' && !inDouble) {
                inSingle = true;
                out.append('"');
                continue;
            }
            out.append(c);
        }
        return out.toString();
    }

    /**
     * Closes an unterminated string and appends the closers for every unmatched brace or bracket. A dangling
     * comma is dropped and a dangling colon gets a null value, since truncation usually cuts right after one.
     */
    static String balanceBrackets(String text) {
        Deque<Character> open = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (escaped) {
                escaped = false;
                continue;
            }
            if (inString) {
                if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '{' -> open.push('}');
                case '[' -> open.push(']');
                case '}', ']' -> {
                    if (!open.isEmpty() && open.peek() == c) {
                        open.pop();
                    }
                }
                default -> {
                }
            }
        }
        if (!inString && open.isEmpty()) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.stripTrailing());
        if (inString) {
            out.append('"');
        } else {
            while (out.length() > 0 && out.charAt(out.length() - 1) == ',') {
                out.setLength(out.length() - 1);
                trimTrailingWhitespace(out);
            }
            if (out.length() > 0 && out.charAt(out.length() - 1) == ':') {
                out.append(" null");
            }
        }
        while (!open.isEmpty()) {
            out.append(open.pop());
        }
        return out.toString();
    }

    private static void trimTrailingWhitespace(StringBuilder out) {
        while (out.length() > 0 && Character.isWhitespace(out.charAt(out.length() - 1))) {
            out.setLength(out.length() - 1);
        }
    }

    static String escapeNewlinesInStrings(String text) {
        StringBuilder out = new StringBuilder(text.length());
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (escaped) {
                out.append(c);
                escaped = false;
                continue;
            }
            if (inString && c == '\\') {
                out.append(c);
                escaped = true;
                continue;
            }
            if (c == '"') {
                inString = !inString;
            }
            if (inString && c == '\n') {
                out.append("\\n");
            } else if (inString && c == '\r') {
                continue;
            } else if (inString && c == '\t') {
                out.append("\\t");
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}
