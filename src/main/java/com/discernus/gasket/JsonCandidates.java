package com.discernus.gasket;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Heuristic JSON candidate discovery for responses whose markers or JSON are
 * damaged. Bracket matching skips string literals and escapes.
 */
final class JsonCandidates {
    static final int MAX_CANDIDATES = 64;

    private JsonCandidates() {
    }

    static List<String> find(String text) {
        Set<String> candidates = new LinkedHashSet<>();
        for (int start = text.indexOf('{'); start >= 0; start = text.indexOf('{', start + 1)) {
            int end = matchingClose(text, start);
            if (end > start) {
                candidates.add(text.substring(start, end + 1));
            }
        }
        String repaired = repairTruncated(text);
        if (repaired != null) {
            candidates.add(repaired);
        }
        List<String> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparingInt(String::length).reversed());
        return ordered.size() > MAX_CANDIDATES ? ordered.subList(0, MAX_CANDIDATES) : ordered;
    }

    static String stripCodeFence(String text) {
        String cleaned = text.strip();
        if (cleaned.startsWith("```")) {
            int firstNewline = cleaned.indexOf('\n');
            cleaned = firstNewline < 0 ? cleaned.substring(3) : cleaned.substring(firstNewline + 1);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.strip();
    }

    static int matchingClose(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
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
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Closes brackets left open by a response that stopped early. Returns null when
     * the outermost object is already balanced or cannot be closed sensibly.
     */
    static String repairTruncated(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            return null;
        }
        Deque<Character> open = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
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
            switch (c) {
                case '"' -> inString = true;
                case '{' -> open.push('}');
                case '[' -> open.push(']');
                case '}', ']' -> {
                    if (open.isEmpty() || open.peek() != c) {
                        return null;
                    }
                    open.pop();
                    if (open.isEmpty()) {
                        return null;
                    }
                }
                default -> {
                }
            }
        }
        if (open.isEmpty()) {
            return null;
        }
        StringBuilder builder = new StringBuilder(text.substring(start).stripTrailing());
        if (inString) {
            builder.append('"');
        }
        while (builder.length() > 0 && builder.charAt(builder.length() - 1) == ',') {
            builder.setLength(builder.length() - 1);
        }
        char last = builder.charAt(builder.length() - 1);
        if (last == ':') {
            return null;
        }
        while (!open.isEmpty()) {
            builder.append(open.pop());
        }
        return builder.toString();
    }
}
