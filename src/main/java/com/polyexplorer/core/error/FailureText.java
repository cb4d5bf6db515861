package com.polyexplorer.core.error;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;

/**
 * Renders raw external text into bounded fragments that are safe to embed in failure messages.
 * All methods are total: null text is treated as empty and negative bounds as zero.
 */
public final class FailureText {
    public static final String TRUNCATION_MARKER = "... (truncated)";
    public static final String ELISION_MARKER = "...";
    public static final int MAX_SNIPPET_LENGTH = 500;
    /** Upper bound for a body already passed through {@link #truncateForDisplay}. */
    public static final int MAX_BODY_LENGTH = MAX_SNIPPET_LENGTH + TRUNCATION_MARKER.length();

    private static final Pattern LINE_BREAK = Pattern.compile("\\s*\\R\\s*");

    private FailureText() {
    }

    /**
     * Returns {@code text} unchanged when it fits in {@code maxLen} chars, otherwise its first
     * {@code maxLen} chars followed by {@link #TRUNCATION_MARKER}.
     */
    public static String truncateForDisplay(String text, int maxLen) {
        String s = text == null ? "" : text;
        int limit = Math.max(0, maxLen);
        if (s.length() <= limit) {
            return s;
        }
        return prefix(s, limit) + TRUNCATION_MARKER;
    }

    /**
     * Bounded variant whose result, marker included, never exceeds {@code maxLen}. Applying it to
     * its own output returns the output unchanged.
     */
    public static String clip(String text, int maxLen) {
        String s = text == null ? "" : text;
        int limit = Math.max(0, maxLen);
        if (s.length() <= limit) {
            return s;
        }
        if (limit <= ELISION_MARKER.length()) {
            return prefix(s, limit);
        }
        return prefix(s, limit - ELISION_MARKER.length()) + ELISION_MARKER;
    }

    /**
     * Extracts the part of a raw JSON payload most likely to explain a parse failure: the first
     * mismatched closing bracket, or the end of the input when a string or bracket is left open.
     * Falls back to prefix clipping when the bracket structure is consistent.
     */
    public static String jsonErrorSnippet(String text, int maxLen) {
        String collapsed = collapseLines(text);
        int limit = Math.max(0, maxLen);
        if (collapsed.length() <= limit) {
            return collapsed;
        }
        int cue = structuralCue(collapsed);
        if (cue < 0) {
            return clip(collapsed, limit);
        }
        return window(collapsed, cue, limit);
    }

    /**
     * Same as {@link #jsonErrorSnippet(String, int)} but centred on a character offset reported by
     * the JSON reader. A negative offset means the reader gave no position.
     */
    public static String jsonErrorSnippet(String text, int errorOffset, int maxLen) {
        if (errorOffset < 0) {
            return jsonErrorSnippet(text, maxLen);
        }
        String raw = text == null ? "" : text;
        String collapsed = collapseLines(raw);
        int limit = Math.max(0, maxLen);
        if (collapsed.length() <= limit) {
            return collapsed;
        }
        int mapped = collapseLines(raw.substring(0, Math.min(errorOffset, raw.length()))).length();
        return window(collapsed, Math.min(mapped, collapsed.length()), limit);
    }

    /**
     * Compact duration text such as {@code 45s}, {@code 1h30m} or {@code 2d3h}.
     */
    public static String formatDuration(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return "0s";
        }
        long days = duration.toDays();
        int hours = duration.toHoursPart();
        int minutes = duration.toMinutesPart();
        int seconds = duration.toSecondsPart();
        StringBuilder sb = new StringBuilder();
        if (days > 0) {
            sb.append(days).append('d');
        }
        if (hours > 0) {
            sb.append(hours).append('h');
        }
        if (minutes > 0) {
            sb.append(minutes).append('m');
        }
        if (seconds > 0 || sb.length() == 0) {
            sb.append(seconds).append('s');
        }
        return sb.toString();
    }

    static String collapseLines(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return LINE_BREAK.matcher(text).replaceAll(" ").strip();
    }

    static int structuralCue(String s) {
        Deque<Character> open = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
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
            } else if (c == '{' || c == '[') {
                open.push(c);
            } else if (c == '}' || c == ']') {
                char expected = c == '}' ? '{' : '[';
                if (open.isEmpty() || open.pop() != expected) {
                    return i;
                }
            }
        }
        return inString || !open.isEmpty() ? s.length() : -1;
    }

    private static String window(String s, int cue, int limit) {
        if (s.length() <= limit) {
            return s;
        }
        int body = limit - 2 * ELISION_MARKER.length();
        if (body < 1) {
            return clip(s, limit);
        }
        int start = Math.max(0, Math.min(cue - body / 2, s.length() - body));
        int end = start + body;
        if (start > 0 && Character.isLowSurrogate(s.charAt(start))) {
            start++;
        }
        if (end < s.length() && Character.isHighSurrogate(s.charAt(end - 1))) {
            end--;
        }
        StringBuilder sb = new StringBuilder(limit);
        if (start > 0) {
            sb.append(ELISION_MARKER);
        }
        sb.append(s, start, end);
        if (end < s.length()) {
            sb.append(ELISION_MARKER);
        }
        return sb.toString();
    }

    private static String prefix(String s, int len) {
        int end = Math.min(len, s.length());
        if (end > 0 && end < s.length() && Character.isHighSurrogate(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(0, end);
    }
}
