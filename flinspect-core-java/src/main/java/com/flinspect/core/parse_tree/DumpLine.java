package com.flinspect.core.parse_tree;

import java.util.ArrayList;
import java.util.List;

/**
 * One significant line of a dump: its nesting depth and the chain of segments it names.
 *
 *   "| | ActualArg -> Expr -> LiteralConstant -> IntLiteralConstant = '10'"
 *   depth 2, four segments, the last carrying the value "10".
 */
record DumpLine(int depth, List<Segment> chain, int line) {

    record Segment(String label, String value) {}

    /**
     * Parses a raw dump line. Returns null for lines that carry no construct:
     * blank lines, comment lines and the {@code =====} source banner.
     */
    static DumpLine parse(String raw, int line) {
        if (raw == null || raw.isBlank()) return null;
        String trimmed = raw.strip();
        if (trimmed.startsWith("=====") || trimmed.startsWith("!") || trimmed.startsWith("#")) {
            return null;
        }

        int depth = 0;
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c == '|') {
                depth++;
            } else if (c != ' ' && c != '\t') {
                break;
            }
            i++;
        }
        String text = raw.substring(i).strip();
        if (text.isEmpty()) return null;

        List<Segment> chain = new ArrayList<>();
        for (String part : splitChain(text)) {
            chain.add(toSegment(part));
        }
        if (chain.isEmpty()) return null;
        return new DumpLine(depth, chain, line);
    }

    /** Splits on "->" outside single-quoted values; empty parts (a trailing "->") are dropped. */
    private static List<String> splitChain(String text) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuote = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'') {
                inQuote = !inQuote;
                current.append(c);
            } else if (!inQuote && c == '-' && i + 1 < text.length() && text.charAt(i + 1) == '>') {
                addPart(parts, current);
                current.setLength(0);
                i++;
            } else {
                current.append(c);
            }
        }
        addPart(parts, current);
        return parts;
    }

    private static void addPart(List<String> parts, StringBuilder current) {
        String part = current.toString().strip();
        if (!part.isEmpty()) parts.add(part);
    }

    private static Segment toSegment(String part) {
        int eq = part.indexOf(" = ");
        if (eq < 0) {
            return new Segment(part, null);
        }
        String label = part.substring(0, eq).strip();
        String value = part.substring(eq + 3).strip();
        if (value.length() >= 2 && value.startsWith("'") && value.endsWith("'")) {
            value = value.substring(1, value.length() - 1);
        }
        return new Segment(label, value);
    }
}
