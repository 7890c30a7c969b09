package com.seibun.backend.services.tables.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Whitespace tokenization of a cell. Position inside a cell is meaningful: the n-th token of the
 * name column pairs with the n-th token of the amount columns.
 */
public final class Tokens {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private Tokens() {}

    public static List<String> split(String cell) {
        List<String> tokens = new ArrayList<>();
        if (cell == null) return tokens;
        String trimmed = cell.trim();
        if (trimmed.isEmpty()) return tokens;
        for (String token : WHITESPACE.split(trimmed)) {
            if (!token.isEmpty()) tokens.add(token);
        }
        return tokens;
    }

    /**
     * Joins with one space, skipping empty padding tokens.
     */
    public static String join(List<String> tokens) {
        StringBuilder sb = new StringBuilder();
        for (String token : tokens) {
            if (token == null || token.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(token);
        }
        return sb.toString();
    }

    public static String tokenAt(List<String> tokens, int index) {
        return index >= 0 && index < tokens.size() ? tokens.get(index) : "";
    }
}
