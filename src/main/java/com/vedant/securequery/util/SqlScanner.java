package com.vedant.securequery.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minimal lexical view of a single SQL statement: string literals and paren nesting.
 * Keyword searches run on the masked text so a literal like {@code 'order by'} is never
 * mistaken for a clause. The masked text has the same length as the input, so every offset
 * found in it is valid in the original.
 */
final class SqlScanner {

    private final String sql;
    private final String masked;
    private final int[] depth;

    private SqlScanner(String sql) {
        this.sql = sql;
        this.masked = maskLiterals(sql);
        this.depth = computeDepth(masked);
    }

    static SqlScanner of(String sql) {
        return new SqlScanner(sql == null ? "" : sql);
    }

    String sql() { return sql; }

    String masked() { return masked; }

    int length() { return sql.length(); }

    // paren nesting level of the character at pos (the '(' itself counts as the outer level)
    int depthAt(int pos) {
        if (pos >= depth.length) return 0;
        return depth[pos];
    }

    /**
     * Index of the '(' that opens the innermost group enclosing pos, or -1 at top level.
     */
    int enclosingOpen(int pos) {
        int level = 0;
        for (int i = pos - 1; i >= 0; i--) {
            char c = masked.charAt(i);
            if (c == ')') {
                level++;
            } else if (c == '(') {
                if (level == 0) return i;
                level--;
            }
        }
        return -1;
    }

    /**
     * Index of the ')' matching the '(' at open, or the statement length if it is unbalanced.
     */
    int matchingClose(int open) {
        int level = 0;
        for (int i = open; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(') {
                level++;
            } else if (c == ')') {
                level--;
                if (level == 0) return i;
            }
        }
        return masked.length();
    }

    /**
     * First match of pattern in [start, end) whose start sits at the given nesting level, or -1.
     */
    int firstAtLevel(Pattern pattern, int start, int end, int level) {
        if (start >= end) return -1;
        Matcher m = pattern.matcher(masked).region(start, end);
        while (m.find()) {
            if (depthAt(m.start()) == level) return m.start();
        }
        return -1;
    }

    // blank out the contents of '...' literals, keeping the quotes; '' is an escaped quote
    static String maskLiterals(String sql) {
        StringBuilder sb = new StringBuilder(sql.length());
        boolean inLiteral = false;
        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (c == '\'') {
                if (inLiteral && i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
                    sb.append("  ");
                    i++;
                    continue;
                }
                inLiteral = !inLiteral;
                sb.append(c);
            } else {
                sb.append(inLiteral ? ' ' : c);
            }
        }
        return sb.toString();
    }

    private static int[] computeDepth(String masked) {
        int[] d = new int[masked.length()];
        int level = 0;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == ')' && level > 0) level--;
            d[i] = level;
            if (c == '(') level++;
        }
        return d;
    }
}
