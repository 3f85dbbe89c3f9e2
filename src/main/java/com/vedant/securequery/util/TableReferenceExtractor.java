package com.vedant.securequery.util;

import com.vedant.securequery.dto.TableReference;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lists the tables a statement reads from, in source order.
 * <p>
 * Recognizes {@code FROM t [[AS] a]}, {@code JOIN t [[AS] a]} and every top-level comma entry of a
 * FROM clause, including entries after a derived table or a {@code JOIN ... ON} item. A delimited
 * name may follow the keyword without whitespace ({@code FROM[t]}). Subqueries are scanned like the
 * outer statement; scoping is handled by {@link FilterInjector}. Self-joins yield one reference per
 * occurrence.
 */
public final class TableReferenceExtractor {

    private static final String PART = "(?:\\[[^\\]]+\\]|\"[^\"]+\"|[A-Za-z_][A-Za-z0-9_]*)";
    private static final String NAME = PART + "(?:\\s*\\.\\s*" + PART + ")*";

    private static final Pattern TABLE = Pattern.compile(
            "\\b(FROM|JOIN)(?:\\s+|(?=[\\[\"]))(" + NAME + ")", Pattern.CASE_INSENSITIVE);
    private static final Pattern FROM = Pattern.compile("\\bFROM\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ALIAS = Pattern.compile("\\s+(?:AS\\s+)?(" + PART + ")", Pattern.CASE_INSENSITIVE);
    private static final Pattern LIST_ENTRY = Pattern.compile("\\s*(" + NAME + ")");
    // where a FROM clause's table list ends
    private static final Pattern FROM_CLAUSE_END = Pattern.compile(
            "\\b(?:WHERE|GROUP\\s+BY|ORDER\\s+BY|HAVING|UNION|EXCEPT|INTERSECT|SELECT|OPTION|FOR|LIMIT|OFFSET|FETCH|WINDOW)\\b|;",
            Pattern.CASE_INSENSITIVE);

    // words that may follow a table name but are never its alias
    private static final Set<String> NOT_AN_ALIAS = Set.of(
            "ON", "WHERE", "GROUP", "ORDER", "HAVING", "INNER", "LEFT", "RIGHT", "OUTER",
            "JOIN", "FULL", "CROSS", "NATURAL", "UNION", "EXCEPT", "INTERSECT", "LIMIT", "OFFSET",
            "FETCH", "FOR", "WITH", "USING", "SELECT", "FROM", "AS", "OPTION", "WINDOW"
    );

    private TableReferenceExtractor() {}

    public static List<TableReference> extract(String sql) {
        return extractPositioned(SqlScanner.of(sql)).stream().map(Positioned::reference).toList();
    }

    static List<Positioned> extractPositioned(SqlScanner scanner) {
        List<Positioned> refs = new ArrayList<>();
        String text = scanner.masked();
        Matcher m = TABLE.matcher(text);
        while (m.find()) {
            addReference(refs, text, m.start(), m.start(2), m.group(2), m.end());
        }
        Matcher from = FROM.matcher(text);
        while (from.find()) {
            addListEntries(refs, scanner, from.start(), from.end());
        }
        refs.sort(Comparator.comparingInt(Positioned::position));
        return refs;
    }

    // comma-separated entries of the FROM clause opened at fromStart: FROM a x, (SELECT ...) d, b y
    private static void addListEntries(List<Positioned> refs, SqlScanner scanner, int fromStart, int fromEnd) {
        String text = scanner.masked();
        int level = scanner.depthAt(fromStart);
        int open = scanner.enclosingOpen(fromStart);
        int blockEnd = open < 0 ? text.length() : scanner.matchingClose(open);
        int clauseEnd = scanner.firstAtLevel(FROM_CLAUSE_END, fromEnd, blockEnd, level);
        if (clauseEnd < 0) clauseEnd = blockEnd;

        for (int i = fromEnd; i < clauseEnd; i++) {
            if (text.charAt(i) != ',' || scanner.depthAt(i) != level) continue;
            Matcher entry = LIST_ENTRY.matcher(text).region(i + 1, text.length());
            if (entry.lookingAt() && !isKeyword(entry.group(1))) {
                addReference(refs, text, entry.start(1), entry.start(1), entry.group(1), entry.end());
            }
        }
    }

    private static void addReference(List<Positioned> refs, String text, int position, int nameStart,
                                     String written, int end) {
        String alias = null;
        Matcher a = ALIAS.matcher(text).region(end, text.length());
        if (a.lookingAt() && !isKeyword(a.group(1))) {
            alias = a.group(1);
            end = a.end();
        }
        String writtenName = written.replaceAll("\\s+", "");
        refs.add(new Positioned(new TableReference(lastSegment(writtenName), alias, writtenName), position, nameStart, end));
    }

    private static boolean isKeyword(String token) {
        return NOT_AN_ALIAS.contains(token.toUpperCase(Locale.ROOT));
    }

    private static String lastSegment(String name) {
        String last = name;
        int dot = lastDotOutsideQuotes(name);
        if (dot >= 0) last = name.substring(dot + 1);
        if ((last.startsWith("[") && last.endsWith("]")) || (last.startsWith("\"") && last.endsWith("\""))) {
            last = last.substring(1, last.length() - 1);
        }
        return last;
    }

    private static int lastDotOutsideQuotes(String name) {
        boolean inBracket = false;
        boolean inQuote = false;
        int found = -1;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '[' && !inQuote) inBracket = true;
            else if (c == ']' && !inQuote) inBracket = false;
            else if (c == '"' && !inBracket) inQuote = !inQuote;
            else if (c == '.' && !inBracket && !inQuote) found = i;
        }
        return found;
    }

    /**
     * A reference together with the offset of the FROM/JOIN keyword (or list entry) introducing it.
     * [nameStart, end) spans the written name and its alias.
     */
    record Positioned(TableReference reference, int position, int nameStart, int end) {

        boolean covers(int offset) {
            return offset >= nameStart && offset < end;
        }
    }
}
