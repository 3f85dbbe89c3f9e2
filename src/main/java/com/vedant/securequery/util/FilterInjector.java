package com.vedant.securequery.util;

import com.vedant.securequery.dto.SecuredStatement;
import com.vedant.securequery.dto.TableReference;
import com.vedant.securequery.exception.SecurityViolationException;
import com.vedant.securequery.exception.ViolationKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites a statement so every tenant-scoped table reference is filtered by a bound
 * parameter: {@code <alias or table>.TenantCode = @tenant_code_<i>}.
 * <p>
 * Predicates go into the WHERE clause of the query block (top level or parenthesized subquery)
 * that contains the reference. An existing WHERE gets {@code <predicates> AND} prepended; its
 * original condition is parenthesized when it has a top-level OR. Without a WHERE, a new clause
 * is placed before GROUP BY, ORDER BY, HAVING, LIMIT/OFFSET/FETCH, OPTION, FOR or a trailing
 * semicolon, or at the end of the block.
 * <p>
 * The tenant code never appears in the SQL text, only in the parameter map.
 */
public final class FilterInjector {

    public static final String PARAMETER_PREFIX = "tenant_code_";

    private static final Pattern WHERE = Pattern.compile("\\bWHERE\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CLAUSE_BOUNDARY = Pattern.compile(
            "\\bGROUP\\s+BY\\b|\\bORDER\\s+BY\\b|\\bHAVING\\b|\\bLIMIT\\b|\\bOFFSET\\b|\\bFETCH\\b|\\bOPTION\\b|\\bFOR\\b|;",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern OR = Pattern.compile("\\bOR\\b", Pattern.CASE_INSENSITIVE);

    private record Insertion(int position, boolean afterWhere, int conditionEnd, String predicates) {}

    private FilterInjector() {}

    public static SecuredStatement inject(String sql, String tenantCode) {
        if (sql == null || sql.isBlank()) {
            throw new SecurityViolationException(ViolationKind.FILTER_INJECTION_FAILED,
                    "Cannot inject filter into empty query");
        }
        String value = TenantCodeValidator.sanitize(tenantCode);
        SqlScanner scanner = SqlScanner.of(sql);

        List<TableReferenceExtractor.Positioned> scoped = TableReferenceExtractor.extractPositioned(scanner).stream()
                .filter(p -> TenantScopedTables.isTenantScoped(p.reference().tableName()))
                .toList();
        if (scoped.isEmpty()) {
            return SecuredStatement.unfiltered(sql);
        }

        Map<String, String> parameters = new LinkedHashMap<>();
        Map<Integer, List<String>> predicatesByBlock = new LinkedHashMap<>();
        for (int i = 0; i < scoped.size(); i++) {
            String name = parameterName(i);
            parameters.put(name, value);
            int block = scanner.enclosingOpen(scoped.get(i).position());
            predicatesByBlock.computeIfAbsent(block, k -> new ArrayList<>())
                    .add(predicate(scoped.get(i).reference(), name));
        }

        List<Insertion> insertions = new ArrayList<>();
        predicatesByBlock.forEach((open, predicates) ->
                insertions.add(locate(scanner, open, String.join(" AND ", predicates))));
        // apply right to left so earlier offsets stay valid
        insertions.sort(Comparator.comparingInt(Insertion::position).reversed());

        String secured = sql;
        List<int[]> applied = new ArrayList<>();
        for (Insertion insertion : insertions) {
            // a subquery rewritten inside this WHERE condition moved its end
            int conditionEnd = insertion.conditionEnd();
            for (int[] done : applied) {
                if (insertion.afterWhere() && done[0] < insertion.conditionEnd()) conditionEnd += done[1];
            }
            int lengthBefore = secured.length();
            secured = apply(secured, insertion, conditionEnd);
            applied.add(new int[] {insertion.position(), secured.length() - lengthBefore});
        }
        return new SecuredStatement(secured.trim(), parameters);
    }

    public static String parameterName(int index) {
        return PARAMETER_PREFIX + index;
    }

    public static String predicate(TableReference reference, String parameterName) {
        return reference.qualifier() + "." + TenantScopedTables.TENANT_COLUMN + " = @" + parameterName;
    }

    private static Insertion locate(SqlScanner scanner, int open, String predicates) {
        int start = open < 0 ? 0 : open + 1;
        int end = open < 0 ? scanner.length() : scanner.matchingClose(open);
        int level = open < 0 ? 0 : scanner.depthAt(open) + 1;

        int where = scanner.firstAtLevel(WHERE, start, end, level);
        if (where >= 0) {
            int whereEnd = where + "WHERE".length();
            int boundary = scanner.firstAtLevel(CLAUSE_BOUNDARY, whereEnd, end, level);
            return new Insertion(whereEnd, true, boundary >= 0 ? boundary : end, predicates);
        }
        int boundary = scanner.firstAtLevel(CLAUSE_BOUNDARY, start, end, level);
        return new Insertion(boundary >= 0 ? boundary : end, false, -1, predicates);
    }

    private static String apply(String sql, Insertion insertion, int conditionEnd) {
        int pos = insertion.position();
        if (insertion.afterWhere()) {
            String condition = sql.substring(pos, conditionEnd);
            String rest = sql.substring(conditionEnd);
            String trimmed = condition.strip();
            if (hasTopLevelOr(trimmed)) {
                String trailing = condition.substring(condition.stripTrailing().length());
                condition = "(" + trimmed + ")" + (trailing.isEmpty() && !rest.isEmpty() && !startsClosing(rest) ? " " : trailing);
            } else {
                condition = condition.stripLeading();
            }
            return sql.substring(0, pos) + " " + insertion.predicates() + " AND " + condition + rest;
        }
        String before = sql.substring(0, pos).stripTrailing();
        String after = sql.substring(pos);
        String separator = after.isEmpty() || startsClosing(after) ? "" : " ";
        return before + " WHERE " + insertion.predicates() + separator + after;
    }

    private static boolean startsClosing(String text) {
        return text.startsWith(")") || text.startsWith(";");
    }

    private static boolean hasTopLevelOr(String condition) {
        SqlScanner scanner = SqlScanner.of(condition);
        Matcher m = OR.matcher(scanner.masked());
        while (m.find()) {
            if (scanner.depthAt(m.start()) == 0) return true;
        }
        return false;
    }
}
