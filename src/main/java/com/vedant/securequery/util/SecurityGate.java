package com.vedant.securequery.util;

import com.vedant.securequery.dto.SecuredStatement;
import com.vedant.securequery.dto.TableReference;
import com.vedant.securequery.exception.SecurityViolationException;
import com.vedant.securequery.exception.ViolationKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-level screening of SQL text. Runs on the generator's raw output and again on the
 * secured statement; it matches the literal text and does not parse SQL.
 * <p>
 * Forbidden operations are reported before injection patterns, so a stacked
 * {@code ; DROP TABLE} is classified as a forbidden operation.
 */
public final class SecurityGate {

    private record Rule(Pattern pattern, ViolationKind kind, String reason) {}

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE;

    private static final List<Rule> RULES = List.of(
            forbidden("\\bDROP\\b", "DROP operations not allowed"),
            forbidden("\\bTRUNCATE\\b", "TRUNCATE operations not allowed"),
            forbidden("\\bDELETE\\b", "DELETE operations not allowed"),
            forbidden("\\bUPDATE\\b", "UPDATE operations not allowed"),
            forbidden("\\bINSERT\\b", "INSERT operations not allowed"),
            forbidden("\\bEXEC\\b", "EXEC operations not allowed"),
            forbidden("\\bEXECUTE\\b", "EXECUTE operations not allowed"),
            forbidden("\\bSP_\\w*", "Stored procedure calls not allowed"),
            forbidden("\\bXP_\\w*", "Extended procedure calls not allowed"),

            injection(";\\s*(DROP|DELETE|UPDATE)\\b", "SQL injection attempt detected: stacked statement"),
            injection(";\\s*\\S", "Multiple statements not allowed"),
            injection("--", "SQL comments not allowed"),
            injection("/\\*|\\*/", "SQL comments not allowed"),
            injection("\\bOR\\s+(\\d+)\\s*=\\s*\\1(?!\\d)", "SQL injection attempt detected: OR tautology"),
            injection("\\bOR\\s+'([^']*)'\\s*=\\s*'\\1'", "SQL injection attempt detected: OR string tautology"),
            injection("\\bUNION[\\s(]*(?:ALL\\b[\\s(]*)?SELECT\\b", "SQL injection attempt detected: UNION SELECT"),
            injection("\\b(?:EXCEPT|INTERSECT)\\b", "Set operators not allowed")
    );

    // a scoped table name, optionally delimited, as a whole word
    private static final Pattern SCOPED_NAME = Pattern.compile(
            "(?<![\\w$#@])[\\[\"]?(?:" + String.join("|", TenantScopedTables.TABLES) + ")[\\]\"]?(?![\\w$#])",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern QUALIFIER_DOT = Pattern.compile("\\s*\\.");

    private SecurityGate() {}

    public static void check(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new SecurityViolationException(ViolationKind.FORBIDDEN_OPERATION, "Empty SQL statement");
        }
        for (Rule rule : RULES) {
            if (rule.pattern().matcher(sql).find()) {
                throw new SecurityViolationException(rule.kind(), rule.reason());
            }
        }
    }

    /**
     * Every reason the statement would be rejected for, in rule order. Empty when {@link #check} passes.
     */
    public static List<String> findViolations(String sql) {
        List<String> reasons = new ArrayList<>();
        if (sql == null || sql.isBlank()) {
            reasons.add("Empty SQL statement");
            return reasons;
        }
        for (Rule rule : RULES) {
            if (rule.pattern().matcher(sql).find() && !reasons.contains(rule.reason())) {
                reasons.add(rule.reason());
            }
        }
        return reasons;
    }

    public static boolean isSafe(String sql) {
        return findViolations(sql).isEmpty();
    }

    /**
     * Confirms the injector's output: each tenant-scoped reference has its own
     * {@code <ref>.TenantCode = @tenant_code_i} predicate and every parameter resolves to the tenant.
     * Fails closed when a scoped table name appears anywhere outside a recognized table reference
     * or a {@code name.column} qualifier.
     */
    public static void verifyTenantFilter(SecuredStatement secured, String tenantCode) {
        SqlScanner scanner = SqlScanner.of(secured.sqlText());
        List<TableReferenceExtractor.Positioned> positioned = TableReferenceExtractor.extractPositioned(scanner);
        requireCoveredScopedNames(scanner.masked(), positioned);

        List<TableReference> scoped = positioned.stream()
                .map(TableReferenceExtractor.Positioned::reference)
                .filter(r -> TenantScopedTables.isTenantScoped(r.tableName()))
                .toList();
        if (scoped.size() != secured.parameters().size()) {
            throw new SecurityViolationException(ViolationKind.FILTER_INJECTION_FAILED,
                    "Expected " + scoped.size() + " tenant parameters but found " + secured.parameters().size());
        }
        String expected = TenantCodeValidator.sanitize(tenantCode);
        for (Map.Entry<String, String> p : secured.parameters().entrySet()) {
            if (!expected.equals(p.getValue())) {
                throw new SecurityViolationException(ViolationKind.FILTER_INJECTION_FAILED,
                        "Parameter " + p.getKey() + " is not bound to the request tenant");
            }
        }
        String masked = scanner.masked();
        for (int i = 0; i < scoped.size(); i++) {
            String predicate = FilterInjector.predicate(scoped.get(i), FilterInjector.parameterName(i));
            if (!secured.parameters().containsKey(FilterInjector.parameterName(i))
                    || !Pattern.compile(Pattern.quote(predicate) + "(?!\\w)").matcher(masked).find()) {
                throw new SecurityViolationException(ViolationKind.FILTER_INJECTION_FAILED,
                        "Missing tenant predicate for table " + scoped.get(i).tableName());
            }
        }
    }

    private static void requireCoveredScopedNames(String masked, List<TableReferenceExtractor.Positioned> refs) {
        Matcher m = SCOPED_NAME.matcher(masked);
        while (m.find()) {
            int at = m.start();
            if (refs.stream().anyMatch(r -> r.covers(at))) continue;
            if (QUALIFIER_DOT.matcher(masked).region(m.end(), masked.length()).lookingAt()) continue;
            throw new SecurityViolationException(ViolationKind.FILTER_INJECTION_FAILED,
                    "Unrecognized reference to tenant-scoped table " + m.group());
        }
    }

    private static Rule forbidden(String regex, String reason) {
        return new Rule(Pattern.compile(regex, FLAGS), ViolationKind.FORBIDDEN_OPERATION, reason);
    }

    private static Rule injection(String regex, String reason) {
        return new Rule(Pattern.compile(regex, FLAGS), ViolationKind.INJECTION_PATTERN_DETECTED, reason);
    }
}
