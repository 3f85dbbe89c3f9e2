package com.vedant.securequery.service;

import com.vedant.securequery.dto.ExecutionAttempt;
import com.vedant.securequery.dto.QueryExecutionResult;
import com.vedant.securequery.dto.SecuredStatement;
import com.vedant.securequery.exception.QueryExecutionException;
import com.vedant.securequery.exception.SecurityViolationException;
import com.vedant.securequery.exception.ViolationKind;
import com.vedant.securequery.util.TenantCodeValidator;
import com.vedant.securequery.util.TenantScopedTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapperResultSetExtractor;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs a {@link SecuredStatement} and checks that every returned row belongs to the caller's tenant.
 * <p>
 * Named parameters ({@code @tenant_code_0}) are rewritten to JDBC placeholders and bound in the
 * order they occur in the text. A row whose TenantCode differs from the caller's discards the whole
 * result. One {@link ExecutionAttempt} is audited per call whatever the outcome.
 */
@Service
public class SecureQueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(SecureQueryExecutor.class);

    static final String RLS_CONTEXT_SQL = "EXEC sp_set_session_context @key = N'TenantCode', @value = ?";

    private static final Pattern NAMED_PARAMETER = Pattern.compile("(?<!@)@([A-Za-z_][A-Za-z0-9_]*)");

    private final JdbcTemplate jdbcTemplate;
    private final TenantAuditLogger auditLogger;
    private final boolean rlsEnabled;

    public SecureQueryExecutor(
            JdbcTemplate jdbcTemplate,
            TenantAuditLogger auditLogger,
            @Value("${secure-query.rls-enabled:false}") boolean rlsEnabled
    ) {
        this.jdbcTemplate = jdbcTemplate;
        this.auditLogger = auditLogger;
        this.rlsEnabled = rlsEnabled;
    }

    /** SQL with JDBC placeholders and the values to bind, in placeholder order. */
    record BoundQuery(String sql, Object[] args) {}

    public QueryExecutionResult execute(SecuredStatement secured, String tenantCode, String sessionId) {
        long start = System.nanoTime();

        List<Map<String, Object>> rows;
        try {
            BoundQuery bound = bind(secured);
            rows = rlsEnabled ? queryWithSessionContext(bound, tenantCode) : query(bound);
        } catch (SecurityViolationException e) {
            auditLogger.log(ExecutionAttempt.rejected(sessionId, tenantCode, secured.sqlText(), elapsedMs(start), e.toAuditString()));
            throw e;
        } catch (DataAccessException e) {
            long ms = Math.round(elapsedMs(start));
            auditLogger.log(ExecutionAttempt.failed(sessionId, tenantCode, secured.sqlText(), elapsedMs(start)));
            QueryExecutionException ex = new QueryExecutionException(describe(e), ms, e);
            log.warn("Query execution failed for session {} after {} ms: {}", sessionId, ms, ex.getMessage());
            throw ex;
        }

        try {
            validateResultTenant(rows, tenantCode);
        } catch (SecurityViolationException e) {
            auditLogger.log(ExecutionAttempt.rejected(sessionId, tenantCode, secured.sqlText(), elapsedMs(start), e.toAuditString()));
            auditLogger.logSecurityViolation(sessionId, tenantCode, e.getKind().getAuditTag(), e.getDetail());
            throw e;
        }

        double durationMs = elapsedMs(start);
        auditLogger.log(ExecutionAttempt.succeeded(sessionId, tenantCode, secured.sqlText(), rows.size(), durationMs));

        int columns = rows.isEmpty() ? 0 : rows.get(0).size();
        String info = String.format("Query executed successfully. Retrieved %d rows, %d columns in %.2fms",
                rows.size(), columns, durationMs);
        log.info("=== QUERY EXECUTED === {} rows returned for session {}", rows.size(), sessionId);

        return new QueryExecutionResult(true, Collections.unmodifiableList(rows), rows.size(), Math.round(durationMs), info);
    }

    /**
     * Replaces each {@code @name} found in the parameter map with {@code ?}, scanning left to right.
     * Every parameter must be referenced at least once.
     */
    static BoundQuery bind(SecuredStatement secured) {
        Map<String, String> parameters = secured.parameters();
        if (parameters.isEmpty()) {
            return new BoundQuery(secured.sqlText(), new Object[0]);
        }
        String sql = secured.sqlText();
        Matcher m = NAMED_PARAMETER.matcher(sql);
        StringBuilder sb = new StringBuilder();
        List<Object> args = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int last = 0;
        while (m.find()) {
            String name = m.group(1);
            if (!parameters.containsKey(name) || insideLiteral(sql, m.start())) continue;
            sb.append(sql, last, m.start()).append('?');
            args.add(parameters.get(name));
            seen.add(name);
            last = m.end();
        }
        sb.append(sql.substring(last));
        if (!seen.containsAll(parameters.keySet())) {
            throw new SecurityViolationException(ViolationKind.FILTER_INJECTION_FAILED,
                    "Statement does not reference every tenant parameter");
        }
        return new BoundQuery(sb.toString(), args.toArray());
    }

    /**
     * Fails closed: one foreign or missing TenantCode value rejects the entire result.
     * GUID tenants compare case-insensitively since uniqueidentifier columns come back upper case.
     */
    static void validateResultTenant(List<Map<String, Object>> rows, String tenantCode) {
        boolean guid = TenantCodeValidator.isGuid(tenantCode);
        for (Map<String, Object> row : rows) {
            for (Map.Entry<String, Object> column : row.entrySet()) {
                if (!TenantScopedTables.TENANT_COLUMN.equalsIgnoreCase(column.getKey())) continue;
                Object value = column.getValue();
                if (value == null || !sameTenant(String.valueOf(value), tenantCode, guid)) {
                    throw new SecurityViolationException(ViolationKind.CROSS_TENANT_LEAK,
                            "CRITICAL: Result contains data from different tenant! Expected: " + tenantCode
                                    + ", Found: " + value);
                }
            }
        }
    }

    private static boolean sameTenant(String value, String tenantCode, boolean guid) {
        return guid ? value.equalsIgnoreCase(tenantCode) : value.equals(tenantCode);
    }

    private List<Map<String, Object>> query(BoundQuery bound) {
        if (bound.args().length == 0) {
            return jdbcTemplate.queryForList(bound.sql());
        }
        return jdbcTemplate.queryForList(bound.sql(), bound.args());
    }

    // context and query must share one connection for row-level security to apply
    private List<Map<String, Object>> queryWithSessionContext(BoundQuery bound, String tenantCode) {
        List<Map<String, Object>> rows = jdbcTemplate.execute((ConnectionCallback<List<Map<String, Object>>>) con -> {
            setSessionContext(con, tenantCode);
            try (PreparedStatement ps = con.prepareStatement(bound.sql())) {
                if (jdbcTemplate.getQueryTimeout() > 0) {
                    ps.setQueryTimeout(jdbcTemplate.getQueryTimeout());
                }
                for (int i = 0; i < bound.args().length; i++) {
                    ps.setObject(i + 1, bound.args()[i]);
                }
                try (ResultSet rs = ps.executeQuery()) {
                    return new RowMapperResultSetExtractor<>(new ColumnMapRowMapper()).extractData(rs);
                }
            }
        });
        return rows != null ? rows : new ArrayList<>();
    }

    private void setSessionContext(Connection con, String tenantCode) {
        try (PreparedStatement ctx = con.prepareStatement(RLS_CONTEXT_SQL)) {
            ctx.setString(1, tenantCode);
            ctx.execute();
        } catch (SQLException e) {
            log.warn("Failed to set session context for row-level security: {}", e.getMessage());
        }
    }

    private static boolean insideLiteral(String sql, int pos) {
        boolean inLiteral = false;
        for (int i = 0; i < pos; i++) {
            if (sql.charAt(i) == '\'') inLiteral = !inLiteral;
        }
        return inLiteral;
    }

    private static String describe(DataAccessException e) {
        Throwable root = e.getMostSpecificCause();
        String message = root.getMessage() != null ? root.getMessage() : e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
