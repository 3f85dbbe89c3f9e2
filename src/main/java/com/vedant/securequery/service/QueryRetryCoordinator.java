package com.vedant.securequery.service;

import com.vedant.securequery.dto.ExecutionAttempt;
import com.vedant.securequery.dto.QueryExecutionResult;
import com.vedant.securequery.dto.RetryOutcome;
import com.vedant.securequery.dto.SecuredStatement;
import com.vedant.securequery.exception.QueryExecutionException;
import com.vedant.securequery.exception.SecurityViolationException;
import com.vedant.securequery.exception.ViolationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Build-and-execute loop with a bounded number of extra attempts.
 * <p>
 * Only {@link QueryExecutionException} is retried. A {@link SecurityViolationException} from either
 * the builder or the executor ends the sequence at once and the outcome carries only the
 * generic user message. A caller-supplied retry count is clamped to
 * {@code [0, secure-query.max-retries]}.
 */
@Service
public class QueryRetryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(QueryRetryCoordinator.class);

    private final SecureQueryBuilder queryBuilder;
    private final SecureQueryExecutor queryExecutor;
    private final TenantAuditLogger auditLogger;
    private final TenantSecurityMonitor securityMonitor;
    private final int defaultMaxRetries;

    public QueryRetryCoordinator(
            SecureQueryBuilder queryBuilder,
            SecureQueryExecutor queryExecutor,
            TenantAuditLogger auditLogger,
            TenantSecurityMonitor securityMonitor,
            @Value("${secure-query.max-retries:2}") int defaultMaxRetries
    ) {
        this.queryBuilder = queryBuilder;
        this.queryExecutor = queryExecutor;
        this.auditLogger = auditLogger;
        this.securityMonitor = securityMonitor;
        this.defaultMaxRetries = defaultMaxRetries;
    }

    public RetryOutcome executeWithRetry(String sql, String tenantCode, String sessionId) {
        return executeWithRetry(sql, tenantCode, sessionId, defaultMaxRetries, SqlCorrector.SAME_STATEMENT);
    }

    public RetryOutcome executeWithRetry(String sql, String tenantCode, String sessionId, SqlCorrector corrector) {
        return executeWithRetry(sql, tenantCode, sessionId, defaultMaxRetries, corrector);
    }

    public RetryOutcome executeWithRetry(String sql, String tenantCode, String sessionId, int maxRetries) {
        return executeWithRetry(sql, tenantCode, sessionId, maxRetries, SqlCorrector.SAME_STATEMENT);
    }

    public RetryOutcome executeWithRetry(String sql, String tenantCode, String sessionId,
                                         int maxRetries, SqlCorrector corrector) {
        int retries = Math.min(Math.max(0, maxRetries), Math.max(0, defaultMaxRetries));
        if (retries != maxRetries) {
            log.debug("Requested {} retries, using {}", maxRetries, retries);
        }
        List<String> attempts = new ArrayList<>();
        long start = System.nanoTime();
        String currentSql = sql;
        String lastError = null;
        String lastSecuredSql = null;

        for (int attempt = 1; attempt <= retries + 1; attempt++) {
            SecuredStatement secured;
            try {
                secured = queryBuilder.build(currentSql, tenantCode);
            } catch (SecurityViolationException e) {
                // rejected before execution; the executor never saw it, so audit here
                auditLogger.log(ExecutionAttempt.rejected(sessionId, tenantCode, currentSql, elapsedMs(start), e.toAuditString()));
                if (e.getKind() == ViolationKind.FILTER_INJECTION_FAILED) {
                    auditLogger.logSecurityViolation(sessionId, tenantCode, e.getKind().getAuditTag(), e.getDetail());
                }
                attempts.add("Attempt " + attempt + ": Security validation failed: " + e.getUserMessage());
                return securityFailure(e, sessionId, tenantCode, attempts, start);
            }
            lastSecuredSql = secured.sqlText();

            try {
                QueryExecutionResult result = queryExecutor.execute(secured, tenantCode, sessionId);
                attempts.add("Attempt " + attempt + ": " + result.info());
                securityMonitor.resetFailures(sessionId, tenantCode);
                return new RetryOutcome(true, result.rows(), null, attempts, null, secured.sqlText(), elapsedMsRounded(start));
            } catch (SecurityViolationException e) {
                attempts.add("Attempt " + attempt + ": Security validation failed: " + e.getUserMessage());
                return securityFailure(e, sessionId, tenantCode, attempts, start);
            } catch (QueryExecutionException e) {
                lastError = e.getMessage();
                attempts.add("Attempt " + attempt + ": Query execution failed: " + lastError);
            }

            if (attempt > retries) break;

            String corrected = corrector.correct(currentSql, lastError, attempt);
            if (corrected == null || corrected.isBlank()) {
                log.info("No corrected statement supplied after attempt {}, giving up", attempt);
                break;
            }
            log.info("Query failed on attempt {}, retrying...", attempt);
            currentSql = corrected;
        }

        securityMonitor.trackFailure(sessionId, tenantCode, "execution failed: " + lastError);
        return new RetryOutcome(false, List.of(), lastError, attempts, null, lastSecuredSql, elapsedMsRounded(start));
    }

    private RetryOutcome securityFailure(SecurityViolationException e, String sessionId, String tenantCode,
                                         List<String> attempts, long start) {
        log.warn("Security violation for session {}: {}", sessionId, e.getKind());
        securityMonitor.trackFailure(sessionId, tenantCode, e.getKind().getAuditTag());
        return new RetryOutcome(false, List.of(), e.getUserMessage(), attempts, e.getKind(), null, elapsedMsRounded(start));
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private static long elapsedMsRounded(long startNanos) {
        return Math.round(elapsedMs(startNanos));
    }
}
