package com.vedant.securequery.service;

import com.vedant.securequery.dto.RetryOutcome;
import com.vedant.securequery.dto.SecuredStatement;
import com.vedant.securequery.entity.QueryHistory;
import com.vedant.securequery.repository.QueryHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for callers holding a generated statement: secures, executes with retry and
 * records the outcome in the session and persistent histories.
 */
@Service
public class SecureQueryService {

    private static final Logger log = LoggerFactory.getLogger(SecureQueryService.class);

    private final SecureQueryBuilder queryBuilder;
    private final QueryRetryCoordinator retryCoordinator;
    private final SessionQueryHistory sessionHistory;
    private final QueryHistoryRepository historyRepository;

    public SecureQueryService(
            SecureQueryBuilder queryBuilder,
            QueryRetryCoordinator retryCoordinator,
            SessionQueryHistory sessionHistory,
            QueryHistoryRepository historyRepository
    ) {
        this.queryBuilder = queryBuilder;
        this.retryCoordinator = retryCoordinator;
        this.sessionHistory = sessionHistory;
        this.historyRepository = historyRepository;
    }

    /* ============================================================
       MAIN: raw SQL -> secure -> execute (with retry) -> history
       ============================================================ */
    public RetryOutcome execute(String rawSql, String tenantCode, String sessionId, Integer maxRetries,
                                SqlCorrector corrector) {
        RetryOutcome outcome;
        if (maxRetries == null) {
            outcome = corrector == null
                    ? retryCoordinator.executeWithRetry(rawSql, tenantCode, sessionId)
                    : retryCoordinator.executeWithRetry(rawSql, tenantCode, sessionId, corrector);
        } else {
            outcome = retryCoordinator.executeWithRetry(rawSql, tenantCode, sessionId, maxRetries,
                    corrector != null ? corrector : SqlCorrector.SAME_STATEMENT);
        }

        if (outcome.success()) {
            sessionHistory.record(sessionId, null, outcome.executedSql(), outcome.rowCount());
            saveHistory(outcome, tenantCode, sessionId);
        }
        return outcome;
    }

    public RetryOutcome execute(String rawSql, String tenantCode, String sessionId, Integer maxRetries) {
        return execute(rawSql, tenantCode, sessionId, maxRetries, null);
    }

    // secures without executing, for callers that only need the rewritten text
    public SecuredStatement preview(String rawSql, String tenantCode) {
        return queryBuilder.build(rawSql, tenantCode);
    }

    private void saveHistory(RetryOutcome outcome, String tenantCode, String sessionId) {
        try {
            QueryHistory h = new QueryHistory();
            h.setSessionId(sessionId);
            h.setTenantCode(tenantCode);
            h.setSecuredSql(outcome.executedSql());
            h.setRowCount(outcome.rowCount());
            h.setExecutionTimeMs(outcome.durationMs());
            historyRepository.save(h);
        } catch (Exception e) {
            log.warn("Failed to persist query history for session {}: {}", sessionId, e.getMessage());
        }
    }
}
