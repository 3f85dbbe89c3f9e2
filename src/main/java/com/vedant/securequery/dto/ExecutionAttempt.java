package com.vedant.securequery.dto;

import java.time.LocalDateTime;

/**
 * One audited execution call. Built once and never modified.
 */
public record ExecutionAttempt(
        LocalDateTime timestamp,
        String sessionId,
        String tenantCode,
        String sqlText,
        boolean success,
        int rowCount,
        double executionTimeMs,
        String violation
) {

    public static ExecutionAttempt succeeded(String sessionId, String tenantCode, String sql,
                                             int rowCount, double executionTimeMs) {
        return new ExecutionAttempt(LocalDateTime.now(), sessionId, tenantCode, sql, true,
                rowCount, executionTimeMs, null);
    }

    public static ExecutionAttempt failed(String sessionId, String tenantCode, String sql,
                                          double executionTimeMs) {
        return new ExecutionAttempt(LocalDateTime.now(), sessionId, tenantCode, sql, false,
                0, executionTimeMs, null);
    }

    public static ExecutionAttempt rejected(String sessionId, String tenantCode, String sql,
                                            double executionTimeMs, String violation) {
        return new ExecutionAttempt(LocalDateTime.now(), sessionId, tenantCode, sql, false,
                0, executionTimeMs, violation);
    }
}
