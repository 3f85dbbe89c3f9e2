package com.vedant.securequery.dto;

import com.vedant.securequery.exception.ViolationKind;

import java.util.List;
import java.util.Map;

/**
 * Final result of a bounded retry sequence. {@code attempts} holds one "Attempt n: ..." line
 * per try; {@code violation} is set only when the sequence ended on a security failure.
 */
public record RetryOutcome(
        boolean success,
        List<Map<String, Object>> rows,
        String error,
        List<String> attempts,
        ViolationKind violation,
        String executedSql,
        long durationMs
) {

    public boolean isSecurityFailure() {
        return violation != null;
    }

    public int rowCount() {
        return rows == null ? 0 : rows.size();
    }
}
