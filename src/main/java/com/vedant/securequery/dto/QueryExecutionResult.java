package com.vedant.securequery.dto;

import java.util.List;
import java.util.Map;

public record QueryExecutionResult(
        boolean success,
        List<Map<String, Object>> rows,
        int rowCount,
        long durationMs,
        String info
) {}
