package com.vedant.securequery.dto;

import java.util.List;
import java.util.Map;

public class SecureQueryResponseDTO {
    private boolean success;
    private String sql;
    private List<Map<String, Object>> rows;
    private Integer rowCount;
    private Long executionTimeMs;
    private List<String> attempts;
    private String message;

    public SecureQueryResponseDTO() {}

    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public String getSql() { return sql; }
    public void setSql(String sql) { this.sql = sql; }

    public List<Map<String, Object>> getRows() { return rows; }
    public void setRows(List<Map<String, Object>> rows) { this.rows = rows; }

    public Integer getRowCount() { return rowCount; }
    public void setRowCount(Integer rowCount) { this.rowCount = rowCount; }

    public Long getExecutionTimeMs() { return executionTimeMs; }
    public void setExecutionTimeMs(Long executionTimeMs) { this.executionTimeMs = executionTimeMs; }

    public List<String> getAttempts() { return attempts; }
    public void setAttempts(List<String> attempts) { this.attempts = attempts; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
}
