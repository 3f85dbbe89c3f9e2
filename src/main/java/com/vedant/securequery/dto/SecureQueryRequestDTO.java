package com.vedant.securequery.dto;

public class SecureQueryRequestDTO {
    private String sql;
    private Integer maxRetries; // optional, falls back to secure-query.max-retries

    public SecureQueryRequestDTO() {}

    public SecureQueryRequestDTO(String sql, Integer maxRetries) {
        this.sql = sql;
        this.maxRetries = maxRetries;
    }

    public String getSql() { return sql; }
    public void setSql(String sql) { this.sql = sql; }

    public Integer getMaxRetries() { return maxRetries; }
    public void setMaxRetries(Integer maxRetries) { this.maxRetries = maxRetries; }
}
