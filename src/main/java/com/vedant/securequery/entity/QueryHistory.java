package com.vedant.securequery.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "secure_query_history")
public class QueryHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false)
    private String sessionId;

    @Column(name = "tenant_code", nullable = false, length = 50)
    private String tenantCode;

    // secured text with @tenant_code_i placeholders, never the bound values
    @Column(name = "secured_sql", columnDefinition = "text", nullable = false)
    private String securedSql;

    @Column(name = "row_count")
    private Integer rowCount;

    @Column(name = "execution_time_ms")
    private Long executionTimeMs;

    @Column(name = "executed_at", nullable = false)
    private Instant executedAt = Instant.now();

    public QueryHistory() {}

    // Getters / setters
    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String getTenantCode() { return tenantCode; }
    public void setTenantCode(String tenantCode) { this.tenantCode = tenantCode; }

    public String getSecuredSql() { return securedSql; }
    public void setSecuredSql(String securedSql) { this.securedSql = securedSql; }

    public Integer getRowCount() { return rowCount; }
    public void setRowCount(Integer rowCount) { this.rowCount = rowCount; }

    public Long getExecutionTimeMs() { return executionTimeMs; }
    public void setExecutionTimeMs(Long executionTimeMs) { this.executionTimeMs = executionTimeMs; }

    public Instant getExecutedAt() { return executedAt; }
    public void setExecutedAt(Instant executedAt) { this.executedAt = executedAt; }
}
