package com.vedant.securequery.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vedant.securequery.dto.ExecutionAttempt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only JSON-lines audit trail of every execution attempt and security violation.
 * <p>
 * Writes are serialized by one lock so concurrent callers never interleave lines. A failed
 * write is reported through SLF4J and dropped; auditing never fails the request.
 */
@Service
public class TenantAuditLogger {

    private static final Logger log = LoggerFactory.getLogger(TenantAuditLogger.class);

    public static final int MAX_SQL_LENGTH = 500;

    private final Path logFile;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ReentrantLock lock = new ReentrantLock();

    public TenantAuditLogger(@Value("${secure-query.audit.log-file:tenant_security_audit.log}") String logFile) {
        this.logFile = Paths.get(logFile);
    }

    public void log(ExecutionAttempt attempt) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("timestamp", attempt.timestamp().toString());
        entry.put("session_id", attempt.sessionId());
        entry.put("tenant_code", attempt.tenantCode());
        entry.put("sql_query", truncate(attempt.sqlText()));
        entry.put("success", attempt.success());
        entry.put("row_count", attempt.rowCount());
        entry.put("execution_time_ms", attempt.executionTimeMs());
        entry.put("security_violation", attempt.violation());
        append(entry);
    }

    public void logSecurityViolation(String sessionId, String tenantCode, String violationType, String details) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("timestamp", LocalDateTime.now().toString());
        entry.put("event_type", "security_violation");
        entry.put("session_id", sessionId);
        entry.put("tenant_code", tenantCode);
        entry.put("violation_type", violationType);
        entry.put("details", details);
        append(entry);

        log.warn("[SECURITY VIOLATION] {}: {} (session={}, tenant={})", violationType, details, sessionId, tenantCode);
    }

    public Path getLogFile() { return logFile; }

    private void append(Map<String, Object> entry) {
        String line;
        try {
            line = mapper.writeValueAsString(entry) + System.lineSeparator();
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize audit entry", e);
            return;
        }
        lock.lock();
        try {
            Files.writeString(logFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to write audit entry to {}: {}", logFile, e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    static String truncate(String sql) {
        if (sql == null) return null;
        return sql.length() > MAX_SQL_LENGTH ? sql.substring(0, MAX_SQL_LENGTH) : sql;
    }
}
