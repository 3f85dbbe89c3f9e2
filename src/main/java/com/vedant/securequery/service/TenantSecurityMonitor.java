package com.vedant.securequery.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Counts failed attempts per (session, tenant) and raises an audit event once a session
 * keeps failing. Counters of idle sessions expire; the number of tracked keys is bounded.
 */
@Service
public class TenantSecurityMonitor {

    private static final Logger log = LoggerFactory.getLogger(TenantSecurityMonitor.class);

    private final TenantAuditLogger auditLogger;
    private final int maxFailures;
    private final Cache<String, Integer> failures;

    public TenantSecurityMonitor(
            TenantAuditLogger auditLogger,
            @Value("${secure-query.monitor.max-failures:5}") int maxFailures,
            @Value("${secure-query.monitor.max-sessions:10000}") long maxSessions,
            @Value("${secure-query.monitor.idle-timeout:60m}") Duration idleTimeout
    ) {
        this.auditLogger = auditLogger;
        this.maxFailures = maxFailures;
        this.failures = Caffeine.newBuilder()
                .maximumSize(maxSessions)
                .expireAfterAccess(idleTimeout)
                .executor(Runnable::run)
                .build();
    }

    /**
     * @return true once the key has reached the failure threshold
     */
    public boolean trackFailure(String sessionId, String tenantCode, String reason) {
        int count = failures.asMap().merge(key(sessionId, tenantCode), 1, Integer::sum);
        if (count >= maxFailures) {
            auditLogger.logSecurityViolation(sessionId, tenantCode, "excessive_failures",
                    "Session exceeded " + maxFailures + " failures: " + reason);
            return true;
        }
        log.debug("Failure {} of {} for session {}", count, maxFailures, sessionId);
        return false;
    }

    public void resetFailures(String sessionId, String tenantCode) {
        failures.invalidate(key(sessionId, tenantCode));
    }

    public int getFailureCount(String sessionId, String tenantCode) {
        Integer count = failures.getIfPresent(key(sessionId, tenantCode));
        return count == null ? 0 : count;
    }

    long trackedSessions() {
        failures.cleanUp();
        return failures.estimatedSize();
    }

    private String key(String sessionId, String tenantCode) {
        return sessionId + "_" + tenantCode;
    }
}
