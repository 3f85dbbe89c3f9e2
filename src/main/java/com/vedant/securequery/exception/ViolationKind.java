package com.vedant.securequery.exception;

/**
 * Categories of terminal security failures. None of them is ever retried.
 */
public enum ViolationKind {

    INVALID_TENANT_CODE("invalid_tenant_code", "Invalid tenant code"),
    FORBIDDEN_OPERATION("forbidden_operation", "Query rejected by security policy"),
    INJECTION_PATTERN_DETECTED("injection_pattern_detected", "Query rejected by security policy"),
    FILTER_INJECTION_FAILED("tenant_filter_injection_failed", "Query rejected by security policy"),
    CROSS_TENANT_LEAK("cross_tenant_leak", "Query rejected by security policy");

    private final String auditTag;
    private final String userMessage;

    ViolationKind(String auditTag, String userMessage) {
        this.auditTag = auditTag;
        this.userMessage = userMessage;
    }

    // value written to the audit log's violation fields
    public String getAuditTag() { return auditTag; }

    // safe to show an end user; never contains SQL
    public String getUserMessage() { return userMessage; }
}
