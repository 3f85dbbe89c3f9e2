package com.vedant.securequery.exception;

/**
 * Raised when a tenant code, a statement or a result set fails a security check.
 * <p>
 * The detail may quote fragments of the offending SQL and is meant for the audit log only.
 * Anything shown to an end user should come from {@link #getUserMessage()}.
 */
public class SecurityViolationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ViolationKind kind;
    private final String detail;

    public SecurityViolationException(ViolationKind kind, String detail) {
        super(kind.name() + ": " + detail);
        this.kind = kind;
        this.detail = detail;
    }

    public ViolationKind getKind() { return kind; }

    public String getDetail() { return detail; }

    public String getUserMessage() { return kind.getUserMessage(); }

    // "<tag>: <detail>" form stored in ExecutionAttempt.violation
    public String toAuditString() {
        return kind.getAuditTag() + ": " + detail;
    }
}
