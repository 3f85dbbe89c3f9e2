package com.vedant.securequery.exception;

/**
 * Driver-level failure while running an already secured statement (syntax error, connectivity,
 * timeout). Unlike {@link SecurityViolationException} this is recoverable: the retry coordinator
 * may run a corrected statement.
 */
public class QueryExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public static final int MAX_MESSAGE_LENGTH = 500;

    private final long durationMs;

    public QueryExecutionException(String message, long durationMs, Throwable cause) {
        super(truncate(message), cause);
        this.durationMs = durationMs;
    }

    public long getDurationMs() { return durationMs; }

    static String truncate(String message) {
        if (message == null) return "Unknown database error";
        return message.length() > MAX_MESSAGE_LENGTH ? message.substring(0, MAX_MESSAGE_LENGTH) : message;
    }
}
