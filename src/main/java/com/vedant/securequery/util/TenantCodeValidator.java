package com.vedant.securequery.util;

import com.vedant.securequery.exception.SecurityViolationException;
import com.vedant.securequery.exception.ViolationKind;

import java.util.regex.Pattern;

/**
 * Tenant code format checks. A tenant code is either an identifier-like code (ACME_CORP)
 * or a canonical GUID, 3-50 characters long.
 */
public final class TenantCodeValidator {

    public static final int MIN_LENGTH = 3;
    public static final int MAX_LENGTH = 50;

    private static final Pattern ALPHANUMERIC = Pattern.compile("^[A-Za-z0-9_]+$");
    private static final Pattern GUID = Pattern.compile(
            "^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$", Pattern.CASE_INSENSITIVE);
    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^A-Za-z0-9_-]");

    private TenantCodeValidator() {}

    public static void validate(String code) {
        if (code == null || code.isEmpty()) {
            throw new SecurityViolationException(ViolationKind.INVALID_TENANT_CODE, "Tenant code is required");
        }
        if (code.length() < MIN_LENGTH || code.length() > MAX_LENGTH) {
            throw new SecurityViolationException(ViolationKind.INVALID_TENANT_CODE,
                    "Tenant code must be " + MIN_LENGTH + "-" + MAX_LENGTH + " characters");
        }
        if (!ALPHANUMERIC.matcher(code).matches() && !GUID.matcher(code).matches()) {
            throw new SecurityViolationException(ViolationKind.INVALID_TENANT_CODE,
                    "Tenant code must be alphanumeric/underscore or valid GUID format");
        }
    }

    public static boolean isValid(String code) {
        try {
            validate(code);
            return true;
        } catch (SecurityViolationException e) {
            return false;
        }
    }

    public static boolean isGuid(String code) {
        return code != null && GUID.matcher(code).matches();
    }

    /**
     * Drops every character outside {@code [A-Za-z0-9_-]}. Applied to codes that already passed
     * {@link #validate(String)} before they become parameter values, so for valid input it is a no-op.
     */
    public static String sanitize(String code) {
        if (code == null) return "";
        return UNSAFE_CHARS.matcher(code).replaceAll("");
    }
}
