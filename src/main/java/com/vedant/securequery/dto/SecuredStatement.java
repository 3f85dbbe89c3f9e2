package com.vedant.securequery.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Statement text plus the named parameters it references, in ascending index order
 * ({@code tenant_code_0}, {@code tenant_code_1}, ...).
 */
public record SecuredStatement(String sqlText, Map<String, String> parameters) {

    public SecuredStatement {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static SecuredStatement unfiltered(String sqlText) {
        return new SecuredStatement(sqlText, Map.of());
    }

    public boolean isTenantFiltered() {
        return !parameters.isEmpty();
    }
}
