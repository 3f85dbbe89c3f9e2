package com.vedant.securequery.util;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tables carrying a TenantCode column. Every reference to one of them must be filtered.
 */
public final class TenantScopedTables {

    public static final String TENANT_COLUMN = "TenantCode";

    public static final Set<String> TABLES = Set.of(
            "UserRecords",
            "Licenses",
            "TenantSummaries",
            "GroupRecords"
    );

    private static final Set<String> NORMALIZED = TABLES.stream()
            .map(t -> t.toUpperCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());

    private TenantScopedTables() {}

    public static boolean isTenantScoped(String tableName) {
        return tableName != null && NORMALIZED.contains(tableName.toUpperCase(Locale.ROOT));
    }
}
