package com.vedant.securequery.dto;

import java.util.Optional;

/**
 * A table named after FROM or JOIN, with the alias it was given (null when none).
 * {@code writtenName} keeps a schema-qualified spelling such as {@code dbo.UserRecords}.
 */
public record TableReference(String tableName, String alias, String writtenName) {

    public TableReference(String tableName, String alias) {
        this(tableName, alias, tableName);
    }

    public Optional<String> aliasOptional() {
        return Optional.ofNullable(alias);
    }

    // the name a predicate must use to address this reference
    public String qualifier() {
        return alias != null ? alias : writtenName;
    }
}
