package com.vedant.securequery.service;

import com.vedant.securequery.dto.SecuredStatement;
import com.vedant.securequery.exception.SecurityViolationException;
import com.vedant.securequery.exception.ViolationKind;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SecureQueryBuilderTest {

    private final SecureQueryBuilder builder = new SecureQueryBuilder();

    @Test
    void securesSelectWithExistingWhere() {
        SecuredStatement secured = builder.build("SELECT * FROM UserRecords WHERE Department = 'IT'", "ACME_CORP");

        assertEquals("SELECT * FROM UserRecords WHERE UserRecords.TenantCode = @tenant_code_0 AND Department = 'IT'",
                secured.sqlText());
        assertEquals(Map.of("tenant_code_0", "ACME_CORP"), secured.parameters());
    }

    @Test
    void securesGuidTenant() {
        SecuredStatement secured = builder.build("SELECT * FROM Licenses", "70b0fb90-1eb4-46d8-b23e-f4104619181b");

        assertEquals("70b0fb90-1eb4-46d8-b23e-f4104619181b", secured.parameters().get("tenant_code_0"));
    }

    @Test
    void rejectsStackedDropBeforeInjection() {
        SecurityViolationException ex = assertThrows(SecurityViolationException.class,
                () -> builder.build("SELECT * FROM UserRecords; DROP TABLE UserRecords;", "ACME_CORP"));

        assertEquals(ViolationKind.FORBIDDEN_OPERATION, ex.getKind());
    }

    @Test
    void rejectsInvalidTenantBeforeLookingAtSql() {
        SecurityViolationException ex = assertThrows(SecurityViolationException.class,
                () -> builder.build("DROP TABLE UserRecords", "a' OR '1'='1"));

        assertEquals(ViolationKind.INVALID_TENANT_CODE, ex.getKind());
        assertEquals("Invalid tenant code", ex.getUserMessage());
    }

    @Test
    void rejectsInjectionPattern() {
        SecurityViolationException ex = assertThrows(SecurityViolationException.class,
                () -> builder.build("SELECT * FROM UserRecords WHERE Mail = 'x' OR 1=1", "ACME_CORP"));

        assertEquals(ViolationKind.INJECTION_PATTERN_DETECTED, ex.getKind());
    }

    @Test
    void passesThroughStatementWithoutScopedTables() {
        SecuredStatement secured = builder.build("SELECT 1 AS test_value", "ACME_CORP");

        assertEquals("SELECT 1 AS test_value", secured.sqlText());
        assertFalse(secured.isTenantFiltered());
    }

    @Test
    void securesDelimitedNamesWrittenWithoutSpaces() {
        SecuredStatement bracketed = builder.build("SELECT Mail FROM[UserRecords]", "ACME_CORP");
        assertEquals("SELECT Mail FROM[UserRecords] WHERE [UserRecords].TenantCode = @tenant_code_0", bracketed.sqlText());

        SecuredStatement quoted = builder.build("SELECT u.Mail FROM UserRecords u JOIN\"Licenses\" l ON l.Id = u.LicenseId", "ACME_CORP");
        assertEquals("SELECT u.Mail FROM UserRecords u JOIN\"Licenses\" l ON l.Id = u.LicenseId"
                + " WHERE u.TenantCode = @tenant_code_0 AND l.TenantCode = @tenant_code_1", quoted.sqlText());
        assertEquals(2, quoted.parameters().size());
    }

    @Test
    void securesEveryCommaSeparatedTable() {
        SecuredStatement secured = builder.build("SELECT u.Mail FROM (SELECT 1 AS x) t, UserRecords u", "ACME_CORP");

        assertTrue(secured.sqlText().endsWith("WHERE u.TenantCode = @tenant_code_0"));
        assertEquals(Map.of("tenant_code_0", "ACME_CORP"), secured.parameters());
    }

    @Test
    void rejectsScopedTableItCannotFilter() {
        SecurityViolationException ex = assertThrows(SecurityViolationException.class,
                () -> builder.build("SELECT * FROM Licenses l CROSS APPLY UserRecords", "ACME_CORP"));

        assertEquals(ViolationKind.FILTER_INJECTION_FAILED, ex.getKind());
    }

    @Test
    void rejectsParenthesizedUnionBranch() {
        SecurityViolationException ex = assertThrows(SecurityViolationException.class,
                () -> builder.build("SELECT Mail FROM UserRecords UNION (SELECT Mail FROM UserRecords)", "ACME_CORP"));

        assertEquals(ViolationKind.INJECTION_PATTERN_DETECTED, ex.getKind());
    }
}
