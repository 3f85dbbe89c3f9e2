package com.vedant.securequery.util;

import com.vedant.securequery.dto.SecuredStatement;
import com.vedant.securequery.dto.TableReference;
import com.vedant.securequery.exception.SecurityViolationException;
import com.vedant.securequery.exception.ViolationKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FilterInjectorTest {

    @Test
    void prependsPredicateToExistingWhere() {
        SecuredStatement secured = FilterInjector.inject("SELECT * FROM UserRecords WHERE Department = 'IT'", "ACME_CORP");

        assertEquals("SELECT * FROM UserRecords WHERE UserRecords.TenantCode = @tenant_code_0 AND Department = 'IT'",
                secured.sqlText());
        assertEquals(Map.of("tenant_code_0", "ACME_CORP"), secured.parameters());
        assertTrue(secured.isTenantFiltered());
    }

    @Test
    void insertsWhereBeforeGroupByForJoins() {
        SecuredStatement secured = FilterInjector.inject(
                "SELECT Id, Name FROM Licenses l JOIN UserRecords ur ON l.Id = ur.LicenseId GROUP BY Id, Name ORDER BY Name",
                "ACME_CORP");

        assertEquals("SELECT Id, Name FROM Licenses l JOIN UserRecords ur ON l.Id = ur.LicenseId"
                        + " WHERE l.TenantCode = @tenant_code_0 AND ur.TenantCode = @tenant_code_1"
                        + " GROUP BY Id, Name ORDER BY Name",
                secured.sqlText());
        assertEquals(List.of("tenant_code_0", "tenant_code_1"), List.copyOf(secured.parameters().keySet()));
    }

    @Test
    void appendsWhereAtEndWithoutClauses() {
        assertEquals("SELECT * FROM Licenses WHERE Licenses.TenantCode = @tenant_code_0",
                FilterInjector.inject("SELECT * FROM Licenses", "ACME_CORP").sqlText());
    }

    @Test
    void keepsTrailingSemicolonAfterNewWhere() {
        assertEquals("SELECT * FROM Licenses WHERE Licenses.TenantCode = @tenant_code_0;",
                FilterInjector.inject("SELECT * FROM Licenses;", "ACME_CORP").sqlText());
    }

    @Test
    void wrapsConditionWithTopLevelOr() {
        SecuredStatement secured = FilterInjector.inject(
                "SELECT * FROM UserRecords WHERE Department = 'IT' OR Department = 'HR' ORDER BY DisplayName", "ACME_CORP");

        assertEquals("SELECT * FROM UserRecords WHERE UserRecords.TenantCode = @tenant_code_0"
                        + " AND (Department = 'IT' OR Department = 'HR') ORDER BY DisplayName",
                secured.sqlText());
    }

    @Test
    void filtersEachSideOfSelfJoin() {
        SecuredStatement secured = FilterInjector.inject(
                "SELECT a.DisplayName FROM UserRecords a JOIN UserRecords b ON a.ManagerId = b.UserID", "ACME_CORP");

        assertEquals("SELECT a.DisplayName FROM UserRecords a JOIN UserRecords b ON a.ManagerId = b.UserID"
                        + " WHERE a.TenantCode = @tenant_code_0 AND b.TenantCode = @tenant_code_1",
                secured.sqlText());
    }

    @Test
    void filtersDerivedTableInsideItsOwnBlock() {
        SecuredStatement secured = FilterInjector.inject("SELECT COUNT(*) FROM (SELECT * FROM UserRecords) t", "ACME_CORP");

        assertEquals("SELECT COUNT(*) FROM (SELECT * FROM UserRecords WHERE UserRecords.TenantCode = @tenant_code_0) t",
                secured.sqlText());
    }

    @Test
    void filtersSubqueryInsideOuterWhere() {
        SecuredStatement secured = FilterInjector.inject(
                "SELECT * FROM UserRecords ur WHERE ur.LicenseId IN (SELECT l.Id FROM Licenses l WHERE l.IsActive = 1)",
                "ACME_CORP");

        assertEquals("SELECT * FROM UserRecords ur WHERE ur.TenantCode = @tenant_code_0 AND ur.LicenseId IN"
                        + " (SELECT l.Id FROM Licenses l WHERE l.TenantCode = @tenant_code_1 AND l.IsActive = 1)",
                secured.sqlText());
    }

    @Test
    void leavesStatementWithoutScopedTablesUntouched() {
        SecuredStatement secured = FilterInjector.inject("SELECT name FROM sys.tables", "ACME_CORP");

        assertEquals("SELECT name FROM sys.tables", secured.sqlText());
        assertTrue(secured.parameters().isEmpty());
        assertFalse(secured.isTenantFiltered());
    }

    @Test
    void ignoresClauseKeywordsInsideLiterals() {
        SecuredStatement secured = FilterInjector.inject(
                "SELECT * FROM GroupRecords g WHERE g.Description = 'sorted where order by name'", "ACME_CORP");

        assertEquals("SELECT * FROM GroupRecords g WHERE g.TenantCode = @tenant_code_0"
                        + " AND g.Description = 'sorted where order by name'",
                secured.sqlText());
    }

    @Test
    void tenantCodeNeverAppearsInSqlText() {
        SecuredStatement secured = FilterInjector.inject(
                "SELECT * FROM TenantSummaries s JOIN Licenses l ON l.Sku = s.Sku", "70b0fb90-1eb4-46d8-b23e-f4104619181b");

        assertFalse(secured.sqlText().contains("70b0fb90"));
        assertTrue(secured.parameters().values().stream().allMatch("70b0fb90-1eb4-46d8-b23e-f4104619181b"::equals));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "SELECT * FROM UserRecords",
            "SELECT Department, COUNT(*) FROM UserRecords GROUP BY Department HAVING COUNT(*) > 1",
            "SELECT * FROM Licenses l, UserRecords ur WHERE ur.LicenseId = l.Id",
            "SELECT * FROM UserRecords ur JOIN (SELECT * FROM Licenses) l ON ur.LicenseId = l.Id",
            "SELECT TOP 10 * FROM dbo.UserRecords ORDER BY DisplayName",
            "SELECT * FROM GroupRecords WHERE Name = 'x' OR Name = 'y'"
    })
    void everyScopedReferenceGetsExactlyOnePredicate(String raw) {
        SecuredStatement secured = FilterInjector.inject(raw, "ACME_CORP");

        List<TableReference> scoped = TableReferenceExtractor.extract(secured.sqlText()).stream()
                .filter(r -> TenantScopedTables.isTenantScoped(r.tableName()))
                .toList();
        assertEquals(scoped.size(), secured.parameters().size());
        for (int i = 0; i < scoped.size(); i++) {
            assertTrue(secured.sqlText().contains(FilterInjector.predicate(scoped.get(i), FilterInjector.parameterName(i))));
        }
        assertDoesNotThrow(() -> SecurityGate.check(secured.sqlText()));
        assertDoesNotThrow(() -> SecurityGate.verifyTenantFilter(secured, "ACME_CORP"));
    }

    @Test
    void rejectsEmptyStatement() {
        SecurityViolationException ex = assertThrows(SecurityViolationException.class,
                () -> FilterInjector.inject("  ", "ACME_CORP"));
        assertEquals(ViolationKind.FILTER_INJECTION_FAILED, ex.getKind());
    }

    @Test
    void filtersDelimitedNameWithoutSpaceAfterFrom() {
        SecuredStatement secured = FilterInjector.inject("SELECT Mail FROM[UserRecords]", "ACME_CORP");

        assertEquals("SELECT Mail FROM[UserRecords] WHERE [UserRecords].TenantCode = @tenant_code_0", secured.sqlText());
        assertEquals(Map.of("tenant_code_0", "ACME_CORP"), secured.parameters());
    }

    @Test
    void filtersCommaEntryAfterDerivedTable() {
        SecuredStatement secured = FilterInjector.inject("SELECT u.Mail FROM (SELECT 1 AS x) t, UserRecords u", "ACME_CORP");

        assertEquals("SELECT u.Mail FROM (SELECT 1 AS x) t, UserRecords u WHERE u.TenantCode = @tenant_code_0",
                secured.sqlText());
    }

    @Test
    void filtersCommaEntryAfterJoinCondition() {
        SecuredStatement secured = FilterInjector.inject(
                "SELECT u.Mail FROM Licenses l JOIN GroupRecords g ON l.Id = g.Id, UserRecords u", "ACME_CORP");

        assertEquals("SELECT u.Mail FROM Licenses l JOIN GroupRecords g ON l.Id = g.Id, UserRecords u"
                        + " WHERE l.TenantCode = @tenant_code_0 AND g.TenantCode = @tenant_code_1"
                        + " AND u.TenantCode = @tenant_code_2",
                secured.sqlText());
        assertEquals(3, secured.parameters().size());
    }
}
