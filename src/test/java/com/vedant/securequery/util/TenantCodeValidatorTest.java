package com.vedant.securequery.util;

import com.vedant.securequery.exception.SecurityViolationException;
import com.vedant.securequery.exception.ViolationKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class TenantCodeValidatorTest {

    @Test
    void acceptsGuidAndIdentifierCodes() {
        assertDoesNotThrow(() -> TenantCodeValidator.validate("70b0fb90-1eb4-46d8-b23e-f4104619181b"));
        assertDoesNotThrow(() -> TenantCodeValidator.validate("70B0FB90-1EB4-46D8-B23E-F4104619181B"));
        assertDoesNotThrow(() -> TenantCodeValidator.validate("ACME_CORP"));
        assertDoesNotThrow(() -> TenantCodeValidator.validate("abc"));
    }

    @Test
    void rejectsInjectionAttempt() {
        SecurityViolationException ex = assertThrows(SecurityViolationException.class,
                () -> TenantCodeValidator.validate("a' OR '1'='1"));
        assertEquals(ViolationKind.INVALID_TENANT_CODE, ex.getKind());
        assertEquals("Tenant code must be alphanumeric/underscore or valid GUID format", ex.getDetail());
    }

    @Test
    void rejectsTooShortAndTooLong() {
        SecurityViolationException shortEx = assertThrows(SecurityViolationException.class,
                () -> TenantCodeValidator.validate("ab"));
        assertEquals("Tenant code must be 3-50 characters", shortEx.getDetail());

        assertThrows(SecurityViolationException.class, () -> TenantCodeValidator.validate("A".repeat(51)));
        assertDoesNotThrow(() -> TenantCodeValidator.validate("A".repeat(50)));
    }

    @Test
    void rejectsMissingCode() {
        SecurityViolationException ex = assertThrows(SecurityViolationException.class,
                () -> TenantCodeValidator.validate(null));
        assertEquals("Tenant code is required", ex.getDetail());
        assertFalse(TenantCodeValidator.isValid(""));
    }

    @ParameterizedTest
    @ValueSource(strings = {"ACME CORP", "ACME;DROP", "acme-corp", "tenant'--", "70b0fb90-1eb4-46d8-b23e-f410461918", "SELECT*"})
    void rejectsOtherCharacterSets(String code) {
        assertFalse(TenantCodeValidator.isValid(code));
    }

    @Test
    void sanitizeKeepsOnlySafeCharacters() {
        assertEquals("ACME_CORP", TenantCodeValidator.sanitize("ACME_CORP"));
        assertEquals("70b0fb90-1eb4-46d8-b23e-f4104619181b",
                TenantCodeValidator.sanitize("70b0fb90-1eb4-46d8-b23e-f4104619181b"));
        assertEquals("aOR11", TenantCodeValidator.sanitize("a' OR '1'='1"));
        assertEquals("", TenantCodeValidator.sanitize(null));
    }

    @Test
    void detectsGuid() {
        assertTrue(TenantCodeValidator.isGuid("6c657194-e896-4367-a285-478e3ef159b6"));
        assertFalse(TenantCodeValidator.isGuid("ACME_CORP"));
    }
}
