package com.vedant.securequery.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SessionQueryHistoryTest {

    @Test
    void keepsOnlyMostRecentEntries() {
        SessionQueryHistory history = new SessionQueryHistory(3, 1000, Duration.ofMinutes(30));

        for (int i = 1; i <= 5; i++) {
            history.record("s1", "q" + i, "SELECT " + i, i);
        }

        List<SessionQueryHistory.HistoryEntry> entries = history.entries("s1");
        assertEquals(3, entries.size());
        assertEquals("q3", entries.get(0).question());
        assertEquals("SELECT 5", history.lastSql("s1"));
    }

    @Test
    void sessionsAreIsolated() {
        SessionQueryHistory history = new SessionQueryHistory(10, 1000, Duration.ofMinutes(30));
        history.record("s1", "q", "SELECT 1", 1);

        assertTrue(history.entries("s2").isEmpty());
        assertNull(history.lastSql("s2"));
    }

    @Test
    void asMapsExposesQuestionSqlAndRowCount() {
        SessionQueryHistory history = new SessionQueryHistory(10, 1000, Duration.ofMinutes(30));
        history.record("s1", null, "SELECT * FROM Licenses WHERE Licenses.TenantCode = @tenant_code_0", 4);

        List<Map<String, String>> maps = history.asMaps("s1");

        assertEquals(1, maps.size());
        assertEquals("", maps.get(0).get("question"));
        assertEquals("4", maps.get(0).get("rowCount"));
    }

    @Test
    void clearAndBlankSessionAreNoOps() {
        SessionQueryHistory history = new SessionQueryHistory(0, 1000, Duration.ofMinutes(30));
        history.record(" ", "q", "SELECT 1", 1);
        history.record("s1", "q", "SELECT 1", 1);
        history.record("s1", "q", "SELECT 2", 1);

        assertEquals(1, history.entries("s1").size());
        history.clear("s1");
        assertTrue(history.entries("s1").isEmpty());
        assertTrue(history.entries(null).isEmpty());
    }

    @Test
    void numberOfSessionsIsBounded() {
        SessionQueryHistory history = new SessionQueryHistory(10, 3, Duration.ofMinutes(30));

        for (int i = 0; i < 40; i++) {
            history.record("s" + i, "q", "SELECT 1", 1);
        }

        assertTrue(history.sessionCount() <= 3);
    }
}
