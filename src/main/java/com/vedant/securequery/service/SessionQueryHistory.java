package com.vedant.securequery.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded per-session history of secured statements, handed to the SQL generator as
 * conversational context. Not consulted by any security check. Idle sessions expire and the
 * number of sessions kept is bounded.
 */
@Service
public class SessionQueryHistory {

    private final int maxEntries;

    // sessionId -> last statements, oldest first
    private final Cache<String, Deque<HistoryEntry>> history;

    public record HistoryEntry(String question, String sql, int rowCount) {}

    public SessionQueryHistory(
            @Value("${secure-query.history.max-entries:10}") int maxEntries,
            @Value("${secure-query.history.max-sessions:1000}") long maxSessions,
            @Value("${secure-query.history.idle-timeout:30m}") Duration idleTimeout
    ) {
        this.maxEntries = Math.max(1, maxEntries);
        this.history = Caffeine.newBuilder()
                .maximumSize(maxSessions)
                .expireAfterAccess(idleTimeout)
                .executor(Runnable::run)
                .build();
    }

    public void record(String sessionId, String question, String sql, int rowCount) {
        if (sessionId == null || sessionId.isBlank()) return;
        history.asMap().compute(sessionId, (k, dq) -> {
            if (dq == null) dq = new ArrayDeque<>();
            synchronized (dq) {
                dq.addLast(new HistoryEntry(question, sql, rowCount));
                while (dq.size() > maxEntries) dq.removeFirst();
            }
            return dq;
        });
    }

    public List<HistoryEntry> entries(String sessionId) {
        if (sessionId == null) return List.of();
        Deque<HistoryEntry> dq = history.getIfPresent(sessionId);
        if (dq == null) return List.of();
        synchronized (dq) {
            return List.copyOf(dq);
        }
    }

    public String lastSql(String sessionId) {
        List<HistoryEntry> all = entries(sessionId);
        return all.isEmpty() ? null : all.get(all.size() - 1).sql();
    }

    // oldest -> newest, as [{question:, sql:}, ...]
    public List<Map<String, String>> asMaps(String sessionId) {
        List<Map<String, String>> out = new ArrayList<>();
        for (HistoryEntry e : entries(sessionId)) {
            Map<String, String> m = new HashMap<>();
            m.put("question", e.question() == null ? "" : e.question());
            m.put("sql", e.sql());
            m.put("rowCount", String.valueOf(e.rowCount()));
            out.add(m);
        }
        return out;
    }

    public void clear(String sessionId) {
        if (sessionId != null) history.invalidate(sessionId);
    }

    long sessionCount() {
        history.cleanUp();
        return history.estimatedSize();
    }
}
