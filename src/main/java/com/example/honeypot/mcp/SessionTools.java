package com.example.honeypot.mcp;

import com.example.honeypot.intel.IntelligenceExtractor;
import com.example.honeypot.model.ExtractedIntelligence;
import com.example.honeypot.model.Session;
import com.example.honeypot.session.KvSessionStore;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only operator view of live sessions, exposed over MCP.
 */
@Service
public class SessionTools {

    private final KvSessionStore sessionStore;
    private final IntelligenceExtractor intelligenceExtractor;

    public SessionTools(KvSessionStore sessionStore, IntelligenceExtractor intelligenceExtractor) {
        this.sessionStore = sessionStore;
        this.intelligenceExtractor = intelligenceExtractor;
    }

    @Tool(description = "Get the state of one honeypot session: message count, scam verdict, report status and notes")
    public Map<String, Object> honeypot_session_get(@ToolParam(description = "session id") String sessionId) {
        Optional<Session> found = sessionStore.find(sessionId);
        if (found.isEmpty()) {
            return Map.of("sessionId", sessionId, "found", false);
        }
        Session session = found.get();
        Map<String, Object> result = new HashMap<>();
        result.put("sessionId", session.getSessionId());
        result.put("found", true);
        result.put("messageCount", session.getMessageCount());
        result.put("historySize", session.getHistory().size());
        result.put("scamConfirmed", session.isScamConfirmed());
        result.put("peakConfidence", session.getPeakConfidence());
        result.put("categories", session.getCategories());
        result.put("agentNotes", session.getAgentNotes());
        result.put("reported", session.isReported());
        result.put("reportOutcome", session.getReportOutcome() == null ? null : session.getReportOutcome().name());
        result.put("createdAt", String.valueOf(session.getCreatedAt()));
        result.put("lastUpdatedAt", String.valueOf(session.getLastUpdatedAt()));
        result.put("ttlSec", sessionStore.remainingTtl(sessionId).map(Duration::toSeconds).orElse(null));
        return result;
    }

    @Tool(description = "Get the intelligence extracted so far in a honeypot session, grouped by kind")
    public Map<String, Object> honeypot_session_intelligence(@ToolParam(description = "session id") String sessionId) {
        return sessionStore.find(sessionId)
                .<Map<String, Object>>map(session -> Map.of(
                        "sessionId", sessionId,
                        "summary", intelligenceExtractor.summarize(session.getIntelligence()),
                        "extractedIntelligence", ExtractedIntelligence.from(session.getIntelligence())))
                .orElseGet(() -> Map.of("sessionId", sessionId, "found", false));
    }

    @Tool(description = "Report whether the session store is connected or running on the in-process fallback")
    public Map<String, Object> honeypot_store_status() {
        return Map.of("store", sessionStore.status().name().toLowerCase(Locale.ROOT));
    }

    @Tool(description = "List ids of live honeypot sessions (limit enforced)")
    public Map<String, Object> honeypot_session_list(
            @ToolParam(description = "maximum number of ids", required = false) Integer limit) {
        int lim = (limit == null || limit <= 0) ? 100 : Math.min(limit, 1000);
        return Map.of("sessionIds", sessionStore.listSessionIds(lim));
    }
}
