package com.example.honeypot.report;

import com.example.honeypot.model.ExtractedIntelligence;
import com.example.honeypot.model.Session;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Final result sent to the evaluator for one session.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReportPayload {
    private String sessionId;
    private boolean scamDetected;
    private int totalMessagesExchanged;
    private ExtractedIntelligence extractedIntelligence;
    private String agentNotes;
    private Classification classification;

    public static ReportPayload from(Session session) {
        return ReportPayload.builder()
                .sessionId(session.getSessionId())
                .scamDetected(session.isScamConfirmed())
                .totalMessagesExchanged(session.getMessageCount())
                .extractedIntelligence(ExtractedIntelligence.from(session.getIntelligence()))
                .agentNotes(session.getAgentNotes().isEmpty() ? "Scam engagement completed" : session.getAgentNotes())
                .classification(new Classification(
                        session.getPeakConfidence(),
                        session.getLastCategory(),
                        new ArrayList<>(session.getCategories())))
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Classification {
        private double confidence;
        private String category;
        private List<String> categories;
    }
}
