package com.example.honeypot.detection;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Verdict for one inbound message. {@code degraded} marks a heuristic verdict that
 * was returned because the semantic stage could not answer.
 */
@Value
@Builder(toBuilder = true)
public class ScamAssessment {

    boolean scam;
    double confidence;
    String category;
    DetectionStage stage;
    @Singular
    Set<String> signals;
    String reasoning;
    boolean degraded;

    public static ScamAssessment neutral(String reason) {
        return ScamAssessment.builder()
                .scam(false)
                .confidence(0.0)
                .category("none")
                .stage(DetectionStage.HEURISTIC)
                .reasoning(reason)
                .degraded(true)
                .build();
    }
}
