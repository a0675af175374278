package com.example.honeypot.detection;

import com.example.honeypot.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Two-stage scam classification. The heuristic verdict stands when it is clearly
 * above the threshold or clearly implausible; anything in between is escalated to
 * the {@link SemanticJudge}. A failed escalation returns the heuristic verdict
 * marked as degraded.
 */
@Service
public class ScamClassifier {

    private static final Logger logger = LoggerFactory.getLogger(ScamClassifier.class);

    private final HeuristicScorer heuristicScorer;
    private final SemanticJudge semanticJudge;

    @Value("${honeypot.detection.confidence-threshold:0.7}")
    private double threshold;

    @Value("${honeypot.detection.low-floor:0.3}")
    private double lowFloor;

    public ScamClassifier(HeuristicScorer heuristicScorer, SemanticJudge semanticJudge) {
        this.heuristicScorer = heuristicScorer;
        this.semanticJudge = semanticJudge;
    }

    public ScamAssessment classify(Message message, List<Message> history) {
        ScamAssessment heuristic = heuristicScorer.score(message.getText(), threshold);
        if (heuristic.getConfidence() >= threshold || heuristic.getConfidence() <= lowFloor) {
            logger.debug("Heuristic verdict {} (confidence {})", heuristic.isScam(), heuristic.getConfidence());
            return heuristic;
        }
        return semanticJudge.judge(message, history, threshold)
                .orElseGet(() -> {
                    logger.warn("Degraded decision: using heuristic verdict {} (confidence {})",
                            heuristic.isScam(), heuristic.getConfidence());
                    return heuristic.toBuilder()
                            .degraded(true)
                            .reasoning(heuristic.getReasoning() + " (semantic stage unavailable)")
                            .build();
                });
    }
}
