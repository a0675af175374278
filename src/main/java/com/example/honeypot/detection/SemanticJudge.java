package com.example.honeypot.detection;

import com.example.honeypot.llm.LlmClient;
import com.example.honeypot.llm.LlmException;
import com.example.honeypot.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * LLM-backed second pass. Returns empty when the model cannot give a usable verdict;
 * the caller decides what to fall back to.
 */
@Component
public class SemanticJudge {

    private static final Logger logger = LoggerFactory.getLogger(SemanticJudge.class);

    private final LlmClient llmClient;
    private final ObjectMapper objectMapper;

    @Value("${honeypot.detection.history-window:6}")
    private int historyWindow;

    public SemanticJudge(LlmClient llmClient, ObjectMapper objectMapper) {
        this.llmClient = llmClient;
        this.objectMapper = objectMapper;
    }

    public Optional<ScamAssessment> judge(Message message, List<Message> history, double threshold) {
        List<Message> window = history.subList(Math.max(0, history.size() - historyWindow), history.size());
        String raw;
        try {
            raw = llmClient.complete(DetectionPrompts.SYSTEM, DetectionPrompts.user(message, window));
        } catch (LlmException e) {
            logger.warn("Semantic stage unavailable: {}", e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            logger.warn("Semantic stage failed unexpectedly", e);
            return Optional.empty();
        }
        return parse(raw, threshold);
    }

    Optional<ScamAssessment> parse(String raw, double threshold) {
        if (raw == null || raw.isBlank()) {
            logger.warn("Semantic stage returned an empty answer");
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(stripCodeFence(raw));
            JsonNode confidenceNode = node == null ? null : node.get("confidence");
            if (confidenceNode == null || !confidenceNode.isNumber()) {
                logger.warn("Semantic stage returned no numeric confidence: {}", abbreviate(raw));
                return Optional.empty();
            }
            double confidence = confidenceNode.asDouble();
            if (confidence < 0.0 || confidence > 1.0) {
                logger.warn("Semantic stage confidence out of range: {}", confidence);
                return Optional.empty();
            }
            return Optional.of(ScamAssessment.builder()
                    .scam(confidence >= threshold)
                    .confidence(confidence)
                    .category(category(node))
                    .stage(DetectionStage.LLM)
                    .reasoning(node.path("reasoning").asText(""))
                    .degraded(false)
                    .build());
        } catch (JsonProcessingException e) {
            logger.warn("Semantic stage returned malformed JSON: {}", abbreviate(raw));
            return Optional.empty();
        }
    }

    private static String category(JsonNode node) {
        String category = node.path("category").asText("");
        if (category.isBlank() && node.path("categories").isArray() && node.path("categories").size() > 0) {
            category = node.path("categories").get(0).asText("");
        }
        if (category.isBlank()) {
            return "unspecified";
        }
        return category.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
    }

    private static String stripCodeFence(String raw) {
        String trimmed = raw.trim();
        if (trimmed.startsWith("```")) {
            int firstBrace = trimmed.indexOf('{');
            int lastBrace = trimmed.lastIndexOf('}');
            if (firstBrace >= 0 && lastBrace > firstBrace) {
                return trimmed.substring(firstBrace, lastBrace + 1);
            }
        }
        return trimmed;
    }

    private static String abbreviate(String raw) {
        return raw.length() <= 120 ? raw : raw.substring(0, 120) + "...";
    }
}
