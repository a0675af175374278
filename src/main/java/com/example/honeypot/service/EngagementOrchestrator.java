package com.example.honeypot.service;

import com.example.honeypot.detection.ScamAssessment;
import com.example.honeypot.detection.ScamClassifier;
import com.example.honeypot.intel.IntelligenceExtractor;
import com.example.honeypot.model.ConversationMetadata;
import com.example.honeypot.model.IntelligenceFinding;
import com.example.honeypot.model.Message;
import com.example.honeypot.model.Session;
import com.example.honeypot.persona.PersonaAgent;
import com.example.honeypot.persona.PersonaReply;
import com.example.honeypot.report.DeliveryOutcome;
import com.example.honeypot.report.ReportDeliveryService;
import com.example.honeypot.report.ReportPayload;
import com.example.honeypot.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs one inbound message through the pipeline:
 * load, classify, extract, reply, persist and, once the reporting trigger is met,
 * report. The session is only ever mutated here.
 * <p>
 * Classification, extraction and reply generation each degrade to a safe default,
 * so a well-formed request always gets a reply.
 */
@Service
public class EngagementOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(EngagementOrchestrator.class);

    static final String SAFE_REPLY = "Sorry, can you repeat that?";

    private final SessionStore sessionStore;
    private final ScamClassifier scamClassifier;
    private final IntelligenceExtractor intelligenceExtractor;
    private final PersonaAgent personaAgent;
    private final ReportDeliveryService reportDeliveryService;
    private final Clock clock;

    @Value("${honeypot.reporting.min-messages:5}")
    private int minMessagesForCallback;

    @Value("${honeypot.reporting.min-intelligence-items:2}")
    private int minIntelligenceItems;

    public EngagementOrchestrator(SessionStore sessionStore,
                                  ScamClassifier scamClassifier,
                                  IntelligenceExtractor intelligenceExtractor,
                                  PersonaAgent personaAgent,
                                  ReportDeliveryService reportDeliveryService,
                                  Clock clock) {
        this.sessionStore = sessionStore;
        this.scamClassifier = scamClassifier;
        this.intelligenceExtractor = intelligenceExtractor;
        this.personaAgent = personaAgent;
        this.reportDeliveryService = reportDeliveryService;
        this.clock = clock;
    }

    public TurnResult handle(TurnRequest request) {
        String sessionId = request.getSessionId();
        Message inbound = request.getMessage();

        Session session = sessionStore.load(sessionId);
        if (session.isNew() && !request.getConversationHistory().isEmpty()) {
            // server history wins; caller history only seeds a brand-new session
            session.seedHistory(request.getConversationHistory());
            session.mergeIntelligence(extractAll(request.getConversationHistory()));
            logger.debug("Session {}: seeded {} prior turn(s) from caller", sessionId,
                    request.getConversationHistory().size());
        }
        List<Message> priorHistory = List.copyOf(session.getHistory());
        session.recordCounterpartMessage(inbound);
        transition(sessionId, TurnStage.LOADED);

        ScamAssessment assessment = classify(inbound, priorHistory);
        session.recordAssessment(assessment.isScam(), assessment.getConfidence(),
                assessment.isScam() ? assessment.getCategory() : null);
        if (assessment.isScam()) {
            session.appendNotes(EngagementNotes.describe(assessment, inbound.getText()));
        }
        transition(sessionId, TurnStage.CLASSIFIED);

        int added = session.mergeIntelligence(extract(inbound.getText()));
        transition(sessionId, TurnStage.EXTRACTED);

        String reply = reply(session, request.getMetadata());
        session.recordAgentReply(Message.agent(reply, clock.millis()));
        transition(sessionId, TurnStage.REPLIED);

        sessionStore.save(session);
        transition(sessionId, TurnStage.PERSISTED);

        logger.info("Session {}: {} (confidence {}, stage {}{}), messages={}, new findings={}, {}",
                sessionId,
                assessment.isScam() ? "SCAM" : "NOT SCAM",
                String.format("%.2f", assessment.getConfidence()),
                assessment.getStage(),
                assessment.isDegraded() ? ", degraded" : "",
                session.getMessageCount(),
                added,
                intelligenceExtractor.summarize(session.getIntelligence()));

        if (shouldReport(session)) {
            logger.info("Session {}: reporting trigger met (messages={}, actionable findings={})",
                    sessionId, session.getMessageCount(), session.actionableFindingCount());
            DeliveryOutcome outcome = reportDeliveryService.deliver(ReportPayload.from(session));
            session.markReported(outcome.getStatus(), clock.instant());
            sessionStore.save(session);
            transition(sessionId, TurnStage.REPORTED);
            if (!outcome.isDelivered()) {
                logger.warn("Session {}: report not delivered after {} attempt(s): {}",
                        sessionId, outcome.getAttempts(), outcome.getDetail());
            }
        }

        return new TurnResult(reply, session.isScamConfirmed(), session.getMessageCount(),
                session.getIntelligence(), session.isReported());
    }

    boolean shouldReport(Session session) {
        if (session.isReported()) {
            return false;
        }
        return session.getMessageCount() >= minMessagesForCallback
                || session.actionableFindingCount() >= minIntelligenceItems;
    }

    private ScamAssessment classify(Message inbound, List<Message> priorHistory) {
        try {
            return scamClassifier.classify(inbound, priorHistory);
        } catch (RuntimeException e) {
            logger.warn("Classification failed, treating turn as neutral", e);
            return ScamAssessment.neutral("classification failed: " + e.getMessage());
        }
    }

    private Set<IntelligenceFinding> extract(String text) {
        try {
            return intelligenceExtractor.extract(text);
        } catch (RuntimeException e) {
            logger.warn("Extraction failed, no findings this turn", e);
            return new LinkedHashSet<>();
        }
    }

    private Set<IntelligenceFinding> extractAll(List<Message> messages) {
        try {
            return intelligenceExtractor.extractAll(messages);
        } catch (RuntimeException e) {
            logger.warn("Extraction from caller history failed", e);
            return new LinkedHashSet<>();
        }
    }

    private String reply(Session session, ConversationMetadata metadata) {
        if (!session.isScamConfirmed()) {
            return personaAgent.neutralReply();
        }
        try {
            PersonaReply reply = personaAgent.generateReply(session.getHistory(),
                    metadata == null ? ConversationMetadata.empty() : metadata,
                    session.getIntelligence());
            return reply.getText();
        } catch (RuntimeException e) {
            logger.warn("Reply generation failed, stalling", e);
            return SAFE_REPLY;
        }
    }

    private void transition(String sessionId, TurnStage stage) {
        logger.debug("Session {} -> {}", sessionId, stage);
    }
}
