package com.example.honeypot.model;

import com.example.honeypot.report.DeliveryStatus;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * State of one scammer-engagement conversation, keyed by the caller's session id.
 * <p>
 * History is append-only, intelligence only grows, and the {@code scamConfirmed} and
 * {@code reported} flags are sticky. Mutators enforce those rules; there are no setters.
 * Serialized field-by-field by {@link com.example.honeypot.session.SessionCodec}.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@JsonAutoDetect(
        fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class Session {

    private static final int MAX_NOTES_LENGTH = 2000;

    private String sessionId;
    @Getter(AccessLevel.NONE)
    private List<Message> history = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    @JsonDeserialize(as = LinkedHashSet.class)
    private Set<IntelligenceFinding> intelligence = new LinkedHashSet<>();
    private int messageCount;
    private boolean scamConfirmed;
    private double peakConfidence;
    private String lastCategory;
    @Getter(AccessLevel.NONE)
    @JsonDeserialize(as = LinkedHashSet.class)
    private Set<String> categories = new LinkedHashSet<>();
    private String agentNotes = "";
    private boolean reported;
    private DeliveryStatus reportOutcome;
    private Instant reportedAt;
    private Instant createdAt;
    private Instant lastUpdatedAt;

    public static Session start(String sessionId, Instant now) {
        Session session = new Session();
        session.sessionId = sessionId;
        session.createdAt = now;
        session.lastUpdatedAt = now;
        return session;
    }

    public List<Message> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public Set<IntelligenceFinding> getIntelligence() {
        return Collections.unmodifiableSet(intelligence);
    }

    public Set<String> getCategories() {
        return Collections.unmodifiableSet(categories);
    }

    public boolean isNew() {
        return history.isEmpty();
    }

    /**
     * Seeds an empty history with turns the caller already exchanged elsewhere.
     * Seeded turns are context only and do not count as processed messages.
     */
    public void seedHistory(List<Message> messages) {
        if (!history.isEmpty()) {
            throw new IllegalStateException("Session " + sessionId + " already has history");
        }
        history.addAll(messages);
    }

    public void recordCounterpartMessage(Message message) {
        if (!message.isFromCounterpart()) {
            throw new IllegalArgumentException("Expected a counterpart message, got " + message.getSender());
        }
        history.add(message);
        messageCount++;
    }

    public void recordAgentReply(Message reply) {
        if (reply.isFromCounterpart()) {
            throw new IllegalArgumentException("Expected an agent message, got " + reply.getSender());
        }
        history.add(reply);
    }

    /**
     * @return how many findings were new to this session
     */
    public int mergeIntelligence(Collection<IntelligenceFinding> findings) {
        int added = 0;
        for (IntelligenceFinding finding : findings) {
            if (intelligence.add(finding)) {
                added++;
            }
        }
        return added;
    }

    public void recordAssessment(boolean scam, double confidence, String category) {
        scamConfirmed = scamConfirmed || scam;
        peakConfidence = Math.max(peakConfidence, confidence);
        if (category != null && !category.isBlank()) {
            lastCategory = category;
            categories.add(category);
        }
    }

    public void appendNotes(String notes) {
        if (notes == null || notes.isBlank()) {
            return;
        }
        if (agentNotes.isEmpty()) {
            agentNotes = notes;
        } else if (!agentNotes.contains(notes) && agentNotes.length() < MAX_NOTES_LENGTH) {
            agentNotes = agentNotes + " | " + notes;
        }
    }

    public void markReported(DeliveryStatus outcome, Instant at) {
        if (reported) {
            throw new IllegalStateException("Session " + sessionId + " was already reported");
        }
        reported = true;
        reportOutcome = outcome;
        reportedAt = at;
    }

    public long actionableFindingCount() {
        return intelligence.stream().filter(IntelligenceFinding::isActionable).count();
    }

    public void touch(Instant now) {
        lastUpdatedAt = now;
    }
}
