package com.example.honeypot.model;

import com.example.honeypot.report.DeliveryStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private Session session;

    @BeforeEach
    void setUp() {
        session = Session.start("session-1", NOW);
    }

    @Test
    void testRecordCounterpartMessage_IncrementsCount() {
        // When
        session.recordCounterpartMessage(Message.counterpart("Hello", 1L));
        session.recordAgentReply(Message.agent("Hi, who is this?", 2L));
        session.recordCounterpartMessage(Message.counterpart("Your account is blocked", 3L));

        // Then
        assertEquals(2, session.getMessageCount());
        assertEquals(3, session.getHistory().size());
        assertFalse(session.isNew());
    }

    @Test
    void testRecordCounterpartMessage_RejectsAgentMessage() {
        assertThrows(IllegalArgumentException.class,
                () -> session.recordCounterpartMessage(Message.agent("Hi", 1L)));
        assertEquals(0, session.getMessageCount());
    }

    @Test
    void testMergeIntelligence_IsIdempotent() {
        // Given
        List<IntelligenceFinding> findings = List.of(
                IntelligenceFinding.of(FindingKind.UPI_HANDLE, "pramod@paytm"),
                IntelligenceFinding.of(FindingKind.PHONE_NUMBER, "+919876543210"));

        // When
        int first = session.mergeIntelligence(findings);
        int second = session.mergeIntelligence(findings);

        // Then
        assertEquals(2, first);
        assertEquals(0, second);
        assertEquals(2, session.getIntelligence().size());
    }

    @Test
    void testMergeIntelligence_IgnoresSnippetForIdentity() {
        // Given
        IntelligenceFinding a = IntelligenceFinding.builder()
                .kind(FindingKind.URL).value("http://fake-bank.com").contextSnippet("click http://fake-bank.com").build();
        IntelligenceFinding b = IntelligenceFinding.builder()
                .kind(FindingKind.URL).value("http://fake-bank.com").contextSnippet("open http://fake-bank.com now").build();

        // When
        session.mergeIntelligence(List.of(a));
        int added = session.mergeIntelligence(List.of(b));

        // Then
        assertEquals(0, added);
        assertEquals(1, session.getIntelligence().size());
    }

    @Test
    void testRecordAssessment_ScamFlagIsSticky() {
        // When
        session.recordAssessment(true, 0.9, "banking_phishing");
        session.recordAssessment(false, 0.1, null);

        // Then
        assertTrue(session.isScamConfirmed());
        assertEquals(0.9, session.getPeakConfidence(), 0.0001);
        assertEquals("banking_phishing", session.getLastCategory());
        assertEquals(1, session.getCategories().size());
    }

    @Test
    void testActionableFindingCount_ExcludesKeywords() {
        // Given
        session.mergeIntelligence(List.of(
                IntelligenceFinding.of(FindingKind.KEYWORD, "urgent"),
                IntelligenceFinding.of(FindingKind.KEYWORD, "verify"),
                IntelligenceFinding.of(FindingKind.URL, "http://fake-bank.com")));

        // Then
        assertEquals(1, session.actionableFindingCount());
    }

    @Test
    void testAppendNotes_SkipsDuplicates() {
        // When
        session.appendNotes("Used urgency tactics");
        session.appendNotes("Used urgency tactics");
        session.appendNotes("Shared suspicious links");

        // Then
        assertEquals("Used urgency tactics | Shared suspicious links", session.getAgentNotes());
    }

    @Test
    void testMarkReported_OnlyOnce() {
        // When
        session.markReported(DeliveryStatus.DELIVERED, NOW);

        // Then
        assertTrue(session.isReported());
        assertEquals(DeliveryStatus.DELIVERED, session.getReportOutcome());
        assertThrows(IllegalStateException.class, () -> session.markReported(DeliveryStatus.EXHAUSTED, NOW));
        assertEquals(DeliveryStatus.DELIVERED, session.getReportOutcome());
    }

    @Test
    void testSeedHistory_RejectedOnceHistoryExists() {
        // Given
        session.seedHistory(List.of(Message.counterpart("Earlier message", 1L)));

        // Then
        assertEquals(0, session.getMessageCount());
        assertThrows(IllegalStateException.class,
                () -> session.seedHistory(List.of(Message.counterpart("Another", 2L))));
    }

    @Test
    void testGetHistory_IsUnmodifiable() {
        assertThrows(UnsupportedOperationException.class,
                () -> session.getHistory().add(Message.counterpart("x", 1L)));
    }
}
