package com.example.honeypot.report;

import com.example.honeypot.model.ExtractedIntelligence;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReportDeliveryServiceTest {

    @Mock
    private CallbackClient callbackClient;

    private final List<Duration> sleeps = new ArrayList<>();
    private ReportDeliveryService reportDeliveryService;
    private ReportPayload payload;

    @BeforeEach
    void setUp() {
        reportDeliveryService = new ReportDeliveryService(callbackClient, sleeps::add);
        ReflectionTestUtils.setField(reportDeliveryService, "maxAttempts", 3);
        ReflectionTestUtils.setField(reportDeliveryService, "baseDelayMs", 1000L);
        payload = ReportPayload.builder()
                .sessionId("session-1")
                .scamDetected(true)
                .totalMessagesExchanged(5)
                .extractedIntelligence(new ExtractedIntelligence())
                .agentNotes("Used urgency tactics")
                .build();
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void testDeliver_SucceedsFirstTime() {
        // Given
        when(callbackClient.post(payload)).thenReturn(200);

        // When
        DeliveryOutcome outcome = reportDeliveryService.deliver(payload);

        // Then
        assertTrue(outcome.isDelivered());
        assertEquals(1, outcome.getAttempts());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testDeliver_FailTwiceThenSucceed() {
        // Given
        when(callbackClient.post(payload))
                .thenThrow(new CallbackTransportException("Connection refused"))
                .thenReturn(503)
                .thenReturn(200);

        // When
        DeliveryOutcome outcome = reportDeliveryService.deliver(payload);

        // Then
        assertEquals(DeliveryStatus.DELIVERED, outcome.getStatus());
        assertEquals(3, outcome.getAttempts());
        assertEquals(List.of(Duration.ofMillis(1000), Duration.ofMillis(2000)), sleeps);
        verify(callbackClient, times(3)).post(payload);
    }

    @Test
    void testDeliver_AlwaysFailingStopsAtCeiling() {
        // Given
        when(callbackClient.post(payload)).thenReturn(500);

        // When
        DeliveryOutcome outcome = reportDeliveryService.deliver(payload);

        // Then
        assertEquals(DeliveryStatus.EXHAUSTED, outcome.getStatus());
        assertEquals(3, outcome.getAttempts());
        assertEquals("HTTP 500", outcome.getDetail());
        assertEquals(2, sleeps.size());
        verify(callbackClient, times(3)).post(payload);
    }

    @Test
    void testDeliver_ClientErrorIsNotRetried() {
        // Given
        when(callbackClient.post(payload)).thenReturn(400);

        // When
        DeliveryOutcome outcome = reportDeliveryService.deliver(payload);

        // Then
        assertEquals(DeliveryStatus.EXHAUSTED, outcome.getStatus());
        assertEquals(1, outcome.getAttempts());
        assertTrue(sleeps.isEmpty());
        verify(callbackClient, times(1)).post(payload);
    }

    @Test
    void testDeliver_TooManyRequestsIsRetried() {
        // Given
        when(callbackClient.post(payload)).thenReturn(429).thenReturn(204);

        // When
        DeliveryOutcome outcome = reportDeliveryService.deliver(payload);

        // Then
        assertTrue(outcome.isDelivered());
        assertEquals(2, outcome.getAttempts());
        assertEquals(List.of(Duration.ofMillis(1000)), sleeps);
    }

    @Test
    void testDeliver_InterruptedWhileBackingOff() {
        // Given
        ReportDeliveryService interrupted = new ReportDeliveryService(callbackClient, d -> {
            throw new InterruptedException("shutdown");
        });
        ReflectionTestUtils.setField(interrupted, "maxAttempts", 3);
        ReflectionTestUtils.setField(interrupted, "baseDelayMs", 1000L);
        when(callbackClient.post(payload)).thenReturn(503);

        // When
        DeliveryOutcome outcome = interrupted.deliver(payload);

        // Then
        assertEquals(DeliveryStatus.EXHAUSTED, outcome.getStatus());
        assertEquals(1, outcome.getAttempts());
        assertEquals("interrupted", outcome.getDetail());
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void testBackoffDelay_Doubles() {
        assertEquals(Duration.ofMillis(1000), reportDeliveryService.backoffDelay(1));
        assertEquals(Duration.ofMillis(2000), reportDeliveryService.backoffDelay(2));
        assertEquals(Duration.ofMillis(4000), reportDeliveryService.backoffDelay(3));
    }
}
