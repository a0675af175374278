package com.example.honeypot.controller;

import com.example.honeypot.config.ApiKeyWebFilter;
import com.example.honeypot.config.GlobalExceptionHandler;
import com.example.honeypot.model.FindingKind;
import com.example.honeypot.model.IntelligenceFinding;
import com.example.honeypot.model.Sender;
import com.example.honeypot.service.EngagementOrchestrator;
import com.example.honeypot.service.TurnRequest;
import com.example.honeypot.service.TurnResult;
import com.example.honeypot.session.SessionStore;
import com.example.honeypot.session.StoreStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChatControllerTest {

    private static final String API_KEY = "test-key";

    private static final String VALID_BODY = """
            {
              "sessionId": "session-1",
              "message": {
                "sender": "scammer",
                "text": "Your bank account will be blocked today. Verify immediately by clicking http://fake-bank.com",
                "timestamp": 1768471200000
              },
              "conversationHistory": [],
              "metadata": {"channel": "SMS", "language": "English", "locale": "IN"}
            }
            """;

    @Mock
    private EngagementOrchestrator orchestrator;

    @Mock
    private SessionStore sessionStore;

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        ApiKeyWebFilter apiKeyWebFilter = new ApiKeyWebFilter();
        ReflectionTestUtils.setField(apiKeyWebFilter, "apiKey", API_KEY);
        Clock clock = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);
        webTestClient = WebTestClient
                .bindToController(new ChatController(orchestrator), new HealthController(sessionStore, clock))
                .controllerAdvice(new GlobalExceptionHandler())
                .webFilter(apiKeyWebFilter)
                .build();
    }

    @Test
    void testChat_Success() {
        // Given
        when(orchestrator.handle(any(TurnRequest.class))).thenReturn(new TurnResult(
                "Oh no! Which account is this about?", true, 1,
                Set.of(IntelligenceFinding.of(FindingKind.URL, "http://fake-bank.com")), false));

        // When / Then
        webTestClient.post().uri("/chat")
                .header("x-api-key", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(VALID_BODY)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("success")
                .jsonPath("$.reply").isEqualTo("Oh no! Which account is this about?")
                .jsonPath("$.scamDetected").isEqualTo(true)
                .jsonPath("$.totalMessagesExchanged").isEqualTo(1)
                .jsonPath("$.extractedIntelligence.phishingLinks[0]").isEqualTo("http://fake-bank.com");

        ArgumentCaptor<TurnRequest> turn = ArgumentCaptor.forClass(TurnRequest.class);
        verify(orchestrator).handle(turn.capture());
        assertEquals("session-1", turn.getValue().getSessionId());
        assertEquals(Sender.COUNTERPART, turn.getValue().getMessage().getSender());
        assertEquals("SMS", turn.getValue().getMetadata().getChannel());
    }

    @Test
    void testChat_MissingApiKey() {
        webTestClient.post().uri("/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(VALID_BODY)
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.status").isEqualTo("error");

        verifyNoInteractions(orchestrator);
    }

    @Test
    void testChat_WrongApiKey() {
        webTestClient.post().uri("/chat")
                .header("x-api-key", "wrong")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(VALID_BODY)
                .exchange()
                .expectStatus().isUnauthorized();

        verifyNoInteractions(orchestrator);
    }

    @Test
    void testChat_MissingSessionId() {
        // Given
        String body = """
                {"message": {"sender": "scammer", "text": "Hello", "timestamp": 1}}
                """;

        // When / Then
        webTestClient.post().uri("/chat")
                .header("x-api-key", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.status").isEqualTo("error")
                .jsonPath("$.reply").isEqualTo("");

        verifyNoInteractions(orchestrator);
    }

    @Test
    void testChat_InboundFromAgentRejected() {
        // Given
        String body = """
                {"sessionId": "session-1", "message": {"sender": "user", "text": "Hello", "timestamp": 1}}
                """;

        // When / Then
        webTestClient.post().uri("/chat")
                .header("x-api-key", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isBadRequest();

        verifyNoInteractions(orchestrator);
    }

    @Test
    void testChat_UnreadableBody() {
        webTestClient.post().uri("/chat")
                .header("x-api-key", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{not json")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.status").isEqualTo("error");
    }

    @Test
    void testChat_UnexpectedFailure() {
        // Given
        when(orchestrator.handle(any(TurnRequest.class))).thenThrow(new IllegalStateException("boom"));

        // When / Then
        webTestClient.post().uri("/chat")
                .header("x-api-key", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(VALID_BODY)
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.status").isEqualTo("error");
    }

    @Test
    void testHealth_OpenAndReportsFallback() {
        // Given
        when(sessionStore.status()).thenReturn(StoreStatus.FALLBACK);

        // When / Then
        webTestClient.get().uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("degraded")
                .jsonPath("$.store").isEqualTo("fallback")
                .jsonPath("$.timestamp").isEqualTo(1768471200000L);
    }

    @Test
    void testInfo_Open() {
        webTestClient.get().uri("/")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.service").isEqualTo("honeypot-engine");
    }
}
