package com.example.honeypot.controller;

import com.example.honeypot.controller.dto.ChatRequest;
import com.example.honeypot.controller.dto.ChatResponse;
import com.example.honeypot.model.ConversationMetadata;
import com.example.honeypot.model.ExtractedIntelligence;
import com.example.honeypot.service.EngagementOrchestrator;
import com.example.honeypot.service.TurnRequest;
import com.example.honeypot.service.TurnResult;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

@RestController
public class ChatController {

    private final EngagementOrchestrator orchestrator;

    public ChatController(EngagementOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping(value = "/chat", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
        // the pipeline blocks on model and callback calls
        return Mono.fromCallable(() -> toResponse(orchestrator.handle(toTurn(request))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping(value = "/", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> info() {
        return Map.of(
                "service", "honeypot-engine",
                "version", "0.1.0",
                "endpoints", List.of("POST /chat", "GET /health"));
    }

    private static TurnRequest toTurn(ChatRequest request) {
        return TurnRequest.builder()
                .sessionId(request.getSessionId())
                .message(request.getMessage())
                .conversationHistory(request.getConversationHistory() == null
                        ? List.of() : request.getConversationHistory())
                .metadata(request.getMetadata() == null ? ConversationMetadata.empty() : request.getMetadata())
                .build();
    }

    private static ChatResponse toResponse(TurnResult result) {
        return ChatResponse.builder()
                .status("success")
                .reply(result.getReply())
                .scamDetected(result.isScamDetected())
                .totalMessagesExchanged(result.getMessageCount())
                .extractedIntelligence(ExtractedIntelligence.from(result.getIntelligence()))
                .build();
    }
}
