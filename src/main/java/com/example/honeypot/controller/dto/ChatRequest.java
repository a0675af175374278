package com.example.honeypot.controller.dto;

import com.example.honeypot.model.ConversationMetadata;
import com.example.honeypot.model.Message;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    @NotBlank(message = "sessionId is required")
    private String sessionId;

    @NotNull(message = "message is required")
    @Valid
    private Message message;

    @Valid
    private List<@NotNull Message> conversationHistory = new ArrayList<>();

    private ConversationMetadata metadata;

    @JsonIgnore
    @AssertTrue(message = "message must be sent by the scammer")
    public boolean isInboundFromCounterpart() {
        return message == null || message.getSender() == null || message.isFromCounterpart();
    }
}
