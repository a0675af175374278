package com.example.honeypot.service;

import com.example.honeypot.model.ConversationMetadata;
import com.example.honeypot.model.Message;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TurnRequest {
    String sessionId;
    Message message;
    @Singular("historyMessage")
    List<Message> conversationHistory;
    ConversationMetadata metadata;
}
