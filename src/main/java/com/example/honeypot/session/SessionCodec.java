package com.example.honeypot.session;

import com.example.honeypot.model.Session;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class SessionCodec {

    private static final Logger logger = LoggerFactory.getLogger(SessionCodec.class);

    private final ObjectMapper objectMapper;

    public SessionCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(Session session) {
        try {
            return objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize session " + session.getSessionId(), e);
        }
    }

    /**
     * Unreadable payloads are treated as absent so the caller starts over.
     */
    public Optional<Session> decode(String sessionId, String json) {
        try {
            return Optional.of(objectMapper.readValue(json, Session.class));
        } catch (JsonProcessingException e) {
            logger.warn("Discarding unreadable session {}: {}", sessionId, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
