package com.example.honeypot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One conversational turn. Immutable once created.
 */
@Value
@Builder
@Jacksonized
public class Message {

    @NotNull(message = "sender is required")
    Sender sender;

    @NotNull(message = "text is required")
    String text;

    @NotNull(message = "timestamp is required")
    Long timestamp;

    public static Message counterpart(String text, long timestamp) {
        return new Message(Sender.COUNTERPART, text, timestamp);
    }

    public static Message agent(String text, long timestamp) {
        return new Message(Sender.AGENT, text, timestamp);
    }

    @JsonIgnore
    public boolean isFromCounterpart() {
        return sender == Sender.COUNTERPART;
    }
}
