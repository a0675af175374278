package com.example.honeypot.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Caller-supplied descriptive context. Steers persona tone only.
 */
@Value
@Builder
@Jacksonized
public class ConversationMetadata {
    String channel;
    String language;
    String locale;

    public static ConversationMetadata empty() {
        return ConversationMetadata.builder().build();
    }
}
