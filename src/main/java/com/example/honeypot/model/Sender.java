package com.example.honeypot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Author of a conversational turn. The wire names follow the evaluator's
 * vocabulary: the counterpart is the "scammer", the agent is the "user".
 */
public enum Sender {
    COUNTERPART("scammer"),
    AGENT("user");

    private final String wireName;

    Sender(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static Sender fromWire(String value) {
        if (value == null) {
            return null;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "scammer":
            case "counterpart":
                return COUNTERPART;
            case "user":
            case "agent":
                return AGENT;
            default:
                throw new IllegalArgumentException("Unknown sender: " + value);
        }
    }
}
