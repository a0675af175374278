package com.example.honeypot.persona;

import lombok.Value;

/**
 * Reply text plus whether it came from the model or the fixed fallback set.
 */
@Value
public class PersonaReply {
    String text;
    boolean fallback;

    public static PersonaReply generated(String text) {
        return new PersonaReply(text, false);
    }

    public static PersonaReply fallback(String text) {
        return new PersonaReply(text, true);
    }
}
