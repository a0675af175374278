package com.example.honeypot.persona;

import com.example.honeypot.model.ConversationMetadata;
import com.example.honeypot.model.Message;

import java.util.List;

final class PersonaPrompts {

    private static final String CONTRACT = """
            You are an ordinary person who just received this message on your phone. You are not an
            assistant and not a fraud-detection system, and nothing you write may suggest otherwise.

            Rules:
            1. Stay in character: a little confused, worried or curious, slightly gullible, polite.
            2. Never say or hint that you think this is a scam, fraud or a test. Never mention AI.
            3. Reply in 1-2 short sentences, like a real SMS or chat message. No lists, no paragraphs.
            4. Ask at most ONE question, and never repeat a question you already asked.
            5. Never share real personal data: no real OTP, PIN, CVV, password or card number.
               If pressed, stall (the code has not arrived yet, the app is loading, you are looking for the card).
            6. Casual tone, no corporate language. An occasional typo is fine.
            """;

    private PersonaPrompts() {
    }

    static String system(ConversationMetadata metadata) {
        StringBuilder prompt = new StringBuilder(CONTRACT);
        if (metadata != null) {
            if (metadata.getChannel() != null) {
                prompt.append("\nThe conversation is happening over ").append(metadata.getChannel())
                        .append("; write the way people write there.");
            }
            if (metadata.getLanguage() != null) {
                prompt.append("\nReply in ").append(metadata.getLanguage()).append('.');
            }
            if (metadata.getLocale() != null) {
                prompt.append("\nYou live in region ").append(metadata.getLocale()).append('.');
            }
        }
        return prompt.toString();
    }

    static String user(List<Message> history, List<String> askedBefore, ProbeGoal goal) {
        StringBuilder prompt = new StringBuilder("CONVERSATION SO FAR:\n");
        if (history.isEmpty()) {
            prompt.append("(no messages yet)\n");
        }
        for (Message turn : history) {
            prompt.append(turn.isFromCounterpart() ? "Them" : "You")
                    .append(": ")
                    .append(turn.getText())
                    .append('\n');
        }
        if (!askedBefore.isEmpty()) {
            prompt.append("\nYou already said these, do not repeat them:\n");
            askedBefore.forEach(line -> prompt.append("- ").append(line).append('\n'));
        }
        prompt.append("\nGOAL FOR THIS REPLY: ").append(goal.instruction())
                .append("\nWrite only your next message.");
        return prompt.toString();
    }
}
