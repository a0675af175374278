package com.example.honeypot.persona;

import com.example.honeypot.llm.LlmClient;
import com.example.honeypot.llm.LlmException;
import com.example.honeypot.model.ConversationMetadata;
import com.example.honeypot.model.IntelligenceFinding;
import com.example.honeypot.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Produces the next in-character reply. The model is asked to probe for whichever
 * kind of intelligence is still missing; anything it returns that is too long,
 * repeated, or breaks character is replaced by a fixed stalling reply.
 */
@Service
public class PersonaAgent {

    private static final Logger logger = LoggerFactory.getLogger(PersonaAgent.class);

    static final int MAX_REPLY_LENGTH = 300;

    private static final Pattern DISCLOSURE = Pattern.compile(
            "\\b(as an ai|ai model|language model|chatbot|honeypot|scam\\w*|fraud\\w*|phishing|bot)\\b");
    private static final Pattern SPEAKER_PREFIX = Pattern.compile("^(you|me|user|reply)\\s*:\\s*",
            Pattern.CASE_INSENSITIVE);

    private final LlmClient llmClient;

    @Value("${honeypot.persona.neutral-reply:I'm not sure what this is about. Can you clarify?}")
    private String neutralReply;

    public PersonaAgent(LlmClient llmClient) {
        this.llmClient = llmClient;
    }

    public PersonaReply generateReply(List<Message> history,
                                      ConversationMetadata metadata,
                                      Set<IntelligenceFinding> intelligenceSoFar) {
        List<String> previousReplies = history.stream()
                .filter(m -> !m.isFromCounterpart())
                .map(Message::getText)
                .collect(Collectors.toList());
        String lastCounterpartText = history.stream()
                .filter(Message::isFromCounterpart)
                .reduce((first, second) -> second)
                .map(Message::getText)
                .orElse("");
        ProbeGoal goal = ProbeGoal.next(intelligenceSoFar);

        String raw;
        try {
            raw = llmClient.complete(PersonaPrompts.system(metadata),
                    PersonaPrompts.user(history, previousReplies, goal));
        } catch (LlmException e) {
            logger.warn("Persona generation unavailable, stalling: {}", e.getMessage());
            return PersonaReply.fallback(FallbackReplies.choose(lastCounterpartText, previousReplies, goal));
        } catch (RuntimeException e) {
            logger.warn("Persona generation failed unexpectedly, stalling", e);
            return PersonaReply.fallback(FallbackReplies.choose(lastCounterpartText, previousReplies, goal));
        }

        String reply = clean(raw);
        if (reply.isEmpty() || breaksCharacter(reply) || FallbackReplies.alreadySaid(reply, previousReplies)) {
            logger.warn("Discarded unusable persona reply: {}", reply);
            return PersonaReply.fallback(FallbackReplies.choose(lastCounterpartText, previousReplies, goal));
        }
        return PersonaReply.generated(reply);
    }

    public String neutralReply() {
        return neutralReply;
    }

    static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        String reply = raw.trim().replaceAll("\\s+", " ");
        reply = SPEAKER_PREFIX.matcher(reply).replaceFirst("");
        if (reply.length() >= 2 && reply.startsWith("\"") && reply.endsWith("\"")) {
            reply = reply.substring(1, reply.length() - 1).trim();
        }
        if (reply.length() > MAX_REPLY_LENGTH) {
            int cut = firstSentenceEnd(reply);
            reply = cut > 0 && cut <= MAX_REPLY_LENGTH
                    ? reply.substring(0, cut)
                    : reply.substring(0, MAX_REPLY_LENGTH).trim();
        }
        return reply;
    }

    static boolean breaksCharacter(String reply) {
        return DISCLOSURE.matcher(reply.toLowerCase(Locale.ROOT)).find();
    }

    private static int firstSentenceEnd(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if ((c == '.' || c == '?' || c == '!') && (i + 1 == text.length() || text.charAt(i + 1) == ' ')) {
                return i + 1;
            }
        }
        return -1;
    }
}
