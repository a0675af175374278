package com.example.honeypot.persona;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Fixed stalling replies used whenever the model cannot be used.
 */
final class FallbackReplies {

    static final List<String> GENERIC = List.of(
            "Sorry, can you repeat that?",
            "Can you give me more details about this?",
            "I'm a bit confused, what exactly do I need to do?",
            "Hold on, I'm checking. What was that again?");

    private FallbackReplies() {
    }

    static String choose(String lastCounterpartText, List<String> previousReplies, ProbeGoal goal) {
        List<String> candidates = new ArrayList<>();
        String lower = lastCounterpartText == null ? "" : lastCounterpartText.toLowerCase(Locale.ROOT);
        if (previousReplies.isEmpty()) {
            if (lower.contains("bank") || lower.contains("account")) {
                candidates.add("Wait, which bank account are you talking about?");
            } else if (lower.contains("upi")) {
                candidates.add("What about my UPI? Can you explain?");
            } else if (lower.contains("blocked") || lower.contains("suspended")) {
                candidates.add("Why would it be blocked??");
            } else {
                candidates.add("I don't understand. Can you explain what this is about?");
            }
        }
        candidates.add(goal.stallingQuestion());
        candidates.addAll(GENERIC);

        for (String candidate : candidates) {
            if (!alreadySaid(candidate, previousReplies)) {
                return candidate;
            }
        }
        return GENERIC.get(previousReplies.size() % GENERIC.size());
    }

    static boolean alreadySaid(String reply, Collection<String> previousReplies) {
        for (String previous : previousReplies) {
            if (previous.equalsIgnoreCase(reply.trim())) {
                return true;
            }
        }
        return false;
    }
}
