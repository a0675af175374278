package com.example.honeypot.service;

import com.example.honeypot.detection.ScamAssessment;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Short operator notes describing the counterpart's tactics, carried into the report.
 */
final class EngagementNotes {

    private static final Map<String, String> SIGNAL_NOTES = Map.of(
            "urgency", "Used urgency tactics",
            "threat", "Employed threats",
            "banking", "Banking/financial scam",
            "phishing_link", "Shared suspicious links",
            "reward", "Prize/reward scam",
            "verification", "Verification/authentication attempt",
            "sensitive_info_request", "Requested sensitive information",
            "link_with_action", "Pushed to open a link",
            "payment_deadline", "Demanded payment against a deadline");

    private static final List<String> SIGNAL_ORDER = List.of(
            "urgency", "threat", "banking", "phishing_link", "link_with_action", "reward",
            "verification", "sensitive_info_request", "payment_deadline");

    private static final Pattern CREDENTIALS = Pattern.compile("\\b(otp|pin|cvv|password)\\b");

    private EngagementNotes() {
    }

    static String describe(ScamAssessment assessment, String messageText) {
        List<String> parts = new ArrayList<>();
        for (String signal : SIGNAL_ORDER) {
            if (assessment.getSignals().contains(signal)) {
                parts.add(SIGNAL_NOTES.get(signal));
            }
        }
        if (messageText != null && CREDENTIALS.matcher(messageText.toLowerCase(Locale.ROOT)).find()) {
            parts.add("Asked for credentials");
        }
        if (parts.isEmpty()) {
            parts.add("Scam attempt detected (" + assessment.getCategory() + ")");
        }
        return String.join("; ", parts);
    }
}
