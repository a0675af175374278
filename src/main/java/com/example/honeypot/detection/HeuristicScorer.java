package com.example.honeypot.detection;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rule-based first pass. Each signal group contributes a fixed weight per distinct
 * hit (capped at two hits), structural signals add a flat weight, and the total is
 * capped below certainty.
 */
@Component
public class HeuristicScorer {

    static final double MAX_CONFIDENCE = 0.95;

    private static final SignalGroup URGENCY = new SignalGroup("urgency", 0.20,
            "urgent", "immediately", "now", "today", "asap", "hurry", "quick", "fast",
            "expire", "expires", "last chance", "limited time");
    private static final SignalGroup BANKING = new SignalGroup("banking", 0.15,
            "bank", "account", "upi", "payment", "transfer", "otp", "cvv", "pin", "atm",
            "card", "debit", "credit", "netbanking");
    private static final SignalGroup THREAT = new SignalGroup("threat", 0.25,
            "blocked", "suspended", "locked", "frozen", "deactivated", "legal action",
            "police", "arrest", "penalty", "court");
    private static final SignalGroup VERIFICATION = new SignalGroup("verification", 0.20,
            "verify", "confirm", "authenticate", "validate", "update details", "kyc",
            "click here", "link", "portal");
    private static final SignalGroup REWARD = new SignalGroup("reward", 0.20,
            "won", "winner", "prize", "lottery", "reward", "cashback", "refund",
            "congratulations", "selected");

    private static final List<SignalGroup> GROUPS = List.of(URGENCY, BANKING, THREAT, VERIFICATION, REWARD);

    private static final double LINK_WEIGHT = 0.15;
    private static final double SENSITIVE_REQUEST_WEIGHT = 0.20;
    private static final double LINK_WITH_ACTION_WEIGHT = 0.15;
    private static final double AMOUNT_WITH_DEADLINE_WEIGHT = 0.20;

    private static final Pattern LINK = Pattern.compile("https?://|www\\.");
    private static final Pattern ACTION_VERB = Pattern.compile(
            "\\b(click(?:ing)?|tap|open|visit|login|log in|sign in|download|install)\\b");
    private static final List<Pattern> SENSITIVE_REQUESTS = List.of(
            Pattern.compile("\\b(otp|cvv|pin|password)\\b"),
            Pattern.compile("\\bshare\\b.*\\b(account|number|details)\\b"),
            Pattern.compile("\\bsend\\b.*\\b(upi|payment|money)\\b"));
    private static final Pattern AMOUNT = Pattern.compile(
            "(?:rs\\.?|inr|₹|\\$|usd)\\s?\\d[\\d,]*(?:\\.\\d+)?|\\b\\d[\\d,]*(?:\\.\\d+)?\\s?(?:rs|rupees|inr|dollars)\\b");
    private static final Pattern DEADLINE = Pattern.compile(
            "\\b(today|tonight|tomorrow|deadline|expires?|within \\d+ (?:minutes?|hours?|days?)|before \\d|by \\d)");

    public ScamAssessment score(String text, double threshold) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        double score = 0.0;
        Set<String> signals = new LinkedHashSet<>();

        for (SignalGroup group : GROUPS) {
            int hits = group.countHits(lower);
            if (hits > 0) {
                score += group.weight * Math.min(hits, 2);
                signals.add(group.name);
            }
        }
        boolean hasLink = LINK.matcher(lower).find();
        if (hasLink) {
            score += LINK_WEIGHT;
            signals.add("phishing_link");
        }
        for (Pattern pattern : SENSITIVE_REQUESTS) {
            if (pattern.matcher(lower).find()) {
                score += SENSITIVE_REQUEST_WEIGHT;
                signals.add("sensitive_info_request");
                break;
            }
        }
        if (hasLink && ACTION_VERB.matcher(lower).find()) {
            score += LINK_WITH_ACTION_WEIGHT;
            signals.add("link_with_action");
        }
        if (AMOUNT.matcher(lower).find() && DEADLINE.matcher(lower).find()) {
            score += AMOUNT_WITH_DEADLINE_WEIGHT;
            signals.add("payment_deadline");
        }

        double confidence = Math.min(score, MAX_CONFIDENCE);
        return ScamAssessment.builder()
                .scam(confidence >= threshold)
                .confidence(confidence)
                .category(categorize(signals))
                .stage(DetectionStage.HEURISTIC)
                .signals(signals)
                .reasoning(signals.isEmpty()
                        ? "No scam signals found"
                        : "Heuristic signals: " + String.join(", ", signals))
                .degraded(false)
                .build();
    }

    static String categorize(Set<String> signals) {
        boolean banking = signals.contains("banking");
        boolean link = signals.contains("phishing_link");
        if (banking && (link || signals.contains("verification"))) {
            return "banking_phishing";
        }
        if (signals.contains("reward")) {
            return "prize_scam";
        }
        if (signals.contains("threat") && !banking) {
            return "threat_extortion";
        }
        if (banking) {
            return "banking_fraud";
        }
        if (link) {
            return "phishing";
        }
        if (signals.contains("payment_deadline")) {
            return "payment_demand";
        }
        return signals.isEmpty() ? "none" : "suspicious";
    }

    private static final class SignalGroup {
        private final String name;
        private final double weight;
        private final List<Pattern> terms;

        private SignalGroup(String name, double weight, String... terms) {
            this.name = name;
            this.weight = weight;
            this.terms = Arrays.stream(terms)
                    .map(term -> Pattern.compile("\\b" + Pattern.quote(term) + "\\b"))
                    .collect(Collectors.toList());
        }

        private int countHits(String lowerText) {
            int hits = 0;
            for (Pattern term : terms) {
                if (term.matcher(lowerText).find()) {
                    hits++;
                }
            }
            return hits;
        }
    }
}
