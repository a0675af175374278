package com.example.honeypot.detection;

import com.example.honeypot.model.Message;

import java.util.List;

final class DetectionPrompts {

    static final String SYSTEM = """
            You review text messages for fraud. Decide whether the CURRENT MESSAGE, read together
            with the recent conversation, is part of a scam.

            Scam indicators:
            - urgency or threats (account will be blocked, legal action, arrest, fines)
            - requests for OTP, PIN, CVV, passwords or account numbers
            - impersonation of banks, government offices, couriers or employers
            - requests to pay, transfer or deposit money, or to share a UPI ID
            - suspicious or shortened links, misspelled domains
            - unexpected prizes, lotteries, refunds or cashback

            Useful categories: banking_phishing, upi_fraud, phishing, prize_scam, courier_scam,
            government_impersonation, job_scam, investment_scam, none.

            False positives are costly. Answer with a single JSON object and nothing else:
            {"is_scam": true|false, "confidence": 0.0-1.0, "category": "<category>", "reasoning": "<one sentence>"}
            """;

    private DetectionPrompts() {
    }

    static String user(Message message, List<Message> recentHistory) {
        StringBuilder prompt = new StringBuilder();
        if (!recentHistory.isEmpty()) {
            prompt.append("RECENT CONVERSATION:\n");
            for (Message turn : recentHistory) {
                prompt.append(turn.isFromCounterpart() ? "Sender" : "Recipient")
                        .append(": ")
                        .append(turn.getText())
                        .append('\n');
            }
            prompt.append('\n');
        }
        prompt.append("CURRENT MESSAGE:\n\"").append(message.getText()).append("\"\n");
        return prompt.toString();
    }
}
