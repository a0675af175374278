package com.example.honeypot.persona;

import com.example.honeypot.model.FindingKind;
import com.example.honeypot.model.IntelligenceFinding;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * What the persona should try to draw out next, in order of usefulness to the evaluator.
 */
enum ProbeGoal {
    PHONE_NUMBER(FindingKind.PHONE_NUMBER,
            "Ask which phone number you can call them back on, because you are worried.",
            "What number should I call to sort this out?"),
    PAYMENT_HANDLE(FindingKind.UPI_HANDLE,
            "Ask exactly where to send the money, for example their UPI ID.",
            "Where do I send the payment? Which UPI?"),
    LINK(FindingKind.URL,
            "Ask them to send the link or website again so you can check it.",
            "Can u send me the link to check this?"),
    BANK_ACCOUNT(FindingKind.BANK_ACCOUNT,
            "Ask which account number you should transfer to.",
            "Which account should I transfer to?"),
    IDENTITY(null,
            "Keep them talking: ask for their name, employee ID or branch.",
            "Whats your name and employee ID? I want to note it down");

    private final FindingKind target;
    private final String instruction;
    private final String stallingQuestion;

    ProbeGoal(FindingKind target, String instruction, String stallingQuestion) {
        this.target = target;
        this.instruction = instruction;
        this.stallingQuestion = stallingQuestion;
    }

    String instruction() {
        return instruction;
    }

    String stallingQuestion() {
        return stallingQuestion;
    }

    static ProbeGoal next(Collection<IntelligenceFinding> intelligence) {
        Set<FindingKind> found = EnumSet.noneOf(FindingKind.class);
        for (IntelligenceFinding finding : intelligence) {
            found.add(finding.getKind());
        }
        for (ProbeGoal goal : values()) {
            if (goal.target != null && !found.contains(goal.target)) {
                return goal;
            }
        }
        return IDENTITY;
    }
}
