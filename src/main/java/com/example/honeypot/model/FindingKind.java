package com.example.honeypot.model;

public enum FindingKind {
    BANK_ACCOUNT("bank account", true),
    UPI_HANDLE("UPI ID", true),
    PHONE_NUMBER("phone number", true),
    URL("suspicious link", true),
    EMAIL("email", true),
    POLICY_NUMBER("policy number", false),
    ORDER_NUMBER("order number", false),
    KEYWORD("keyword", false);

    private final String label;
    private final boolean actionable;

    FindingKind(String label, boolean actionable) {
        this.label = label;
        this.actionable = actionable;
    }

    public String getLabel() {
        return label;
    }

    /** Payment destinations, contact points and links. Keywords and quoted references only describe the lure. */
    public boolean isActionable() {
        return actionable;
    }
}
