package com.example.honeypot.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Findings grouped by kind, in the shape the evaluator expects.
 */
@Data
@NoArgsConstructor
public class ExtractedIntelligence {
    private List<String> bankAccounts = new ArrayList<>();
    private List<String> upiIds = new ArrayList<>();
    private List<String> phishingLinks = new ArrayList<>();
    private List<String> phoneNumbers = new ArrayList<>();
    private List<String> emailAddresses = new ArrayList<>();
    private List<String> policyNumbers = new ArrayList<>();
    private List<String> orderNumbers = new ArrayList<>();
    private List<String> suspiciousKeywords = new ArrayList<>();

    public static ExtractedIntelligence from(Collection<IntelligenceFinding> findings) {
        ExtractedIntelligence grouped = new ExtractedIntelligence();
        for (IntelligenceFinding finding : findings) {
            switch (finding.getKind()) {
                case BANK_ACCOUNT:
                    grouped.bankAccounts.add(finding.getValue());
                    break;
                case UPI_HANDLE:
                    grouped.upiIds.add(finding.getValue());
                    break;
                case URL:
                    grouped.phishingLinks.add(finding.getValue());
                    break;
                case PHONE_NUMBER:
                    grouped.phoneNumbers.add(finding.getValue());
                    break;
                case EMAIL:
                    grouped.emailAddresses.add(finding.getValue());
                    break;
                case POLICY_NUMBER:
                    grouped.policyNumbers.add(finding.getValue());
                    break;
                case ORDER_NUMBER:
                    grouped.orderNumbers.add(finding.getValue());
                    break;
                case KEYWORD:
                    grouped.suspiciousKeywords.add(finding.getValue());
                    break;
                default:
                    break;
            }
        }
        return grouped;
    }
}
