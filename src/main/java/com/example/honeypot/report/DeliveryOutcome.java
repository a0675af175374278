package com.example.honeypot.report;

import lombok.Value;

@Value
public class DeliveryOutcome {
    DeliveryStatus status;
    int attempts;
    String detail;

    public static DeliveryOutcome delivered(int attempts) {
        return new DeliveryOutcome(DeliveryStatus.DELIVERED, attempts, "delivered");
    }

    public static DeliveryOutcome exhausted(int attempts, String detail) {
        return new DeliveryOutcome(DeliveryStatus.EXHAUSTED, attempts, detail);
    }

    public boolean isDelivered() {
        return status == DeliveryStatus.DELIVERED;
    }
}
