package com.example.honeypot.report;

public enum DeliveryStatus {
    DELIVERED,
    EXHAUSTED
}
