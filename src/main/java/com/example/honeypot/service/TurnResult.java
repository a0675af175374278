package com.example.honeypot.service;

import com.example.honeypot.model.IntelligenceFinding;
import lombok.Value;

import java.util.Set;

@Value
public class TurnResult {
    String reply;
    boolean scamDetected;
    int messageCount;
    Set<IntelligenceFinding> intelligence;
    boolean reported;
}
