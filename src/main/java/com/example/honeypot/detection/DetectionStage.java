package com.example.honeypot.detection;

public enum DetectionStage {
    HEURISTIC,
    LLM
}
