package com.example.honeypot.service;

/**
 * Progress of one inbound message through the engagement pipeline.
 */
public enum TurnStage {
    LOADED,
    CLASSIFIED,
    EXTRACTED,
    REPLIED,
    PERSISTED,
    REPORTED
}
