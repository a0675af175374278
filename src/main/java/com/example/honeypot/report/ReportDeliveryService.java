package com.example.honeypot.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Delivers the final report with bounded retries.
 * <p>
 * Transport failures, timeouts, 5xx and 429 are retried with exponential backoff
 * ({@code base, 2*base, 4*base, ...}) up to {@code max-attempts}. Any other 4xx is a
 * definitive rejection and ends delivery immediately. Both a rejection and running out
 * of attempts come back as {@link DeliveryStatus#EXHAUSTED}; nothing is thrown.
 */
@Service
public class ReportDeliveryService {

    private static final Logger logger = LoggerFactory.getLogger(ReportDeliveryService.class);

    private final CallbackClient callbackClient;
    private final Sleeper sleeper;

    @Value("${honeypot.reporting.max-attempts:3}")
    private int maxAttempts;

    @Value("${honeypot.reporting.base-delay-ms:1000}")
    private long baseDelayMs;

    public ReportDeliveryService(CallbackClient callbackClient, Sleeper sleeper) {
        this.callbackClient = callbackClient;
        this.sleeper = sleeper;
    }

    public DeliveryOutcome deliver(ReportPayload payload) {
        int attempts = Math.max(1, maxAttempts);
        String lastFailure = "not attempted";
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                int status = callbackClient.post(payload);
                if (status >= 200 && status < 300) {
                    logger.info("Report delivered for session {} (attempt {}/{})",
                            payload.getSessionId(), attempt, attempts);
                    return DeliveryOutcome.delivered(attempt);
                }
                if (!isRetryable(status)) {
                    logger.error("Report for session {} rejected with HTTP {}, not retrying",
                            payload.getSessionId(), status);
                    return DeliveryOutcome.exhausted(attempt, "rejected with HTTP " + status);
                }
                lastFailure = "HTTP " + status;
            } catch (RuntimeException e) {
                lastFailure = e.getMessage();
            }

            if (attempt < attempts) {
                Duration delay = backoffDelay(attempt);
                logger.warn("Report delivery for session {} failed ({}), retrying in {}ms (attempt {}/{})",
                        payload.getSessionId(), lastFailure, delay.toMillis(), attempt, attempts);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.error("Report delivery for session {} interrupted after {} attempt(s)",
                            payload.getSessionId(), attempt);
                    return DeliveryOutcome.exhausted(attempt, "interrupted");
                }
            }
        }
        logger.error("Report delivery for session {} failed after {} attempts: {}",
                payload.getSessionId(), attempts, lastFailure);
        return DeliveryOutcome.exhausted(attempts, lastFailure);
    }

    Duration backoffDelay(int attempt) {
        return Duration.ofMillis(baseDelayMs * (1L << (attempt - 1)));
    }

    private static boolean isRetryable(int status) {
        return status == 429 || status >= 500 || status < 200 || (status >= 300 && status < 400);
    }
}
