package com.example.honeypot.controller;

import com.example.honeypot.session.SessionStore;
import com.example.honeypot.session.StoreStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@RestController
public class HealthController {

    private final SessionStore sessionStore;
    private final Clock clock;

    public HealthController(SessionStore sessionStore, Clock clock) {
        this.sessionStore = sessionStore;
        this.clock = clock;
    }

    /**
     * Always 200 while the process can answer; a store in fallback mode is reported
     * as degraded rather than down.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        StoreStatus store = sessionStore.status();
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", store == StoreStatus.CONNECTED ? "healthy" : "degraded");
        health.put("store", store.name().toLowerCase(Locale.ROOT));
        health.put("timestamp", clock.millis());
        return ResponseEntity.ok(health);
    }
}
