package com.example.honeypot.session;

import com.example.honeypot.kv.KvClient;
import com.example.honeypot.model.Session;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Session store over an expiring key-value capability.
 * <p>
 * Sessions are written as JSON to the primary store (Redis). If the primary is
 * unreachable at startup or fails during a call, the store switches to the
 * in-process fallback and reports {@link StoreStatus#FALLBACK} until a scheduled
 * probe finds the primary again. On reconnect, sessions written during the outage
 * are moved into the primary. A fallback entry only exists when it was written
 * after the primary copy, so lookups read it first.
 */
@Service
public class KvSessionStore implements SessionStore {

    private static final Logger logger = LoggerFactory.getLogger(KvSessionStore.class);

    private final KvClient primary;
    private final KvClient fallback;
    private final SessionCodec codec;
    private final Clock clock;
    private final AtomicReference<StoreStatus> status = new AtomicReference<>(StoreStatus.CONNECTED);

    @Value("${honeypot.session.ttl-seconds:86400}")
    private long ttlSeconds;

    @Value("${honeypot.session.key-prefix:honeypot:session:}")
    private String keyPrefix;

    public KvSessionStore(@Qualifier("redisKvClient") KvClient primary,
                          @Qualifier("inMemoryKvClient") KvClient fallback,
                          SessionCodec codec,
                          Clock clock) {
        this.primary = primary;
        this.fallback = fallback;
        this.codec = codec;
        this.clock = clock;
    }

    @PostConstruct
    public void probeOnStartup() {
        if (primaryReachable()) {
            logger.info("Session store connected, ttl={}s", ttlSeconds);
        } else {
            status.set(StoreStatus.FALLBACK);
            logger.warn("Session store unreachable at startup; using in-process fallback, "
                    + "sessions will not survive a restart");
        }
    }

    @Scheduled(fixedDelayString = "${honeypot.session.reprobe-interval-ms:30000}",
            initialDelayString = "${honeypot.session.reprobe-interval-ms:30000}")
    public void reprobe() {
        if (status.get() != StoreStatus.FALLBACK || !primaryReachable()) {
            return;
        }
        try {
            int moved = moveFallbackToPrimary();
            status.set(StoreStatus.CONNECTED);
            logger.info("Session store reachable again, leaving fallback mode ({} session(s) moved)", moved);
        } catch (RuntimeException e) {
            logger.warn("Session store answered but moving fallback sessions failed; staying in fallback: {}",
                    e.getMessage());
        }
    }

    private int moveFallbackToPrimary() {
        int moved = 0;
        for (String key : fallback.scan(keyPrefix, Integer.MAX_VALUE)) {
            Optional<String> json = fallback.get(key);
            if (json.isEmpty()) {
                continue;
            }
            Duration ttl = fallback.ttl(key).orElse(Duration.ofSeconds(ttlSeconds));
            primary.set(key, json.get(), ttl);
            fallback.del(key);
            moved++;
        }
        return moved;
    }

    @Override
    public Session load(String sessionId) {
        return find(sessionId).orElseGet(() -> {
            logger.debug("Starting new session {}", sessionId);
            return Session.start(sessionId, clock.instant());
        });
    }

    @Override
    public Optional<Session> find(String sessionId) {
        String key = key(sessionId);
        Optional<String> pending = fallback.get(key);
        if (pending.isPresent()) {
            return codec.decode(sessionId, pending.get());
        }
        if (status.get() == StoreStatus.CONNECTED) {
            try {
                Optional<String> json = primary.get(key);
                if (json.isPresent()) {
                    return codec.decode(sessionId, json.get());
                }
            } catch (RuntimeException e) {
                degrade("load", sessionId, e);
            }
        }
        return Optional.empty();
    }

    @Override
    public void save(Session session) {
        session.touch(clock.instant());
        String key = key(session.getSessionId());
        String json = codec.encode(session);
        Duration ttl = Duration.ofSeconds(ttlSeconds);
        if (status.get() == StoreStatus.CONNECTED) {
            try {
                primary.set(key, json, ttl);
                fallback.del(key);
                return;
            } catch (RuntimeException e) {
                degrade("save", session.getSessionId(), e);
            }
        }
        fallback.set(key, json, ttl);
    }

    @Override
    public StoreStatus status() {
        return status.get();
    }

    /**
     * Ids of live sessions, for operator tooling.
     */
    public List<String> listSessionIds(int limit) {
        Set<String> keys = new LinkedHashSet<>();
        if (status.get() == StoreStatus.CONNECTED) {
            try {
                keys.addAll(primary.scan(keyPrefix, limit));
            } catch (RuntimeException e) {
                degrade("scan", "*", e);
            }
        }
        keys.addAll(fallback.scan(keyPrefix, limit));
        return keys.stream()
                .limit(limit)
                .map(k -> k.substring(keyPrefix.length()))
                .collect(Collectors.toList());
    }

    /**
     * Time left before the session expires, from whichever store currently holds it.
     */
    public Optional<Duration> remainingTtl(String sessionId) {
        String key = key(sessionId);
        Optional<Duration> pending = fallback.ttl(key);
        if (pending.isPresent() || status.get() != StoreStatus.CONNECTED) {
            return pending;
        }
        try {
            return primary.ttl(key);
        } catch (RuntimeException e) {
            degrade("ttl", sessionId, e);
            return Optional.empty();
        }
    }

    private void degrade(String operation, String sessionId, RuntimeException e) {
        if (status.compareAndSet(StoreStatus.CONNECTED, StoreStatus.FALLBACK)) {
            logger.warn("Session store failed during {} of {}; switching to in-process fallback: {}",
                    operation, sessionId, e.getMessage());
        }
    }

    private boolean primaryReachable() {
        try {
            return primary.ping();
        } catch (RuntimeException e) {
            logger.debug("Session store probe failed: {}", e.getMessage());
            return false;
        }
    }

    private String key(String sessionId) {
        return keyPrefix + sessionId;
    }
}
