package com.example.honeypot.kv;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link KvClient}. Entries expire lazily on read and are purged
 * periodically. Nothing survives a restart.
 */
@Component
public class InMemoryKvClient implements KvClient {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryKvClient() {
        this(Clock.systemUTC());
    }

    public InMemoryKvClient(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        Instant expiresAt = (ttl == null || ttl.isZero() || ttl.isNegative()) ? null : clock.instant().plus(ttl);
        entries.put(key, new Entry(value, expiresAt));
    }

    @Override
    public void del(String key) {
        entries.remove(key);
    }

    @Override
    public Optional<Duration> ttl(String key) {
        Entry entry = entries.get(key);
        Instant now = clock.instant();
        if (entry == null || entry.expiresAt == null || entry.isExpired(now)) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(now, entry.expiresAt));
    }

    @Override
    public List<String> scan(String prefix, int limit) {
        Instant now = clock.instant();
        List<String> keys = new ArrayList<>();
        for (Map.Entry<String, Entry> e : entries.entrySet()) {
            if (keys.size() >= limit) {
                break;
            }
            if (e.getKey().startsWith(prefix) && !e.getValue().isExpired(now)) {
                keys.add(e.getKey());
            }
        }
        return keys;
    }

    @Override
    public boolean ping() {
        return true;
    }

    @Scheduled(fixedDelayString = "${honeypot.session.purge-interval-ms:60000}")
    public void purgeExpired() {
        Instant now = clock.instant();
        entries.entrySet().removeIf(e -> e.getValue().isExpired(now));
    }

    int size() {
        return entries.size();
    }

    private static final class Entry {
        private final String value;
        private final Instant expiresAt;

        private Entry(String value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
