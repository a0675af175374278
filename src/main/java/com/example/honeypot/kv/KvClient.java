package com.example.honeypot.kv;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Expiring key-value capability the session store is built on.
 */
public interface KvClient {
    Optional<String> get(String key);
    void set(String key, String value, Duration ttl);
    void del(String key);
    Optional<Duration> ttl(String key);
    List<String> scan(String prefix, int limit);

    /**
     * @return true when the backing store answered
     */
    boolean ping();
}
