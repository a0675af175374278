package com.example.honeypot.session;

import com.example.honeypot.model.Session;

import java.util.Optional;

/**
 * Owns per-conversation state. Writes are last-write-wins; there is no locking across
 * concurrent turns of the same session.
 */
public interface SessionStore {

    /**
     * @return the stored session, or a fresh empty one when none exists or it expired
     */
    Session load(String sessionId);

    Optional<Session> find(String sessionId);

    /**
     * Overwrites the stored session and restarts its time-to-live.
     */
    void save(Session session);

    StoreStatus status();
}
