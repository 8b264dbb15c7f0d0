package com.example.anchormud.net;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks sessions by player ref and delivers outboxes to them.
 */
public class SessionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, Session> byPlayer = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);

    /**
     * Open a session for a player, replacing any previous one.
     */
    public Session open(String playerRef, MessageSink sink, long nowMillis) {
        Session session = new Session("s" + nextId.getAndIncrement(), playerRef, sink, nowMillis);
        Session old = byPlayer.put(playerRef, session);
        if (old != null) {
            old.markDisconnected(nowMillis);
            logger.info("[SessionRegistry] {} reconnected; replaced {}", playerRef, old.getSessionId());
        }
        return session;
    }

    public Session get(String playerRef) {
        return playerRef == null ? null : byPlayer.get(playerRef);
    }

    public String sessionIdFor(String playerRef) {
        Session s = get(playerRef);
        return s == null ? null : s.getSessionId();
    }

    /**
     * Mark a session disconnected. It stays registered until {@link #remove}.
     */
    public Session markDisconnected(String playerRef, long nowMillis) {
        Session s = byPlayer.get(playerRef);
        if (s != null) s.markDisconnected(nowMillis);
        return s;
    }

    /**
     * Remove the session only if it is still the given one.
     */
    public boolean remove(Session session) {
        return byPlayer.remove(session.getPlayerRef(), session);
    }

    public Collection<Session> all() {
        return Collections.unmodifiableCollection(byPlayer.values());
    }

    public void send(String playerRef, GameMessage message) {
        Session s = byPlayer.get(playerRef);
        if (s != null) {
            deliverSafely(s, message);
        }
    }

    /**
     * Deliver every envelope to its recipient. Refs without a session
     * (creatures, NPCs, departed players) are skipped.
     */
    public void deliver(Outbox outbox) {
        for (Outbox.Envelope e : outbox.drain()) {
            Session s = byPlayer.get(e.recipientRef());
            if (s != null) {
                deliverSafely(s, e.message());
            }
        }
    }

    private void deliverSafely(Session s, GameMessage message) {
        try {
            s.send(message);
        } catch (RuntimeException ex) {
            logger.warn("[SessionRegistry] Delivery to {} failed: {}", s.getSessionId(), ex.getMessage());
        }
    }
}
