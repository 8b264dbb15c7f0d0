package com.example.anchormud.net;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Messages collected while a room lock is held and delivered after it is
 * released, so no session I/O ever happens under a lock.
 */
public class Outbox {

    public record Envelope(String recipientRef, GameMessage message) {}

    private final List<Envelope> envelopes = new ArrayList<>();

    public Outbox to(String recipientRef, GameMessage message) {
        if (recipientRef != null) {
            envelopes.add(new Envelope(recipientRef, message));
        }
        return this;
    }

    public Outbox to(String recipientRef, MessageType type, String text) {
        return to(recipientRef, new GameMessage(type, text));
    }

    public Outbox toAll(Collection<String> recipientRefs, GameMessage message) {
        for (String ref : recipientRefs) {
            to(ref, message);
        }
        return this;
    }

    public Outbox toAllExcept(Collection<String> recipientRefs, String excludedRef, GameMessage message) {
        for (String ref : recipientRefs) {
            if (!ref.equals(excludedRef)) to(ref, message);
        }
        return this;
    }

    public boolean isEmpty() {
        return envelopes.isEmpty();
    }

    public List<Envelope> getEnvelopes() {
        return Collections.unmodifiableList(envelopes);
    }

    /**
     * Messages addressed to one recipient, in the order they were queued.
     */
    public List<GameMessage> messagesFor(String recipientRef) {
        List<GameMessage> out = new ArrayList<>();
        for (Envelope e : envelopes) {
            if (e.recipientRef().equals(recipientRef)) out.add(e.message());
        }
        return out;
    }

    /**
     * Remove and return every queued envelope.
     */
    public List<Envelope> drain() {
        List<Envelope> out = new ArrayList<>(envelopes);
        envelopes.clear();
        return out;
    }
}
