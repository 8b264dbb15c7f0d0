package com.example.anchormud.net;

/**
 * Transport-side receiver for a session's messages. Implementations must not
 * block for long; delivery happens after room locks are released but still on
 * the game's threads.
 */
@FunctionalInterface
public interface MessageSink {
    void deliver(GameMessage message);
}
