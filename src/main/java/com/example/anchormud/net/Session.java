package com.example.anchormud.net;

/**
 * A connected (or recently disconnected) player session.
 */
public class Session {

    private final String sessionId;
    private final String playerRef;
    private final MessageSink sink;
    private final long connectedAt;
    private volatile long disconnectedAt = -1;   // world millis, -1 while connected

    public Session(String sessionId, String playerRef, MessageSink sink, long connectedAt) {
        this.sessionId = sessionId;
        this.playerRef = playerRef;
        this.sink = sink;
        this.connectedAt = connectedAt;
    }

    public String getSessionId() { return sessionId; }
    public String getPlayerRef() { return playerRef; }
    public long getConnectedAt() { return connectedAt; }
    public long getDisconnectedAt() { return disconnectedAt; }

    public boolean isConnected() {
        return disconnectedAt < 0;
    }

    void markDisconnected(long nowMillis) {
        this.disconnectedAt = nowMillis;
    }

    void send(GameMessage message) {
        if (isConnected()) {
            sink.deliver(message);
        }
    }
}
