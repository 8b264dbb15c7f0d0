package com.example.anchormud.net;

/**
 * One line of output for a session.
 */
public record GameMessage(MessageType type, String text) {

    public GameMessage {
        if (type == null) throw new IllegalArgumentException("type required");
        if (text == null) text = "";
    }

    public static GameMessage notice(String text) {
        return new GameMessage(MessageType.NOTICE, text);
    }

    public static GameMessage state(String text) {
        return new GameMessage(MessageType.STATE, text);
    }

    @Override
    public String toString() {
        return type + ": " + text;
    }
}
