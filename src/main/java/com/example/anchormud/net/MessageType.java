package com.example.anchormud.net;

/**
 * Kinds of message delivered to a session's event stream.
 */
public enum MessageType {
    ROUND_SUMMARY,
    HIT,
    MISS,
    CRITICAL,
    STATE,      // engaged / disengaged / died
    NOTICE,     // action feedback
    PRESENCE,   // arrivals and departures
    WEATHER,
    ROOM
}
