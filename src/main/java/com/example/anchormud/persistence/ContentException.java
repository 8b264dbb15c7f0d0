package com.example.anchormud.persistence;

/**
 * Invalid or inconsistent content: unknown template references, overlapping
 * schedule blocks, malformed definitions.
 */
public class ContentException extends RuntimeException {

    public ContentException(String message) {
        super(message);
    }

    public ContentException(String message, Throwable cause) {
        super(message, cause);
    }
}
