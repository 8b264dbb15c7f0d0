package com.example.anchormud.persistence;

/**
 * Raised by external persistence collaborators when a read or write fails.
 * Callers in the runtime treat it as transient and retry out of band.
 */
public class PersistenceException extends Exception {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
