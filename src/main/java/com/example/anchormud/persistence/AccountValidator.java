package com.example.anchormud.persistence;

/**
 * External account check performed once when a session attaches a character.
 */
@FunctionalInterface
public interface AccountValidator {

    boolean validate(String accountName, String credential) throws PersistenceException;
}
