package com.example.anchormud.persistence;

import com.example.anchormud.model.PlayerCharacter;

import java.util.Optional;

/**
 * External owner of character sheets. The runtime loads a sheet on connect and
 * saves it through the deferred write queue; it never reads sheets mid-combat.
 */
public interface CharacterSheetStore {

    Optional<PlayerCharacter> load(String name) throws PersistenceException;

    void save(PlayerCharacter character) throws PersistenceException;
}
