package com.example.anchormud.combat;

import com.example.anchormud.model.CreatureInstance;

/**
 * Combatant backed by a spawned creature.
 */
public final class CreatureCombatant extends InstanceCombatant {

    public CreatureCombatant(CreatureInstance creature) {
        super(creature);
    }
}
