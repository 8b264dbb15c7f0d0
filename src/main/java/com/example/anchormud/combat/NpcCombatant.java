package com.example.anchormud.combat;

import com.example.anchormud.model.NpcInstance;

/**
 * Combatant backed by a schedule-bound NPC.
 */
public final class NpcCombatant extends InstanceCombatant {

    public NpcCombatant(NpcInstance npc) {
        super(npc);
    }

    public NpcInstance getNpc() {
        return (NpcInstance) instance;
    }
}
