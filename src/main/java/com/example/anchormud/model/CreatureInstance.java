package com.example.anchormud.model;

/**
 * A spawned creature.
 */
public class CreatureInstance extends CombatantInstance {

    public CreatureInstance(long instanceId, CreatureTemplate template, long createdAt, long expiresAt,
                            String originRoomId, String spawnRuleId, String encounterId) {
        super(instanceId, template, createdAt, expiresAt, originRoomId, spawnRuleId, encounterId);
    }
}
