package com.example.anchormud.model;

/**
 * Immutable maneuver definition.
 *
 * @param id                  key used by players ("feint", "riposte")
 * @param name                display name
 * @param staminaCost         stamina paid on use
 * @param tickerDelaySeconds  game seconds added to the user's next automatic swing
 * @param accuracyBonus       added to effective accuracy for this attack
 * @param damageMultiplier    applied to raw damage on hit
 * @param appliesModifier     modifier put on the target on hit, may be null
 * @param ranged              usable from any band
 * @param reaction            trigger for reaction maneuvers, NONE for active ones
 */
public record ManeuverDefinition(String id, String name, int staminaCost, double tickerDelaySeconds,
                                 int accuracyBonus, double damageMultiplier, CombatModifier appliesModifier,
                                 boolean ranged, ReactionTrigger reaction) {

    public ManeuverDefinition {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("maneuver id is required");
        if (name == null) name = id;
        if (staminaCost < 0) throw new IllegalArgumentException("negative stamina cost for " + id);
        if (tickerDelaySeconds < 0) tickerDelaySeconds = 0;
        if (damageMultiplier < 0) damageMultiplier = 0;
        if (reaction == null) reaction = ReactionTrigger.NONE;
    }

    public boolean isReaction() {
        return reaction != ReactionTrigger.NONE;
    }

    public long tickerDelayMillis() {
        return Math.round(tickerDelaySeconds * 1000.0);
    }
}
