package com.example.anchormud.combat;

import com.example.anchormud.model.CombatModifier;
import com.example.anchormud.model.ManeuverDefinition;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A combatant's per-session record: state, round slots, modifiers, readied
 * reaction and threat. Range band and target live in the entity's position.
 * Mutated only under the room lock.
 */
public class CombatParticipant {

    private final String ref;
    private final boolean lateJoiner;
    private volatile ParticipantState state;

    // round slots
    private PendingAction primary;
    private boolean minorUsed;
    private int reactionsUsed;
    private int pendingSwings;        // ticker fires accumulated this round

    private ManeuverDefinition readied;
    private final Map<CombatModifier, Integer> modifiers = new EnumMap<>(CombatModifier.class);   // -> last round active
    private final Map<String, Integer> threat = new LinkedHashMap<>();                             // attacker -> damage dealt

    // disengage bookkeeping
    private long disengageDeadline = -1;
    private String preDisengageTarget;

    public CombatParticipant(String ref, ParticipantState state, boolean lateJoiner) {
        this.ref = ref;
        this.state = state;
        this.lateJoiner = lateJoiner;
    }

    public String getRef() { return ref; }
    public boolean isLateJoiner() { return lateJoiner; }

    public ParticipantState getState() { return state; }
    public void setState(ParticipantState state) { this.state = state; }

    public PendingAction getPrimary() { return primary; }
    public boolean hasPrimary() { return primary != null; }
    public void setPrimary(PendingAction primary) { this.primary = primary; }

    public boolean isMinorUsed() { return minorUsed; }
    public void useMinor() { this.minorUsed = true; }

    public int getReactionsUsed() { return reactionsUsed; }
    public void useReaction() { reactionsUsed++; }

    public int getPendingSwings() { return pendingSwings; }
    public void addSwing() { pendingSwings++; }

    public int takeSwings() {
        int n = pendingSwings;
        pendingSwings = 0;
        return n;
    }

    public ManeuverDefinition getReadied() { return readied; }
    public void setReadied(ManeuverDefinition readied) { this.readied = readied; }

    // ========== Modifiers ==========

    /**
     * Apply a modifier that lasts through the given round.
     */
    public void addModifier(CombatModifier modifier, int throughRound) {
        modifiers.merge(modifier, throughRound, Math::max);
    }

    public boolean hasModifier(CombatModifier modifier) {
        return modifiers.containsKey(modifier);
    }

    public Set<CombatModifier> getModifiers() {
        return Collections.unmodifiableSet(modifiers.keySet());
    }

    public int accuracyModifier() {
        int sum = 0;
        for (CombatModifier m : modifiers.keySet()) sum += m.getAccuracyModifier();
        return sum;
    }

    public int avoidanceModifier() {
        int sum = 0;
        for (CombatModifier m : modifiers.keySet()) sum += m.getAvoidanceModifier();
        return sum;
    }

    public boolean isMovementBlocked() {
        for (CombatModifier m : modifiers.keySet()) {
            if (m.blocksMovement()) return true;
        }
        return false;
    }

    /**
     * Drop modifiers that do not outlast the finished round.
     */
    public void expireModifiers(int finishedRound) {
        modifiers.values().removeIf(through -> through <= finishedRound);
    }

    // ========== Threat ==========

    public void addThreat(String attackerRef, int amount) {
        threat.merge(attackerRef, Math.max(0, amount), Integer::sum);
    }

    public void forgetThreat(String attackerRef) {
        threat.remove(attackerRef);
    }

    /** Attackers in the order they first dealt (or attempted) damage. */
    public Map<String, Integer> getThreat() {
        return Collections.unmodifiableMap(threat);
    }

    // ========== Disengage ==========

    public long getDisengageDeadline() { return disengageDeadline; }
    public String getPreDisengageTarget() { return preDisengageTarget; }

    public void beginDisengage(long deadline, String currentTarget) {
        this.state = ParticipantState.DISENGAGING;
        this.disengageDeadline = deadline;
        this.preDisengageTarget = currentTarget;
    }

    public void clearDisengage() {
        this.disengageDeadline = -1;
        this.preDisengageTarget = null;
    }

    /**
     * Reset per-round slots at the end of a round.
     */
    public void resetRound() {
        primary = null;
        minorUsed = false;
        reactionsUsed = 0;
    }

    @Override
    public String toString() {
        return "CombatParticipant[" + ref + " " + state + "]";
    }
}
