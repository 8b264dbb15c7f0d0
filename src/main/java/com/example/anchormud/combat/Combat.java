package com.example.anchormud.combat;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Represents an active combat session in a room.
 *
 * Initiative is rolled once when the session is created and never changes.
 * Combatants who join later are appended to the joiner queue, which runs
 * after the initiative order every round. Mutated only under the room lock;
 * state lookups from other threads see a consistent participant map.
 */
public class Combat {

    /** Unique identifier for this combat instance */
    private final long combatId;

    /** Room where this combat is taking place */
    private final String roomId;

    /** Current state of the combat */
    private volatile CombatState state = CombatState.ACTIVE;

    /** Fixed initiative order established at session start */
    private final List<String> initiativeOrder;

    /** Combatants who joined after the session started, in join order */
    private final List<String> joiners = new CopyOnWriteArrayList<>();

    /** Current participants, keyed by ref */
    private final Map<String, CombatParticipant> participants = Collections.synchronizedMap(new LinkedHashMap<>());

    /** Current round number (starts at 1) */
    private volatile int currentRound = 1;

    /** World millis when the current round started */
    private volatile long roundStartedAt;

    /** World millis when the combat started */
    private final long startedAt;

    public record InitiativeRoll(Combatant combatant, int roll) {}

    private Combat(long combatId, String roomId, List<String> initiativeOrder, long startedAt) {
        this.combatId = combatId;
        this.roomId = roomId;
        this.initiativeOrder = Collections.unmodifiableList(new ArrayList<>(initiativeOrder));
        this.startedAt = startedAt;
        this.roundStartedAt = startedAt;
    }

    /**
     * Start a session. Rolls are sorted descending, ties broken by ref.
     * Every initial combatant starts Engaged.
     */
    public static Combat start(long combatId, String roomId, List<InitiativeRoll> rolls, long nowMillis) {
        List<InitiativeRoll> sorted = new ArrayList<>(rolls);
        sorted.sort(Comparator.comparingInt(InitiativeRoll::roll).reversed()
                .thenComparing(r -> r.combatant().getRef()));
        List<String> order = new ArrayList<>();
        for (InitiativeRoll r : sorted) {
            if (!order.contains(r.combatant().getRef())) order.add(r.combatant().getRef());
        }
        Combat combat = new Combat(combatId, roomId, order, nowMillis);
        for (String ref : order) {
            combat.participants.put(ref, new CombatParticipant(ref, ParticipantState.ENGAGED, false));
        }
        return combat;
    }

    // ========== Participants ==========

    /**
     * Add a combatant after the session started. A ref that already holds a
     * place in the initiative order or joiner queue keeps it.
     */
    public CombatParticipant addLateJoiner(String ref, ParticipantState state) {
        CombatParticipant existing = participants.get(ref);
        if (existing != null) return existing;
        if (!initiativeOrder.contains(ref) && !joiners.contains(ref)) {
            joiners.add(ref);
        }
        CombatParticipant p = new CombatParticipant(ref, state, true);
        participants.put(ref, p);
        return p;
    }

    public CombatParticipant getParticipant(String ref) {
        return ref == null ? null : participants.get(ref);
    }

    public boolean hasParticipant(String ref) {
        return participants.containsKey(ref);
    }

    public CombatParticipant removeParticipant(String ref) {
        return participants.remove(ref);
    }

    /**
     * Snapshot of the current participants.
     */
    public Collection<CombatParticipant> getParticipants() {
        synchronized (participants) {
            return List.copyOf(participants.values());
        }
    }

    /**
     * Participants in action order: initiative order, then joiners.
     */
    public List<CombatParticipant> actionQueue() {
        List<CombatParticipant> out = new ArrayList<>();
        for (String ref : initiativeOrder) {
            CombatParticipant p = participants.get(ref);
            if (p != null) out.add(p);
        }
        for (String ref : joiners) {
            CombatParticipant p = participants.get(ref);
            if (p != null) out.add(p);
        }
        return out;
    }

    // ========== Rounds ==========

    public boolean isRoundDue(long nowMillis, long roundMillis) {
        return state == CombatState.ACTIVE && nowMillis >= roundStartedAt + roundMillis;
    }

    public void advanceRound(long nowMillis) {
        currentRound++;
        roundStartedAt = nowMillis;
    }

    public void end() {
        state = CombatState.ENDED;
    }

    // ========== Getters ==========

    public long getCombatId() { return combatId; }
    public String getRoomId() { return roomId; }
    public CombatState getState() { return state; }
    public boolean isActive() { return state == CombatState.ACTIVE; }
    public List<String> getInitiativeOrder() { return initiativeOrder; }
    public List<String> getJoiners() { return Collections.unmodifiableList(joiners); }
    public int getCurrentRound() { return currentRound; }
    public long getRoundStartedAt() { return roundStartedAt; }
    public long getStartedAt() { return startedAt; }

    @Override
    public String toString() {
        return "Combat[" + combatId + " in " + roomId + " round " + currentRound + ", "
                + participants.size() + " participants]";
    }
}
