package com.example.anchormud.model;

/**
 * A schedule-bound NPC. Busy NPCs defer schedule moves until released.
 */
public class NpcInstance extends CombatantInstance {

    private volatile long busyUntil = -1;   // world millis; mid-transaction or mid-dialogue

    public NpcInstance(long instanceId, NpcTemplate template, long createdAt, String originRoomId) {
        super(instanceId, template, createdAt, 0, originRoomId, null, null);
    }

    public NpcTemplate getNpcTemplate() {
        return (NpcTemplate) getTemplate();
    }

    public boolean isBusy(long nowMillis) { return nowMillis < busyUntil; }
    public long getBusyUntil() { return busyUntil; }

    /**
     * Keep the NPC in place until the given time. A shorter hold never cuts a longer one.
     */
    public synchronized void holdUntil(long untilMillis) {
        if (untilMillis > busyUntil) busyUntil = untilMillis;
    }

    public void release() { busyUntil = -1; }
}
