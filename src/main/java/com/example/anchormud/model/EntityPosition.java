package com.example.anchormud.model;

/**
 * Binds a live entity (instance or player) to a room, with an optional
 * combat range band and engaged target. Positions are replaced, never
 * mutated in place.
 *
 * @param ref        entity ref ("e:42", "p:mara")
 * @param roomId     room the entity occupies
 * @param band       range band, null outside combat
 * @param targetRef  engaged target, null when none
 */
public record EntityPosition(String ref, String roomId, RangeBand band, String targetRef) {

    public EntityPosition {
        if (ref == null) throw new IllegalArgumentException("ref is required");
        if (roomId == null) throw new IllegalArgumentException("roomId is required");
    }

    public static EntityPosition at(String ref, String roomId) {
        return new EntityPosition(ref, roomId, null, null);
    }

    public EntityPosition withRoom(String newRoomId) {
        // entering a room drops combat context
        return new EntityPosition(ref, newRoomId, null, null);
    }

    public EntityPosition withBand(RangeBand newBand) {
        return new EntityPosition(ref, roomId, newBand, targetRef);
    }

    public EntityPosition withTarget(String newTargetRef) {
        return new EntityPosition(ref, roomId, band, newTargetRef);
    }

    public EntityPosition clearCombat() {
        return new EntityPosition(ref, roomId, null, null);
    }
}
