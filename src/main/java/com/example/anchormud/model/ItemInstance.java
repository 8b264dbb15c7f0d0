package com.example.anchormud.model;

/**
 * An item lying in a room. Items produced by a kill may be reserved for the
 * killer's session until the reservation lapses.
 */
public class ItemInstance extends EntityInstance {

    private int quantity;
    private int durability;
    private volatile String reservedFor;   // session id, null when unreserved
    private volatile long reservedUntil;   // world millis

    public ItemInstance(long instanceId, ItemTemplate template, long createdAt, long expiresAt,
                        String originRoomId, String lootRuleId, int quantity) {
        super(instanceId, template, createdAt, expiresAt, originRoomId, null, lootRuleId, null);
        if (quantity <= 0) throw new IllegalArgumentException("quantity must be positive");
        this.quantity = quantity;
        this.durability = template.getMaxDurability();
    }

    public ItemTemplate getItemTemplate() {
        return (ItemTemplate) getTemplate();
    }

    public int getQuantity() { return quantity; }
    public void setQuantity(int quantity) { this.quantity = Math.max(1, quantity); }
    public int getDurability() { return durability; }
    public void setDurability(int durability) { this.durability = Math.max(0, durability); }

    public void reserve(String sessionId, long untilMillis) {
        this.reservedFor = sessionId;
        this.reservedUntil = untilMillis;
    }

    public String getReservedFor() { return reservedFor; }
    public long getReservedUntil() { return reservedUntil; }

    /**
     * Whether the given session may take this item at the given time.
     */
    public boolean canBeTakenBy(String sessionId, long nowMillis) {
        if (reservedFor == null || nowMillis >= reservedUntil) return true;
        return reservedFor.equals(sessionId);
    }
}
