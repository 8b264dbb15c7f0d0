package com.example.anchormud.model;

import java.util.List;
import java.util.Map;

/**
 * Blueprint for an item that can lie in a room.
 */
public class ItemTemplate extends EntityTemplate {

    private final int maxDurability;   // 0 = indestructible
    private final boolean stackable;

    public ItemTemplate(String id, String name, List<String> keywords, Map<String, Object> extensions,
                        int maxDurability, boolean stackable) {
        super(id, name, keywords, extensions);
        this.maxDurability = Math.max(0, maxDurability);
        this.stackable = stackable;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.ITEM;
    }

    public int getMaxDurability() { return maxDurability; }
    public boolean isStackable() { return stackable; }
}
