package com.example.anchormud.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Drop table rolled once when a combatant dies. Each entry is checked
 * independently against its chance.
 */
public class LootTable {

    /**
     * @param chance  drop chance in [0,1]
     */
    public record Entry(String itemTemplateId, double chance, int minQuantity, int maxQuantity) {
        public Entry {
            if (itemTemplateId == null) throw new IllegalArgumentException("loot entry needs an item");
            chance = Math.max(0.0, Math.min(1.0, chance));
            if (minQuantity < 1) minQuantity = 1;
            if (maxQuantity < minQuantity) maxQuantity = minQuantity;
        }
    }

    public record Drop(String itemTemplateId, int quantity) {}

    private final String id;
    private final List<Entry> entries;

    public LootTable(String id, List<Entry> entries) {
        this.id = id;
        this.entries = entries == null ? Collections.emptyList() : List.copyOf(entries);
    }

    public String getId() { return id; }
    public List<Entry> getEntries() { return entries; }

    public List<Drop> roll(Random rng) {
        List<Drop> drops = new ArrayList<>();
        for (Entry e : entries) {
            if (rng.nextDouble() < e.chance()) {
                int qty = e.minQuantity() + rng.nextInt(e.maxQuantity() - e.minQuantity() + 1);
                drops.add(new Drop(e.itemTemplateId(), qty));
            }
        }
        return drops;
    }
}
