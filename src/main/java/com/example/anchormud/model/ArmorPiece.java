package com.example.anchormud.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * An equipped armor piece. Reduction applies in full to the primary damage type
 * and at {@link #SECONDARY_RATE} to secondary coverage. Durability is consumed
 * by the amount the piece absorbs; a piece at zero durability stays equipped
 * but contributes nothing.
 *
 * Mutated only under the owning room's lock.
 */
public class ArmorPiece {

    public static final double SECONDARY_RATE = 0.5;

    private final String name;
    private final DamageType primaryType;
    private final Set<DamageType> secondaryTypes;
    private final int reduction;
    private final int maxDurability;
    private int durability;

    public ArmorPiece(String name, DamageType primaryType, Set<DamageType> secondaryTypes,
                      int reduction, int durability) {
        this(name, primaryType, secondaryTypes, reduction, durability, durability);
    }

    public ArmorPiece(String name, DamageType primaryType, Set<DamageType> secondaryTypes,
                      int reduction, int maxDurability, int durability) {
        if (reduction < 0 || maxDurability < 0 || durability < 0) {
            throw new IllegalArgumentException("armor values must be non-negative");
        }
        this.name = name;
        this.primaryType = primaryType;
        this.secondaryTypes = secondaryTypes == null || secondaryTypes.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(secondaryTypes));
        this.reduction = reduction;
        this.maxDurability = maxDurability;
        this.durability = Math.min(durability, maxDurability);
    }

    public ArmorPiece copy() {
        return new ArmorPiece(name, primaryType, secondaryTypes, reduction, maxDurability);
    }

    public String getName() { return name; }
    public DamageType getPrimaryType() { return primaryType; }
    public Set<DamageType> getSecondaryTypes() { return secondaryTypes; }
    public int getReduction() { return reduction; }
    public int getMaxDurability() { return maxDurability; }
    public int getDurability() { return durability; }

    /**
     * Reduction this piece would offer against the given type right now,
     * capped by remaining durability.
     */
    public int reductionAgainst(DamageType type) {
        if (durability <= 0 || type == null) return 0;
        int nominal;
        if (type == primaryType) {
            nominal = reduction;
        } else if (secondaryTypes.contains(type)) {
            nominal = (int) Math.floor(reduction * SECONDARY_RATE);
        } else {
            nominal = 0;
        }
        return Math.min(nominal, durability);
    }

    /**
     * Record that this piece absorbed the given amount of damage.
     */
    public void absorb(int amount) {
        if (amount < 0) throw new IllegalArgumentException("negative absorb: " + amount);
        durability = Math.max(0, durability - amount);
    }

    public boolean isBroken() {
        return durability <= 0;
    }

    @Override
    public String toString() {
        return name + " (" + durability + "/" + maxDurability + ")";
    }
}
