package com.example.anchormud.model;

/**
 * Room-attached item generator. Same timer and ceiling shape as {@link SpawnRule}.
 *
 * @param expirySeconds  lifetime of produced items; 0 uses the configured default
 */
public record LootRule(String id, String itemTemplateId, int minQuantity, int maxQuantity,
                       int maxAlive, int cooldownSeconds, int expirySeconds) {

    public LootRule {
        if (id == null || itemTemplateId == null) throw new IllegalArgumentException("loot rule needs id and item");
        if (minQuantity < 1) minQuantity = 1;
        if (maxQuantity < minQuantity) maxQuantity = minQuantity;
        if (maxAlive < 1) maxAlive = 1;
        if (cooldownSeconds < 0) cooldownSeconds = 0;
        if (expirySeconds < 0) expirySeconds = 0;
    }

    public long cooldownMillis() {
        return cooldownSeconds * 1000L;
    }
}
