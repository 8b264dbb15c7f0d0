package com.example.anchormud.model;

/**
 * Room-attached creature generator.
 *
 * @param id               rule id, unique within the room
 * @param templateId       creature or NPC template to instantiate
 * @param minCount         fewest instances per firing
 * @param maxCount         most instances per firing
 * @param maxAlive         ceiling on live instances from this rule
 * @param cooldownSeconds  game seconds between firings
 */
public record SpawnRule(String id, String templateId, int minCount, int maxCount,
                        int maxAlive, int cooldownSeconds) {

    public SpawnRule {
        if (id == null || templateId == null) throw new IllegalArgumentException("spawn rule needs id and template");
        if (minCount < 1) minCount = 1;
        if (maxCount < minCount) maxCount = minCount;
        if (maxAlive < 1) maxAlive = 1;
        if (cooldownSeconds < 0) cooldownSeconds = 0;
    }

    public long cooldownMillis() {
        return cooldownSeconds * 1000L;
    }
}
