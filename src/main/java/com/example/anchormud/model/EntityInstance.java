package com.example.anchormud.model;

/**
 * A live creature, NPC or dropped item, distinct from its template.
 *
 * The template reference is final. Spawn provenance (origin room, spawn rule,
 * loot rule, encounter) is recorded at creation so death and pickup can
 * release the right timer slot.
 */
public abstract class EntityInstance {

    public static final String REF_PREFIX = "e:";

    private final long instanceId;
    private final EntityTemplate template;
    private final long createdAt;          // world millis
    private volatile long expiresAt;       // world millis, 0 = never
    private final String originRoomId;
    private final String spawnRuleId;      // null unless spawned by a spawn rule
    private final String lootRuleId;       // null unless produced by a loot rule
    private final String encounterId;      // null unless part of a wandering encounter

    protected EntityInstance(long instanceId, EntityTemplate template, long createdAt, long expiresAt,
                             String originRoomId, String spawnRuleId, String lootRuleId, String encounterId) {
        if (template == null) throw new IllegalArgumentException("template is required");
        this.instanceId = instanceId;
        this.template = template;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.originRoomId = originRoomId;
        this.spawnRuleId = spawnRuleId;
        this.lootRuleId = lootRuleId;
        this.encounterId = encounterId;
    }

    public static String refFor(long instanceId) {
        return REF_PREFIX + instanceId;
    }

    public static boolean isInstanceRef(String ref) {
        return ref != null && ref.startsWith(REF_PREFIX);
    }

    /**
     * Parse an instance ref.
     * @return the instance id, or -1 if the ref is not an instance ref
     */
    public static long idFromRef(String ref) {
        if (!isInstanceRef(ref)) return -1;
        try {
            return Long.parseLong(ref.substring(REF_PREFIX.length()));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    public String getRef() {
        return refFor(instanceId);
    }

    public long getInstanceId() { return instanceId; }
    public EntityTemplate getTemplate() { return template; }
    public String getTemplateId() { return template.getId(); }
    public EntityKind getKind() { return template.getKind(); }
    public String getName() { return template.getName(); }
    public long getCreatedAt() { return createdAt; }
    public long getExpiresAt() { return expiresAt; }
    public void setExpiresAt(long expiresAt) { this.expiresAt = expiresAt; }
    public String getOriginRoomId() { return originRoomId; }
    public String getSpawnRuleId() { return spawnRuleId; }
    public String getLootRuleId() { return lootRuleId; }
    public String getEncounterId() { return encounterId; }

    public boolean isExpired(long nowMillis) {
        return expiresAt > 0 && nowMillis >= expiresAt;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "#" + instanceId + "(" + template.getId() + ")";
    }
}
