package com.example.anchormud.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Runtime view of a player's character sheet.
 * Loaded from and saved to the external sheet store; mutated only under the
 * lock of the room the player occupies.
 */
public class PlayerCharacter {

    public static final String REF_PREFIX = "p:";

    private final String name;
    private int hp;
    private int maxHp;
    private int stamina;
    private int maxStamina;
    private int accuracy;          // 0-100
    private int avoidance;         // 0-100
    private int initiativeBonus;
    private AttackProfile weapon;  // null = unarmed
    private final List<ArmorPiece> armor = new ArrayList<>();
    private final Set<String> maneuvers = new LinkedHashSet<>();
    private final Map<String, Integer> inventory = new LinkedHashMap<>();
    private String savedRoomId;

    public PlayerCharacter(String name, int maxHp, int maxStamina, int accuracy, int avoidance, int initiativeBonus) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
        if (maxHp <= 0) throw new IllegalArgumentException("maxHp must be positive");
        this.name = name;
        this.maxHp = maxHp;
        this.hp = maxHp;
        this.maxStamina = Math.max(0, maxStamina);
        this.stamina = this.maxStamina;
        this.accuracy = accuracy;
        this.avoidance = avoidance;
        this.initiativeBonus = initiativeBonus;
    }

    public static String refFor(String name) {
        return REF_PREFIX + name.toLowerCase(Locale.ROOT);
    }

    public static boolean isPlayerRef(String ref) {
        return ref != null && ref.startsWith(REF_PREFIX);
    }

    public String getRef() {
        return refFor(name);
    }

    public String getName() { return name; }

    public int getHp() { return hp; }
    public int getMaxHp() { return maxHp; }

    public void setHp(int hp) {
        this.hp = Math.max(0, Math.min(maxHp, hp));
    }

    public void setMaxHp(int maxHp) {
        if (maxHp <= 0) throw new IllegalArgumentException("maxHp must be positive");
        this.maxHp = maxHp;
        if (hp > maxHp) hp = maxHp;
    }

    /**
     * @return hit points actually lost
     */
    public int applyDamage(int amount) {
        if (amount < 0) throw new IllegalArgumentException("negative damage: " + amount);
        int before = hp;
        setHp(hp - amount);
        return before - hp;
    }

    public boolean isDead() {
        return hp <= 0;
    }

    public int getStamina() { return stamina; }
    public int getMaxStamina() { return maxStamina; }

    public void setStamina(int stamina) {
        this.stamina = Math.max(0, Math.min(maxStamina, stamina));
    }

    /**
     * Pay a stamina cost.
     * @return false, with nothing spent, if the pool is too small
     */
    public boolean spendStamina(int cost) {
        if (cost > stamina) return false;
        stamina -= cost;
        return true;
    }

    public int getAccuracy() { return accuracy; }
    public void setAccuracy(int accuracy) { this.accuracy = accuracy; }
    public int getAvoidance() { return avoidance; }
    public void setAvoidance(int avoidance) { this.avoidance = avoidance; }
    public int getInitiativeBonus() { return initiativeBonus; }

    /**
     * The equipped weapon, or the unarmed profile.
     */
    public AttackProfile getAttack() {
        return weapon == null ? AttackProfile.UNARMED : weapon;
    }

    public AttackProfile getWeapon() { return weapon; }
    public void setWeapon(AttackProfile weapon) { this.weapon = weapon; }

    public List<ArmorPiece> getArmor() { return armor; }

    public void equipArmor(ArmorPiece piece) {
        armor.add(piece);
    }

    public Set<String> getManeuvers() { return Collections.unmodifiableSet(maneuvers); }

    public void learnManeuver(String maneuverId) {
        maneuvers.add(maneuverId.toLowerCase(Locale.ROOT));
    }

    public boolean knowsManeuver(String maneuverId) {
        return maneuverId != null && maneuvers.contains(maneuverId.toLowerCase(Locale.ROOT));
    }

    public Map<String, Integer> getInventory() { return Collections.unmodifiableMap(inventory); }

    public void addToInventory(String itemTemplateId, int quantity) {
        inventory.merge(itemTemplateId, quantity, Integer::sum);
    }

    public String getSavedRoomId() { return savedRoomId; }
    public void setSavedRoomId(String savedRoomId) { this.savedRoomId = savedRoomId; }
}
