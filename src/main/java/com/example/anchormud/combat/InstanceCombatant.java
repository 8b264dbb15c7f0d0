package com.example.anchormud.combat;

import com.example.anchormud.model.ArmorPiece;
import com.example.anchormud.model.AttackProfile;
import com.example.anchormud.model.BehaviorProfile;
import com.example.anchormud.model.CombatantInstance;

import java.util.List;

/**
 * Shared behavior for combatants backed by a registry instance.
 * Instances have no stamina pool: only free maneuvers can be paid for.
 */
abstract class InstanceCombatant implements Combatant {

    protected final CombatantInstance instance;

    InstanceCombatant(CombatantInstance instance) {
        this.instance = instance;
    }

    public CombatantInstance getInstance() {
        return instance;
    }

    @Override public String getRef() { return instance.getRef(); }
    @Override public String getName() { return instance.getName(); }
    @Override public boolean isPlayer() { return false; }
    @Override public int getHp() { return instance.getHp(); }
    @Override public int getMaxHp() { return instance.getMaxHp(); }
    @Override public int applyDamage(int amount) { return instance.applyDamage(amount); }
    @Override public int getAccuracy() { return instance.getAccuracy(); }
    @Override public int getAvoidance() { return instance.getAvoidance(); }
    @Override public int getInitiativeBonus() { return instance.getCombatTemplate().getInitiativeBonus(); }
    @Override public AttackProfile getAttack() { return instance.getAttack(); }
    @Override public List<ArmorPiece> getArmor() { return instance.getArmor(); }
    @Override public BehaviorProfile getBehavior() { return instance.getBehavior(); }
    @Override public int getAlliance() { return WORLD_ALLIANCE; }
    @Override public boolean spendStamina(int cost) { return cost <= 0; }
    @Override public void refundStamina(int amount) { }
    @Override public boolean knowsManeuver(String maneuverId) { return false; }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getName() + " " + getRef() + "]";
    }
}
