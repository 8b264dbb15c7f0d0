package com.example.anchormud.combat;

import com.example.anchormud.model.ArmorPiece;
import com.example.anchormud.model.AttackProfile;
import com.example.anchormud.model.BehaviorProfile;
import com.example.anchormud.model.PlayerCharacter;

import java.util.List;

/**
 * Combatant backed by a connected player character.
 */
public final class PlayerCombatant implements Combatant {

    private final PlayerCharacter character;

    public PlayerCombatant(PlayerCharacter character) {
        this.character = character;
    }

    public PlayerCharacter getCharacter() {
        return character;
    }

    @Override public String getRef() { return character.getRef(); }
    @Override public String getName() { return character.getName(); }
    @Override public boolean isPlayer() { return true; }
    @Override public int getHp() { return character.getHp(); }
    @Override public int getMaxHp() { return character.getMaxHp(); }
    @Override public int applyDamage(int amount) { return character.applyDamage(amount); }
    @Override public int getAccuracy() { return character.getAccuracy(); }
    @Override public int getAvoidance() { return character.getAvoidance(); }
    @Override public int getInitiativeBonus() { return character.getInitiativeBonus(); }
    @Override public AttackProfile getAttack() { return character.getAttack(); }
    @Override public List<ArmorPiece> getArmor() { return character.getArmor(); }
    @Override public BehaviorProfile getBehavior() { return BehaviorProfile.PASSIVE; }
    @Override public int getAlliance() { return PLAYER_ALLIANCE; }
    @Override public boolean spendStamina(int cost) { return character.spendStamina(cost); }

    @Override
    public void refundStamina(int amount) {
        character.setStamina(character.getStamina() + amount);
    }

    @Override
    public boolean knowsManeuver(String maneuverId) {
        return character.knowsManeuver(maneuverId);
    }

    @Override
    public String toString() {
        return "Player[" + getName() + "]";
    }
}
