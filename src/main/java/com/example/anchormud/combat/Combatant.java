package com.example.anchormud.combat;

import com.example.anchormud.model.ArmorPiece;
import com.example.anchormud.model.AttackProfile;
import com.example.anchormud.model.BehaviorProfile;
import com.example.anchormud.model.CreatureInstance;
import com.example.anchormud.model.EntityInstance;
import com.example.anchormud.model.NpcInstance;
import com.example.anchormud.model.PlayerCharacter;
import com.example.anchormud.world.EntityRegistry;

import java.util.List;

/**
 * Capability view of anything that can fight: a player character, a creature
 * instance or an NPC instance. Combat code works only through this interface.
 */
public interface Combatant {

    /** Alliance shared by all player characters. */
    int PLAYER_ALLIANCE = 0;
    /** Alliance of creatures and NPCs. */
    int WORLD_ALLIANCE = 1;

    String getRef();
    String getName();
    boolean isPlayer();

    int getHp();
    int getMaxHp();

    /**
     * Apply damage, clamped at zero.
     * @return damage actually taken
     */
    int applyDamage(int amount);

    default boolean isAlive() {
        return getHp() > 0;
    }

    int getAccuracy();
    int getAvoidance();
    int getInitiativeBonus();
    AttackProfile getAttack();
    List<ArmorPiece> getArmor();
    BehaviorProfile getBehavior();
    int getAlliance();

    default boolean isHostileTo(Combatant other) {
        return other != null && getAlliance() != other.getAlliance();
    }

    /**
     * Pay a stamina cost.
     * @return false, with nothing spent, if the cost cannot be paid
     */
    boolean spendStamina(int cost);

    void refundStamina(int amount);

    boolean knowsManeuver(String maneuverId);

    /**
     * Wrap the live entity behind a ref.
     * @return the combatant, or null if the ref names nothing that can fight
     */
    static Combatant lookup(EntityRegistry registry, String ref) {
        if (ref == null) return null;
        if (PlayerCharacter.isPlayerRef(ref)) {
            PlayerCharacter pc = registry.getPlayer(ref);
            return pc == null ? null : new PlayerCombatant(pc);
        }
        EntityInstance inst = registry.getInstance(ref);
        if (inst instanceof NpcInstance npc) return new NpcCombatant(npc);
        if (inst instanceof CreatureInstance creature) return new CreatureCombatant(creature);
        return null;
    }
}
