package com.example.anchormud;

import com.example.anchormud.model.ArmorPiece;
import com.example.anchormud.model.AttackProfile;
import com.example.anchormud.model.DamageType;
import com.example.anchormud.model.PlayerCharacter;
import com.example.anchormud.persistence.H2CharacterSheetDAO;
import com.example.anchormud.persistence.PersistenceException;
import com.example.anchormud.persistence.SettingsDAO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the H2-backed character sheet and settings stores.
 */
public class PersistenceTest {

    private String url;

    @BeforeEach
    void setUp() {
        url = "jdbc:h2:mem:anchormud_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1";
    }

    // ========== Character sheets ==========

    @Test
    void testSheet_MissingCharacterIsEmpty() throws PersistenceException {
        H2CharacterSheetDAO dao = new H2CharacterSheetDAO(url, "sa", "");
        assertEquals(Optional.empty(), dao.load("Nobody"));
    }

    @Test
    void testSheet_SaveAndLoad() throws PersistenceException {
        H2CharacterSheetDAO dao = new H2CharacterSheetDAO(url, "sa", "");
        PlayerCharacter pc = new PlayerCharacter("Mara", 30, 20, 60, 40, 2);
        pc.setHp(17);
        pc.setStamina(5);
        pc.setSavedRoomId("net_sheds");
        pc.setWeapon(new AttackProfile("rusty cutlass", 2, 5, 0.9, DamageType.SLASHING, 0.05, false));
        pc.learnManeuver("feint");
        pc.learnManeuver("riposte");
        pc.addToInventory("copper_bit", 4);
        ArmorPiece jerkin = new ArmorPiece("jerkin", DamageType.SLASHING, EnumSet.of(DamageType.PIERCING), 2, 20);
        jerkin.absorb(6);
        pc.equipArmor(jerkin);
        dao.save(pc);

        PlayerCharacter loaded = dao.load("Mara").orElseThrow();
        assertEquals(17, loaded.getHp());
        assertEquals(30, loaded.getMaxHp());
        assertEquals(5, loaded.getStamina());
        assertEquals(60, loaded.getAccuracy());
        assertEquals(2, loaded.getInitiativeBonus());
        assertEquals("net_sheds", loaded.getSavedRoomId());
        assertEquals(pc.getWeapon(), loaded.getWeapon());
        assertTrue(loaded.knowsManeuver("feint"));
        assertTrue(loaded.knowsManeuver("riposte"));
        assertEquals(4, loaded.getInventory().get("copper_bit"));
        assertEquals(1, loaded.getArmor().size());
        ArmorPiece piece = loaded.getArmor().get(0);
        assertEquals(14, piece.getDurability());
        assertEquals(20, piece.getMaxDurability());
        assertEquals(EnumSet.of(DamageType.PIERCING), piece.getSecondaryTypes());
    }

    @Test
    void testSheet_SaveOverwrites() throws PersistenceException {
        H2CharacterSheetDAO dao = new H2CharacterSheetDAO(url, "sa", "");
        PlayerCharacter pc = new PlayerCharacter("Mara", 30, 20, 60, 40, 0);
        dao.save(pc);
        pc.setHp(3);
        dao.save(pc);
        assertEquals(3, dao.load("Mara").orElseThrow().getHp());
    }

    // ========== Settings ==========

    @Test
    void testSettings_PutAndGet() throws PersistenceException {
        SettingsDAO settings = new SettingsDAO(url, "sa", "");
        assertNull(settings.get("world.seconds"));
        settings.put("world.seconds", "12345");
        settings.put("world.seconds", "12400");
        assertEquals("12400", settings.get("world.seconds"));
    }
}
