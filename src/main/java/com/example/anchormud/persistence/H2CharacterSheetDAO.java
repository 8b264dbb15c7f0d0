package com.example.anchormud.persistence;

import com.example.anchormud.model.ArmorPiece;
import com.example.anchormud.model.AttackProfile;
import com.example.anchormud.model.DamageType;
import com.example.anchormud.model.PlayerCharacter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * H2 implementation of the character sheet store.
 *
 * Sheets live in {@code character_sheet}; equipped armor in {@code character_armor},
 * rewritten on every save.
 */
public class H2CharacterSheetDAO implements CharacterSheetStore {
    private static final Logger logger = LoggerFactory.getLogger(H2CharacterSheetDAO.class);

    private final String url;
    private final String user;
    private final String pass;

    public H2CharacterSheetDAO(String url, String user, String pass) throws PersistenceException {
        this.url = url;
        this.user = user;
        this.pass = pass;
        MigrationManager.ensureMigration(url, "character_sheet", this::ensureTables);
    }

    private void ensureTables() throws PersistenceException {
        try (Connection c = DriverManager.getConnection(url, user, pass);
             Statement s = c.createStatement()) {
            s.execute("CREATE TABLE IF NOT EXISTS character_sheet (" +
                    "name VARCHAR(100) PRIMARY KEY, " +
                    "hp_cur INT NOT NULL, " +
                    "hp_max INT NOT NULL, " +
                    "stamina_cur INT NOT NULL, " +
                    "stamina_max INT NOT NULL, " +
                    "accuracy INT NOT NULL, " +
                    "avoidance INT NOT NULL, " +
                    "initiative_bonus INT DEFAULT 0, " +
                    "current_room VARCHAR(100), " +
                    "weapon VARCHAR(500), " +
                    "maneuvers VARCHAR(1000) DEFAULT '', " +
                    "inventory VARCHAR(2000) DEFAULT '' " +
                    ")");
            s.execute("CREATE TABLE IF NOT EXISTS character_armor (" +
                    "name VARCHAR(100) NOT NULL, " +
                    "idx INT NOT NULL, " +
                    "piece_name VARCHAR(100) NOT NULL, " +
                    "primary_type VARCHAR(30) NOT NULL, " +
                    "secondary_types VARCHAR(200) DEFAULT '', " +
                    "reduction INT NOT NULL, " +
                    "durability INT NOT NULL, " +
                    "max_durability INT NOT NULL, " +
                    "PRIMARY KEY (name, idx))");
            logger.debug("[H2CharacterSheetDAO] tables ready");
        } catch (SQLException e) {
            throw new PersistenceException("Failed to create character tables", e);
        }
    }

    @Override
    public Optional<PlayerCharacter> load(String name) throws PersistenceException {
        String sql = "SELECT name, hp_cur, hp_max, stamina_cur, stamina_max, accuracy, avoidance, " +
                "initiative_bonus, current_room, weapon, maneuvers, inventory FROM character_sheet WHERE name = ?";
        try (Connection c = DriverManager.getConnection(url, user, pass);
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, name);
            PlayerCharacter pc;
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                pc = new PlayerCharacter(rs.getString("name"), rs.getInt("hp_max"), rs.getInt("stamina_max"),
                        rs.getInt("accuracy"), rs.getInt("avoidance"), rs.getInt("initiative_bonus"));
                pc.setHp(rs.getInt("hp_cur"));
                pc.setStamina(rs.getInt("stamina_cur"));
                pc.setSavedRoomId(rs.getString("current_room"));
                pc.setWeapon(decodeWeapon(rs.getString("weapon")));
                String maneuvers = rs.getString("maneuvers");
                if (maneuvers != null && !maneuvers.isBlank()) {
                    for (String m : maneuvers.split(",")) {
                        if (!m.isBlank()) pc.learnManeuver(m.trim());
                    }
                }
                String inventory = rs.getString("inventory");
                if (inventory != null && !inventory.isBlank()) {
                    for (String entry : inventory.split(",")) {
                        String[] kv = entry.split("=");
                        if (kv.length == 2) {
                            pc.addToInventory(kv[0].trim(), Integer.parseInt(kv[1].trim()));
                        }
                    }
                }
            }
            loadArmor(c, pc);
            return Optional.of(pc);
        } catch (SQLException | RuntimeException e) {
            throw new PersistenceException("Failed to load character " + name, e);
        }
    }

    private void loadArmor(Connection c, PlayerCharacter pc) throws SQLException {
        String sql = "SELECT piece_name, primary_type, secondary_types, reduction, durability, max_durability " +
                "FROM character_armor WHERE name = ? ORDER BY idx";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, pc.getName());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Set<DamageType> secondary = EnumSet.noneOf(DamageType.class);
                    String sec = rs.getString("secondary_types");
                    if (sec != null && !sec.isBlank()) {
                        for (String t : sec.split(",")) secondary.add(DamageType.fromString(t));
                    }
                    pc.equipArmor(new ArmorPiece(rs.getString("piece_name"),
                            DamageType.fromString(rs.getString("primary_type")), secondary,
                            rs.getInt("reduction"), rs.getInt("max_durability"), rs.getInt("durability")));
                }
            }
        }
    }

    @Override
    public void save(PlayerCharacter pc) throws PersistenceException {
        String sql = "MERGE INTO character_sheet (name, hp_cur, hp_max, stamina_cur, stamina_max, accuracy, " +
                "avoidance, initiative_bonus, current_room, weapon, maneuvers, inventory) KEY(name) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection c = DriverManager.getConnection(url, user, pass)) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, pc.getName());
                ps.setInt(2, pc.getHp());
                ps.setInt(3, pc.getMaxHp());
                ps.setInt(4, pc.getStamina());
                ps.setInt(5, pc.getMaxStamina());
                ps.setInt(6, pc.getAccuracy());
                ps.setInt(7, pc.getAvoidance());
                ps.setInt(8, pc.getInitiativeBonus());
                ps.setString(9, pc.getSavedRoomId());
                ps.setString(10, encodeWeapon(pc.getWeapon()));
                ps.setString(11, String.join(",", pc.getManeuvers()));
                ps.setString(12, encodeInventory(pc.getInventory()));
                ps.executeUpdate();
            }
            try (PreparedStatement del = c.prepareStatement("DELETE FROM character_armor WHERE name = ?")) {
                del.setString(1, pc.getName());
                del.executeUpdate();
            }
            String armorSql = "INSERT INTO character_armor (name, idx, piece_name, primary_type, secondary_types, " +
                    "reduction, durability, max_durability) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
            try (PreparedStatement ps = c.prepareStatement(armorSql)) {
                int idx = 0;
                for (ArmorPiece piece : pc.getArmor()) {
                    ps.setString(1, pc.getName());
                    ps.setInt(2, idx++);
                    ps.setString(3, piece.getName());
                    ps.setString(4, piece.getPrimaryType().name());
                    StringBuilder sec = new StringBuilder();
                    for (DamageType t : piece.getSecondaryTypes()) {
                        if (sec.length() > 0) sec.append(',');
                        sec.append(t.name());
                    }
                    ps.setString(5, sec.toString());
                    ps.setInt(6, piece.getReduction());
                    ps.setInt(7, piece.getDurability());
                    ps.setInt(8, piece.getMaxDurability());
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            c.commit();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save character " + pc.getName(), e);
        }
    }

    static String encodeWeapon(AttackProfile w) {
        if (w == null) return null;
        return String.join("|", w.name(), String.valueOf(w.minDamage()), String.valueOf(w.maxDamage()),
                String.valueOf(w.speed()), w.damageType().name(), String.valueOf(w.critChance()),
                String.valueOf(w.ranged()));
    }

    static AttackProfile decodeWeapon(String s) {
        if (s == null || s.isBlank()) return null;
        String[] p = s.split("\\|");
        if (p.length != 7) {
            logger.warn("[H2CharacterSheetDAO] Ignoring malformed weapon '{}'", s);
            return null;
        }
        return new AttackProfile(p[0], Integer.parseInt(p[1]), Integer.parseInt(p[2]), Double.parseDouble(p[3]),
                DamageType.fromString(p[4]), Double.parseDouble(p[5]), Boolean.parseBoolean(p[6]));
    }

    private static String encodeInventory(Map<String, Integer> inventory) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Integer> e : inventory.entrySet()) {
            if (sb.length() > 0) sb.append(',');
            sb.append(e.getKey()).append('=').append(e.getValue());
        }
        return sb.toString();
    }
}
