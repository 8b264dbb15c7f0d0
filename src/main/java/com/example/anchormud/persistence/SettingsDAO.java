package com.example.anchormud.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * H2-backed settings table.
 */
public class SettingsDAO implements SettingsStore {
    private static final Logger logger = LoggerFactory.getLogger(SettingsDAO.class);

    private final String url;
    private final String user;
    private final String pass;

    public SettingsDAO(String url, String user, String pass) throws PersistenceException {
        this.url = url;
        this.user = user;
        this.pass = pass;
        MigrationManager.ensureMigration(url, "settings", this::ensureTable);
    }

    private void ensureTable() throws PersistenceException {
        try (Connection c = DriverManager.getConnection(url, user, pass);
             Statement s = c.createStatement()) {
            s.execute("CREATE TABLE IF NOT EXISTS settings (k VARCHAR(200) PRIMARY KEY, v VARCHAR(2000))");
            logger.debug("[SettingsDAO] settings table ready");
        } catch (SQLException e) {
            throw new PersistenceException("Failed to create settings table", e);
        }
    }

    @Override
    public String get(String key) throws PersistenceException {
        String sql = "SELECT v FROM settings WHERE k = ?";
        try (Connection c = DriverManager.getConnection(url, user, pass);
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return rs.getString("v");
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to read setting " + key, e);
        }
        return null;
    }

    @Override
    public void put(String key, String value) throws PersistenceException {
        String sql = "MERGE INTO settings (k, v) KEY(k) VALUES (?, ?)";
        try (Connection c = DriverManager.getConnection(url, user, pass);
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to write setting " + key, e);
        }
    }
}
