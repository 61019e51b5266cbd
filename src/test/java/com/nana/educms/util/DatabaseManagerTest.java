package com.nana.educms.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseManagerTest {

    @TempDir
    Path tempDir;

    private DatabaseManager managerAt(Path file) {
        return new DatabaseManager("jdbc:sqlite:" + file.toAbsolutePath(), 5000);
    }

    @Test
    @DisplayName("Only jdbc:sqlite: URLs are accepted")
    void constructor_nonSqliteUrl_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new DatabaseManager("jdbc:postgresql://localhost/educms", 5000));
        assertThrows(IllegalArgumentException.class, () -> new DatabaseManager(null, 5000));
    }

    @Test
    @DisplayName("initialize creates missing parent directories")
    void initialize_createsDirectory() {
        Path file = tempDir.resolve("nested").resolve("data").resolve("educms.db");

        managerAt(file).initialize();

        assertTrue(Files.isDirectory(file.getParent()));
        assertTrue(Files.exists(file));
    }

    @Test
    @DisplayName("initialize records the current schema version and is idempotent")
    void initialize_idempotent() throws SQLException {
        DatabaseManager manager = managerAt(tempDir.resolve("educms.db"));
        manager.initialize();
        manager.initialize();

        try (Connection c = manager.openConnection()) {
            assertEquals(DatabaseManager.CURRENT_SCHEMA_VERSION, manager.getStoredSchemaVersion(c));
            try (Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM schema_version")) {
                assertTrue(rs.next());
                assertEquals(1, rs.getInt(1));
            }
        }
    }

    @Test
    @DisplayName("All entity tables exist after initialize")
    void initialize_createsTables() throws SQLException {
        DatabaseManager manager = managerAt(tempDir.resolve("educms.db"));
        manager.initialize();

        List<String> tables = new ArrayList<>();
        try (Connection c = manager.openConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery(
                     "SELECT name FROM sqlite_master WHERE type = 'table' ORDER BY name")) {
            while (rs.next()) {
                tables.add(rs.getString(1));
            }
        }
        assertTrue(tables.containsAll(List.of(
                "announcement_attachments", "announcements", "documents", "schema_version", "students")));
    }

    @Test
    @DisplayName("Connections have foreign keys enabled")
    void openConnection_foreignKeysOn() throws SQLException {
        DatabaseManager manager = managerAt(tempDir.resolve("educms.db"));
        manager.initialize();

        try (Connection c = manager.openConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA foreign_keys")) {
            assertTrue(rs.next());
            assertEquals(1, rs.getInt(1));
        }
    }

    @Test
    @DisplayName("fromConfig reads the URL from configuration")
    void fromConfig_usesConfiguredUrl() {
        String url = "jdbc:sqlite:" + tempDir.resolve("configured.db").toAbsolutePath();
        Properties overrides = new Properties();
        overrides.setProperty(AppConfig.KEY_DB_URL, url);

        assertEquals(url, DatabaseManager.fromConfig(new AppConfig(overrides)).getUrl());
    }
}
