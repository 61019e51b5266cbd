package com.nana.educms.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * DatabaseManager — Infrastructure / Utility Layer
 *
 * <p>The one place that knows how to reach the SQLite store and what its
 * schema looks like.
 *
 * <p>RESPONSIBILITIES:
 * <ul>
 *   <li>Create the directory of a file-based database if absent.</li>
 *   <li>Open configured connections: one per unit of work.</li>
 *   <li>Execute all DDL (CREATE TABLE / CREATE INDEX) on startup.</li>
 *   <li>Track the schema version and run forward-only migrations.</li>
 * </ul>
 *
 * <p>CONNECTION MODEL:
 * Every {@link com.nana.educms.repository.UnitOfWork} owns its own
 * connection, obtained from {@link #openConnection()} and closed when the
 * unit is closed. SQLite in WAL mode lets readers proceed while one writer
 * commits; the busy timeout makes a second writer wait instead of failing
 * immediately.
 */
public final class DatabaseManager {

    private static final Logger log = LoggerFactory.getLogger(DatabaseManager.class);

    // -----------------------------------------------------------------------
    // CONSTANTS
    // -----------------------------------------------------------------------

    private static final String URL_PREFIX = "jdbc:sqlite:";

    /**
     * Current schema version. Increment whenever DDL changes so the
     * migration block can run upgrade steps automatically.
     */
    static final int CURRENT_SCHEMA_VERSION = 2;

    private static final String PRAGMA_WAL = "PRAGMA journal_mode=WAL;";

    /** SQLite disables FK constraints by default; they must be enabled per connection. */
    private static final String PRAGMA_FK = "PRAGMA foreign_keys=ON;";

    private final String url;
    private final int busyTimeoutMs;

    // -----------------------------------------------------------------------
    // CONSTRUCTOR
    // -----------------------------------------------------------------------

    /**
     * @param url           JDBC URL, e.g. {@code jdbc:sqlite:/var/lib/educms/educms.db}
     * @param busyTimeoutMs how long a connection waits on a locked database
     */
    public DatabaseManager(String url, int busyTimeoutMs) {
        if (url == null || !url.startsWith(URL_PREFIX)) {
            throw new IllegalArgumentException("Expected a jdbc:sqlite: URL but got: " + url);
        }
        this.url = url;
        this.busyTimeoutMs = busyTimeoutMs;
    }

    /** Builds a manager from {@code db.url} and {@code db.busy.timeout.ms}. */
    public static DatabaseManager fromConfig(AppConfig config) {
        return new DatabaseManager(
                config.getString(AppConfig.KEY_DB_URL),
                config.getInt(AppConfig.KEY_DB_BUSY_TIMEOUT_MS, AppConfig.DEFAULT_BUSY_TIMEOUT_MS));
    }

    public String getUrl() {
        return url;
    }

    // -----------------------------------------------------------------------
    // PUBLIC API
    // -----------------------------------------------------------------------

    /**
     * Prepares the store: creates the directory, runs DDL and migrations.
     * Safe to call on every startup.
     *
     * @throws DatabaseInitException if anything in the startup sequence fails
     */
    public void initialize() {
        log.info("Initializing database at {}", url);
        try {
            initializeDirectory();
            try (Connection connection = openConnection()) {
                DatabaseMetaData meta = connection.getMetaData();
                log.info("Connected to SQLite {} via driver {}",
                        meta.getDatabaseProductVersion(), meta.getDriverVersion());
                initializeSchema(connection);
                runMigrations(connection);
            }
        } catch (SQLException | IOException ex) {
            throw new DatabaseInitException("Failed to initialize the database at: " + url, ex);
        }
    }

    /**
     * Opens a new connection with all PRAGMAs applied. The caller owns it
     * and must close it.
     *
     * @throws SQLException if the driver cannot open the database
     */
    public Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(url);
        try {
            configurePragmas(connection);
        } catch (SQLException ex) {
            connection.close();
            throw ex;
        }
        return connection;
    }

    // -----------------------------------------------------------------------
    // PRIVATE INITIALIZATION METHODS
    // -----------------------------------------------------------------------

    private void initializeDirectory() throws IOException {
        Path file = databaseFile();
        if (file == null || file.getParent() == null) {
            return;
        }
        Path dir = file.toAbsolutePath().getParent();
        if (!Files.exists(dir)) {
            Files.createDirectories(dir);
            log.info("Created database directory: {}", dir);
        }
    }

    /** @return the database file, or null for in-memory databases */
    private Path databaseFile() {
        String location = url.substring(URL_PREFIX.length());
        int query = location.indexOf('?');
        if (query >= 0) {
            location = location.substring(0, query);
        }
        if (location.isBlank() || location.startsWith(":memory:") || location.startsWith("file:")) {
            return null;
        }
        return Paths.get(location);
    }

    /**
     * PRAGMAs other than journal_mode are not persisted in the database file,
     * so they must be set on every new connection.
     */
    private void configurePragmas(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute(PRAGMA_WAL);
            st.execute(PRAGMA_FK);
            st.execute("PRAGMA busy_timeout=" + busyTimeoutMs + ";");
        }
    }

    /**
     * Creates all tables and indexes if they do not already exist.
     *
     * <p>TABLE DESIGN:
     * <ul>
     *   <li>Every entity table starts with the same five lifecycle columns
     *       ({@code id}, {@code created_at}, {@code updated_at},
     *       {@code is_deleted}, {@code deleted_at}) and a CHECK that keeps
     *       {@code deleted_at} set exactly when {@code is_deleted = 1}.</li>
     *   <li>Student {@code student_id} and {@code email} are unique among
     *       non-deleted rows only (partial indexes), so a soft-deleted
     *       student's identifiers can be reused.</li>
     *   <li>{@code announcement_attachments} cascades on hard delete of its
     *       announcement.</li>
     * </ul>
     */
    private void initializeSchema(Connection connection) throws SQLException {
        log.info("Running schema initialization (CREATE TABLE IF NOT EXISTS)...");

        try (Statement st = connection.createStatement()) {

            // ----------------------------------------------------------
            // TABLE: students
            // ----------------------------------------------------------
            st.execute("""
                CREATE TABLE IF NOT EXISTS students (
                    id                TEXT    PRIMARY KEY,
                    created_at        TEXT    NOT NULL,
                    updated_at        TEXT    NOT NULL,
                    is_deleted        INTEGER NOT NULL DEFAULT 0,
                    deleted_at        TEXT,
                    student_id        TEXT    NOT NULL CHECK(length(student_id) BETWEEN 1 AND 20),
                    name              TEXT    NOT NULL CHECK(length(name) <= 200),
                    email             TEXT    NOT NULL CHECK(length(email) <= 256),
                    grade             TEXT    NOT NULL CHECK(length(grade) <= 10),
                    section           TEXT    NOT NULL CHECK(length(section) <= 10),
                    enrollment_date   TEXT    NOT NULL,
                    status            TEXT    NOT NULL DEFAULT 'ACTIVE'
                                              CHECK(status IN ('ACTIVE','INACTIVE','SUSPENDED',
                                                               'GRADUATED','TRANSFERRED','WITHDRAWN')),
                    avatar_url        TEXT,
                    phone_number      TEXT,
                    address           TEXT,
                    date_of_birth     TEXT,
                    emergency_contact TEXT,
                    notes             TEXT,
                    CHECK((is_deleted = 1) = (deleted_at IS NOT NULL))
                );
                """);

            st.execute("""
                CREATE UNIQUE INDEX IF NOT EXISTS ux_students_student_id
                    ON students(student_id) WHERE is_deleted = 0;
                """);
            st.execute("""
                CREATE UNIQUE INDEX IF NOT EXISTS ux_students_email
                    ON students(email) WHERE is_deleted = 0;
                """);

            // ----------------------------------------------------------
            // TABLE: announcements
            // ----------------------------------------------------------
            st.execute("""
                CREATE TABLE IF NOT EXISTS announcements (
                    id              TEXT    PRIMARY KEY,
                    created_at      TEXT    NOT NULL,
                    updated_at      TEXT    NOT NULL,
                    is_deleted      INTEGER NOT NULL DEFAULT 0,
                    deleted_at      TEXT,
                    title           TEXT    NOT NULL,
                    content         TEXT    NOT NULL,
                    category        TEXT    NOT NULL DEFAULT 'GENERAL',
                    priority        TEXT    NOT NULL DEFAULT 'NORMAL',
                    author_id       TEXT    NOT NULL,
                    author_name     TEXT    NOT NULL,
                    is_published    INTEGER NOT NULL DEFAULT 1,
                    publish_date    TEXT,
                    expiry_date     TEXT,
                    target_audience TEXT,
                    is_pinned       INTEGER NOT NULL DEFAULT 0,
                    view_count      INTEGER NOT NULL DEFAULT 0,
                    CHECK((is_deleted = 1) = (deleted_at IS NOT NULL))
                );
                """);

            // ----------------------------------------------------------
            // TABLE: announcement_attachments
            // ----------------------------------------------------------
            st.execute("""
                CREATE TABLE IF NOT EXISTS announcement_attachments (
                    id              TEXT    PRIMARY KEY,
                    created_at      TEXT    NOT NULL,
                    updated_at      TEXT    NOT NULL,
                    is_deleted      INTEGER NOT NULL DEFAULT 0,
                    deleted_at      TEXT,
                    announcement_id TEXT    NOT NULL
                                            REFERENCES announcements(id) ON DELETE CASCADE,
                    file_name       TEXT    NOT NULL,
                    file_url        TEXT    NOT NULL,
                    content_type    TEXT    NOT NULL,
                    file_size       INTEGER NOT NULL DEFAULT 0,
                    description     TEXT,
                    CHECK((is_deleted = 1) = (deleted_at IS NOT NULL))
                );
                """);

            // ----------------------------------------------------------
            // TABLE: documents
            // ----------------------------------------------------------
            st.execute("""
                CREATE TABLE IF NOT EXISTS documents (
                    id               TEXT    PRIMARY KEY,
                    created_at       TEXT    NOT NULL,
                    updated_at       TEXT    NOT NULL,
                    is_deleted       INTEGER NOT NULL DEFAULT 0,
                    deleted_at       TEXT,
                    name             TEXT    NOT NULL,
                    description      TEXT,
                    file_name        TEXT    NOT NULL,
                    file_url         TEXT    NOT NULL,
                    content_type     TEXT    NOT NULL,
                    file_size        INTEGER NOT NULL DEFAULT 0,
                    category         TEXT    NOT NULL DEFAULT 'GENERAL',
                    access_level     TEXT    NOT NULL DEFAULT 'PUBLIC',
                    uploaded_by_id   TEXT    NOT NULL,
                    uploaded_by_name TEXT    NOT NULL,
                    download_count   INTEGER NOT NULL DEFAULT 0,
                    tags             TEXT,
                    version          TEXT    NOT NULL DEFAULT '1.0',
                    is_archived      INTEGER NOT NULL DEFAULT 0,
                    archived_at      TEXT,
                    file_hash        TEXT,
                    CHECK((is_deleted = 1) = (deleted_at IS NOT NULL))
                );
                """);

            // ----------------------------------------------------------
            // TABLE: schema_version
            // ----------------------------------------------------------
            st.execute("""
                CREATE TABLE IF NOT EXISTS schema_version (
                    version     INTEGER NOT NULL
                );
                """);

            log.info("Schema initialization complete.");
        }
    }

    /**
     * Checks the stored schema version and runs any pending migration steps,
     * from {@code storedVersion + 1} up to {@link #CURRENT_SCHEMA_VERSION}.
     * A fresh database runs every step, so each one must be idempotent.
     */
    private void runMigrations(Connection connection) throws SQLException {
        int storedVersion = getStoredSchemaVersion(connection);

        if (storedVersion == CURRENT_SCHEMA_VERSION) {
            log.debug("Schema is up to date at version {}.", CURRENT_SCHEMA_VERSION);
            return;
        }

        int from = storedVersion == -1 ? 1 : storedVersion + 1;
        log.info("Migrating schema from version {} to {}.", Math.max(storedVersion, 0), CURRENT_SCHEMA_VERSION);
        for (int v = from; v <= CURRENT_SCHEMA_VERSION; v++) {
            applyMigration(connection, v);
        }
        if (storedVersion == -1) {
            insertSchemaVersion(connection, CURRENT_SCHEMA_VERSION);
        } else {
            updateSchemaVersion(connection, CURRENT_SCHEMA_VERSION);
        }
        log.info("Schema migration complete. Now at version {}.", CURRENT_SCHEMA_VERSION);
    }

    /** @return the stored version, or -1 if the table is empty */
    int getStoredSchemaVersion(Connection connection) throws SQLException {
        String sql = "SELECT version FROM schema_version LIMIT 1;";
        try (PreparedStatement ps = connection.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                return rs.getInt("version");
            }
            return -1;
        }
    }

    private void insertSchemaVersion(Connection connection, int version) throws SQLException {
        String sql = "INSERT INTO schema_version (version) VALUES (?);";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setInt(1, version);
            ps.executeUpdate();
        }
    }

    private void updateSchemaVersion(Connection connection, int version) throws SQLException {
        String sql = "UPDATE schema_version SET version = ?;";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setInt(1, version);
            ps.executeUpdate();
        }
    }

    /**
     * Individual migration steps. Each case must be additive only.
     */
    private void applyMigration(Connection connection, int targetVersion) throws SQLException {
        log.info("Applying migration to schema version {}...", targetVersion);
        try (Statement st = connection.createStatement()) {
            switch (targetVersion) {
                case 1 -> log.debug("Version 1 is the base schema; nothing to apply.");
                case 2 -> {
                    st.execute("CREATE INDEX IF NOT EXISTS ix_students_grade ON students(grade);");
                    st.execute("CREATE INDEX IF NOT EXISTS ix_students_status ON students(status);");
                    st.execute("CREATE INDEX IF NOT EXISTS ix_students_enrollment_date "
                               + "ON students(enrollment_date);");
                    st.execute("CREATE INDEX IF NOT EXISTS ix_attachments_announcement "
                               + "ON announcement_attachments(announcement_id);");
                }
                default -> log.warn("No migration defined for version {}. Skipping.", targetVersion);
            }
        }
    }

    // -----------------------------------------------------------------------
    // INNER EXCEPTION CLASS
    // -----------------------------------------------------------------------

    /**
     * Unchecked exception thrown when the store cannot be prepared at startup.
     * The backend cannot run without it, so there is nothing for a caller to
     * recover.
     */
    public static final class DatabaseInitException extends RuntimeException {

        public DatabaseInitException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
