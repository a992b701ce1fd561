package org.harvest.traits.storage.impl;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.jboss.logging.Logger;

/**
 * Applies the SQL migrations under {@code /db/migrations/} in version order and
 * records each applied version in {@code schema_version}.
 *
 * <p>Files are named {@code V{version}__{description}.sql}.</p>
 */
public final class SQLiteSchemaMigrator {

    private static final Logger LOG = Logger.getLogger(SQLiteSchemaMigrator.class);

    private static final String MIGRATION_PATH = "/db/migrations/";

    private final List<Migration> migrations;

    public SQLiteSchemaMigrator() {
        this(List.of(
            new Migration(1, "Trait extraction schema", MIGRATION_PATH + "V001__trait_extraction_schema.sql")));
    }

    SQLiteSchemaMigrator(List<Migration> migrations) {
        this.migrations = migrations;
    }

    /**
     * Gets current schema version from database.
     *
     * @param conn database connection
     * @return current version number, 0 if not initialized
     * @throws SQLException if the version table cannot be read
     */
    public int getCurrentVersion(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                 "SELECT name FROM sqlite_master WHERE type='table' AND name='schema_version'")) {
            if (!rs.next()) {
                return 0;
            }
        }
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COALESCE(MAX(version), 0) FROM schema_version")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    /**
     * Applies all pending migrations in a single transaction.
     *
     * @param conn database connection
     * @throws SQLException if a migration fails; nothing is applied in that case
     */
    public void migrateToLatest(Connection conn) throws SQLException {
        final int currentVersion = getCurrentVersion(conn);
        LOG.infof("Current schema version: %d", currentVersion);

        final boolean autoCommit = conn.getAutoCommit();
        try {
            conn.setAutoCommit(false);
            ensureVersionTable(conn);

            for (Migration migration : migrations) {
                if (migration.version() > currentVersion) {
                    LOG.infof("Applying migration V%03d: %s", migration.version(), migration.description());
                    for (String statement : splitStatements(migration.load())) {
                        try (Statement stmt = conn.createStatement()) {
                            stmt.execute(statement);
                        }
                    }
                    recordVersion(conn, migration);
                }
            }

            conn.commit();
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    private static void ensureVersionTable(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS schema_version (
                    version INTEGER PRIMARY KEY,
                    description TEXT NOT NULL,
                    applied_at TEXT NOT NULL
                )
                """);
        }
    }

    private static void recordVersion(Connection conn, Migration migration) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO schema_version (version, description, applied_at) VALUES (?, ?, ?)")) {
            stmt.setInt(1, migration.version());
            stmt.setString(2, migration.description());
            stmt.setString(3, Instant.now().toString());
            stmt.executeUpdate();
        }
    }

    /**
     * Splits a script on semicolons outside quoted strings, dropping {@code --} comments.
     */
    static List<String> splitStatements(String sql) {
        final List<String> statements = new ArrayList<>();
        final StringBuilder current = new StringBuilder();
        char quote = 0;

        for (int i = 0; i < sql.length(); i++) {
            final char c = sql.charAt(i);
            if (quote != 0) {
                current.append(c);
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                current.append(c);
            } else if (c == '-' && i + 1 < sql.length() && sql.charAt(i + 1) == '-') {
                while (i < sql.length() && sql.charAt(i) != '\n') {
                    i++;
                }
                current.append('\n');
            } else if (c == ';') {
                addIfPresent(statements, current);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        addIfPresent(statements, current);
        return statements;
    }

    private static void addIfPresent(List<String> statements, StringBuilder current) {
        final String statement = current.toString().trim();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
    }

    record Migration(int version, String description, String resourcePath) {

        String load() {
            try (InputStream is = SQLiteSchemaMigrator.class.getResourceAsStream(resourcePath)) {
                if (is == null) {
                    throw new IllegalStateException("Migration resource not found: " + resourcePath);
                }
                return new String(is.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load migration: " + resourcePath, e);
            }
        }
    }
}
