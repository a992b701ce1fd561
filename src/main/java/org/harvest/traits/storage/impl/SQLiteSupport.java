package org.harvest.traits.storage.impl;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;

/**
 * Statement helpers shared by the SQLite repositories.
 */
final class SQLiteSupport {

    private SQLiteSupport() {
    }

    static <T> T read(SQLiteConnectionManager manager, String action, SQLiteConnectionManager.SqlWork<T> work) {
        try {
            return manager.withReader(work);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to " + action, e);
        }
    }

    /**
     * Runs the work in a write transaction. Domain exceptions propagate unchanged.
     */
    static <T> T write(SQLiteConnectionManager manager, String action, SQLiteConnectionManager.SqlWork<T> work) {
        try {
            return manager.inTransaction(work);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to " + action, e);
        }
    }

    static long generatedId(PreparedStatement stmt) throws SQLException {
        try (ResultSet keys = stmt.getGeneratedKeys()) {
            if (!keys.next()) {
                throw new SQLException("No generated key returned");
            }
            return keys.getLong(1);
        }
    }

    static void setNullableLong(PreparedStatement stmt, int index, Long value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.INTEGER);
        } else {
            stmt.setLong(index, value);
        }
    }

    static void setNullableInstant(PreparedStatement stmt, int index, Instant value) throws SQLException {
        stmt.setString(index, value == null ? null : value.toString());
    }

    static Long getNullableLong(ResultSet rs, String column) throws SQLException {
        final long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        final int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    static Instant getInstant(ResultSet rs, String column) throws SQLException {
        final String value = rs.getString(column);
        return value == null ? null : Instant.parse(value);
    }
}
