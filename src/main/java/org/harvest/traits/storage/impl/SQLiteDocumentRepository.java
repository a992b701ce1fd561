package org.harvest.traits.storage.impl;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.harvest.exception.ResourceNotFoundException;
import org.harvest.traits.document.TraitDocument;
import org.harvest.traits.storage.DocumentRepositoryPort;
import org.harvest.traits.storage.Page;
import org.jboss.logging.Logger;

/**
 * SQLite-based implementation of DocumentRepositoryPort using the trait_documents table.
 */
public final class SQLiteDocumentRepository implements DocumentRepositoryPort {

    private static final Logger LOG = Logger.getLogger(SQLiteDocumentRepository.class);

    private static final String COLUMNS =
        "id, project_id, file_path, text_content, doi, doi_hash, status, created_at, updated_at";

    private final SQLiteConnectionManager connectionManager;

    public SQLiteDocumentRepository(SQLiteConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public TraitDocument save(TraitDocument document) {
        return SQLiteSupport.write(connectionManager, "save document", conn -> {
            final Instant now = Instant.now();
            final String sql = """
                INSERT INTO trait_documents (project_id, file_path, text_content, doi, doi_hash, status, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;
            try (PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                SQLiteSupport.setNullableLong(stmt, 1, document.getProjectId());
                stmt.setString(2, document.getFilePath());
                stmt.setString(3, document.getTextContent());
                stmt.setString(4, document.getDoi());
                stmt.setString(5, document.getDoiHash());
                stmt.setString(6, document.getStatus());
                stmt.setString(7, now.toString());
                stmt.setString(8, now.toString());
                stmt.executeUpdate();
                document.setId(SQLiteSupport.generatedId(stmt));
            }
            document.setCreatedAt(now);
            document.setUpdatedAt(now);
            LOG.debugf("Stored document %d (%s)", document.getId(), document.getFilePath());
            return document;
        });
    }

    @Override
    public Optional<TraitDocument> findById(long id) {
        return SQLiteSupport.read(connectionManager, "find document " + id, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT " + COLUMNS + " FROM trait_documents WHERE id = ?")) {
                stmt.setLong(1, id);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.<TraitDocument>empty();
                }
            }
        });
    }

    @Override
    public Page<TraitDocument> findAll(Long projectId, String status, int page, int perPage) {
        Page.validate(page, perPage);
        return SQLiteSupport.read(connectionManager, "list documents", conn -> {
            final String where = " WHERE (? IS NULL OR project_id = ?) AND (? IS NULL OR status = ?)";

            long total;
            try (PreparedStatement stmt = conn.prepareStatement("SELECT COUNT(*) FROM trait_documents" + where)) {
                bindFilters(stmt, projectId, status);
                try (ResultSet rs = stmt.executeQuery()) {
                    total = rs.next() ? rs.getLong(1) : 0;
                }
            }

            final List<TraitDocument> items = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT " + COLUMNS + " FROM trait_documents" + where + " ORDER BY id DESC LIMIT ? OFFSET ?")) {
                bindFilters(stmt, projectId, status);
                stmt.setInt(5, perPage);
                stmt.setInt(6, (page - 1) * perPage);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        items.add(fromResultSet(rs));
                    }
                }
            }
            return new Page<>(items, page, perPage, total);
        });
    }

    @Override
    public void updateStatus(long id, String status) {
        SQLiteSupport.write(connectionManager, "update document status", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "UPDATE trait_documents SET status = ?, updated_at = ? WHERE id = ?")) {
                stmt.setString(1, status);
                stmt.setString(2, Instant.now().toString());
                stmt.setLong(3, id);
                if (stmt.executeUpdate() == 0) {
                    throw new ResourceNotFoundException("Document not found: " + id);
                }
            }
            return null;
        });
    }

    private static void bindFilters(PreparedStatement stmt, Long projectId, String status) throws SQLException {
        SQLiteSupport.setNullableLong(stmt, 1, projectId);
        SQLiteSupport.setNullableLong(stmt, 2, projectId);
        stmt.setString(3, status);
        stmt.setString(4, status);
    }

    private static TraitDocument fromResultSet(ResultSet rs) throws SQLException {
        final TraitDocument document = new TraitDocument();
        document.setId(rs.getLong("id"));
        document.setProjectId(SQLiteSupport.getNullableLong(rs, "project_id"));
        document.setFilePath(rs.getString("file_path"));
        document.setTextContent(rs.getString("text_content"));
        document.setDoi(rs.getString("doi"));
        document.setDoiHash(rs.getString("doi_hash"));
        document.setStatus(rs.getString("status"));
        document.setCreatedAt(SQLiteSupport.getInstant(rs, "created_at"));
        document.setUpdatedAt(SQLiteSupport.getInstant(rs, "updated_at"));
        return document;
    }
}
