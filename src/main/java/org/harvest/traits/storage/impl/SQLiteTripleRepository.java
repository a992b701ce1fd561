package org.harvest.traits.storage.impl;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.harvest.exception.ResourceNotFoundException;
import org.harvest.traits.storage.Page;
import org.harvest.traits.storage.TripleRepositoryPort;
import org.harvest.traits.triple.ExtractedTriple;
import org.harvest.traits.triple.Sentence;
import org.harvest.traits.triple.TripleEdits;
import org.harvest.traits.triple.TripleQuery;
import org.harvest.traits.triple.TripleStatus;
import org.jboss.logging.Logger;

/**
 * SQLite-based implementation of TripleRepositoryPort.
 *
 * <p>A batch is written in one transaction together with the sentence rows it needs.</p>
 */
public final class SQLiteTripleRepository implements TripleRepositoryPort {

    private static final Logger LOG = Logger.getLogger(SQLiteTripleRepository.class);

    private static final String SELECT = """
        SELECT t.id, t.sentence_id, t.source_entity_name, t.source_entity_attr, t.relation_type,
               t.sink_entity_name, t.sink_entity_attr, t.confidence, t.model_profile, t.status,
               t.trait_name, t.trait_value, t.unit, t.project_id, t.document_id, t.job_id, t.doi_hash,
               t.contributor_email, t.created_at, t.updated_at, s.text AS sentence_text
        FROM triples t
        LEFT JOIN sentences s ON s.id = t.sentence_id
        """;

    private final SQLiteConnectionManager connectionManager;

    public SQLiteTripleRepository(SQLiteConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public int insertBatch(List<ExtractedTriple> triples) {
        if (triples.isEmpty()) {
            return 0;
        }
        return SQLiteSupport.write(connectionManager, "insert triples", conn -> {
            for (ExtractedTriple triple : triples) {
                validateReferences(conn, triple);
            }

            final Instant now = Instant.now();
            final String sql = """
                INSERT INTO triples (sentence_id, source_entity_name, source_entity_attr, relation_type,
                    sink_entity_name, sink_entity_attr, confidence, model_profile, status, trait_name,
                    trait_value, unit, project_id, document_id, job_id, doi_hash, contributor_email,
                    created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
            try (PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                for (ExtractedTriple triple : triples) {
                    if (triple.getSentenceId() == null && triple.getSentence() != null) {
                        triple.setSentenceId(insertSentence(conn, triple.getSentence(), triple.getDoiHash(), now));
                    }
                    if (triple.getStatus() == null) {
                        triple.setStatus(TripleStatus.RAW);
                    }
                    SQLiteSupport.setNullableLong(stmt, 1, triple.getSentenceId());
                    stmt.setString(2, triple.getSourceEntityName());
                    stmt.setString(3, triple.getSourceEntityAttr());
                    stmt.setString(4, triple.getRelationType());
                    stmt.setString(5, triple.getSinkEntityName());
                    stmt.setString(6, triple.getSinkEntityAttr());
                    stmt.setDouble(7, triple.getConfidence());
                    stmt.setString(8, triple.getModelProfile());
                    stmt.setString(9, triple.getStatus().value());
                    stmt.setString(10, triple.getTraitName());
                    stmt.setString(11, triple.getTraitValue());
                    stmt.setString(12, triple.getUnit());
                    SQLiteSupport.setNullableLong(stmt, 13, triple.getProjectId());
                    SQLiteSupport.setNullableLong(stmt, 14, triple.getDocumentId());
                    SQLiteSupport.setNullableLong(stmt, 15, triple.getJobId());
                    stmt.setString(16, triple.getDoiHash());
                    stmt.setString(17, triple.getContributorEmail());
                    stmt.setString(18, now.toString());
                    stmt.setString(19, now.toString());
                    stmt.executeUpdate();
                    triple.setId(SQLiteSupport.generatedId(stmt));
                    triple.setCreatedAt(now);
                    triple.setUpdatedAt(now);
                }
            }
            LOG.debugf("Inserted %d triples", triples.size());
            return triples.size();
        });
    }

    private static void validateReferences(Connection conn, ExtractedTriple triple) throws SQLException {
        if (triple.getConfidence() < 0.0 || triple.getConfidence() > 1.0) {
            throw new IllegalArgumentException("Triple confidence outside [0, 1]: " + triple.getConfidence());
        }
        if (triple.getJobId() == null) {
            return;
        }
        try (PreparedStatement stmt = conn.prepareStatement("SELECT 1 FROM extraction_jobs WHERE id = ?")) {
            stmt.setLong(1, triple.getJobId());
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new IllegalArgumentException("Triple references unknown job " + triple.getJobId());
                }
            }
        }
        if (triple.getDocumentId() == null) {
            return;
        }
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT 1 FROM extraction_job_documents WHERE job_id = ? AND document_id = ?")) {
            stmt.setLong(1, triple.getJobId());
            stmt.setLong(2, triple.getDocumentId());
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new IllegalArgumentException(String.format(
                        "Document %d is not part of job %d", triple.getDocumentId(), triple.getJobId()));
                }
            }
        }
    }

    private static long insertSentence(Connection conn, String text, String doiHash, Instant now) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO sentences (text, doi_hash, created_at) VALUES (?, ?, ?)",
                Statement.RETURN_GENERATED_KEYS)) {
            stmt.setString(1, text);
            stmt.setString(2, doiHash);
            stmt.setString(3, now.toString());
            stmt.executeUpdate();
            return SQLiteSupport.generatedId(stmt);
        }
    }

    @Override
    public Optional<ExtractedTriple> findById(long id) {
        return SQLiteSupport.read(connectionManager, "find triple " + id, conn -> load(conn, id));
    }

    @Override
    public Page<ExtractedTriple> findAll(TripleQuery query) {
        return SQLiteSupport.read(connectionManager, "list triples", conn -> {
            final String where = """
                 WHERE (? IS NULL OR t.job_id = ?)
                   AND (? IS NULL OR t.document_id = ?)
                   AND (? IS NULL OR t.project_id = ?)
                   AND (? IS NULL OR t.status = ?)
                   AND t.confidence >= ?
                """;

            long total;
            try (PreparedStatement stmt = conn.prepareStatement("SELECT COUNT(*) FROM triples t" + where)) {
                bindQuery(stmt, query);
                try (ResultSet rs = stmt.executeQuery()) {
                    total = rs.next() ? rs.getLong(1) : 0;
                }
            }

            final List<ExtractedTriple> items = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(
                    SELECT + where + " ORDER BY t.confidence DESC, t.id ASC LIMIT ? OFFSET ?")) {
                bindQuery(stmt, query);
                stmt.setInt(10, query.perPage());
                stmt.setInt(11, query.offset());
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        items.add(fromResultSet(rs));
                    }
                }
            }
            return new Page<>(items, query.page(), query.perPage(), total);
        });
    }

    @Override
    public Optional<Sentence> findSentence(long sentenceId) {
        return SQLiteSupport.read(connectionManager, "find sentence " + sentenceId, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT id, text, literature_link, doi_hash, created_at FROM sentences WHERE id = ?")) {
                stmt.setLong(1, sentenceId);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.<Sentence>empty();
                    }
                    return Optional.of(new Sentence(
                        rs.getLong("id"),
                        rs.getString("text"),
                        rs.getString("literature_link"),
                        rs.getString("doi_hash"),
                        SQLiteSupport.getInstant(rs, "created_at")));
                }
            }
        });
    }

    @Override
    public ExtractedTriple updateStatus(long id, TripleStatus status, TripleEdits edits) {
        return SQLiteSupport.write(connectionManager, "update triple " + id, conn -> {
            final ExtractedTriple triple = load(conn, id)
                .orElseThrow(() -> new ResourceNotFoundException("Triple not found: " + id));
            edits.applyTo(triple);
            triple.setStatus(status);
            triple.setUpdatedAt(Instant.now());

            final String sql = """
                UPDATE triples
                SET source_entity_name = ?, source_entity_attr = ?, relation_type = ?, sink_entity_name = ?,
                    sink_entity_attr = ?, trait_name = ?, trait_value = ?, unit = ?, status = ?, updated_at = ?
                WHERE id = ?
                """;
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, triple.getSourceEntityName());
                stmt.setString(2, triple.getSourceEntityAttr());
                stmt.setString(3, triple.getRelationType());
                stmt.setString(4, triple.getSinkEntityName());
                stmt.setString(5, triple.getSinkEntityAttr());
                stmt.setString(6, triple.getTraitName());
                stmt.setString(7, triple.getTraitValue());
                stmt.setString(8, triple.getUnit());
                stmt.setString(9, status.value());
                stmt.setString(10, triple.getUpdatedAt().toString());
                stmt.setLong(11, id);
                stmt.executeUpdate();
            }
            return triple;
        });
    }

    private static Optional<ExtractedTriple> load(Connection conn, long id) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT + " WHERE t.id = ?")) {
            stmt.setLong(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        }
    }

    private static void bindQuery(PreparedStatement stmt, TripleQuery query) throws SQLException {
        SQLiteSupport.setNullableLong(stmt, 1, query.jobId());
        SQLiteSupport.setNullableLong(stmt, 2, query.jobId());
        SQLiteSupport.setNullableLong(stmt, 3, query.documentId());
        SQLiteSupport.setNullableLong(stmt, 4, query.documentId());
        SQLiteSupport.setNullableLong(stmt, 5, query.projectId());
        SQLiteSupport.setNullableLong(stmt, 6, query.projectId());
        final String status = query.status() == null ? null : query.status().value();
        stmt.setString(7, status);
        stmt.setString(8, status);
        stmt.setDouble(9, query.minConfidence());
    }

    private static ExtractedTriple fromResultSet(ResultSet rs) throws SQLException {
        final ExtractedTriple triple = new ExtractedTriple();
        triple.setId(rs.getLong("id"));
        triple.setSentenceId(SQLiteSupport.getNullableLong(rs, "sentence_id"));
        triple.setSourceEntityName(rs.getString("source_entity_name"));
        triple.setSourceEntityAttr(rs.getString("source_entity_attr"));
        triple.setRelationType(rs.getString("relation_type"));
        triple.setSinkEntityName(rs.getString("sink_entity_name"));
        triple.setSinkEntityAttr(rs.getString("sink_entity_attr"));
        triple.setConfidence(rs.getDouble("confidence"));
        triple.setModelProfile(rs.getString("model_profile"));
        triple.setStatus(TripleStatus.fromValue(rs.getString("status")));
        triple.setTraitName(rs.getString("trait_name"));
        triple.setTraitValue(rs.getString("trait_value"));
        triple.setUnit(rs.getString("unit"));
        triple.setProjectId(SQLiteSupport.getNullableLong(rs, "project_id"));
        triple.setDocumentId(SQLiteSupport.getNullableLong(rs, "document_id"));
        triple.setJobId(SQLiteSupport.getNullableLong(rs, "job_id"));
        triple.setDoiHash(rs.getString("doi_hash"));
        triple.setContributorEmail(rs.getString("contributor_email"));
        triple.setCreatedAt(SQLiteSupport.getInstant(rs, "created_at"));
        triple.setUpdatedAt(SQLiteSupport.getInstant(rs, "updated_at"));
        triple.setSentence(rs.getString("sentence_text"));
        return triple;
    }
}
