package org.harvest.traits.storage.impl;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.harvest.exception.ResourceNotFoundException;
import org.harvest.traits.job.ExtractionJob;
import org.harvest.traits.job.ExtractionMode;
import org.harvest.traits.job.JobResults;
import org.harvest.traits.job.JobStatus;
import org.harvest.traits.job.JobUpdate;
import org.harvest.traits.storage.ExtractionJobRepositoryPort;
import org.harvest.traits.storage.Page;
import org.jboss.logging.Logger;

/**
 * SQLite-based implementation of ExtractionJobRepositoryPort.
 *
 * <p>Jobs live in extraction_jobs; the ordered document list lives in
 * extraction_job_documents. Updates read, validate and write the job inside one
 * write transaction.</p>
 */
public final class SQLiteExtractionJobRepository implements ExtractionJobRepositoryPort {

    private static final Logger LOG = Logger.getLogger(SQLiteExtractionJobRepository.class);

    private static final String COLUMNS = """
        id, project_id, model_profile, mode, status, progress, total, error_message,
        total_triples, created_by, created_at, started_at, completed_at
        """;

    private final SQLiteConnectionManager connectionManager;

    public SQLiteExtractionJobRepository(SQLiteConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public ExtractionJob create(Long projectId, List<Long> documentIds, String modelProfile,
            ExtractionMode mode, String createdBy) {
        return SQLiteSupport.write(connectionManager, "create extraction job", conn -> {
            final Instant now = Instant.now();
            final long id;
            final String sql = """
                INSERT INTO extraction_jobs (project_id, model_profile, mode, status, progress, total, created_by, created_at)
                VALUES (?, ?, ?, ?, 0, ?, ?, ?)
                """;
            try (PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                SQLiteSupport.setNullableLong(stmt, 1, projectId);
                stmt.setString(2, modelProfile);
                stmt.setString(3, mode.value());
                stmt.setString(4, JobStatus.PENDING.value());
                stmt.setInt(5, documentIds.size());
                stmt.setString(6, createdBy);
                stmt.setString(7, now.toString());
                stmt.executeUpdate();
                id = SQLiteSupport.generatedId(stmt);
            }

            try (PreparedStatement stmt = conn.prepareStatement(
                    "INSERT INTO extraction_job_documents (job_id, position, document_id) VALUES (?, ?, ?)")) {
                for (int position = 0; position < documentIds.size(); position++) {
                    stmt.setLong(1, id);
                    stmt.setInt(2, position);
                    stmt.setLong(3, documentIds.get(position));
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }

            LOG.debugf("Created extraction job %d for %d documents", id, documentIds.size());
            return ExtractionJob.pending(id, projectId, documentIds, modelProfile, mode, createdBy, now);
        });
    }

    @Override
    public Optional<ExtractionJob> findById(long id) {
        return SQLiteSupport.read(connectionManager, "find extraction job " + id, conn -> load(conn, id));
    }

    @Override
    public ExtractionJob update(long id, JobUpdate update) {
        return SQLiteSupport.write(connectionManager, "update extraction job " + id, conn -> {
            final ExtractionJob current = load(conn, id)
                .orElseThrow(() -> new ResourceNotFoundException("Extraction job not found: " + id));
            final ExtractionJob updated = current.apply(update);

            final String sql = """
                UPDATE extraction_jobs
                SET status = ?, progress = ?, error_message = ?, total_triples = ?, started_at = ?, completed_at = ?
                WHERE id = ?
                """;
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, updated.status().value());
                stmt.setInt(2, updated.progress());
                stmt.setString(3, updated.errorMessage());
                if (updated.results() == null) {
                    stmt.setNull(4, Types.INTEGER);
                } else {
                    stmt.setInt(4, updated.results().totalTriples());
                }
                SQLiteSupport.setNullableInstant(stmt, 5, updated.startedAt());
                SQLiteSupport.setNullableInstant(stmt, 6, updated.completedAt());
                stmt.setLong(7, id);
                stmt.executeUpdate();
            }
            return updated;
        });
    }

    @Override
    public Page<ExtractionJob> findAll(Long projectId, JobStatus status, int page, int perPage) {
        Page.validate(page, perPage);
        final String statusValue = status == null ? null : status.value();
        return SQLiteSupport.read(connectionManager, "list extraction jobs", conn -> {
            final String where = " WHERE (? IS NULL OR project_id = ?) AND (? IS NULL OR status = ?)";

            long total;
            try (PreparedStatement stmt = conn.prepareStatement("SELECT COUNT(*) FROM extraction_jobs" + where)) {
                bindFilters(stmt, projectId, statusValue);
                try (ResultSet rs = stmt.executeQuery()) {
                    total = rs.next() ? rs.getLong(1) : 0;
                }
            }

            final List<Long> ids = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT id FROM extraction_jobs" + where + " ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?")) {
                bindFilters(stmt, projectId, statusValue);
                stmt.setInt(5, perPage);
                stmt.setInt(6, (page - 1) * perPage);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        ids.add(rs.getLong(1));
                    }
                }
            }

            final List<ExtractionJob> items = new ArrayList<>(ids.size());
            for (Long id : ids) {
                load(conn, id).ifPresent(items::add);
            }
            return new Page<>(items, page, perPage, total);
        });
    }

    private static Optional<ExtractionJob> load(Connection conn, long id) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT " + COLUMNS + " FROM extraction_jobs WHERE id = ?")) {
            stmt.setLong(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                final Integer totalTriples = SQLiteSupport.getNullableInt(rs, "total_triples");
                return Optional.of(new ExtractionJob(
                    rs.getLong("id"),
                    SQLiteSupport.getNullableLong(rs, "project_id"),
                    loadDocumentIds(conn, id),
                    rs.getString("model_profile"),
                    ExtractionMode.fromValue(rs.getString("mode")),
                    JobStatus.fromValue(rs.getString("status")),
                    rs.getInt("progress"),
                    rs.getInt("total"),
                    rs.getString("error_message"),
                    totalTriples == null ? null : new JobResults(totalTriples),
                    rs.getString("created_by"),
                    SQLiteSupport.getInstant(rs, "created_at"),
                    SQLiteSupport.getInstant(rs, "started_at"),
                    SQLiteSupport.getInstant(rs, "completed_at")));
            }
        }
    }

    private static List<Long> loadDocumentIds(Connection conn, long jobId) throws SQLException {
        final List<Long> ids = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT document_id FROM extraction_job_documents WHERE job_id = ? ORDER BY position")) {
            stmt.setLong(1, jobId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getLong(1));
                }
            }
        }
        return ids;
    }

    private static void bindFilters(PreparedStatement stmt, Long projectId, String status) throws SQLException {
        SQLiteSupport.setNullableLong(stmt, 1, projectId);
        SQLiteSupport.setNullableLong(stmt, 2, projectId);
        stmt.setString(3, status);
        stmt.setString(4, status);
    }
}
