package org.harvest.traits.storage;

import java.sql.SQLException;

import org.harvest.traits.profile.TraitExtractionConfig;
import org.harvest.traits.storage.impl.InMemoryDocumentRepository;
import org.harvest.traits.storage.impl.InMemoryExtractionJobRepository;
import org.harvest.traits.storage.impl.InMemoryTripleRepository;
import org.harvest.traits.storage.impl.SQLiteConnectionManager;
import org.harvest.traits.storage.impl.SQLiteDocumentRepository;
import org.harvest.traits.storage.impl.SQLiteExtractionJobRepository;
import org.harvest.traits.storage.impl.SQLiteSchemaMigrator;
import org.harvest.traits.storage.impl.SQLiteTripleRepository;
import org.jboss.logging.Logger;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

/**
 * CDI producer that selects the repository implementations from
 * {@code trait-extraction.storage.backend} at runtime.
 *
 * <pre>
 * trait-extraction.storage.backend=sqlite   # or "memory"
 * trait-extraction.storage.sqlite-path=data/trait_extraction.db
 * </pre>
 */
@ApplicationScoped
public class TraitStorageProvider {

    private static final Logger LOG = Logger.getLogger(TraitStorageProvider.class);

    @Inject
    TraitExtractionConfig config;

    private SQLiteConnectionManager connectionManager;
    private ExtractionJobRepositoryPort jobRepository;

    @Produces
    @ApplicationScoped
    public DocumentRepositoryPort produceDocumentRepository() {
        if (useSqlite()) {
            LOG.info("Using SQLite document repository");
            return new SQLiteDocumentRepository(connectionManager());
        }
        LOG.info("Using in-memory document repository");
        return new InMemoryDocumentRepository();
    }

    @Produces
    @ApplicationScoped
    public ExtractionJobRepositoryPort produceJobRepository() {
        return jobRepository();
    }

    @Produces
    @ApplicationScoped
    public TripleRepositoryPort produceTripleRepository() {
        if (useSqlite()) {
            LOG.info("Using SQLite triple repository");
            return new SQLiteTripleRepository(connectionManager());
        }
        LOG.info("Using in-memory triple repository");
        return new InMemoryTripleRepository(jobRepository());
    }

    private synchronized ExtractionJobRepositoryPort jobRepository() {
        if (jobRepository == null) {
            if (useSqlite()) {
                LOG.info("Using SQLite extraction job repository");
                jobRepository = new SQLiteExtractionJobRepository(connectionManager());
            } else {
                LOG.info("Using in-memory extraction job repository");
                jobRepository = new InMemoryExtractionJobRepository();
            }
        }
        return jobRepository;
    }

    private boolean useSqlite() {
        final String backend = config.storage().backend();
        if ("sqlite".equalsIgnoreCase(backend)) {
            return true;
        }
        if ("memory".equalsIgnoreCase(backend)) {
            return false;
        }
        throw new IllegalStateException("Unsupported trait-extraction.storage.backend: " + backend);
    }

    private synchronized SQLiteConnectionManager connectionManager() {
        if (connectionManager == null) {
            final String path = config.storage().sqlitePath();
            LOG.infof("Initializing SQLite storage with database: %s", path);
            final SQLiteConnectionManager manager = new SQLiteConnectionManager(path);
            try {
                manager.inTransaction(conn -> {
                    new SQLiteSchemaMigrator().migrateToLatest(conn);
                    return null;
                });
            } catch (SQLException | RuntimeException e) {
                manager.close();
                throw new IllegalStateException("Failed to migrate SQLite schema at " + path, e);
            }
            connectionManager = manager;
        }
        return connectionManager;
    }

    @PreDestroy
    void close() {
        if (connectionManager != null) {
            connectionManager.close();
        }
    }
}
