package org.harvest.traits.storage.impl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;
import org.sqlite.SQLiteConfig;

/**
 * Owns the connections to one trait extraction database file.
 *
 * <p>Writes are serialised on a single connection and always run in a
 * transaction. Reads borrow one of a few idle connections; WAL journaling lets
 * them proceed while a job is being written.</p>
 *
 * <pre>
 * SQLiteConnectionManager manager = new SQLiteConnectionManager("data/trait_extraction.db");
 * long id = manager.inTransaction(conn -&gt; insertJob(conn));
 * Optional&lt;ExtractionJob&gt; job = manager.withReader(conn -&gt; loadJob(conn, id));
 * </pre>
 */
public final class SQLiteConnectionManager implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(SQLiteConnectionManager.class);

    private static final int BUSY_TIMEOUT_MS = 30_000;
    private static final int MAX_IDLE_READERS = 4;

    @FunctionalInterface
    public interface SqlWork<T> {
        T execute(Connection conn) throws SQLException;
    }

    private final String databasePath;
    private final Deque<Connection> idleReaders = new ArrayDeque<>();
    private final ReentrantLock writeLock = new ReentrantLock();

    private Connection writer;
    private volatile boolean closed;

    /**
     * @param databasePath database file; missing parent directories are created
     */
    public SQLiteConnectionManager(String databasePath) {
        this.databasePath = databasePath;
        final Path parent = Path.of(databasePath).toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            try {
                Files.createDirectories(parent);
                LOG.infof("Created database directory: %s", parent);
            } catch (IOException e) {
                throw new IllegalStateException("Cannot create database directory " + parent, e);
            }
        }
    }

    /**
     * Runs the work on the write connection inside one transaction. Any
     * exception rolls the transaction back and propagates unchanged.
     */
    public <T> T inTransaction(SqlWork<T> work) throws SQLException {
        writeLock.lock();
        try {
            ensureOpen();
            if (writer == null || writer.isClosed()) {
                writer = open();
            }
            writer.setAutoCommit(false);
            try {
                final T result = work.execute(writer);
                writer.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                writer.rollback();
                throw e;
            } finally {
                writer.setAutoCommit(true);
            }
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Runs read-only work on a pooled connection.
     */
    public <T> T withReader(SqlWork<T> work) throws SQLException {
        final Connection conn = borrowReader();
        boolean reusable = false;
        try {
            final T result = work.execute(conn);
            reusable = true;
            return result;
        } finally {
            returnReader(conn, reusable);
        }
    }

    /**
     * Opens a new connection with foreign keys, WAL and the busy timeout set.
     * The caller owns and closes it.
     */
    Connection open() throws SQLException {
        ensureOpen();
        final SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setBusyTimeout(BUSY_TIMEOUT_MS);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        LOG.debugf("Opening SQLite connection to %s", databasePath);
        return DriverManager.getConnection("jdbc:sqlite:" + databasePath, config.toProperties());
    }

    private Connection borrowReader() throws SQLException {
        synchronized (idleReaders) {
            ensureOpen();
            final Connection idle = idleReaders.pollFirst();
            if (idle != null) {
                return idle;
            }
        }
        return open();
    }

    private void returnReader(Connection conn, boolean reusable) {
        synchronized (idleReaders) {
            if (reusable && !closed && idleReaders.size() < MAX_IDLE_READERS) {
                idleReaders.addFirst(conn);
                return;
            }
        }
        closeQuietly(conn);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Connection manager for " + databasePath + " is closed");
        }
    }

    @Override
    public void close() {
        closed = true;
        writeLock.lock();
        try {
            closeQuietly(writer);
            writer = null;
        } finally {
            writeLock.unlock();
        }
        synchronized (idleReaders) {
            idleReaders.forEach(SQLiteConnectionManager::closeQuietly);
            idleReaders.clear();
        }
        LOG.infof("Closed SQLite connections for %s", databasePath);
    }

    private static void closeQuietly(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException e) {
            LOG.debug("Error closing SQLite connection", e);
        }
    }
}
