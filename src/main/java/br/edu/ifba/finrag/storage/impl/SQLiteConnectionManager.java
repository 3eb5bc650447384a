package br.edu.ifba.finrag.storage.impl;

import br.edu.ifba.finrag.exception.IndexUnavailableException;
import org.jboss.logging.Logger;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Manages SQLite connections for the on-disk vector index.
 *
 * <p>Features:</p>
 * <ul>
 *   <li>WAL mode so readers are not blocked by the single writer</li>
 *   <li>Connection pool for read operations</li>
 *   <li>Exclusive write connection with ReentrantLock</li>
 *   <li>Configurable busy timeout for lock waiting</li>
 * </ul>
 *
 * <p>Every connection opens its own database, so {@code :memory:} is not supported;
 * use {@link InMemoryVectorStorage} for a volatile index.</p>
 */
public final class SQLiteConnectionManager implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(SQLiteConnectionManager.class);

    private static final Duration DEFAULT_BUSY_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_POOL_SIZE = 4;

    private final String databasePath;
    private final Duration busyTimeout;
    private final BlockingQueue<Connection> readPool;
    private final ReentrantLock writeLock;

    private Connection writeConnection;
    private volatile boolean closed = false;

    /**
     * Creates a connection manager with default settings.
     *
     * @param databasePath path to the SQLite database file
     */
    public SQLiteConnectionManager(String databasePath) {
        this(databasePath, DEFAULT_BUSY_TIMEOUT, DEFAULT_POOL_SIZE);
    }

    /**
     * @param databasePath path to the SQLite database file
     * @param busyTimeout  how long to wait for locks
     * @param readPoolSize number of connections kept in the read pool
     */
    public SQLiteConnectionManager(String databasePath, Duration busyTimeout, int readPoolSize) {
        if (databasePath == null || databasePath.isBlank() || databasePath.startsWith(":memory:")) {
            throw new IllegalArgumentException("A database file path is required, got: " + databasePath);
        }
        this.databasePath = databasePath;
        this.busyTimeout = busyTimeout;
        this.readPool = new ArrayBlockingQueue<>(readPoolSize);
        this.writeLock = new ReentrantLock();
    }

    /**
     * Opens a new connection with pragmas applied.
     *
     * @throws IndexUnavailableException if the database cannot be opened
     */
    public Connection createConnection() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }

        Path parentDir = Paths.get(databasePath).toAbsolutePath().getParent();
        if (parentDir != null && !Files.exists(parentDir)) {
            try {
                Files.createDirectories(parentDir);
                LOG.infof("Created database directory: %s", parentDir);
            } catch (IOException e) {
                throw new IndexUnavailableException("open", e);
            }
        }

        try {
            SQLiteConfig config = new SQLiteConfig();
            config.setBusyTimeout((int) busyTimeout.toMillis());
            config.setJournalMode(SQLiteConfig.JournalMode.WAL);
            config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);

            Connection conn = DriverManager.getConnection("jdbc:sqlite:" + databasePath, config.toProperties());
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA temp_store = MEMORY");
            }
            LOG.debugf("Created SQLite connection to %s", databasePath);
            return conn;
        } catch (SQLException e) {
            throw new IndexUnavailableException("open", e);
        }
    }

    /**
     * Gets a connection for read operations from the pool.
     * Creates a new connection if pool is empty.
     */
    public Connection getReadConnection() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }

        Connection conn = readPool.poll();
        if (conn != null) {
            try {
                if (!conn.isClosed()) {
                    return conn;
                }
            } catch (SQLException e) {
                LOG.debug("Read connection was closed, creating new one", e);
            }
        }
        return createConnection();
    }

    /**
     * Returns a read connection to the pool, closing it when the pool is full.
     */
    public void releaseReadConnection(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            if (conn.isClosed()) {
                return;
            }
            if (closed || !readPool.offer(conn)) {
                conn.close();
            }
        } catch (SQLException e) {
            LOG.debug("Error releasing read connection", e);
        }
    }

    /**
     * Gets the exclusive write connection; the caller holds the write lock until
     * {@link #releaseWriteConnection(Connection)}.
     */
    public Connection getWriteConnection() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }

        writeLock.lock();
        try {
            if (writeConnection == null || writeConnection.isClosed()) {
                writeConnection = createConnection();
            }
            return writeConnection;
        } catch (SQLException e) {
            writeLock.unlock();
            throw new IndexUnavailableException("open", e);
        } catch (RuntimeException e) {
            writeLock.unlock();
            throw e;
        }
    }

    /**
     * Releases the write connection lock.
     *
     * @param conn the write connection (must match current write connection)
     */
    public void releaseWriteConnection(Connection conn) {
        if (conn == writeConnection && writeLock.isHeldByCurrentThread()) {
            writeLock.unlock();
        }
    }

    public String getDatabasePath() {
        return databasePath;
    }

    @Override
    public void close() {
        closed = true;

        writeLock.lock();
        try {
            if (writeConnection != null) {
                writeConnection.close();
                writeConnection = null;
            }
        } catch (SQLException e) {
            LOG.debug("Error closing write connection", e);
        } finally {
            writeLock.unlock();
        }

        Connection conn;
        while ((conn = readPool.poll()) != null) {
            try {
                conn.close();
            } catch (SQLException e) {
                LOG.debug("Error closing pooled connection", e);
            }
        }

        LOG.infof("Closed SQLite connection manager for %s", databasePath);
    }
}
