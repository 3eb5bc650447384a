package br.edu.ifba.finrag.storage.impl;

import br.edu.ifba.finrag.exception.IndexUnavailableException;
import br.edu.ifba.finrag.storage.VectorStorage;
import br.edu.ifba.finrag.utils.EmbeddingUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * SQLite-based implementation of VectorStorage.
 *
 * <p>Stores vectors as Float32 BLOBs and metadata as a JSON column; similarity is
 * computed in Java over the rows that pass the document filter. Every write runs in a
 * single transaction, so a batch is either fully visible or not at all.</p>
 *
 * <p>{@link SQLException}s surface as {@link IndexUnavailableException}.</p>
 */
public final class SQLiteVectorStorage implements VectorStorage {

    private static final Logger LOG = Logger.getLogger(SQLiteVectorStorage.class);

    /** Default table name for vector storage */
    private static final String DEFAULT_TABLE_NAME = "chunk_vectors";

    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() {
    };

    private static final Comparator<VectorSearchResult> BY_DISTANCE =
            Comparator.comparingDouble(VectorSearchResult::distance)
                    .thenComparing(VectorSearchResult::id);

    private final SQLiteConnectionManager connectionManager;
    private final ObjectMapper objectMapper;
    private final String tableName;

    public SQLiteVectorStorage(SQLiteConnectionManager connectionManager) {
        this(connectionManager, new ObjectMapper(), DEFAULT_TABLE_NAME);
    }

    /**
     * @param connectionManager the SQLite connection manager
     * @param objectMapper      mapper for the metadata column
     * @param tableName         table holding the vectors
     */
    public SQLiteVectorStorage(SQLiteConnectionManager connectionManager, ObjectMapper objectMapper, String tableName) {
        this.connectionManager = connectionManager;
        this.objectMapper = objectMapper;
        this.tableName = tableName != null && !tableName.isBlank() ? tableName : DEFAULT_TABLE_NAME;
    }

    public String getTableName() {
        return tableName;
    }

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> {
            createTableIfNotExists();
            LOG.infof("Initialized SQLiteVectorStorage, table '%s' in %s", tableName, connectionManager.getDatabasePath());
        });
    }

    private void createTableIfNotExists() {
        String createTableSql = String.format("""
            CREATE TABLE IF NOT EXISTS %s (
                id TEXT PRIMARY KEY,
                document_id TEXT,
                content TEXT NOT NULL,
                metadata TEXT NOT NULL,
                vector BLOB NOT NULL,
                updated_at TEXT NOT NULL DEFAULT (datetime('now'))
            )
            """, tableName);
        String createIndexDocumentSql = String.format(
            "CREATE INDEX IF NOT EXISTS idx_%s_document_id ON %s(document_id)", tableName, tableName);

        inTransaction("initialize", conn -> {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(createTableSql);
                stmt.execute(createIndexDocumentSql);
            }
            return 0;
        });
        LOG.debugf("Ensured table '%s' exists with indexes", tableName);
    }

    @Override
    public CompletableFuture<Void> upsertBatch(@NotNull List<VectorEntry> entries) {
        List<VectorEntry> batch = List.copyOf(entries);
        return CompletableFuture.runAsync(() -> {
            if (batch.isEmpty()) {
                return;
            }
            inTransaction("upsert", conn -> insertAll(conn, batch));
            LOG.debugf("Batch upserted %d vectors", Integer.valueOf(batch.size()));
        });
    }

    @Override
    public CompletableFuture<Void> replaceDocument(@NotNull String documentId, @NotNull List<VectorEntry> entries) {
        List<VectorEntry> batch = List.copyOf(entries);
        return CompletableFuture.runAsync(() -> {
            int removed = inTransaction("replace-document", conn -> {
                int deleted;
                try (PreparedStatement stmt = conn.prepareStatement(
                        String.format("DELETE FROM %s WHERE document_id = ?", tableName))) {
                    stmt.setString(1, documentId);
                    deleted = stmt.executeUpdate();
                }
                insertAll(conn, batch);
                return deleted;
            });
            LOG.debugf("Replaced %d vectors of document %s with %d",
                Integer.valueOf(removed), documentId, Integer.valueOf(batch.size()));
        });
    }

    private int insertAll(Connection conn, List<VectorEntry> batch) throws SQLException {
        String sql = String.format("""
            INSERT INTO %s (id, document_id, content, metadata, vector, updated_at)
            VALUES (?, ?, ?, ?, ?, datetime('now'))
            ON CONFLICT(id) DO UPDATE SET
                document_id = excluded.document_id,
                content = excluded.content,
                metadata = excluded.metadata,
                vector = excluded.vector,
                updated_at = excluded.updated_at
            """, tableName);

        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (VectorEntry entry : batch) {
                stmt.setString(1, entry.id());
                stmt.setString(2, entry.documentId());
                stmt.setString(3, entry.text());
                stmt.setString(4, writeMetadata(entry.metadata()));
                stmt.setBytes(5, EmbeddingUtil.toBytes(entry.vector()));
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
        return batch.size();
    }

    @Override
    public CompletableFuture<List<VectorSearchResult>> query(
            @NotNull float[] queryVector,
            int topK,
            @Nullable VectorFilter filter) {
        if (topK < 0) {
            throw new IllegalArgumentException("topK must be >= 0, got: " + topK);
        }
        float[] query = queryVector.clone();
        return CompletableFuture.supplyAsync(() -> {
            List<VectorSearchResult> results = new ArrayList<>();
            for (VectorEntry entry : select("query", filter)) {
                double distance = EmbeddingUtil.cosineDistance(query, entry.vector());
                results.add(new VectorSearchResult(entry.id(), entry.text(), entry.metadata(), distance));
            }
            results.sort(BY_DISTANCE);
            return results.size() > topK ? List.copyOf(results.subList(0, topK)) : results;
        });
    }

    @Override
    public CompletableFuture<Integer> delete(@NotNull VectorFilter filter) {
        return CompletableFuture.supplyAsync(() -> {
            int deleted = inTransaction("delete", conn -> {
                List<String> ids = new ArrayList<>();
                for (VectorEntry entry : select(conn, filter)) {
                    ids.add(entry.id());
                }
                if (ids.isEmpty()) {
                    return 0;
                }
                try (PreparedStatement stmt = conn.prepareStatement(
                        String.format("DELETE FROM %s WHERE id = ?", tableName))) {
                    for (String id : ids) {
                        stmt.setString(1, id);
                        stmt.addBatch();
                    }
                    stmt.executeBatch();
                }
                return ids.size();
            });
            LOG.debugf("Deleted %d vectors matching %s", Integer.valueOf(deleted), filter.equalTo());
            return deleted;
        });
    }

    @Override
    public CompletableFuture<VectorEntry> get(@NotNull String id) {
        return CompletableFuture.supplyAsync(() -> {
            String sql = String.format(
                "SELECT id, content, metadata, vector FROM %s WHERE id = ?", tableName);
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, id);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? readEntry(rs) : null;
                }
            } catch (SQLException e) {
                throw new IndexUnavailableException("get", e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Long> size() {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getReadConnection();
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery(String.format("SELECT COUNT(*) FROM %s", tableName))) {
                return rs.next() ? rs.getLong(1) : 0L;
            } catch (SQLException e) {
                throw new IndexUnavailableException("size", e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Void> clear() {
        return CompletableFuture.runAsync(() -> {
            inTransaction("clear", conn -> {
                try (Statement stmt = conn.createStatement()) {
                    return stmt.executeUpdate(String.format("DELETE FROM %s", tableName));
                }
            });
            LOG.infof("Cleared all vectors from table '%s'", tableName);
        });
    }

    /**
     * Closes the underlying connection manager.
     */
    @Override
    public void close() {
        connectionManager.close();
        LOG.debug("SQLiteVectorStorage closed");
    }

    private List<VectorEntry> select(String operation, @Nullable VectorFilter filter) {
        Connection conn = connectionManager.getReadConnection();
        try {
            return select(conn, filter);
        } catch (SQLException e) {
            throw new IndexUnavailableException(operation, e);
        } finally {
            connectionManager.releaseReadConnection(conn);
        }
    }

    private List<VectorEntry> select(Connection conn, @Nullable VectorFilter filter) throws SQLException {
        String documentId = filter != null ? filter.documentId() : null;
        String sql = documentId != null
                ? String.format("SELECT id, content, metadata, vector FROM %s WHERE document_id = ?", tableName)
                : String.format("SELECT id, content, metadata, vector FROM %s", tableName);

        List<VectorEntry> entries = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (documentId != null) {
                stmt.setString(1, documentId);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    VectorEntry entry = readEntry(rs);
                    if (filter == null || filter.matches(entry.metadata())) {
                        entries.add(entry);
                    }
                }
            }
        }
        return entries;
    }

    private VectorEntry readEntry(ResultSet rs) throws SQLException {
        return new VectorEntry(
            rs.getString("id"),
            EmbeddingUtil.fromBytes(rs.getBytes("vector")),
            rs.getString("content"),
            readMetadata(rs.getString("metadata"))
        );
    }

    private String writeMetadata(Map<String, String> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata is not serializable: " + metadata, e);
        }
    }

    private Map<String, String> readMetadata(String json) throws SQLException {
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt metadata column: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Runs {@code work} on the write connection inside one transaction.
     */
    private int inTransaction(String operation, SqlWork work) {
        Connection conn = connectionManager.getWriteConnection();
        try {
            conn.setAutoCommit(false);
            int result = work.run(conn);
            conn.commit();
            return result;
        } catch (SQLException e) {
            try {
                conn.rollback();
            } catch (SQLException rollbackEx) {
                LOG.warn("Failed to rollback after " + operation + " failure", rollbackEx);
            }
            throw new IndexUnavailableException(operation, e);
        } finally {
            try {
                conn.setAutoCommit(true);
            } catch (SQLException e) {
                LOG.warn("Failed to reset auto-commit", e);
            }
            connectionManager.releaseWriteConnection(conn);
        }
    }

    @FunctionalInterface
    private interface SqlWork {
        int run(Connection conn) throws SQLException;
    }
}
