package br.edu.ifba.finrag.storage.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;

import br.edu.ifba.finrag.chunking.Chunk;
import br.edu.ifba.finrag.storage.VectorStorage;
import br.edu.ifba.finrag.storage.VectorStorage.VectorEntry;
import br.edu.ifba.finrag.storage.VectorStorage.VectorFilter;

/**
 * Runs the shared contract against a SQLite file plus SQLite-specific checks.
 */
class SQLiteVectorStorageTest extends VectorStorageContractTest {

    @TempDir
    Path tempDir;

    @Override
    protected VectorStorage createStorage() {
        return new SQLiteVectorStorage(new SQLiteConnectionManager(tempDir.resolve("vectors.db").toString()));
    }

    @Test
    void metadataAndVectorsSurviveReopening() throws Exception {
        String path = tempDir.resolve("persistent.db").toString();
        VectorEntry stored = new VectorEntry("doc_acme_chunk_0", new float[] {0.1f, 0.2f, 0.3f},
                "Revenue was $1,000,000 in Q1",
                Map.of(Chunk.META_DOCUMENT_ID, "acme", Chunk.META_COMPANY, "ACME", Chunk.META_PERIOD, "2023Q1"));

        try (SQLiteVectorStorage first = new SQLiteVectorStorage(new SQLiteConnectionManager(path))) {
            first.initialize().join();
            first.upsert(stored).join();
        }

        try (SQLiteVectorStorage reopened = new SQLiteVectorStorage(
                new SQLiteConnectionManager(path), new ObjectMapper(), null)) {
            reopened.initialize().join();
            VectorEntry loaded = reopened.get(stored.id()).join();
            assertNotNull(loaded);
            assertEquals(stored, loaded);
            assertEquals(1L, reopened.size().join());
        }
    }

    @Test
    void customTableNameIsUsed() throws Exception {
        String path = tempDir.resolve("custom.db").toString();
        try (SQLiteVectorStorage custom = new SQLiteVectorStorage(
                new SQLiteConnectionManager(path), new ObjectMapper(), "filing_vectors")) {
            custom.initialize().join();
            custom.upsert(entry("a", 0, 1f, 0f)).join();
            assertEquals("filing_vectors", custom.getTableName());
            assertEquals(1L, custom.size().join());
        }
    }

    @Test
    void filterOnNonDocumentMetadataIsApplied() {
        storage.upsertBatch(List.of(
                new VectorEntry("x", new float[] {1f, 0f}, "x",
                        Map.of(Chunk.META_DOCUMENT_ID, "a", Chunk.META_COMPANY, "ACME")),
                new VectorEntry("y", new float[] {1f, 0f}, "y",
                        Map.of(Chunk.META_DOCUMENT_ID, "b", Chunk.META_COMPANY, "GLOBEX")))).join();

        var results = storage.query(new float[] {1f, 0f}, 10,
                VectorFilter.of(Map.of(Chunk.META_COMPANY, "GLOBEX"))).join();

        assertEquals(1, results.size());
        assertTrue(results.stream().allMatch(r -> "y".equals(r.id())));
    }
}
