package br.edu.ifba.finrag.indexing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import br.edu.ifba.finrag.chunking.Chunk;
import br.edu.ifba.finrag.chunking.TextChunker;
import br.edu.ifba.finrag.embedding.EmbeddingFunction;
import br.edu.ifba.finrag.embedding.KeywordEmbeddingFunction;
import br.edu.ifba.finrag.exception.EmbeddingUnavailableException;
import br.edu.ifba.finrag.exception.IndexUnavailableException;
import br.edu.ifba.finrag.storage.VectorStorage;
import br.edu.ifba.finrag.storage.impl.InMemoryVectorStorage;
import br.edu.ifba.finrag.utils.RetryEventLogger;

class DocumentIndexingServiceTest {

    private final TextChunker chunker = new TextChunker(100, 20);
    private final KeywordEmbeddingFunction embeddingFunction = new KeywordEmbeddingFunction();
    private final List<DocumentIndexingService> services = new ArrayList<>();

    private InMemoryVectorStorage storage;

    @BeforeEach
    void setUp() {
        storage = new InMemoryVectorStorage();
        storage.initialize().join();
    }

    @AfterEach
    void tearDown() {
        services.forEach(DocumentIndexingService::close);
    }

    private DocumentIndexingService service(EmbeddingFunction embedding, VectorStorage vectorStorage) {
        DocumentIndexingService service = new DocumentIndexingService(chunker, embedding, vectorStorage,
                new IndexWriter(new RetryEventLogger(), 1), 4);
        services.add(service);
        return service;
    }

    private static String longText(int sentences) {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < sentences; i++) {
            text.append("Revenue in segment ").append(i).append(" grew. ");
        }
        return text.toString();
    }

    @Nested
    @DisplayName("Single documents")
    class SingleDocuments {

        @Test
        @DisplayName("indexing stores every chunk under the document")
        void indexingStoresEveryChunk() {
            DocumentIndexingService service = service(embeddingFunction, storage);

            IndexingResult result = service.onDocumentAdded("A", longText(12), Map.of(Chunk.META_COMPANY, "ACME")).join();

            assertTrue(result.isIndexed());
            assertEquals(1, result.attempts());
            assertEquals(chunker.chunk("A", longText(12)).size(), result.chunkCount());
            assertEquals((long) result.chunkCount(), storage.size().join());
            assertEquals("ACME", storage.get(Chunk.idFor("A", 0)).join().metadata().get(Chunk.META_COMPANY));
        }

        @Test
        @DisplayName("a document added without metadata is indexed")
        void documentAddedWithoutMetadata() {
            DocumentLifecycleListener listener = service(embeddingFunction, storage);

            IndexingResult result = listener.onDocumentAdded("B", "Revenue was $1,000,000 in Q1").join();

            assertTrue(result.isIndexed());
            assertEquals(1L, storage.size().join());
            assertEquals("B", storage.get(Chunk.idFor("B", 0)).join().documentId());
        }

        @Test
        @DisplayName("re-indexing a shorter version removes stale chunks")
        void reindexingRemovesStaleChunks() {
            DocumentIndexingService service = service(embeddingFunction, storage);
            service.indexDocument(IndexingRequest.of("A", longText(20))).join();

            IndexingResult result = service.indexDocument(IndexingRequest.of("A", "Revenue was flat.")).join();

            assertEquals(1, result.chunkCount());
            assertEquals(1L, storage.size().join());
        }

        @Test
        @DisplayName("re-indexing identical content is idempotent")
        void reindexingIsIdempotent() {
            DocumentIndexingService service = service(embeddingFunction, storage);
            service.indexDocument(IndexingRequest.of("A", longText(8))).join();
            long size = storage.size().join();

            service.indexDocument(IndexingRequest.of("A", longText(8))).join();

            assertEquals(size, storage.size().join());
        }

        @Test
        @DisplayName("blank text removes the document")
        void blankTextRemovesDocument() {
            DocumentIndexingService service = service(embeddingFunction, storage);
            service.indexDocument(IndexingRequest.of("A", longText(5))).join();

            IndexingResult result = service.indexDocument(IndexingRequest.of("A", "  ")).join();

            assertEquals(0, result.chunkCount());
            assertEquals(0L, storage.size().join());
        }

        @Test
        @DisplayName("deleting reports the removed chunk count")
        void deletingReportsCount() {
            DocumentIndexingService service = service(embeddingFunction, storage);
            int chunks = service.indexDocument(IndexingRequest.of("A", longText(10))).join().chunkCount();

            assertEquals(chunks, service.onDocumentDeleted("A").join());
            assertEquals(0L, storage.size().join());
        }

        @Test
        @DisplayName("an embedding failure keeps the previous version")
        void embeddingFailureKeepsPreviousVersion() {
            service(embeddingFunction, storage).indexDocument(IndexingRequest.of("A", longText(4))).join();
            long size = storage.size().join();
            EmbeddingFunction failing = texts -> CompletableFuture.failedFuture(
                    new EmbeddingUnavailableException("endpoint down"));

            CompletionException error = assertThrows(CompletionException.class,
                    () -> service(failing, storage).indexDocument(IndexingRequest.of("A", longText(9))).join());

            assertInstanceOf(EmbeddingUnavailableException.class, error.getCause());
            assertEquals(size, storage.size().join());
        }
    }

    @Nested
    @DisplayName("Write failures")
    class WriteFailures {

        @Test
        @DisplayName("an index failure fails the document and keeps the previous version")
        void indexFailurePropagates() {
            VectorStorage broken = mock(VectorStorage.class);
            when(broken.replaceDocument(eq("A"), anyList())).thenReturn(
                    CompletableFuture.failedFuture(new IndexUnavailableException("replaceDocument", "disk full")));

            CompletionException error = assertThrows(CompletionException.class, () -> service(embeddingFunction, broken)
                    .indexDocument(IndexingRequest.of("A", "Revenue was $1,000,000 in Q1")).join());

            assertInstanceOf(IndexUnavailableException.class, error.getCause());
            verify(broken, times(1)).replaceDocument(eq("A"), anyList());
        }

        @Test
        @DisplayName("a failing delete of blank text surfaces as a failed future")
        void blankTextDeleteFailureSurfaces() {
            VectorStorage broken = mock(VectorStorage.class);
            when(broken.replaceDocument(eq("A"), anyList())).thenReturn(
                    CompletableFuture.failedFuture(new IndexUnavailableException("replaceDocument", "database is locked")));

            CompletableFuture<IndexingResult> result = service(embeddingFunction, broken)
                    .indexDocument(IndexingRequest.of("A", " "));

            CompletionException error = assertThrows(CompletionException.class, result::join);
            assertInstanceOf(IndexUnavailableException.class, error.getCause());
        }

        @Test
        @DisplayName("invalid settings are rejected")
        void invalidSettingsAreRejected() {
            RetryEventLogger retryLogger = new RetryEventLogger();
            assertThrows(IllegalArgumentException.class, () -> new IndexWriter(retryLogger, 0));
            assertThrows(IllegalArgumentException.class, () -> new DocumentIndexingService(
                    chunker, embeddingFunction, storage, new IndexWriter(retryLogger, 1), 0));
        }
    }

    @Nested
    @DisplayName("Bulk indexing")
    class BulkIndexing {

        @Test
        @DisplayName("many documents index concurrently and results keep request order")
        void manyDocumentsIndexConcurrently() {
            List<IndexingRequest> requests = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                requests.add(IndexingRequest.of("doc-" + i, longText(3 + i % 5)));
            }

            List<IndexingResult> results = service(embeddingFunction, storage).indexAll(requests).join();

            assertEquals(40, results.size());
            long expectedChunks = 0;
            for (int i = 0; i < results.size(); i++) {
                assertEquals("doc-" + i, results.get(i).documentId());
                assertTrue(results.get(i).isIndexed());
                expectedChunks += results.get(i).chunkCount();
            }
            assertEquals(expectedChunks, storage.size().join());
        }

        @Test
        @DisplayName("a failing document does not stop the others")
        void failingDocumentIsIsolated() {
            EmbeddingFunction picky = texts -> texts.stream().anyMatch(t -> t.contains("corrupt"))
                    ? CompletableFuture.failedFuture(new EmbeddingUnavailableException("cannot embed"))
                    : embeddingFunction.embed(texts);

            List<IndexingResult> results = service(picky, storage).indexAll(List.of(
                    IndexingRequest.of("good-1", "Revenue grew."),
                    IndexingRequest.of("bad", "corrupt payload"),
                    IndexingRequest.of("good-2", "Costs fell."))).join();

            assertTrue(results.get(0).isIndexed());
            assertFalse(results.get(1).isIndexed());
            assertEquals(IndexingResult.Status.FAILED, results.get(1).status());
            assertTrue(results.get(1).error().contains("cannot embed"));
            assertTrue(results.get(2).isIndexed());
        }
    }
}
