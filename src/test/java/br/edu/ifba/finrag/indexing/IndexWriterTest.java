package br.edu.ifba.finrag.indexing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import br.edu.ifba.finrag.chunking.TextChunker;
import br.edu.ifba.finrag.embedding.KeywordEmbeddingFunction;
import br.edu.ifba.finrag.exception.IndexUnavailableException;
import br.edu.ifba.finrag.storage.VectorStorage;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;

/**
 * Retry behaviour of the guarded index write, with the fault tolerance interceptor active.
 * The test profile keeps the default two retries with a 10 ms delay.
 */
@QuarkusTest
class IndexWriterTest {

    @Inject
    IndexWriter indexWriter;

    private DocumentIndexingService service;

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.close();
        }
    }

    private static IndexUnavailableException locked() {
        return new IndexUnavailableException("replaceDocument", "database is locked");
    }

    @Test
    void transientFailureIsRetried() {
        VectorStorage flaky = mock(VectorStorage.class);
        when(flaky.replaceDocument(eq("A"), anyList())).thenReturn(
                CompletableFuture.failedFuture(locked()),
                CompletableFuture.completedFuture(null));
        WriteAttempts attempts = new WriteAttempts();

        indexWriter.replaceDocument(flaky, "A", List.of(), attempts);

        assertEquals(2, attempts.count());
        assertInstanceOf(IndexUnavailableException.class, attempts.lastFailure());
        verify(flaky, times(2)).replaceDocument(eq("A"), anyList());
    }

    @Test
    void retriesStopAfterConfiguredAttempts() {
        VectorStorage broken = mock(VectorStorage.class);
        when(broken.replaceDocument(eq("A"), anyList())).thenReturn(CompletableFuture.failedFuture(locked()));
        WriteAttempts attempts = new WriteAttempts();

        assertThrows(IndexUnavailableException.class,
                () -> indexWriter.replaceDocument(broken, "A", List.of(), attempts));

        assertEquals(3, attempts.count());
        verify(broken, times(3)).replaceDocument(eq("A"), anyList());
    }

    @Test
    void otherFailuresAreNotRetried() {
        VectorStorage broken = mock(VectorStorage.class);
        when(broken.replaceDocument(eq("A"), anyList())).thenReturn(
                CompletableFuture.failedFuture(new IllegalArgumentException("dimension mismatch")));
        WriteAttempts attempts = new WriteAttempts();

        assertThrows(IllegalArgumentException.class,
                () -> indexWriter.replaceDocument(broken, "A", List.of(), attempts));

        assertEquals(1, attempts.count());
        verify(broken, times(1)).replaceDocument(eq("A"), anyList());
    }

    @Test
    void indexingResultReportsRetriedAttempts() {
        VectorStorage flaky = mock(VectorStorage.class);
        when(flaky.replaceDocument(eq("A"), anyList())).thenReturn(
                CompletableFuture.failedFuture(locked()),
                CompletableFuture.completedFuture(null));
        service = new DocumentIndexingService(new TextChunker(100, 20), new KeywordEmbeddingFunction(),
                flaky, indexWriter, 2);

        IndexingResult result = service.indexDocument(IndexingRequest.of("A", "Revenue was $1,000,000 in Q1")).join();

        assertTrue(result.isIndexed());
        assertEquals(2, result.attempts());
    }
}
