package br.edu.ifba.finrag.indexing;

import br.edu.ifba.finrag.chunking.Chunk;
import br.edu.ifba.finrag.chunking.TextChunker;
import br.edu.ifba.finrag.embedding.EmbeddingFunction;
import br.edu.ifba.finrag.exception.EmbeddingUnavailableException;
import br.edu.ifba.finrag.exception.FinRagException;
import br.edu.ifba.finrag.exception.IndexUnavailableException;
import br.edu.ifba.finrag.storage.VectorStorage;
import br.edu.ifba.finrag.storage.VectorStorage.VectorEntry;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Chunks, embeds and indexes documents.
 *
 * <p>Each document is written with {@link VectorStorage#replaceDocument(String, List)}, so its
 * chunks become retrievable all at once and chunks of an older, longer version disappear in
 * the same write. Re-indexing unchanged content produces the same ids and vectors.</p>
 *
 * <p>Writes go through {@link IndexWriter}, which retries them on
 * {@link IndexUnavailableException}. {@link #indexAll(List)} indexes documents on a bounded pool.</p>
 */
public class DocumentIndexingService implements DocumentLifecycleListener, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DocumentIndexingService.class);

    private final TextChunker chunker;
    private final EmbeddingFunction embeddingFunction;
    private final VectorStorage vectorStorage;
    private final IndexWriter indexWriter;
    private final ExecutorService workers;

    public DocumentIndexingService(
            @NotNull TextChunker chunker,
            @NotNull EmbeddingFunction embeddingFunction,
            @NotNull VectorStorage vectorStorage,
            @NotNull IndexWriter indexWriter,
            int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        this.chunker = chunker;
        this.embeddingFunction = embeddingFunction;
        this.vectorStorage = vectorStorage;
        this.indexWriter = indexWriter;
        this.workers = Executors.newFixedThreadPool(parallelism, new IndexingThreadFactory());
    }

    @Override
    public CompletableFuture<IndexingResult> onDocumentAdded(
            @NotNull String documentId,
            @NotNull String text,
            @NotNull Map<String, String> metadata) {
        return indexDocument(new IndexingRequest(documentId, text, metadata));
    }

    @Override
    public CompletableFuture<Integer> onDocumentDeleted(@NotNull String documentId) {
        return deleteDocument(documentId);
    }

    /**
     * Indexes one document, replacing whatever was indexed for it before.
     *
     * <p>Blank text removes the document from the index. The future fails with
     * {@link EmbeddingUnavailableException} or {@link IndexUnavailableException} when the
     * document could not be indexed; the index then still holds the previous version.</p>
     */
    public CompletableFuture<IndexingResult> indexDocument(@NotNull IndexingRequest request) {
        String documentId = request.documentId();
        List<Chunk> chunks = chunker.chunk(documentId, request.text(), request.metadata());
        logger.info("Document {} split into {} chunks", documentId, chunks.size());

        if (chunks.isEmpty()) {
            try {
                return CompletableFuture.completedFuture(IndexingResult.indexed(documentId, 0, write(documentId, List.of())));
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }

        List<String> texts = chunks.stream().map(Chunk::text).toList();
        return embed(texts)
            .thenApply(vectors -> {
                if (vectors.size() != chunks.size()) {
                    throw new CompletionException(new EmbeddingUnavailableException(String.format(
                        "Expected %d embeddings for document %s but received %d",
                        chunks.size(), documentId, vectors.size())));
                }
                List<VectorEntry> entries = new ArrayList<>(chunks.size());
                for (int i = 0; i < chunks.size(); i++) {
                    entries.add(VectorEntry.of(chunks.get(i), vectors.get(i)));
                }
                return write(documentId, entries);
            })
            .thenApply(attempts -> {
                logger.info("Indexed document {} ({} chunks)", documentId, chunks.size());
                return IndexingResult.indexed(documentId, chunks.size(), attempts);
            });
    }

    /**
     * Removes every chunk of a document. The future completes after the removal is visible.
     */
    public CompletableFuture<Integer> deleteDocument(@NotNull String documentId) {
        return vectorStorage.deleteByDocument(documentId)
            .thenApply(deleted -> {
                logger.info("Removed {} chunks of document {}", deleted, documentId);
                return deleted;
            });
    }

    /**
     * Indexes documents concurrently. A failing document does not stop the others; its
     * result carries {@link IndexingResult.Status#FAILED}.
     *
     * @return one result per request, in request order
     */
    public CompletableFuture<List<IndexingResult>> indexAll(@NotNull List<IndexingRequest> requests) {
        List<CompletableFuture<IndexingResult>> futures = new ArrayList<>(requests.size());
        for (IndexingRequest request : requests) {
            futures.add(CompletableFuture
                .supplyAsync(() -> indexDocument(request).join(), workers)
                .exceptionally(error -> {
                    Throwable cause = FinRagException.unwrap(error);
                    logger.error("Failed to index document {}: {}", request.documentId(), cause.getMessage());
                    return IndexingResult.failed(request.documentId(), cause);
                }));
        }

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
            .thenApply(v -> {
                List<IndexingResult> results = futures.stream().map(CompletableFuture::join).toList();
                long failed = results.stream().filter(r -> !r.isIndexed()).count();
                logger.info("Indexed {} documents, {} failed", results.size() - failed, failed);
                return results;
            });
    }

    private CompletableFuture<List<float[]>> embed(List<String> texts) {
        try {
            return embeddingFunction.embed(texts);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * @return the number of write attempts used
     */
    private int write(String documentId, List<VectorEntry> entries) {
        WriteAttempts attempts = new WriteAttempts();
        indexWriter.replaceDocument(vectorStorage, documentId, entries, attempts);
        return attempts.count();
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Indexing workers did not stop within 30s, forcing shutdown");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class IndexingThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(@NotNull Runnable runnable) {
            Thread thread = new Thread(runnable, "finrag-indexer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
