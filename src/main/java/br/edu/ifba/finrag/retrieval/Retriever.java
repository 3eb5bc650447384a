package br.edu.ifba.finrag.retrieval;

import br.edu.ifba.finrag.chunking.Chunk;
import br.edu.ifba.finrag.embedding.EmbeddingFunction;
import br.edu.ifba.finrag.exception.EmbeddingUnavailableException;
import br.edu.ifba.finrag.exception.FinRagException;
import br.edu.ifba.finrag.exception.IndexUnavailableException;
import br.edu.ifba.finrag.storage.VectorStorage;
import br.edu.ifba.finrag.storage.VectorStorage.VectorFilter;
import br.edu.ifba.finrag.storage.VectorStorage.VectorSearchResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Turns a question into an {@link EvidenceBundle}: embeds the question, queries the
 * vector index, ranks the hits and builds citations plus a numbered context block.
 *
 * <p>The embedding call is bounded by the configured timeout, also for ports that block
 * before returning their future. Embedding failures follow
 * the {@link RetrievalMode}; index failures always fail the returned future with
 * {@link IndexUnavailableException}.</p>
 */
public class Retriever {

    private static final Logger logger = LoggerFactory.getLogger(Retriever.class);

    public static final int DEFAULT_TOP_K = 5;
    public static final int DEFAULT_DOCUMENT_TOP_K = 10;

    private static final Comparator<RetrievalHit> BY_RELEVANCE =
            Comparator.comparingDouble(RetrievalHit::relevanceScore).reversed()
                    .thenComparing(RetrievalHit::chunkId);

    private static final AtomicInteger CALLER_THREADS = new AtomicInteger();

    // the port is invoked here so that a blocking implementation cannot outlive the timeout
    private static final ExecutorService EMBEDDING_CALLER = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "finrag-query-embedding-" + CALLER_THREADS.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    private final EmbeddingFunction embeddingFunction;
    private final VectorStorage vectorStorage;
    private final Duration embeddingTimeout;
    private final RetrievalMode mode;
    private final int defaultTopK;
    private final int defaultDocumentTopK;

    public Retriever(
            @NotNull EmbeddingFunction embeddingFunction,
            @NotNull VectorStorage vectorStorage,
            @NotNull Duration embeddingTimeout,
            @NotNull RetrievalMode mode) {
        this(embeddingFunction, vectorStorage, embeddingTimeout, mode, DEFAULT_TOP_K, DEFAULT_DOCUMENT_TOP_K);
    }

    /**
     * @param defaultTopK         hits per query when the caller gives no limit
     * @param defaultDocumentTopK chunks searched by {@link #searchSimilarDocuments(String)}
     */
    public Retriever(
            @NotNull EmbeddingFunction embeddingFunction,
            @NotNull VectorStorage vectorStorage,
            @NotNull Duration embeddingTimeout,
            @NotNull RetrievalMode mode,
            int defaultTopK,
            int defaultDocumentTopK) {
        checkTopK(defaultTopK);
        checkTopK(defaultDocumentTopK);
        this.defaultTopK = defaultTopK;
        this.defaultDocumentTopK = defaultDocumentTopK;
        this.embeddingFunction = Objects.requireNonNull(embeddingFunction, "embeddingFunction must not be null");
        this.vectorStorage = Objects.requireNonNull(vectorStorage, "vectorStorage must not be null");
        this.embeddingTimeout = Objects.requireNonNull(embeddingTimeout, "embeddingTimeout must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
    }

    public RetrievalMode getMode() {
        return mode;
    }

    public CompletableFuture<EvidenceBundle> retrieve(@NotNull String query, @Nullable String documentId) {
        return retrieve(query, documentId, defaultTopK);
    }

    public CompletableFuture<EvidenceBundle> retrieve(@NotNull String query) {
        return retrieve(query, null, defaultTopK);
    }

    /**
     * Retrieves evidence for a question.
     *
     * @param query      the natural-language question
     * @param documentId restricts the search to one document when not null
     * @param topK       maximum number of hits, 0 yields an empty bundle
     * @return the ranked evidence; empty when nothing is indexed or nothing matches
     */
    public CompletableFuture<EvidenceBundle> retrieve(
            @NotNull String query,
            @Nullable String documentId,
            int topK) {
        Objects.requireNonNull(query, "query must not be null");
        checkTopK(topK);
        if (topK == 0 || query.isBlank()) {
            return CompletableFuture.completedFuture(EvidenceBundle.empty(query));
        }

        return embedQueries(List.of(query))
                .thenCompose(vectors -> searchHits(vectors.get(0), documentId, topK))
                .thenApply(hits -> assemble(query, hits))
                .exceptionally(error -> recoverEmbeddingFailure(query, error));
    }

    /**
     * Retrieves evidence for several questions with a single embedding call.
     *
     * @return one bundle per query, in query order
     */
    public CompletableFuture<List<EvidenceBundle>> retrieveBatch(
            @NotNull List<String> queries,
            @Nullable String documentId,
            int topK) {
        checkTopK(topK);
        if (queries.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        if (topK == 0) {
            return CompletableFuture.completedFuture(queries.stream().map(EvidenceBundle::empty).toList());
        }

        return embedQueries(queries)
                .thenCompose(vectors -> {
                    List<CompletableFuture<EvidenceBundle>> bundles = new ArrayList<>(queries.size());
                    for (int i = 0; i < queries.size(); i++) {
                        String query = queries.get(i);
                        bundles.add(searchHits(vectors.get(i), documentId, topK)
                                .thenApply(hits -> assemble(query, hits)));
                    }
                    return CompletableFuture.allOf(bundles.toArray(CompletableFuture[]::new))
                            .thenApply(ignored -> bundles.stream().map(CompletableFuture::join).toList());
                })
                .exceptionally(error -> {
                    recoverEmbeddingFailure(queries.get(0), error);
                    return queries.stream().map(EvidenceBundle::empty).toList();
                });
    }

    public CompletableFuture<List<DocumentMatch>> searchSimilarDocuments(@NotNull String query) {
        return searchSimilarDocuments(query, defaultDocumentTopK);
    }

    /**
     * Searches chunks across the whole index and groups the hits by document.
     *
     * @param query the natural-language question
     * @param topK  number of chunks to search, not documents
     * @return documents ordered by their best chunk relevance, ties by document id
     */
    public CompletableFuture<List<DocumentMatch>> searchSimilarDocuments(@NotNull String query, int topK) {
        Objects.requireNonNull(query, "query must not be null");
        checkTopK(topK);
        if (topK == 0 || query.isBlank()) {
            return CompletableFuture.completedFuture(List.of());
        }

        return embedQueries(List.of(query))
                .thenCompose(vectors -> searchHits(vectors.get(0), null, topK))
                .thenApply(Retriever::groupByDocument)
                .exceptionally(error -> {
                    recoverEmbeddingFailure(query, error);
                    return List.of();
                });
    }

    private static List<DocumentMatch> groupByDocument(List<RetrievalHit> hits) {
        Map<String, List<RetrievalHit>> byDocument = new LinkedHashMap<>();
        for (RetrievalHit hit : hits) {
            if (hit.documentId() == null) {
                logger.debug("Skipping chunk {} without document id", hit.chunkId());
                continue;
            }
            byDocument.computeIfAbsent(hit.documentId(), id -> new ArrayList<>()).add(hit);
        }

        List<DocumentMatch> matches = new ArrayList<>(byDocument.size());
        for (Map.Entry<String, List<RetrievalHit>> entry : byDocument.entrySet()) {
            List<RetrievalHit> chunks = entry.getValue();
            double maxRelevance = chunks.stream().mapToDouble(RetrievalHit::relevanceScore).max().orElse(0.0);
            matches.add(new DocumentMatch(entry.getKey(), maxRelevance, chunks, chunks.size()));
        }
        matches.sort(Comparator.comparingDouble(DocumentMatch::maxRelevance).reversed()
                .thenComparing(DocumentMatch::documentId));
        return matches;
    }

    private CompletableFuture<List<float[]>> embedQueries(List<String> queries) {
        CompletableFuture<List<float[]>> embedding = CompletableFuture
                .supplyAsync(() -> embeddingFunction.embed(queries), EMBEDDING_CALLER)
                .thenCompose(Function.identity());

        return embedding
                .orTimeout(embeddingTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((vectors, error) -> {
                    if (error != null) {
                        throw new CompletionException(toEmbeddingFailure(FinRagException.unwrap(error)));
                    }
                    if (vectors == null || vectors.size() != queries.size()) {
                        throw new CompletionException(new EmbeddingUnavailableException(String.format(
                                "Expected %d query embeddings but received %d",
                                queries.size(), vectors == null ? 0 : vectors.size())));
                    }
                    return vectors;
                });
    }

    private EmbeddingUnavailableException toEmbeddingFailure(Throwable cause) {
        if (cause instanceof EmbeddingUnavailableException unavailable) {
            return unavailable;
        }
        if (cause instanceof TimeoutException) {
            return new EmbeddingUnavailableException(
                    "Query embedding timed out after " + embeddingTimeout.toMillis() + " ms", cause);
        }
        return new EmbeddingUnavailableException("Query embedding failed: " + cause.getMessage(), cause);
    }

    private CompletableFuture<List<RetrievalHit>> searchHits(float[] queryVector, @Nullable String documentId, int topK) {
        VectorFilter filter = documentId != null ? VectorFilter.byDocument(documentId) : null;

        CompletableFuture<List<VectorSearchResult>> search;
        try {
            search = vectorStorage.query(queryVector, topK, filter);
        } catch (RuntimeException e) {
            search = CompletableFuture.failedFuture(e);
        }

        return search.handle((results, error) -> {
            if (error != null) {
                throw new CompletionException(toIndexFailure(FinRagException.unwrap(error)));
            }
            return rank(results);
        });
    }

    private static RuntimeException toIndexFailure(Throwable cause) {
        if (cause instanceof IndexUnavailableException || cause instanceof IllegalArgumentException) {
            return (RuntimeException) cause;
        }
        return new IndexUnavailableException("query", cause);
    }

    static List<RetrievalHit> rank(List<VectorSearchResult> results) {
        List<RetrievalHit> unranked = new ArrayList<>(results.size());
        for (VectorSearchResult result : results) {
            double relevance = Math.max(0.0, Math.min(1.0, 1.0 - result.distance()));
            if (Double.isNaN(relevance)) {
                relevance = 0.0;
            }
            unranked.add(new RetrievalHit(
                    result.id(),
                    result.metadata().get(Chunk.META_DOCUMENT_ID),
                    result.text(),
                    relevance,
                    1,
                    result.metadata()));
        }
        unranked.sort(BY_RELEVANCE);

        List<RetrievalHit> ranked = new ArrayList<>(unranked.size());
        for (int i = 0; i < unranked.size(); i++) {
            RetrievalHit hit = unranked.get(i);
            ranked.add(new RetrievalHit(hit.chunkId(), hit.documentId(), hit.text(),
                    hit.relevanceScore(), i + 1, hit.metadata()));
        }
        return ranked;
    }

    static EvidenceBundle assemble(String query, List<RetrievalHit> hits) {
        if (hits.isEmpty()) {
            logger.debug("No hits for query, returning empty bundle");
            return EvidenceBundle.empty(query);
        }

        List<Citation> citations = new ArrayList<>(hits.size());
        List<String> contextParts = new ArrayList<>(hits.size());
        for (RetrievalHit hit : hits) {
            contextParts.add("[Context " + hit.rank() + "]: " + hit.text());
            citations.add(citationFor(hit));
        }

        logger.debug("Assembled evidence with {} citations", citations.size());
        return new EvidenceBundle(query, String.join("\n\n", contextParts), citations, hits);
    }

    private static Citation citationFor(RetrievalHit hit) {
        Map<String, String> metadata = hit.metadata();
        String chunkIndexValue = metadata.get(Chunk.META_CHUNK_INDEX);
        int chunkIndex = -1;
        if (chunkIndexValue != null) {
            try {
                chunkIndex = Integer.parseInt(chunkIndexValue);
            } catch (NumberFormatException e) {
                logger.warn("Chunk {} has a non-numeric chunk index '{}'", hit.chunkId(), chunkIndexValue);
            }
        }

        return new Citation(
                hit.rank(),
                metadata.get(Chunk.META_COMPANY),
                metadata.get(Chunk.META_PERIOD),
                Citation.snippetOf(hit.text()),
                hit.relevanceScore(),
                hit.documentId(),
                chunkIndex,
                "Document " + hit.documentId() + ", Chunk " + chunkIndexValue);
    }

    private EvidenceBundle recoverEmbeddingFailure(String query, Throwable error) {
        Throwable cause = FinRagException.unwrap(error);
        if (mode == RetrievalMode.BEST_EFFORT && cause instanceof EmbeddingUnavailableException) {
            logger.warn("Returning empty evidence, query embedding unavailable: {}", cause.getMessage());
            return EvidenceBundle.empty(query);
        }
        throw error instanceof CompletionException completion ? completion : new CompletionException(cause);
    }

    private static void checkTopK(int topK) {
        if (topK < 0) {
            throw new IllegalArgumentException("topK must be >= 0, got: " + topK);
        }
    }
}
