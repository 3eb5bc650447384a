package br.edu.ifba.finrag.storage.impl;

import br.edu.ifba.finrag.storage.VectorStorage;
import br.edu.ifba.finrag.utils.EmbeddingUtil;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * In-memory vector storage implementation.
 * Uses brute-force cosine distance for vector queries.
 *
 * <p>Writers copy the current snapshot, apply their change and publish the new snapshot
 * under a lock; readers work on whatever snapshot was published last and never lock.
 * A batch therefore becomes visible to queries all at once.</p>
 */
public class InMemoryVectorStorage implements VectorStorage {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryVectorStorage.class);

    private static final Comparator<VectorSearchResult> BY_DISTANCE =
            Comparator.comparingDouble(VectorSearchResult::distance)
                    .thenComparing(VectorSearchResult::id);

    private final ReentrantLock writeLock = new ReentrantLock();
    private final Executor executor;
    private volatile Map<String, VectorEntry> snapshot = Map.of();
    private volatile boolean initialized = false;

    public InMemoryVectorStorage() {
        this(ForkJoinPool.commonPool());
    }

    public InMemoryVectorStorage(@NotNull Executor executor) {
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> {
            if (!initialized) {
                initialized = true;
                logger.info("InMemoryVectorStorage initialized");
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Void> upsertBatch(@NotNull List<VectorEntry> entries) {
        ensureInitialized();
        List<VectorEntry> batch = List.copyOf(entries);
        return CompletableFuture.runAsync(() -> {
            write(map -> {
                for (VectorEntry entry : batch) {
                    map.put(entry.id(), entry);
                }
            });
            logger.debug("Upserted {} vectors", batch.size());
        }, executor);
    }

    @Override
    public CompletableFuture<Void> replaceDocument(@NotNull String documentId, @NotNull List<VectorEntry> entries) {
        ensureInitialized();
        List<VectorEntry> batch = List.copyOf(entries);
        return CompletableFuture.runAsync(() -> {
            write(map -> {
                map.values().removeIf(entry -> documentId.equals(entry.documentId()));
                for (VectorEntry entry : batch) {
                    map.put(entry.id(), entry);
                }
            });
            logger.debug("Replaced vectors of document {} with {} entries", documentId, batch.size());
        }, executor);
    }

    @Override
    public CompletableFuture<List<VectorSearchResult>> query(
        @NotNull float[] queryVector,
        int topK,
        @Nullable VectorFilter filter
    ) {
        ensureInitialized();
        if (topK < 0) {
            throw new IllegalArgumentException("topK must be >= 0, got: " + topK);
        }
        float[] query = queryVector.clone();
        return CompletableFuture.supplyAsync(() -> {
            Map<String, VectorEntry> current = snapshot;
            List<VectorSearchResult> scored = new ArrayList<>();

            for (VectorEntry entry : current.values()) {
                if (filter != null && !filter.matches(entry.metadata())) {
                    continue;
                }
                double distance = EmbeddingUtil.cosineDistance(query, entry.vector());
                scored.add(new VectorSearchResult(entry.id(), entry.text(), entry.metadata(), distance));
            }

            return scored.stream()
                .sorted(BY_DISTANCE)
                .limit(topK)
                .toList();
        }, executor);
    }

    @Override
    public CompletableFuture<Integer> delete(@NotNull VectorFilter filter) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            int[] deleted = {0};
            write(map -> {
                int before = map.size();
                map.values().removeIf(entry -> filter.matches(entry.metadata()));
                deleted[0] = before - map.size();
            });
            logger.debug("Deleted {} vectors matching {}", deleted[0], filter.equalTo());
            return deleted[0];
        }, executor);
    }

    @Override
    public CompletableFuture<VectorEntry> get(@NotNull String id) {
        ensureInitialized();
        return CompletableFuture.completedFuture(snapshot.get(id));
    }

    @Override
    public CompletableFuture<Long> size() {
        ensureInitialized();
        return CompletableFuture.completedFuture((long) snapshot.size());
    }

    @Override
    public CompletableFuture<Void> clear() {
        ensureInitialized();
        return CompletableFuture.runAsync(() -> {
            write(Map::clear);
            logger.info("Cleared all vectors");
        }, executor);
    }

    @Override
    public void close() throws Exception {
        if (initialized) {
            write(Map::clear);
            initialized = false;
            logger.info("InMemoryVectorStorage closed");
        }
    }

    private void write(Consumer<Map<String, VectorEntry>> mutation) {
        writeLock.lock();
        try {
            Map<String, VectorEntry> copy = new HashMap<>(snapshot);
            mutation.accept(copy);
            snapshot = Collections.unmodifiableMap(copy);
        } finally {
            writeLock.unlock();
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Storage not initialized. Call initialize() first.");
        }
    }
}
