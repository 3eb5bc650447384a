package br.edu.ifba.finrag.storage;

import br.edu.ifba.finrag.chunking.Chunk;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Interface for vector index operations over chunk embeddings.
 *
 * <p>Contract shared by every backend:</p>
 * <ul>
 *   <li>Upserting an existing id replaces its vector, text and metadata in place.</li>
 *   <li>A batch passed to {@link #upsertBatch(List)} or {@link #replaceDocument(String, List)}
 *       becomes visible to queries all at once; a concurrent query never observes part of it.</li>
 *   <li>{@link #query(float[], int, VectorFilter)} returns results ordered by ascending cosine
 *       distance, ties broken by id, and an empty list on an empty index.</li>
 *   <li>A write whose future has completed is visible to every query issued afterwards.</li>
 * </ul>
 *
 * Implementations: InMemoryVectorStorage, SQLiteVectorStorage
 */
public interface VectorStorage extends AutoCloseable {

    /**
     * Initializes the vector storage backend.
     * Must be called before any other operations.
     */
    CompletableFuture<Void> initialize();

    /**
     * Upserts a single vector.
     */
    default CompletableFuture<Void> upsert(@NotNull VectorEntry entry) {
        return upsertBatch(List.of(entry));
    }

    /**
     * Upserts multiple vectors as one atomic write.
     *
     * @param entries the vector entries to upsert
     */
    CompletableFuture<Void> upsertBatch(@NotNull List<VectorEntry> entries);

    /**
     * Atomically replaces every vector of a document with {@code entries}.
     *
     * <p>Vectors of the document whose ids are not in {@code entries} are removed, so
     * re-indexing a shortened document leaves no stale chunks behind.</p>
     *
     * @param documentId the document whose vectors are replaced
     * @param entries    the complete new vector set of the document
     */
    CompletableFuture<Void> replaceDocument(@NotNull String documentId, @NotNull List<VectorEntry> entries);

    /**
     * Finds the vectors closest to {@code queryVector} by cosine distance.
     *
     * @param queryVector the query vector
     * @param topK        maximum number of results, 0 yields an empty list
     * @param filter      optional metadata filter, null matches everything
     * @return up to {@code topK} results ordered by ascending distance
     */
    CompletableFuture<List<VectorSearchResult>> query(
            @NotNull float[] queryVector,
            int topK,
            @Nullable VectorFilter filter);

    /**
     * Deletes every vector whose metadata matches the filter.
     *
     * @return the number of vectors deleted
     */
    CompletableFuture<Integer> delete(@NotNull VectorFilter filter);

    /**
     * Deletes every vector that belongs to a document.
     *
     * @return the number of vectors deleted
     */
    default CompletableFuture<Integer> deleteByDocument(@NotNull String documentId) {
        return delete(VectorFilter.byDocument(documentId));
    }

    /**
     * Gets a vector by ID.
     *
     * @return the vector entry, or null if not found
     */
    CompletableFuture<VectorEntry> get(@NotNull String id);

    /**
     * Gets the number of vectors in the storage.
     */
    CompletableFuture<Long> size();

    /**
     * Clears all vectors from the storage.
     */
    CompletableFuture<Void> clear();

    @Override
    void close() throws Exception;

    /**
     * A stored vector with its chunk text and string metadata.
     */
    record VectorEntry(
            @NotNull String id,
            @NotNull float[] vector,
            @NotNull String text,
            @NotNull Map<String, String> metadata) {

        public VectorEntry {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(vector, "vector must not be null");
            Objects.requireNonNull(text, "text must not be null");
            vector = vector.clone();
            metadata = Map.copyOf(metadata);
        }

        @Override
        public float[] vector() {
            return vector.clone();
        }

        @Nullable
        public String documentId() {
            return metadata.get(Chunk.META_DOCUMENT_ID);
        }

        /**
         * Builds the index entry for a chunk and its embedding.
         */
        public static VectorEntry of(@NotNull Chunk chunk, @NotNull float[] embedding) {
            return new VectorEntry(chunk.id(), embedding, chunk.text(), chunk.metadata());
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof VectorEntry other)) return false;
            return id.equals(other.id)
                    && Arrays.equals(vector, other.vector)
                    && text.equals(other.text)
                    && metadata.equals(other.metadata);
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, Arrays.hashCode(vector), text, metadata);
        }

        @Override
        public String toString() {
            return "VectorEntry{id='" + id + "', dimension=" + vector.length + ", metadata=" + metadata + '}';
        }
    }

    /**
     * Conjunction of metadata equality predicates. An empty filter matches everything.
     *
     * @param equalTo metadata key/value pairs that must all match
     */
    record VectorFilter(@NotNull Map<String, String> equalTo) {

        public VectorFilter {
            equalTo = Map.copyOf(equalTo);
        }

        public static VectorFilter byDocument(@NotNull String documentId) {
            return new VectorFilter(Map.of(Chunk.META_DOCUMENT_ID, documentId));
        }

        public static VectorFilter of(@NotNull Map<String, String> equalTo) {
            return new VectorFilter(equalTo);
        }

        public boolean matches(@NotNull Map<String, String> metadata) {
            for (Map.Entry<String, String> predicate : equalTo.entrySet()) {
                if (!predicate.getValue().equals(metadata.get(predicate.getKey()))) {
                    return false;
                }
            }
            return true;
        }

        @Nullable
        public String documentId() {
            return equalTo.get(Chunk.META_DOCUMENT_ID);
        }

        public boolean isEmpty() {
            return equalTo.isEmpty();
        }
    }

    /**
     * Represents a search result from a vector query.
     *
     * @param distance cosine distance, {@code 1 - similarity}
     */
    record VectorSearchResult(
            @NotNull String id,
            @NotNull String text,
            @NotNull Map<String, String> metadata,
            double distance) {
    }
}
