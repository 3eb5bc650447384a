package br.edu.ifba.finrag.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Objects;

/**
 * One ranked chunk returned for a query.
 *
 * @param chunkId        id of the indexed chunk
 * @param documentId     owning document, null when the chunk carries no document metadata
 * @param text           chunk text
 * @param relevanceScore {@code 1 - cosine distance}, clamped to [0, 1]
 * @param rank           1-based position in the result list
 * @param metadata       chunk metadata as stored in the index
 */
public record RetrievalHit(
        @JsonProperty("chunk_id") @NotNull String chunkId,
        @JsonProperty("document_id") @Nullable String documentId,
        @JsonProperty("content") @NotNull String text,
        @JsonProperty("relevance_score") double relevanceScore,
        @JsonProperty("rank") int rank,
        @JsonProperty("metadata") @NotNull Map<String, String> metadata) {

    public RetrievalHit {
        Objects.requireNonNull(chunkId, "chunkId must not be null");
        Objects.requireNonNull(text, "text must not be null");
        if (relevanceScore < 0.0 || relevanceScore > 1.0) {
            throw new IllegalArgumentException("relevanceScore must be within [0, 1], got " + relevanceScore);
        }
        if (rank < 1) {
            throw new IllegalArgumentException("rank must be >= 1, got " + rank);
        }
        metadata = Map.copyOf(metadata);
    }
}
