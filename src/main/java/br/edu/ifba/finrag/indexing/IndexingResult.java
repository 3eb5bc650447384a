package br.edu.ifba.finrag.indexing;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of indexing one document.
 *
 * @param chunkCount number of chunks now indexed for the document
 * @param attempts   storage write attempts used, 0 when nothing was written
 * @param error      failure message when the document could not be indexed
 */
public record IndexingResult(
        @JsonProperty("document_id") @NotNull String documentId,
        @JsonProperty("status") @NotNull Status status,
        @JsonProperty("chunk_count") int chunkCount,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("error") @Nullable String error) {

    public enum Status {
        INDEXED,
        FAILED
    }

    public static IndexingResult indexed(@NotNull String documentId, int chunkCount, int attempts) {
        return new IndexingResult(documentId, Status.INDEXED, chunkCount, attempts, null);
    }

    public static IndexingResult failed(@NotNull String documentId, @NotNull Throwable cause) {
        return new IndexingResult(documentId, Status.FAILED, 0, 0,
            cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    @JsonIgnore
    public boolean isIndexed() {
        return status == Status.INDEXED;
    }
}
