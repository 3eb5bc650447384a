package br.edu.ifba.finrag.chunking;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.Objects;

/**
 * A bounded, retrievable slice of a document's text.
 *
 * <p>The id is derived from {@code (documentId, index)} so that re-chunking the same
 * document with the same parameters reproduces the same ids. Chunks are never mutated;
 * re-indexing a document supersedes its previous chunks.</p>
 *
 * @param id         deterministic chunk id, see {@link #idFor(String, int)}
 * @param documentId owning document
 * @param index      0-based position within the document, contiguous
 * @param text       trimmed chunk text, never blank
 * @param metadata   string metadata copied onto the indexed vector
 */
public record Chunk(
        @JsonProperty("chunk_id") @NotNull String id,
        @JsonProperty("document_id") @NotNull String documentId,
        @JsonProperty("chunk_index") int index,
        @JsonProperty("content") @NotNull String text,
        @JsonProperty("metadata") @NotNull Map<String, String> metadata) {

    public static final String META_DOCUMENT_ID = "document_id";
    public static final String META_CHUNK_INDEX = "chunk_index";
    public static final String META_CHUNK_LENGTH = "chunk_length";
    public static final String META_COMPANY = "company";
    public static final String META_PERIOD = "period";

    public Chunk {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(documentId, "documentId must not be null");
        Objects.requireNonNull(text, "text must not be null");
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, got " + index);
        }
        metadata = Map.copyOf(metadata);
    }

    /**
     * Deterministic id for the chunk at {@code index} of {@code documentId}.
     */
    @NotNull
    public static String idFor(@NotNull String documentId, int index) {
        return "doc_" + documentId + "_chunk_" + index;
    }

    @Override
    public String toString() {
        return "Chunk{" +
                "id='" + id + '\'' +
                ", documentId='" + documentId + '\'' +
                ", index=" + index +
                ", length=" + text.length() +
                '}';
    }
}
