package br.edu.ifba.finrag.indexing;

import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.Objects;

/**
 * A document to (re-)index.
 */
public record IndexingRequest(
        @NotNull String documentId,
        @NotNull String text,
        @NotNull Map<String, String> metadata) {

    public IndexingRequest {
        Objects.requireNonNull(documentId, "documentId must not be null");
        Objects.requireNonNull(text, "text must not be null");
        metadata = Map.copyOf(metadata);
    }

    public static IndexingRequest of(@NotNull String documentId, @NotNull String text) {
        return new IndexingRequest(documentId, text, Map.of());
    }
}
