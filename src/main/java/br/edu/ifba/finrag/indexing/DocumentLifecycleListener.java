package br.edu.ifba.finrag.indexing;

import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Hooks called by the document store when a document's content becomes available or the
 * document is removed. The returned futures complete once the index reflects the change.
 */
public interface DocumentLifecycleListener {

    CompletableFuture<IndexingResult> onDocumentAdded(
            @NotNull String documentId,
            @NotNull String text,
            @NotNull Map<String, String> metadata);

    default CompletableFuture<IndexingResult> onDocumentAdded(@NotNull String documentId, @NotNull String text) {
        return onDocumentAdded(documentId, text, Map.of());
    }

    /**
     * @return number of chunks removed from the index
     */
    CompletableFuture<Integer> onDocumentDeleted(@NotNull String documentId);
}
