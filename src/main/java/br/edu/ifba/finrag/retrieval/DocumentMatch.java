package br.edu.ifba.finrag.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Chunk hits of a single document, grouped for document-level search.
 *
 * @param documentId   the document
 * @param maxRelevance best relevance among its matched chunks
 * @param chunks       matched chunks in rank order
 * @param totalChunks  number of matched chunks
 */
public record DocumentMatch(
        @JsonProperty("document_id") @NotNull String documentId,
        @JsonProperty("max_relevance") double maxRelevance,
        @JsonProperty("chunks") @NotNull List<RetrievalHit> chunks,
        @JsonProperty("total_chunks") int totalChunks) {

    public DocumentMatch {
        chunks = List.copyOf(chunks);
    }
}
