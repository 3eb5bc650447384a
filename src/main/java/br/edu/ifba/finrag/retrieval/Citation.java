package br.edu.ifba.finrag.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Reference from generated text back to a retrieved chunk.
 *
 * @param index          1-based citation number, equal to the hit's rank
 * @param company        company the chunk is about, from its metadata
 * @param period         reporting period of the chunk, from its metadata
 * @param snippet        first {@value #SNIPPET_LENGTH} characters of the chunk, with "..." when cut
 * @param relevanceScore relevance of the cited hit
 * @param documentId     owning document
 * @param chunkIndex     position of the chunk in its document, -1 when unknown
 * @param source         human-readable label, e.g. "Document 42, Chunk 3"
 */
public record Citation(
        @JsonProperty("index") int index,
        @JsonProperty("company") @Nullable String company,
        @JsonProperty("period") @Nullable String period,
        @JsonProperty("snippet") @NotNull String snippet,
        @JsonProperty("relevance_score") double relevanceScore,
        @JsonProperty("document_id") @Nullable String documentId,
        @JsonProperty("chunk_index") int chunkIndex,
        @JsonProperty("source") @NotNull String source) {

    public static final int SNIPPET_LENGTH = 200;

    /**
     * Cuts {@code text} to the snippet length, appending "..." only when something was cut.
     */
    @NotNull
    public static String snippetOf(@NotNull String text) {
        if (text.length() <= SNIPPET_LENGTH) {
            return text;
        }
        return text.substring(0, SNIPPET_LENGTH) + "...";
    }
}
