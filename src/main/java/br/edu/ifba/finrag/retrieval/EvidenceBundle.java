package br.edu.ifba.finrag.retrieval;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Retrieval result handed to narrative generation: the assembled context plus the
 * citations and hits it was built from, all in rank order.
 */
public record EvidenceBundle(
        @JsonProperty("query") @NotNull String query,
        @JsonProperty("context") @NotNull String context,
        @JsonProperty("citations") @NotNull List<Citation> citations,
        @JsonProperty("hits") @NotNull List<RetrievalHit> hits) {

    public EvidenceBundle {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(context, "context must not be null");
        citations = List.copyOf(citations);
        hits = List.copyOf(hits);
    }

    public static EvidenceBundle empty(@NotNull String query) {
        return new EvidenceBundle(query, "", List.of(), List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return hits.isEmpty();
    }
}
