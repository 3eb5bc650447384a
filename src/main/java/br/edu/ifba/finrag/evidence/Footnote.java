package br.edu.ifba.finrag.evidence;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

/**
 * One numbered entry of an evidence report.
 *
 * @param index  1-based, contiguous within a report
 * @param kind   what the footnote refers to
 * @param source where the fact comes from, e.g. "Document 7, Chunk 2" or "Revenue 2023Q2"
 * @param text   rendered footnote body
 */
public record Footnote(
        @JsonProperty("index") int index,
        @JsonProperty("kind") @NotNull FootnoteKind kind,
        @JsonProperty("source") @NotNull String source,
        @JsonProperty("text") @NotNull String text) {

    public String render() {
        return "[^" + index + "]: " + text;
    }
}
