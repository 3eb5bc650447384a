package br.edu.ifba.finrag.evidence;

import br.edu.ifba.finrag.metrics.FinancialSummary;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Evidence of a single generation request: retrieved context, the metrics summary and one
 * footnote list covering both.
 */
public record EvidenceReport(
        @JsonProperty("query") @NotNull String query,
        @JsonProperty("context") @NotNull String context,
        @JsonProperty("summary") @Nullable FinancialSummary summary,
        @JsonProperty("footnotes") @NotNull List<Footnote> footnotes) {

    public EvidenceReport {
        footnotes = List.copyOf(footnotes);
    }

    /**
     * Footnotes as markdown footnote definitions, one per line.
     */
    public String renderFootnotes() {
        return footnotes.stream().map(Footnote::render).collect(Collectors.joining("\n"));
    }
}
