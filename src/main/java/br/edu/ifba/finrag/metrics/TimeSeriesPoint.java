package br.edu.ifba.finrag.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * One reported value of a financial concept for a company and period.
 */
public record TimeSeriesPoint(
        @JsonProperty("company") @NotNull String company,
        @JsonProperty("period") @NotNull FiscalPeriod period,
        @JsonProperty("concept") @NotNull String concept,
        @JsonProperty("value") double value) {

    public TimeSeriesPoint {
        Objects.requireNonNull(company, "company must not be null");
        Objects.requireNonNull(period, "period must not be null");
        Objects.requireNonNull(concept, "concept must not be null");
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value must be finite for " + concept + " " + period + ", got " + value);
        }
    }

    public TimeSeriesPoint withConcept(@NotNull String newConcept) {
        return new TimeSeriesPoint(company, period, newConcept, value);
    }
}
