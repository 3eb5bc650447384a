package br.edu.ifba.finrag.metrics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Period-over-period change of a concept. A field is null when the history or a non-zero
 * base needed to compute it is missing; it is never NaN or infinite.
 *
 * @param qoqPct       change against the preceding period, in percent
 * @param yoyPct       change against the same period one year earlier, in percent
 * @param derivedRatio gross margin of the company at this period, when computable
 */
public record DeltaMetric(
        @JsonProperty("concept") @NotNull String concept,
        @JsonProperty("period") @NotNull FiscalPeriod period,
        @JsonProperty("value") double value,
        @JsonProperty("qoq_pct") @Nullable Double qoqPct,
        @JsonProperty("yoy_pct") @Nullable Double yoyPct,
        @JsonProperty("derived_ratio") @Nullable Double derivedRatio) {

    public DeltaMetric {
        checkFinite("qoqPct", qoqPct);
        checkFinite("yoyPct", yoyPct);
        checkFinite("derivedRatio", derivedRatio);
    }

    private static void checkFinite(String field, @Nullable Double value) {
        if (value != null && !Double.isFinite(value)) {
            throw new IllegalArgumentException(field + " must be finite or null, got " + value);
        }
    }

    public DeltaMetric withDerivedRatio(@Nullable Double ratio) {
        return new DeltaMetric(concept, period, value, qoqPct, yoyPct, ratio);
    }

    @JsonIgnore
    public boolean hasAnyValue() {
        return qoqPct != null || yoyPct != null || derivedRatio != null;
    }
}
