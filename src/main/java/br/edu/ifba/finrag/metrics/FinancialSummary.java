package br.edu.ifba.finrag.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metrics of one company handed to narrative generation alongside the retrieved evidence.
 *
 * <p>{@code anomalyConfidence} rates the warnings as a whole, see
 * {@link SeriesAnomalyDetector#confidence(List)}.</p>
 */
public record FinancialSummary(
        @JsonProperty("company") @NotNull String company,
        @JsonProperty("ratios") @NotNull Map<String, Double> ratios,
        @JsonProperty("deltas") @NotNull List<DeltaMetric> deltas,
        @JsonProperty("trends") @NotNull List<TrendResult> trends,
        @JsonProperty("warnings") @NotNull List<NumericWarning> warnings,
        @JsonProperty("risk_level") @NotNull RiskLevel riskLevel,
        @JsonProperty("anomaly_confidence") double anomalyConfidence) {

    public FinancialSummary {
        ratios = Collections.unmodifiableMap(new LinkedHashMap<>(ratios));
        deltas = List.copyOf(deltas);
        trends = List.copyOf(trends);
        warnings = List.copyOf(warnings);
    }

    public FinancialSummary(@NotNull String company, @NotNull Map<String, Double> ratios, @NotNull List<DeltaMetric> deltas,
                            @NotNull List<TrendResult> trends, @NotNull List<NumericWarning> warnings, @NotNull RiskLevel riskLevel) {
        this(company, ratios, deltas, trends, warnings, riskLevel, SeriesAnomalyDetector.confidence(warnings));
    }

    public static FinancialSummary empty(@NotNull String company) {
        return new FinancialSummary(company, Map.of(), List.of(), List.of(), List.of(), RiskLevel.LOW);
    }
}
