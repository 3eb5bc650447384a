package br.edu.ifba.finrag.metrics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

/**
 * Least-squares trend of a concept over its period index.
 *
 * @param slope        change per period
 * @param rSquared     coefficient of determination
 * @param pValue       two-sided significance of the slope
 * @param forecastNext fitted value one period after the last point
 * @param volatility   population standard deviation of the residuals
 * @param strength     absolute Pearson correlation
 * @param sampleSize   number of points fitted
 */
public record TrendResult(
        @JsonProperty("concept") @NotNull String concept,
        @JsonProperty("direction") @NotNull TrendDirection direction,
        @JsonProperty("slope") double slope,
        @JsonProperty("r_squared") double rSquared,
        @JsonProperty("p_value") double pValue,
        @JsonProperty("forecast_next") double forecastNext,
        @JsonProperty("volatility") double volatility,
        @JsonProperty("strength") double strength,
        @JsonProperty("sample_size") int sampleSize) {

    /**
     * Degenerate result for a series too short to fit.
     */
    public static TrendResult unknown(@NotNull String concept, int sampleSize) {
        return new TrendResult(concept, TrendDirection.UNKNOWN, 0.0, 0.0, 1.0, 0.0, 0.0, 0.0, sampleSize);
    }

    @JsonIgnore
    public boolean isKnown() {
        return direction != TrendDirection.UNKNOWN;
    }
}
