package br.edu.ifba.finrag.metrics.forecast;

import br.edu.ifba.finrag.metrics.FiscalPeriod;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

/**
 * One forecast value with its 95% band.
 */
public record ForecastPoint(
        @JsonProperty("period") @NotNull FiscalPeriod period,
        @JsonProperty("value") double value,
        @JsonProperty("lower_bound") double lowerBound,
        @JsonProperty("upper_bound") double upperBound) {

    static final double Z_95 = 1.96;

    static ForecastPoint withBand(FiscalPeriod period, double value, double sigma) {
        return new ForecastPoint(period, value, value - Z_95 * sigma, value + Z_95 * sigma);
    }
}
