package br.edu.ifba.finrag.metrics.forecast;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Forecast of a concept.
 *
 * @param requestedMethod method the caller asked for
 * @param method          method that produced the points
 * @param confidenceScore confidence of {@code method}
 */
public record ForecastResult(
        @JsonProperty("concept") @NotNull String concept,
        @JsonProperty("requested_method") @NotNull ForecastMethod requestedMethod,
        @JsonProperty("method") @NotNull ForecastMethod method,
        @JsonProperty("confidence_score") double confidenceScore,
        @JsonProperty("forecast") @NotNull List<ForecastPoint> points) {

    public ForecastResult {
        points = List.copyOf(points);
    }

    /**
     * True when the requested method was unavailable and another one was used.
     */
    @JsonIgnore
    public boolean isDegraded() {
        return requestedMethod != method;
    }
}
