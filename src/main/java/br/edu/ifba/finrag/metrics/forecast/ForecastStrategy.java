package br.edu.ifba.finrag.metrics.forecast;

import br.edu.ifba.finrag.metrics.MetricSeries;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * A forecasting method over a metric series.
 */
public interface ForecastStrategy {

    ForecastMethod method();

    /**
     * Whether this strategy can forecast {@code series}, e.g. enough history is present.
     */
    boolean supports(@NotNull MetricSeries series);

    /**
     * Forecasts the {@code horizon} periods following the last point of {@code series}.
     *
     * @throws IllegalArgumentException if the series is not supported
     */
    List<ForecastPoint> forecast(@NotNull MetricSeries series, int horizon);
}
