package br.edu.ifba.finrag.metrics.forecast;

import br.edu.ifba.finrag.metrics.MetricSeries;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the requested forecast strategy and falls back to the linear one when the seasonal
 * strategy is disabled, lacks history, or fails. The result reports the method actually used
 * and its confidence.
 */
public class ForecastService {

    private static final Logger logger = LoggerFactory.getLogger(ForecastService.class);

    private final LinearForecastStrategy linear;
    @Nullable
    private final ForecastStrategy seasonal;

    /**
     * @param linear   always-available fallback
     * @param seasonal seasonal strategy, or null when that capability is not available
     */
    public ForecastService(@NotNull LinearForecastStrategy linear, @Nullable ForecastStrategy seasonal) {
        this.linear = linear;
        this.seasonal = seasonal;
    }

    public boolean isSeasonalAvailable() {
        return seasonal != null;
    }

    /**
     * @param series  history to extend, must not be empty
     * @param horizon number of periods to forecast, at least 1
     * @param method  preferred method
     */
    public ForecastResult forecast(@NotNull MetricSeries series, int horizon, @NotNull ForecastMethod method) {
        if (horizon < 1) {
            throw new IllegalArgumentException("horizon must be >= 1, got " + horizon);
        }

        if (method == ForecastMethod.SEASONAL) {
            if (seasonal == null) {
                logger.info("Seasonal forecasting unavailable, using linear for {}", series.concept());
            } else if (!seasonal.supports(series)) {
                logger.info("Not enough seasonal history for {} ({} points), using linear",
                    series.concept(), series.size());
            } else {
                try {
                    return result(series, method, seasonal, horizon);
                } catch (ArithmeticException | IllegalArgumentException e) {
                    logger.warn("Seasonal forecast of {} failed, using linear: {}", series.concept(), e.getMessage());
                }
            }
        }
        return result(series, method, linear, horizon);
    }

    private static ForecastResult result(MetricSeries series, ForecastMethod requested,
                                         ForecastStrategy strategy, int horizon) {
        List<ForecastPoint> points = strategy.forecast(series, horizon);
        ForecastMethod used = strategy.method();
        return new ForecastResult(series.concept(), requested, used, used.confidenceScore(), points);
    }
}
