package br.edu.ifba.finrag.metrics.forecast;

import br.edu.ifba.finrag.metrics.FiscalPeriod;
import br.edu.ifba.finrag.metrics.MetricSeries;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Additive Holt-Winters smoothing with a yearly season of quarters.
 *
 * <p>Level and trend are initialized from the first two seasons, so at least two full
 * seasons of quarterly data are required. The band uses the population standard deviation
 * of the one-step-ahead errors.</p>
 */
public class SeasonalForecastStrategy implements ForecastStrategy {

    public static final int SEASON_LENGTH = 4;

    private final double alpha;
    private final double beta;
    private final double gamma;

    public SeasonalForecastStrategy() {
        this(0.5, 0.1, 0.3);
    }

    /**
     * @param alpha level smoothing factor
     * @param beta  trend smoothing factor
     * @param gamma seasonal smoothing factor
     */
    public SeasonalForecastStrategy(double alpha, double beta, double gamma) {
        checkFactor("alpha", alpha);
        checkFactor("beta", beta);
        checkFactor("gamma", gamma);
        this.alpha = alpha;
        this.beta = beta;
        this.gamma = gamma;
    }

    private static void checkFactor(String name, double value) {
        if (!(value > 0.0 && value < 1.0)) {
            throw new IllegalArgumentException(name + " must be within (0, 1), got " + value);
        }
    }

    @Override
    public ForecastMethod method() {
        return ForecastMethod.SEASONAL;
    }

    @Override
    public boolean supports(@NotNull MetricSeries series) {
        return series.size() >= 2 * SEASON_LENGTH && !series.isAnnual();
    }

    @Override
    public List<ForecastPoint> forecast(@NotNull MetricSeries series, int horizon) {
        if (!supports(series)) {
            throw new IllegalArgumentException(String.format(
                "Seasonal forecast of %s needs %d quarterly points, got %d",
                series.concept(), 2 * SEASON_LENGTH, series.size()));
        }
        double[] y = series.values();
        int n = y.length;
        int m = SEASON_LENGTH;

        Mean mean = new Mean();
        double firstSeason = mean.evaluate(y, 0, m);
        double secondSeason = mean.evaluate(y, m, m);

        double level = firstSeason;
        double trend = (secondSeason - firstSeason) / m;
        double[] seasonal = new double[m];
        for (int i = 0; i < m; i++) {
            seasonal[i] = y[i] - firstSeason;
        }

        double[] errors = new double[n];
        for (int t = 0; t < n; t++) {
            int s = t % m;
            errors[t] = y[t] - (level + trend + seasonal[s]);

            double previousLevel = level;
            level = alpha * (y[t] - seasonal[s]) + (1 - alpha) * (level + trend);
            trend = beta * (level - previousLevel) + (1 - beta) * trend;
            seasonal[s] = gamma * (y[t] - level) + (1 - gamma) * seasonal[s];
        }
        // The first season only reproduces its own initialization
        double sigma = new StandardDeviation(false).evaluate(Arrays.copyOfRange(errors, m, n));

        FiscalPeriod last = series.lastPeriod();
        List<ForecastPoint> points = new ArrayList<>(horizon);
        for (int h = 1; h <= horizon; h++) {
            double value = level + h * trend + seasonal[(n + h - 1) % m];
            points.add(ForecastPoint.withBand(last.plus(h), value, sigma));
        }
        return points;
    }
}
