package br.edu.ifba.finrag.metrics;

import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits an ordinary least squares line of value against period index {@code 0..N-1}.
 */
public class TrendAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(TrendAnalyzer.class);

    public static final int MIN_POINTS = 3;

    public TrendResult analyze(@NotNull MetricSeries series) {
        return analyze(series.concept(), series.values());
    }

    /**
     * Fits the trend of {@code values}. Fewer than {@value #MIN_POINTS} points yield an
     * {@link TrendDirection#UNKNOWN} result with zeroed statistics.
     */
    public TrendResult analyze(@NotNull String concept, @NotNull double[] values) {
        int n = values.length;
        if (n < MIN_POINTS) {
            logger.debug("Trend of {} needs {} points, got {}", concept, MIN_POINTS, n);
            return TrendResult.unknown(concept, n);
        }

        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < n; i++) {
            regression.addData(i, values[i]);
        }

        double slope = regression.getSlope();
        double intercept = regression.getIntercept();

        double[] residuals = new double[n];
        for (int i = 0; i < n; i++) {
            residuals[i] = values[i] - (slope * i + intercept);
        }
        double volatility = new StandardDeviation(false).evaluate(residuals);

        // A constant series has no variance to explain
        double r = finiteOr(regression.getR(), 0.0);
        double rSquared = finiteOr(regression.getRSquare(), 0.0);
        double pValue = finiteOr(regression.getSignificance(), 1.0);

        return new TrendResult(
            concept,
            TrendDirection.ofSlope(slope),
            slope,
            rSquared,
            pValue,
            regression.predict(n),
            volatility,
            Math.abs(r),
            n
        );
    }

    private static double finiteOr(double value, double fallback) {
        return Double.isFinite(value) ? value : fallback;
    }
}
