package br.edu.ifba.finrag.metrics.forecast;

import br.edu.ifba.finrag.metrics.FiscalPeriod;
import br.edu.ifba.finrag.metrics.MetricSeries;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Extrapolates the least squares line of value against period index. The band is
 * {@code ±1.96} times the population standard deviation of the in-sample residuals.
 *
 * <p>A single point is carried forward flat with a zero-width band.</p>
 */
public class LinearForecastStrategy implements ForecastStrategy {

    @Override
    public ForecastMethod method() {
        return ForecastMethod.LINEAR;
    }

    @Override
    public boolean supports(@NotNull MetricSeries series) {
        return !series.isEmpty();
    }

    @Override
    public List<ForecastPoint> forecast(@NotNull MetricSeries series, int horizon) {
        if (!supports(series)) {
            throw new IllegalArgumentException("Cannot forecast empty series " + series.concept());
        }
        double[] values = series.values();
        int n = values.length;
        FiscalPeriod last = series.lastPeriod();

        double slope = 0.0;
        double intercept = values[0];
        double sigma = 0.0;
        if (n >= 2) {
            SimpleRegression regression = new SimpleRegression();
            for (int i = 0; i < n; i++) {
                regression.addData(i, values[i]);
            }
            slope = regression.getSlope();
            intercept = regression.getIntercept();

            double[] residuals = new double[n];
            for (int i = 0; i < n; i++) {
                residuals[i] = values[i] - (slope * i + intercept);
            }
            sigma = new StandardDeviation(false).evaluate(residuals);
        }

        List<ForecastPoint> points = new ArrayList<>(horizon);
        for (int h = 1; h <= horizon; h++) {
            double value = slope * (n - 1 + h) + intercept;
            points.add(ForecastPoint.withBand(last.plus(h), value, sigma));
        }
        return points;
    }
}
