package br.edu.ifba.finrag.metrics;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Flags sudden changes and trend reversals within a reported series.
 *
 * <p>A sudden change is a point whose z-score against the whole series, using the population
 * standard deviation, exceeds {@value #SUDDEN_CHANGE_Z}; it is HIGH above
 * {@value #HIGH_SUDDEN_CHANGE_Z}. A trend reversal is a crossover of the
 * {@value #SHORT_WINDOW}-point and {@value #LONG_WINDOW}-point trailing moving averages; it is
 * HIGH when the point moved more than {@value #HIGH_REVERSAL_MOVE} relative to the previous one.</p>
 */
public class SeriesAnomalyDetector {

    private static final Logger logger = LoggerFactory.getLogger(SeriesAnomalyDetector.class);

    public static final int MIN_POINTS = 3;
    public static final double SUDDEN_CHANGE_Z = 2.5;
    public static final double HIGH_SUDDEN_CHANGE_Z = 3.0;
    public static final int SHORT_WINDOW = 3;
    public static final int LONG_WINDOW = 5;
    public static final double HIGH_REVERSAL_MOVE = 0.2;

    public List<NumericWarning> detect(@NotNull MetricSeries series) {
        List<NumericWarning> warnings = new ArrayList<>();
        if (series.size() < MIN_POINTS) {
            return warnings;
        }
        double[] values = series.values();
        List<TimeSeriesPoint> points = series.points();

        double mean = new Mean().evaluate(values);
        double deviation = new StandardDeviation(false).evaluate(values);
        if (deviation > 0) {
            for (int i = 0; i < values.length; i++) {
                double z = Math.abs(values[i] - mean) / deviation;
                if (z > SUDDEN_CHANGE_Z) {
                    warnings.add(new NumericWarning(
                        NumericWarning.Kind.SUDDEN_CHANGE,
                        series.concept(),
                        values[i],
                        z > HIGH_SUDDEN_CHANGE_Z ? NumericWarning.Severity.HIGH : NumericWarning.Severity.MEDIUM,
                        String.format(Locale.ROOT, "Sudden change in %s at %s: %.2f (z-score %.2f)",
                            series.concept(), points.get(i).period(), values[i], z)));
                }
            }
        }

        // the long average first exists at LONG_WINDOW - 1, so a crossover needs one more point
        for (int i = LONG_WINDOW; i < values.length; i++) {
            double shortBefore = trailingMean(values, i - 1, SHORT_WINDOW);
            double longBefore = trailingMean(values, i - 1, LONG_WINDOW);
            double shortNow = trailingMean(values, i, SHORT_WINDOW);
            double longNow = trailingMean(values, i, LONG_WINDOW);
            boolean crossedUp = shortBefore <= longBefore && shortNow > longNow;
            boolean crossedDown = shortBefore >= longBefore && shortNow < longNow;
            if (crossedUp || crossedDown) {
                warnings.add(new NumericWarning(
                    NumericWarning.Kind.TREND_REVERSAL,
                    series.concept(),
                    values[i],
                    isLargeMove(values[i - 1], values[i]) ? NumericWarning.Severity.HIGH : NumericWarning.Severity.MEDIUM,
                    String.format(Locale.ROOT, "Trend reversal in %s at %s: moving averages crossed %s",
                        series.concept(), points.get(i).period(), crossedUp ? "upwards" : "downwards")));
            }
        }

        if (!warnings.isEmpty()) {
            logger.debug("Detected {} series anomalies in {}", warnings.size(), series.concept());
        }
        return warnings;
    }

    public List<NumericWarning> detectAll(@NotNull Iterable<MetricSeries> series) {
        List<NumericWarning> warnings = new ArrayList<>();
        for (MetricSeries one : series) {
            warnings.addAll(detect(one));
        }
        return warnings;
    }

    /**
     * How much weight the detected warnings deserve: 0 without warnings, otherwise 0.5 raised by
     * 0.1 per warning and by another 0.1 per HIGH warning, capped at 0.9.
     */
    public static double confidence(@NotNull List<NumericWarning> warnings) {
        if (warnings.isEmpty()) {
            return 0.0;
        }
        long high = warnings.stream().filter(w -> w.severity() == NumericWarning.Severity.HIGH).count();
        return Math.min(0.9, 0.5 + warnings.size() * 0.1 + high * 0.1);
    }

    private static double trailingMean(double[] values, int end, int window) {
        return new Mean().evaluate(Arrays.copyOfRange(values, end - window + 1, end + 1));
    }

    private static boolean isLargeMove(double previous, double current) {
        if (previous == 0) {
            return current != 0;
        }
        return Math.abs(current - previous) / Math.abs(previous) > HIGH_REVERSAL_MOVE;
    }
}
