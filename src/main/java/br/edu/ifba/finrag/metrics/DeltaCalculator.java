package br.edu.ifba.finrag.metrics;

import org.apache.commons.math3.util.Precision;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes quarter-over-quarter and year-over-year percentage changes.
 *
 * <p>QoQ compares a point with the one immediately before it in the series. YoY compares it
 * with the point of the period {@code lag} steps back: the configured quarterly lag for
 * quarters, one fiscal year for annual periods. A series never mixes quarters with annual
 * periods, so both comparisons stay at one granularity. A change is null when its base
 * point is missing or zero.</p>
 */
public class DeltaCalculator {

    private static final Logger logger = LoggerFactory.getLogger(DeltaCalculator.class);

    public static final int DEFAULT_QUARTERLY_YOY_LAG = 4;

    private final int quarterlyYoyLag;

    public DeltaCalculator() {
        this(DEFAULT_QUARTERLY_YOY_LAG);
    }

    public DeltaCalculator(int quarterlyYoyLag) {
        if (quarterlyYoyLag < 1) {
            throw new IllegalArgumentException("YoY lag must be >= 1, got " + quarterlyYoyLag);
        }
        this.quarterlyYoyLag = quarterlyYoyLag;
    }

    /**
     * One delta per point of the series, in period order. {@code derivedRatio} is left null.
     */
    public List<DeltaMetric> compute(@NotNull MetricSeries series) {
        List<TimeSeriesPoint> points = series.points();
        int yoyLag = series.isAnnual() ? 1 : quarterlyYoyLag;
        Map<FiscalPeriod, Double> byPeriod = new HashMap<>();
        for (TimeSeriesPoint point : points) {
            byPeriod.put(point.period(), point.value());
        }

        List<DeltaMetric> deltas = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            TimeSeriesPoint current = points.get(i);
            Double qoq = i >= 1 ? percentChange(current.value(), points.get(i - 1).value()) : null;
            Double yearBefore = byPeriod.get(current.period().plus(-yoyLag));
            Double yoy = yearBefore != null ? percentChange(current.value(), yearBefore) : null;
            deltas.add(new DeltaMetric(series.concept(), current.period(), current.value(), qoq, yoy, null));
        }
        return deltas;
    }

    /**
     * Computes the deltas of several concepts of one company and attaches the gross margin
     * of each period as {@code derivedRatio}.
     *
     * @param seriesByConcept series of one company; a concept may span several series when
     *                        its quarterly and annual points are kept apart
     */
    public List<DeltaMetric> computeAll(@NotNull Map<String, MetricSeries> seriesByConcept) {
        Map<FiscalPeriod, Double> grossMargins = grossMargins(
            valuesOf(seriesByConcept, ConceptNormalizer.GROSS_PROFIT),
            valuesOf(seriesByConcept, ConceptNormalizer.REVENUE));

        List<DeltaMetric> deltas = new ArrayList<>();
        for (MetricSeries series : seriesByConcept.values()) {
            for (DeltaMetric delta : compute(series)) {
                deltas.add(delta.withDerivedRatio(grossMargins.get(delta.period())));
            }
        }
        logger.debug("Computed {} deltas over {} concepts", deltas.size(), seriesByConcept.size());
        return deltas;
    }

    private static Map<FiscalPeriod, Double> valuesOf(Map<String, MetricSeries> seriesByConcept, String concept) {
        Map<FiscalPeriod, Double> values = new HashMap<>();
        for (MetricSeries series : seriesByConcept.values()) {
            if (concept.equals(series.concept())) {
                for (TimeSeriesPoint point : series.points()) {
                    values.put(point.period(), point.value());
                }
            }
        }
        return values;
    }

    private static Map<FiscalPeriod, Double> grossMargins(Map<FiscalPeriod, Double> grossProfit, Map<FiscalPeriod, Double> revenue) {
        Map<FiscalPeriod, Double> margins = new HashMap<>();
        grossProfit.forEach((period, value) -> {
            Double revenueValue = revenue.get(period);
            if (revenueValue != null && FinancialRatioCalculator.isUsableDenominator(revenueValue)) {
                margins.put(period, value / revenueValue);
            }
        });
        return margins;
    }

    /**
     * {@code (current / base - 1) * 100}, rounded to six decimals.
     *
     * @return the change in percent, or null when {@code base} is zero
     */
    @Nullable
    public static Double percentChange(double current, double base) {
        if (base == 0d) {
            return null;
        }
        double change = ((current / base) - 1d) * 100d;
        if (!Double.isFinite(change)) {
            return null;
        }
        return Precision.round(change, 6);
    }
}
