package br.edu.ifba.finrag.metrics;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Chronologically ordered points of a single {@code (company, concept)} pair, at most one
 * point per period. A series holds either quarters or annual periods, never both.
 */
public final class MetricSeries {

    private final String company;
    private final String concept;
    private final List<TimeSeriesPoint> points;

    private MetricSeries(String company, String concept, List<TimeSeriesPoint> points) {
        this.company = company;
        this.concept = concept;
        this.points = points;
    }

    /**
     * Builds a series, sorting the points by period.
     *
     * @throws IllegalArgumentException if the points mix companies, concepts or quarterly with
     *                                  annual periods, or repeat a period
     */
    public static MetricSeries of(@NotNull String company, @NotNull String concept, @NotNull List<TimeSeriesPoint> points) {
        Objects.requireNonNull(company, "company must not be null");
        Objects.requireNonNull(concept, "concept must not be null");

        List<TimeSeriesPoint> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparing(TimeSeriesPoint::period));
        for (int i = 0; i < sorted.size(); i++) {
            TimeSeriesPoint point = sorted.get(i);
            if (!company.equals(point.company()) || !concept.equals(point.concept())) {
                throw new IllegalArgumentException(String.format(
                    "Point %s/%s does not belong to series %s/%s",
                    point.company(), point.concept(), company, concept));
            }
            if (i > 0 && sorted.get(i - 1).period().equals(point.period())) {
                throw new IllegalArgumentException("Duplicate period " + point.period() + " in series " + concept);
            }
            if (i > 0 && sorted.get(0).period().isAnnual() != point.period().isAnnual()) {
                throw new IllegalArgumentException(String.format(
                    "Series %s mixes quarterly and annual periods (%s, %s)", concept, sorted.get(0).period(), point.period()));
            }
        }
        return new MetricSeries(company, concept, List.copyOf(sorted));
    }

    /**
     * Builds a series from plain values over consecutive periods starting at {@code first}.
     */
    public static MetricSeries ofValues(@NotNull String company, @NotNull String concept,
                                        @NotNull FiscalPeriod first, double... values) {
        List<TimeSeriesPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(new TimeSeriesPoint(company, first.plus(i), concept, values[i]));
        }
        return of(company, concept, points);
    }

    public String company() {
        return company;
    }

    public String concept() {
        return concept;
    }

    public List<TimeSeriesPoint> points() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).value();
        }
        return values;
    }

    /**
     * True when every point is an annual period.
     */
    public boolean isAnnual() {
        return !points.isEmpty() && points.stream().allMatch(p -> p.period().isAnnual());
    }

    public FiscalPeriod lastPeriod() {
        if (points.isEmpty()) {
            throw new IllegalStateException("Series " + concept + " is empty");
        }
        return points.get(points.size() - 1).period();
    }

    @Override
    public String toString() {
        return "MetricSeries{company='" + company + "', concept='" + concept + "', size=" + points.size() + '}';
    }
}
