package br.edu.ifba.finrag.metrics;

import br.edu.ifba.finrag.metrics.forecast.ForecastMethod;
import br.edu.ifba.finrag.metrics.forecast.ForecastResult;
import br.edu.ifba.finrag.metrics.forecast.ForecastService;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Facade over the metrics calculators. Every operation is a pure function of its inputs.
 */
public class MetricsEngine {

    private static final Logger logger = LoggerFactory.getLogger(MetricsEngine.class);

    private final ConceptNormalizer normalizer;
    private final FinancialRatioCalculator ratioCalculator;
    private final DeltaCalculator deltaCalculator;
    private final TrendAnalyzer trendAnalyzer;
    private final RatioAnomalyDetector anomalyDetector;
    private final SeriesAnomalyDetector seriesAnomalyDetector;
    private final ForecastService forecastService;

    public MetricsEngine(
            @NotNull ConceptNormalizer normalizer,
            @NotNull FinancialRatioCalculator ratioCalculator,
            @NotNull DeltaCalculator deltaCalculator,
            @NotNull TrendAnalyzer trendAnalyzer,
            @NotNull RatioAnomalyDetector anomalyDetector,
            @NotNull SeriesAnomalyDetector seriesAnomalyDetector,
            @NotNull ForecastService forecastService) {
        this.normalizer = normalizer;
        this.ratioCalculator = ratioCalculator;
        this.deltaCalculator = deltaCalculator;
        this.trendAnalyzer = trendAnalyzer;
        this.anomalyDetector = anomalyDetector;
        this.seriesAnomalyDetector = seriesAnomalyDetector;
        this.forecastService = forecastService;
    }

    /**
     * Summarizes one company.
     *
     * @param company  company to summarize; points of other companies are ignored
     * @param points   reported values, in any order, possibly with aliased concepts
     * @param snapshot latest balance sheet and income statement values for ratios, may be null
     */
    public FinancialSummary summarize(
            @NotNull String company,
            @NotNull List<TimeSeriesPoint> points,
            @Nullable Map<String, Double> snapshot) {
        Map<String, MetricSeries> seriesByConcept = seriesOf(company, points);

        List<DeltaMetric> deltas = deltaCalculator.computeAll(seriesByConcept);
        List<TrendResult> trends = new ArrayList<>(seriesByConcept.size());
        for (MetricSeries series : seriesByConcept.values()) {
            trends.add(trendAnalyzer.analyze(series));
        }

        Map<String, Double> facts = snapshot != null ? snapshot : Map.of();
        Map<String, Double> ratios = ratioCalculator.computeAll(facts);
        List<NumericWarning> warnings = new ArrayList<>(anomalyDetector.detect(ratios, facts));
        warnings.addAll(seriesAnomalyDetector.detectAll(seriesByConcept.values()));

        logger.info("Summarized {}: {} concepts, {} ratios, {} warnings",
            company, seriesByConcept.size(), ratios.size(), warnings.size());
        return new FinancialSummary(company, ratios, deltas, trends, warnings, RiskLevel.of(warnings),
            SeriesAnomalyDetector.confidence(warnings));
    }

    /**
     * Groups a company's points into one series per canonical concept, ordered by key.
     *
     * <p>A concept reported both quarterly and annually yields two series: the quarters under
     * the concept name and the annual periods under {@link #annualKey(String)}.</p>
     */
    public Map<String, MetricSeries> seriesOf(@NotNull String company, @NotNull List<TimeSeriesPoint> points) {
        List<TimeSeriesPoint> ofCompany = points.stream()
            .filter(point -> company.equals(point.company()))
            .toList();

        Map<String, List<TimeSeriesPoint>> quarterly = new TreeMap<>();
        Map<String, List<TimeSeriesPoint>> annual = new TreeMap<>();
        for (TimeSeriesPoint point : normalizer.normalize(ofCompany)) {
            Map<String, List<TimeSeriesPoint>> target = point.period().isAnnual() ? annual : quarterly;
            target.computeIfAbsent(point.concept(), concept -> new ArrayList<>()).add(point);
        }

        Map<String, MetricSeries> series = new TreeMap<>();
        quarterly.forEach((concept, conceptPoints) ->
            series.put(concept, MetricSeries.of(company, concept, conceptPoints)));
        annual.forEach((concept, conceptPoints) ->
            series.put(quarterly.containsKey(concept) ? annualKey(concept) : concept,
                MetricSeries.of(company, concept, conceptPoints)));
        return series;
    }

    /**
     * Key of the annual series of a concept that is also reported quarterly.
     */
    public static String annualKey(@NotNull String concept) {
        return concept + "@FY";
    }

    public Map<String, Double> ratios(@NotNull Map<String, Double> snapshot) {
        return ratioCalculator.computeAll(snapshot);
    }

    public TrendResult trend(@NotNull MetricSeries series) {
        return trendAnalyzer.analyze(series);
    }

    public ForecastResult forecast(@NotNull MetricSeries series, int horizon, @NotNull ForecastMethod method) {
        return forecastService.forecast(series, horizon, method);
    }
}
