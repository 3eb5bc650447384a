package br.edu.ifba.finrag.metrics;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Flags ratios outside their configured normal range, denominators too close to zero,
 * and negative values of concepts that are normally positive.
 */
public class RatioAnomalyDetector {

    private static final Logger logger = LoggerFactory.getLogger(RatioAnomalyDetector.class);

    /** Ranges used when configuration supplies none. Pending product-owner review. */
    public static final Map<String, RatioRange> DEFAULT_RANGES = defaultRanges();

    private final Map<String, RatioRange> ranges;

    public RatioAnomalyDetector() {
        this(DEFAULT_RANGES);
    }

    /**
     * @param ranges normal ranges keyed by ratio key, e.g. {@code current_ratio}
     */
    public RatioAnomalyDetector(@NotNull Map<String, RatioRange> ranges) {
        this.ranges = Collections.unmodifiableMap(new LinkedHashMap<>(ranges));
    }

    public Map<String, RatioRange> getRanges() {
        return ranges;
    }

    /**
     * @param ratios   computed ratios keyed by ratio key
     * @param snapshot the snapshot they were computed from
     */
    public List<NumericWarning> detect(@NotNull Map<String, Double> ratios, @NotNull Map<String, Double> snapshot) {
        List<NumericWarning> warnings = new ArrayList<>();

        for (Map.Entry<String, RatioRange> entry : ranges.entrySet()) {
            Double value = ratios.get(entry.getKey());
            RatioRange range = entry.getValue();
            if (value != null && !range.contains(value)) {
                warnings.add(new NumericWarning(
                    NumericWarning.Kind.RATIO_OUT_OF_RANGE,
                    entry.getKey(),
                    value,
                    range.severityOf(value),
                    String.format(Locale.ROOT, "%s of %.2f is outside normal range (%s)", entry.getKey(), value, range)));
            }
        }

        Set<String> reported = new HashSet<>();
        for (FinancialRatio ratio : FinancialRatio.values()) {
            String concept = ratio.denominatorConcept();
            Double denominator = snapshot.get(concept);
            if (denominator != null && !FinancialRatioCalculator.isUsableDenominator(denominator) && reported.add(concept)) {
                warnings.add(new NumericWarning(
                    NumericWarning.Kind.NEAR_ZERO_DENOMINATOR,
                    concept,
                    denominator,
                    NumericWarning.Severity.MEDIUM,
                    String.format("%s is too close to zero to divide by; dependent ratios omitted", concept)));
            }
        }

        for (String concept : FinancialConcept.NORMALLY_POSITIVE) {
            Double value = snapshot.get(concept);
            if (value != null && value < 0) {
                warnings.add(new NumericWarning(
                    NumericWarning.Kind.NEGATIVE_VALUE,
                    concept,
                    value,
                    NumericWarning.Severity.HIGH,
                    String.format(Locale.ROOT, "%s is negative (%.2f)", concept, value)));
            }
        }

        if (!warnings.isEmpty()) {
            logger.info("Detected {} numeric anomalies", warnings.size());
        }
        return warnings;
    }

    private static Map<String, RatioRange> defaultRanges() {
        Map<String, RatioRange> ranges = new LinkedHashMap<>();
        ranges.put(FinancialRatio.CURRENT_RATIO.key(), new RatioRange(1.0, 3.0));
        ranges.put(FinancialRatio.QUICK_RATIO.key(), new RatioRange(0.5, 2.0));
        ranges.put(FinancialRatio.DEBT_TO_EQUITY.key(), new RatioRange(0.0, 2.0));
        ranges.put(FinancialRatio.GROSS_MARGIN.key(), new RatioRange(0.1, 0.8));
        ranges.put(FinancialRatio.NET_MARGIN.key(), new RatioRange(0.0, 0.3));
        ranges.put(FinancialRatio.RETURN_ON_EQUITY.key(), new RatioRange(0.0, 0.5));
        ranges.put(FinancialRatio.RETURN_ON_ASSETS.key(), new RatioRange(0.0, 0.2));
        return ranges;
    }
}
