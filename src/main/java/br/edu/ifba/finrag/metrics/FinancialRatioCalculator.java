package br.edu.ifba.finrag.metrics;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Computes financial ratios from a {@code {concept: value}} snapshot.
 *
 * <p>A ratio is defined only when its numerator is present and its denominator is present
 * with an absolute value above {@link #EPSILON}. Undefined ratios are left out of the
 * result instead of being reported as infinite or NaN.</p>
 */
public class FinancialRatioCalculator {

    private static final Logger logger = LoggerFactory.getLogger(FinancialRatioCalculator.class);

    public static final double EPSILON = 1e-9;

    /**
     * Computes one ratio by key.
     *
     * @throws IllegalArgumentException if the key names no known ratio
     */
    public Optional<Double> computeRatio(@NotNull String ratioKey, @NotNull Map<String, Double> snapshot) {
        FinancialRatio ratio = FinancialRatio.fromKey(ratioKey)
            .orElseThrow(() -> new IllegalArgumentException("Unknown ratio: " + ratioKey));
        return computeRatio(ratio, snapshot);
    }

    public Optional<Double> computeRatio(@NotNull FinancialRatio ratio, @NotNull Map<String, Double> snapshot) {
        Double numerator = ratio.numerator(snapshot);
        Double denominator = snapshot.get(ratio.denominatorConcept());
        if (numerator == null || denominator == null || !isUsableDenominator(denominator)) {
            return Optional.empty();
        }
        double value = numerator / denominator;
        return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
    }

    /**
     * Computes every ratio of a category.
     *
     * @return defined ratios keyed by {@link FinancialRatio#key()}, in declaration order
     */
    public Map<String, Double> computeCategory(@NotNull RatioCategory category, @NotNull Map<String, Double> snapshot) {
        Map<String, Double> ratios = new LinkedHashMap<>();
        for (FinancialRatio ratio : FinancialRatio.values()) {
            if (ratio.category() == category) {
                computeRatio(ratio, snapshot).ifPresent(value -> ratios.put(ratio.key(), value));
            }
        }
        return ratios;
    }

    public Map<String, Double> computeAll(@NotNull Map<String, Double> snapshot) {
        Map<String, Double> ratios = new LinkedHashMap<>();
        for (RatioCategory category : RatioCategory.values()) {
            ratios.putAll(computeCategory(category, snapshot));
        }
        logger.debug("Computed {} of {} ratios from {} concepts",
            ratios.size(), FinancialRatio.values().length, snapshot.size());
        return ratios;
    }

    public static boolean isUsableDenominator(double denominator) {
        return Double.isFinite(denominator) && Math.abs(denominator) > EPSILON;
    }
}
