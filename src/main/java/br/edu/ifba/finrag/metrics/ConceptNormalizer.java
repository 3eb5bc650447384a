package br.edu.ifba.finrag.metrics;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps reported concept names (XBRL tags and their variants) onto canonical series names
 * and merges points that land on the same {@code (company, period, concept)}.
 */
public class ConceptNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(ConceptNormalizer.class);

    public static final String REVENUE = "Revenue";
    public static final String GROSS_PROFIT = "GrossProfit";
    public static final String OPERATING_INCOME = "OperatingIncome";
    public static final String NET_INCOME = "NetIncome";

    public static final Map<String, String> DEFAULT_ALIASES = Map.of(
        "Revenues", REVENUE,
        "SalesRevenueNet", REVENUE,
        "RevenueFromContractWithCustomerExcludingAssessedTax", REVENUE,
        "OperatingIncomeLoss", OPERATING_INCOME,
        "NetIncomeLoss", NET_INCOME
    );

    private final Map<String, String> aliases;

    public ConceptNormalizer() {
        this(DEFAULT_ALIASES);
    }

    public ConceptNormalizer(@NotNull Map<String, String> aliases) {
        this.aliases = Map.copyOf(aliases);
    }

    @NotNull
    public String canonicalName(@NotNull String concept) {
        return aliases.getOrDefault(concept, concept);
    }

    /**
     * Renames aliased concepts and sums duplicate points.
     *
     * @return one point per {@code (company, period, concept)}, in first-seen order
     */
    public List<TimeSeriesPoint> normalize(@NotNull List<TimeSeriesPoint> points) {
        Map<Key, TimeSeriesPoint> merged = new LinkedHashMap<>();
        int duplicates = 0;
        for (TimeSeriesPoint point : points) {
            TimeSeriesPoint canonical = point.withConcept(canonicalName(point.concept()));
            Key key = new Key(canonical.company(), canonical.period(), canonical.concept());
            TimeSeriesPoint existing = merged.get(key);
            if (existing == null) {
                merged.put(key, canonical);
            } else {
                duplicates++;
                merged.put(key, new TimeSeriesPoint(existing.company(), existing.period(),
                    existing.concept(), existing.value() + canonical.value()));
            }
        }
        if (duplicates > 0) {
            logger.debug("Summed {} duplicate points while normalizing {} points", duplicates, points.size());
        }
        return new ArrayList<>(merged.values());
    }

    private record Key(String company, FiscalPeriod period, String concept) {
    }
}
