package br.edu.ifba.finrag.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import br.edu.ifba.finrag.metrics.RatioAnomalyDetector;
import br.edu.ifba.finrag.metrics.RatioRange;

class FinRagProducersTest {

    private static FinRagConfig.Metrics.Range range(double min, double max) {
        return new FinRagConfig.Metrics.Range() {
            @Override
            public double min() {
                return min;
            }

            @Override
            public double max() {
                return max;
            }
        };
    }

    @Test
    void kebabCaseNamesBecomeRatioKeys() {
        Map<String, FinRagConfig.Metrics.Range> configured = new LinkedHashMap<>();
        configured.put("current-ratio", range(1.2, 2.8));
        configured.put("Debt-To-Equity", range(0.0, 1.5));

        Map<String, RatioRange> ranges = FinRagProducers.ratioRanges(configured);

        assertEquals(List.of("current_ratio", "debt_to_equity"), List.copyOf(ranges.keySet()));
        assertEquals(new RatioRange(1.2, 2.8), ranges.get("current_ratio"));
    }

    @Test
    void emptyConfigurationFallsBackToDefaults() {
        assertSame(RatioAnomalyDetector.DEFAULT_RANGES, FinRagProducers.ratioRanges(Map.of()));
    }

    @Test
    void unknownRatiosAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> FinRagProducers.ratioRanges(Map.of("happiness-ratio", range(0, 1))));
    }
}
