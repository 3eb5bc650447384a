package br.edu.ifba.finrag.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import br.edu.ifba.finrag.metrics.NumericWarning.Kind;
import br.edu.ifba.finrag.metrics.NumericWarning.Severity;

class RatioAnomalyDetectorTest {

    private final RatioAnomalyDetector detector = new RatioAnomalyDetector();

    private static NumericWarning warning(Severity severity) {
        return new NumericWarning(Kind.RATIO_OUT_OF_RANGE, "current_ratio", 9.0, severity, "test");
    }

    @Nested
    @DisplayName("Detection")
    class Detection {

        @Test
        @DisplayName("ratios inside their range raise nothing")
        void healthyRatiosRaiseNothing() {
            List<NumericWarning> warnings = detector.detect(
                    Map.of("current_ratio", 2.0, "gross_margin", 0.4), Map.of());

            assertTrue(warnings.isEmpty());
        }

        @Test
        @DisplayName("slightly out of range is medium, far out of range is high")
        void severityGrowsWithDistance() {
            List<NumericWarning> slightly = detector.detect(Map.of("current_ratio", 3.5), Map.of());
            List<NumericWarning> far = detector.detect(Map.of("current_ratio", 5.0), Map.of());

            assertEquals(Severity.MEDIUM, slightly.get(0).severity());
            assertEquals(Severity.HIGH, far.get(0).severity());
            assertEquals(Kind.RATIO_OUT_OF_RANGE, far.get(0).kind());
            assertEquals("current_ratio", far.get(0).subject());
            assertTrue(far.get(0).message().contains("1.0-3.0"));
        }

        @Test
        @DisplayName("ratios without a range are not checked")
        void unrangedRatiosAreIgnored() {
            assertTrue(detector.detect(Map.of("asset_turnover", 42.0), Map.of()).isEmpty());
        }

        @Test
        @DisplayName("a near-zero denominator is reported once per concept")
        void nearZeroDenominatorReportedOnce() {
            List<NumericWarning> warnings = detector.detect(Map.of(), Map.of(
                    FinancialConcept.CURRENT_ASSETS, 100.0,
                    FinancialConcept.CURRENT_LIABILITIES, 0.0));

            assertEquals(1, warnings.size());
            assertEquals(Kind.NEAR_ZERO_DENOMINATOR, warnings.get(0).kind());
            assertEquals(FinancialConcept.CURRENT_LIABILITIES, warnings.get(0).subject());
            assertEquals(Severity.MEDIUM, warnings.get(0).severity());
        }

        @Test
        @DisplayName("negative values of normally positive concepts are high")
        void negativeValuesAreHigh() {
            List<NumericWarning> warnings = detector.detect(Map.of(), Map.of(FinancialConcept.REVENUE, -10.0));

            assertEquals(1, warnings.size());
            assertEquals(Kind.NEGATIVE_VALUE, warnings.get(0).kind());
            assertEquals(Severity.HIGH, warnings.get(0).severity());
        }

        @Test
        @DisplayName("custom ranges replace the defaults")
        void customRanges() {
            RatioAnomalyDetector strict = new RatioAnomalyDetector(Map.of("current_ratio", new RatioRange(2.0, 2.5)));

            assertEquals(1, strict.detect(Map.of("current_ratio", 1.5, "gross_margin", 0.95), Map.of()).size());
            assertThrows(IllegalArgumentException.class, () -> new RatioRange(3.0, 1.0));
        }
    }

    @Nested
    @DisplayName("Risk level")
    class Risk {

        @Test
        void noWarningsIsLow() {
            assertEquals(RiskLevel.LOW, RiskLevel.of(List.of()));
        }

        @Test
        void oneMediumIsMedium() {
            assertEquals(RiskLevel.MEDIUM, RiskLevel.of(List.of(warning(Severity.MEDIUM))));
        }

        @Test
        void threeMediumOrOneHighIsHigh() {
            assertEquals(RiskLevel.HIGH, RiskLevel.of(List.of(
                    warning(Severity.MEDIUM), warning(Severity.MEDIUM), warning(Severity.MEDIUM))));
            assertEquals(RiskLevel.HIGH, RiskLevel.of(List.of(warning(Severity.HIGH))));
        }

        @Test
        void threeHighIsCritical() {
            assertEquals(RiskLevel.CRITICAL, RiskLevel.of(List.of(
                    warning(Severity.HIGH), warning(Severity.HIGH), warning(Severity.HIGH))));
        }
    }
}
