package br.edu.ifba.finrag.metrics.forecast;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import br.edu.ifba.finrag.metrics.FiscalPeriod;
import br.edu.ifba.finrag.metrics.MetricSeries;

class ForecastServiceTest {

    private static final FiscalPeriod START = FiscalPeriod.quarter(2022, 1);

    private final ForecastService service =
            new ForecastService(new LinearForecastStrategy(), new SeasonalForecastStrategy());

    private static MetricSeries quarterly(double... values) {
        return MetricSeries.ofValues("ACME", "Revenue", START, values);
    }

    @Nested
    @DisplayName("Linear")
    class Linear {

        @Test
        @DisplayName("extends a straight line with a zero-width band")
        void extendsStraightLine() {
            ForecastResult result = service.forecast(quarterly(100, 110, 120, 130), 2, ForecastMethod.LINEAR);

            assertEquals(ForecastMethod.LINEAR, result.method());
            assertEquals(0.8, result.confidenceScore());
            assertFalse(result.isDegraded());
            List<ForecastPoint> points = result.points();
            assertEquals(2, points.size());
            assertEquals(140.0, points.get(0).value(), 1e-9);
            assertEquals(150.0, points.get(1).value(), 1e-9);
            assertEquals(FiscalPeriod.quarter(2023, 1), points.get(0).period());
            assertEquals(points.get(0).value(), points.get(0).lowerBound(), 1e-9);
        }

        @Test
        @DisplayName("noisy history widens the band around the value")
        void noisyHistoryWidensBand() {
            ForecastPoint next = service.forecast(quarterly(100, 130, 110, 140), 1, ForecastMethod.LINEAR).points().get(0);

            assertTrue(next.lowerBound() < next.value());
            assertTrue(next.upperBound() > next.value());
            assertEquals(next.value() - next.lowerBound(), next.upperBound() - next.value(), 1e-9);
        }

        @Test
        @DisplayName("a single point is carried forward")
        void singlePointIsFlat() {
            ForecastResult result = service.forecast(quarterly(75), 3, ForecastMethod.LINEAR);

            assertTrue(result.points().stream().allMatch(p -> p.value() == 75.0));
        }

        @Test
        @DisplayName("empty history and non-positive horizons are rejected")
        void invalidInputsAreRejected() {
            assertThrows(IllegalArgumentException.class, () -> service.forecast(quarterly(), 1, ForecastMethod.LINEAR));
            assertThrows(IllegalArgumentException.class, () -> service.forecast(quarterly(1, 2), 0, ForecastMethod.LINEAR));
        }
    }

    @Nested
    @DisplayName("Seasonal")
    class Seasonal {

        private final MetricSeries twoYears = quarterly(10, 20, 30, 40, 12, 22, 32, 42);

        @Test
        @DisplayName("two years of quarters use the seasonal model")
        void twoYearsUseSeasonalModel() {
            ForecastResult result = service.forecast(twoYears, 4, ForecastMethod.SEASONAL);

            assertEquals(ForecastMethod.SEASONAL, result.method());
            assertEquals(0.9, result.confidenceScore());
            List<ForecastPoint> points = result.points();
            assertEquals(4, points.size());
            assertEquals(FiscalPeriod.quarter(2024, 1), points.get(0).period());
            assertTrue(points.get(3).value() > points.get(0).value(), "seasonal shape should repeat");
        }

        @Test
        @DisplayName("short history degrades to linear")
        void shortHistoryDegrades() {
            ForecastResult result = service.forecast(quarterly(10, 20, 30, 40, 50), 2, ForecastMethod.SEASONAL);

            assertEquals(ForecastMethod.SEASONAL, result.requestedMethod());
            assertEquals(ForecastMethod.LINEAR, result.method());
            assertEquals(0.8, result.confidenceScore());
            assertTrue(result.isDegraded());
        }

        @Test
        @DisplayName("annual history degrades to linear")
        void annualHistoryDegrades() {
            MetricSeries annual = MetricSeries.ofValues("ACME", "Revenue", FiscalPeriod.annual(2015),
                    1, 2, 3, 4, 5, 6, 7, 8, 9);

            assertEquals(ForecastMethod.LINEAR, service.forecast(annual, 1, ForecastMethod.SEASONAL).method());
        }

        @Test
        @DisplayName("a missing seasonal capability degrades to linear")
        void missingCapabilityDegrades() {
            ForecastService linearOnly = new ForecastService(new LinearForecastStrategy(), null);

            ForecastResult result = linearOnly.forecast(twoYears, 1, ForecastMethod.SEASONAL);

            assertFalse(linearOnly.isSeasonalAvailable());
            assertEquals(ForecastMethod.LINEAR, result.method());
        }

        @Test
        @DisplayName("a failing seasonal model degrades to linear")
        void failingModelDegrades() {
            ForecastStrategy failing = mock(ForecastStrategy.class);
            when(failing.method()).thenReturn(ForecastMethod.SEASONAL);
            when(failing.supports(any())).thenReturn(true);
            when(failing.forecast(any(), anyInt())).thenThrow(new ArithmeticException("diverged"));

            ForecastResult result = new ForecastService(new LinearForecastStrategy(), failing)
                    .forecast(twoYears, 1, ForecastMethod.SEASONAL);

            assertEquals(ForecastMethod.LINEAR, result.method());
        }

        @Test
        @DisplayName("smoothing factors must lie strictly between 0 and 1")
        void smoothingFactorsAreValidated() {
            assertThrows(IllegalArgumentException.class, () -> new SeasonalForecastStrategy(0.0, 0.1, 0.3));
            assertThrows(IllegalArgumentException.class, () -> new SeasonalForecastStrategy(0.5, 1.0, 0.3));
        }
    }
}
