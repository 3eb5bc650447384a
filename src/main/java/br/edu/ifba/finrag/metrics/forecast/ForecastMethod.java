package br.edu.ifba.finrag.metrics.forecast;

/**
 * Forecasting methods with the confidence score reported for their forecasts.
 */
public enum ForecastMethod {
    LINEAR(0.8),
    SEASONAL(0.9);

    private final double confidenceScore;

    ForecastMethod(double confidenceScore) {
        this.confidenceScore = confidenceScore;
    }

    public double confidenceScore() {
        return confidenceScore;
    }
}
