package br.edu.ifba.finrag.metrics;

/**
 * Inclusive normal range of a ratio.
 */
public record RatioRange(double min, double max) {

    public RatioRange {
        if (!(min <= max)) {
            throw new IllegalArgumentException("min must not exceed max, got [" + min + ", " + max + "]");
        }
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    /**
     * HIGH when the value lies further from the midpoint than the width of the range.
     */
    public NumericWarning.Severity severityOf(double value) {
        double midpoint = (min + max) / 2;
        return Math.abs(value - midpoint) > (max - min)
            ? NumericWarning.Severity.HIGH
            : NumericWarning.Severity.MEDIUM;
    }

    @Override
    public String toString() {
        return min + "-" + max;
    }
}
