package br.edu.ifba.finrag.metrics;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE,
    /** Not enough points to fit a trend. */
    UNKNOWN;

    public static TrendDirection ofSlope(double slope) {
        if (slope > 0) {
            return INCREASING;
        }
        if (slope < 0) {
            return DECREASING;
        }
        return STABLE;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
