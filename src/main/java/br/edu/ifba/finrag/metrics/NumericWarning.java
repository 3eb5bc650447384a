package br.edu.ifba.finrag.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Data quality annotation on a metrics result. Warnings never stop a computation.
 *
 * @param kind     what was detected
 * @param subject  ratio key, snapshot concept or series concept the warning is about
 * @param value    offending value, when there is one
 * @param severity how far the value is from normal
 * @param message  human-readable description
 */
public record NumericWarning(
        @JsonProperty("kind") @NotNull Kind kind,
        @JsonProperty("subject") @NotNull String subject,
        @JsonProperty("value") @Nullable Double value,
        @JsonProperty("severity") @NotNull Severity severity,
        @JsonProperty("message") @NotNull String message) {

    public enum Kind {
        RATIO_OUT_OF_RANGE,
        NEAR_ZERO_DENOMINATOR,
        NEGATIVE_VALUE,
        SUDDEN_CHANGE,
        TREND_REVERSAL
    }

    public enum Severity {
        MEDIUM,
        HIGH
    }
}
