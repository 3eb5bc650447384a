package br.edu.ifba.finrag.metrics;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Overall data risk derived from the warnings of a summary.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Three or more HIGH warnings are critical; one HIGH or three MEDIUM are high; any
     * remaining warning is medium.
     */
    public static RiskLevel of(@NotNull List<NumericWarning> warnings) {
        long high = warnings.stream().filter(w -> w.severity() == NumericWarning.Severity.HIGH).count();
        long medium = warnings.size() - high;
        if (high >= 3) {
            return CRITICAL;
        }
        if (high >= 1 || medium >= 3) {
            return HIGH;
        }
        return medium >= 1 ? MEDIUM : LOW;
    }
}
