package br.edu.ifba.finrag.metrics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;

import java.util.Comparator;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A fiscal reporting period: a quarter of a fiscal year, or the whole year.
 *
 * <p>Ordered chronologically; within a year the annual period sorts after its quarters.</p>
 *
 * @param year    fiscal year
 * @param quarter 1..4, or 0 for an annual period
 */
public record FiscalPeriod(int year, int quarter) implements Comparable<FiscalPeriod> {

    private static final Pattern YEAR_QUARTER = Pattern.compile("^(\\d{4})\\s*-?\\s*Q([1-4])$");
    private static final Pattern QUARTER_YEAR = Pattern.compile("^Q([1-4])\\s*-?\\s*(\\d{4})$");
    private static final Pattern ANNUAL = Pattern.compile("^(?:FY\\s*)?(\\d{4})$");

    private static final Comparator<FiscalPeriod> CHRONOLOGICAL =
            Comparator.comparingInt(FiscalPeriod::year)
                    .thenComparingInt(p -> p.isAnnual() ? 5 : p.quarter());

    public FiscalPeriod {
        if (quarter < 0 || quarter > 4) {
            throw new IllegalArgumentException("quarter must be within 0..4, got " + quarter);
        }
    }

    public static FiscalPeriod quarter(int year, int quarter) {
        if (quarter == 0) {
            throw new IllegalArgumentException("quarter must be within 1..4");
        }
        return new FiscalPeriod(year, quarter);
    }

    public static FiscalPeriod annual(int year) {
        return new FiscalPeriod(year, 0);
    }

    /**
     * Parses labels such as {@code 2023Q1}, {@code 2023-Q1}, {@code Q1 2023}, {@code FY2023}
     * or {@code 2023}.
     *
     * @throws IllegalArgumentException if the label matches none of the formats
     */
    @JsonCreator
    public static FiscalPeriod parse(@NotNull String label) {
        String normalized = label.trim().toUpperCase(Locale.ROOT);

        Matcher matcher = YEAR_QUARTER.matcher(normalized);
        if (matcher.matches()) {
            return quarter(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
        }
        matcher = QUARTER_YEAR.matcher(normalized);
        if (matcher.matches()) {
            return quarter(Integer.parseInt(matcher.group(2)), Integer.parseInt(matcher.group(1)));
        }
        matcher = ANNUAL.matcher(normalized);
        if (matcher.matches()) {
            return annual(Integer.parseInt(matcher.group(1)));
        }
        throw new IllegalArgumentException("Unrecognized fiscal period: '" + label + "'");
    }

    public boolean isAnnual() {
        return quarter == 0;
    }

    /**
     * The period {@code steps} periods later at the same granularity.
     */
    public FiscalPeriod plus(int steps) {
        if (isAnnual()) {
            return annual(year + steps);
        }
        int zeroBased = year * 4 + (quarter - 1) + steps;
        return quarter(Math.floorDiv(zeroBased, 4), Math.floorMod(zeroBased, 4) + 1);
    }

    @Override
    public int compareTo(@NotNull FiscalPeriod other) {
        return CHRONOLOGICAL.compare(this, other);
    }

    @JsonValue
    @Override
    public String toString() {
        return isAnnual() ? "FY" + year : year + "Q" + quarter;
    }
}
