package br.edu.ifba.finrag.metrics;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static br.edu.ifba.finrag.metrics.FinancialConcept.*;

/**
 * Ratio formulas, each the quotient of a numerator expression and one snapshot concept.
 */
public enum FinancialRatio {

    CURRENT_RATIO(RatioCategory.LIQUIDITY, concept(CURRENT_ASSETS), CURRENT_LIABILITIES),
    QUICK_RATIO(RatioCategory.LIQUIDITY, FinancialRatio::quickAssets, CURRENT_LIABILITIES),
    CASH_RATIO(RatioCategory.LIQUIDITY, concept(CASH), CURRENT_LIABILITIES),

    GROSS_MARGIN(RatioCategory.PROFITABILITY, concept(GROSS_PROFIT), REVENUE),
    NET_MARGIN(RatioCategory.PROFITABILITY, concept(NET_INCOME), REVENUE),
    RETURN_ON_ASSETS(RatioCategory.PROFITABILITY, concept(NET_INCOME), TOTAL_ASSETS),
    RETURN_ON_EQUITY(RatioCategory.PROFITABILITY, concept(NET_INCOME), SHAREHOLDERS_EQUITY),

    DEBT_RATIO(RatioCategory.LEVERAGE, concept(TOTAL_DEBT), TOTAL_ASSETS),
    DEBT_TO_EQUITY(RatioCategory.LEVERAGE, concept(TOTAL_DEBT), SHAREHOLDERS_EQUITY),
    INTEREST_COVERAGE(RatioCategory.LEVERAGE, concept(EBIT), INTEREST_EXPENSE),

    ASSET_TURNOVER(RatioCategory.EFFICIENCY, concept(REVENUE), TOTAL_ASSETS),
    INVENTORY_TURNOVER(RatioCategory.EFFICIENCY, concept(COST_OF_GOODS_SOLD), INVENTORY),
    RECEIVABLES_TURNOVER(RatioCategory.EFFICIENCY, concept(REVENUE), ACCOUNTS_RECEIVABLE),

    PRICE_TO_EARNINGS(RatioCategory.VALUATION, concept(MARKET_CAP), NET_INCOME),
    PRICE_TO_BOOK(RatioCategory.VALUATION, concept(MARKET_CAP), BOOK_VALUE),
    EV_TO_EBITDA(RatioCategory.VALUATION, concept(ENTERPRISE_VALUE), EBITDA);

    private final RatioCategory category;
    private final Function<Map<String, Double>, Double> numerator;
    private final String denominator;

    FinancialRatio(RatioCategory category, Function<Map<String, Double>, Double> numerator, String denominator) {
        this.category = category;
        this.numerator = numerator;
        this.denominator = denominator;
    }

    /**
     * Snapshot key of the ratio, e.g. {@code current_ratio}.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public RatioCategory category() {
        return category;
    }

    public String denominatorConcept() {
        return denominator;
    }

    @Nullable
    Double numerator(Map<String, Double> snapshot) {
        return numerator.apply(snapshot);
    }

    public static Optional<FinancialRatio> fromKey(@NotNull String key) {
        for (FinancialRatio ratio : values()) {
            if (ratio.key().equalsIgnoreCase(key.trim())) {
                return Optional.of(ratio);
            }
        }
        return Optional.empty();
    }

    private static Function<Map<String, Double>, Double> concept(String name) {
        return snapshot -> snapshot.get(name);
    }

    // Missing inventory counts as zero
    private static Double quickAssets(Map<String, Double> snapshot) {
        Double currentAssets = snapshot.get(CURRENT_ASSETS);
        if (currentAssets == null) {
            return null;
        }
        return currentAssets - snapshot.getOrDefault(INVENTORY, 0.0);
    }
}
