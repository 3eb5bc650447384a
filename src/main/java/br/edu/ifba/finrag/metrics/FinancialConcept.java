package br.edu.ifba.finrag.metrics;

import java.util.List;

/**
 * Keys of a financial snapshot, i.e. the {@code {concept: value}} map ratios are computed from.
 */
public final class FinancialConcept {

    public static final String CURRENT_ASSETS = "current_assets";
    public static final String CURRENT_LIABILITIES = "current_liabilities";
    public static final String INVENTORY = "inventory";
    public static final String CASH = "cash";
    public static final String REVENUE = "revenue";
    public static final String GROSS_PROFIT = "gross_profit";
    public static final String NET_INCOME = "net_income";
    public static final String TOTAL_ASSETS = "total_assets";
    public static final String SHAREHOLDERS_EQUITY = "shareholders_equity";
    public static final String TOTAL_DEBT = "total_debt";
    public static final String EBIT = "ebit";
    public static final String INTEREST_EXPENSE = "interest_expense";
    public static final String ACCOUNTS_RECEIVABLE = "accounts_receivable";
    public static final String COST_OF_GOODS_SOLD = "cost_of_goods_sold";
    public static final String MARKET_CAP = "market_cap";
    public static final String BOOK_VALUE = "book_value";
    public static final String EBITDA = "ebitda";
    public static final String ENTERPRISE_VALUE = "enterprise_value";

    /** Concepts whose negative values indicate a data quality problem. */
    public static final List<String> NORMALLY_POSITIVE = List.of(
        TOTAL_ASSETS, REVENUE, CURRENT_ASSETS, SHAREHOLDERS_EQUITY, INVENTORY, CASH);

    private FinancialConcept() {
    }
}
