package br.edu.ifba.finrag.metrics;

public enum RatioCategory {
    LIQUIDITY,
    PROFITABILITY,
    LEVERAGE,
    EFFICIENCY,
    VALUATION
}
