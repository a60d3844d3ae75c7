package com.jay.riskengine.model;

/** Portfolio metrics, or the number of trades available when there are too few to compute them. */
public record MetricsResult(PortfolioMetrics metrics, int tradeCount) {

    public static MetricsResult available(PortfolioMetrics metrics) {
        return new MetricsResult(metrics, metrics.getTotalTrades());
    }

    public static MetricsResult insufficientData(int tradeCount) {
        return new MetricsResult(null, tradeCount);
    }

    public boolean isAvailable() {
        return metrics != null;
    }

    public boolean isInsufficientData() {
        return metrics == null;
    }
}
