package com.jay.riskengine.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Derived portfolio statistics. Always recomputed from trade history and the
 * current account state, never stored as the source of truth.
 */
@Value
@Builder
public class PortfolioMetrics {

    // Balances
    BigDecimal totalBalance;
    BigDecimal unrealizedPnl;
    BigDecimal totalValue;
    double totalReturnPct;

    // Risk-adjusted return
    double sharpeRatio;
    double returnVolatility;     // population stddev of per-trade returns
    double maxDrawdownPct;
    double currentDrawdownPct;
    BigDecimal var95;            // one-period historical VaR, in account currency (negative = loss)

    // Trade quality
    double winRatePct;
    double avgWinPct;
    double avgLossPct;
    double profitFactor;

    // Counts
    int totalTrades;
    int openPositions;
    int consecutiveLosses;

    /** Set when the sample is too small for Sharpe and VaR to be stable. */
    boolean lowSampleWarning;
}
