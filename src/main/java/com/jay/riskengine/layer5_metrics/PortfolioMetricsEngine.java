package com.jay.riskengine.layer5_metrics;

import com.jay.riskengine.config.EngineConfig;
import com.jay.riskengine.model.AccountState;
import com.jay.riskengine.model.MetricsResult;
import com.jay.riskengine.model.PortfolioMetrics;
import com.jay.riskengine.model.Position;
import com.jay.riskengine.model.TradeRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.List;

/**
 * Layer 5 — Portfolio Metrics Engine.
 * Derives risk and performance statistics from the closed-trade sequence and the
 * current account. Read-only; the same inputs always give the same result.
 *
 * Per-trade return r = pnlPercent / 100.
 * - Sharpe       : mean(r − rf) / stddev(r), population stddev; 0 when stddev is 0
 * - Max drawdown : worst peak-to-trough fall of Π(1 + r), peak seeded by the first trade
 * - VaR 95       : 5th percentile of r (linear interpolation) × current balance
 * - Profit factor: Σ winning pnlPercent / |Σ losing pnlPercent|; 0 when there are no losses
 *
 * Sharpe and VaR are noisy on short histories; results below
 * {@code metrics.min_reliable_sample_size} trades carry {@code lowSampleWarning}.
 */
@Service
@RequiredArgsConstructor
public class PortfolioMetricsEngine {

    public static final int MIN_TRADES = 2;

    private final EngineConfig config;

    public MetricsResult compute(List<TradeRecord> trades, AccountState account, List<Position> openPositions) {
        if (trades.size() < MIN_TRADES) {
            return MetricsResult.insufficientData(trades.size());
        }

        double[] returns = trades.stream().mapToDouble(TradeRecord::returnFraction).toArray();
        double riskFree = config.metrics().getRiskFreeRatePerTrade();

        double mean = mean(returns);
        double stdDev = populationStdDev(returns, mean);
        double sharpe = stdDev > 0 ? (mean - riskFree) / stdDev : 0;

        double[] winPcts = trades.stream().filter(TradeRecord::isWin)
            .mapToDouble(t -> t.pnlPercent().doubleValue()).toArray();
        double[] lossPcts = trades.stream().filter(TradeRecord::isLoss)
            .mapToDouble(t -> t.pnlPercent().doubleValue()).toArray();
        double grossWins = Arrays.stream(winPcts).sum();
        double grossLosses = Math.abs(Arrays.stream(lossPcts).sum());

        BigDecimal unrealized = openPositions.stream()
            .map(Position::getUnrealizedPnl)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal balance = account.currentBalance();
        double percentile = percentile(returns, config.metrics().getVarPercentile());

        PortfolioMetrics metrics = PortfolioMetrics.builder()
            .totalBalance(balance)
            .unrealizedPnl(unrealized)
            .totalValue(balance.add(unrealized))
            .totalReturnPct(totalReturnPct(account))
            .sharpeRatio(sharpe)
            .returnVolatility(stdDev)
            .maxDrawdownPct(maxDrawdown(returns) * 100)
            .currentDrawdownPct(account.currentDrawdown().doubleValue() * 100)
            .var95(BigDecimal.valueOf(percentile).multiply(balance).setScale(2, RoundingMode.HALF_EVEN))
            .winRatePct((double) winPcts.length / trades.size() * 100)
            .avgWinPct(winPcts.length > 0 ? grossWins / winPcts.length : 0)
            .avgLossPct(lossPcts.length > 0 ? Arrays.stream(lossPcts).sum() / lossPcts.length : 0)
            .profitFactor(grossLosses > 0 ? grossWins / grossLosses : 0)
            .totalTrades(trades.size())
            .openPositions(openPositions.size())
            .consecutiveLosses(account.consecutiveLosses())
            .lowSampleWarning(trades.size() < config.metrics().getMinReliableSampleSize())
            .build();
        return MetricsResult.available(metrics);
    }

    // ── Statistics helpers ────────────────────────────────────────────────────

    static double mean(double[] values) {
        return values.length == 0 ? 0 : Arrays.stream(values).sum() / values.length;
    }

    static double populationStdDev(double[] values, double mean) {
        if (values.length == 0) return 0;
        double sumSq = 0;
        for (double v : values) {
            sumSq += (v - mean) * (v - mean);
        }
        return Math.sqrt(sumSq / values.length);
    }

    /**
     * Largest fractional fall from a running peak of the compounded return curve.
     * The curve's first point is the value after the first trade, so the peak starts there.
     */
    static double maxDrawdown(double[] returns) {
        double value = 1.0;
        double peak = Double.NEGATIVE_INFINITY;
        double worst = 0;
        for (double r : returns) {
            value *= (1 + r);
            if (value > peak) peak = value;
            double dd = (peak - value) / peak;
            if (dd > worst) worst = dd;
        }
        return worst;
    }

    /** Percentile with linear interpolation between closest ranks; {@code pct} in [0, 100]. */
    static double percentile(double[] values, double pct) {
        if (values.length == 0) return 0;
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double rank = pct / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double weight = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * weight;
    }

    private static double totalReturnPct(AccountState account) {
        BigDecimal initial = account.initialBalance();
        if (initial.signum() == 0) return 0;
        return account.currentBalance().subtract(initial)
            .divide(initial, 10, RoundingMode.HALF_EVEN)
            .doubleValue() * 100;
    }
}
