package com.jay.riskengine.layer5_metrics;

import com.jay.riskengine.config.EngineConfig;
import com.jay.riskengine.model.AccountState;
import com.jay.riskengine.model.MetricsResult;
import com.jay.riskengine.model.PortfolioMetrics;
import com.jay.riskengine.model.Position;
import com.jay.riskengine.model.TradeRecord;
import com.jay.riskengine.model.enums.PositionSide;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.jay.riskengine.TestEngines.bd;
import static com.jay.riskengine.TestEngines.trade;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PortfolioMetricsEngineTest {

    private final PortfolioMetricsEngine engine = new PortfolioMetricsEngine(new EngineConfig());
    private final AccountState flat = AccountState.initial(bd("10000"));

    private static final List<TradeRecord> MIXED = List.of(
        trade("100", "10"), trade("-50", "-5"), trade("50", "5"), trade("-100", "-10"));

    @Nested
    @DisplayName("insufficient data")
    class InsufficientData {

        @Test
        @DisplayName("no trades")
        void empty() {
            MetricsResult result = engine.compute(List.of(), flat, List.of());

            assertThat(result.isInsufficientData()).isTrue();
            assertThat(result.tradeCount()).isZero();
        }

        @Test
        @DisplayName("one trade")
        void single() {
            MetricsResult result = engine.compute(List.of(trade("10", "1")), flat, List.of());

            assertThat(result.isInsufficientData()).isTrue();
            assertThat(result.tradeCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("mixed history: +10%, -5%, +5%, -10%")
    class Mixed {

        private final PortfolioMetrics m = engine.compute(MIXED, flat, List.of()).metrics();

        @Test
        @DisplayName("trade quality")
        void tradeQuality() {
            assertThat(m.getWinRatePct()).isCloseTo(50.0, within(1e-9));
            assertThat(m.getAvgWinPct()).isCloseTo(7.5, within(1e-9));
            assertThat(m.getAvgLossPct()).isCloseTo(-7.5, within(1e-9));
            assertThat(m.getProfitFactor()).isCloseTo(1.0, within(1e-9));
            assertThat(m.getTotalTrades()).isEqualTo(4);
        }

        @Test
        @DisplayName("Sharpe on population stddev, net of the per-trade risk-free rate")
        void sharpe() {
            double stdDev = Math.sqrt(0.00625);
            assertThat(m.getReturnVolatility()).isCloseTo(stdDev, within(1e-12));
            assertThat(m.getSharpeRatio()).isCloseTo(-0.000003 / stdDev, within(1e-9));
        }

        @Test
        @DisplayName("max drawdown of the compounded curve from 1.0")
        void maxDrawdown() {
            // 1.1 → 1.045 → 1.09725 → 0.987525; worst fall from the 1.1 peak
            assertThat(m.getMaxDrawdownPct()).isCloseTo(10.225, within(1e-9));
        }

        @Test
        @DisplayName("VaR 95 is the interpolated 5th percentile times the balance")
        void var95() {
            assertThat(m.getVar95()).isEqualByComparingTo("-925.00");
            assertThat(m.getVar95().scale()).isEqualTo(2);
        }

        @Test
        @DisplayName("short history carries the low-sample warning")
        void lowSample() {
            assertThat(m.isLowSampleWarning()).isTrue();
        }
    }

    @Test
    @DisplayName("identical returns: Sharpe 0, no losses → profit factor 0")
    void degenerateInputs() {
        PortfolioMetrics m = engine.compute(List.of(trade("5", "5"), trade("5", "5")), flat, List.of()).metrics();

        assertThat(m.getSharpeRatio()).isZero();
        assertThat(m.getProfitFactor()).isZero();
        assertThat(m.getWinRatePct()).isCloseTo(100.0, within(1e-9));
        assertThat(m.getMaxDrawdownPct()).isZero();
        assertThat(m.getAvgLossPct()).isZero();
    }

    @Test
    @DisplayName("balances reflect the account and the open book")
    void balances() {
        AccountState account = AccountState.of(bd("10000"), bd("10500"), bd("11000"), 0);
        Position open = Position.builder()
            .positionId(9).symbol("BTC").side(PositionSide.LONG)
            .entryPrice(bd("100")).quantity(bd("2")).stopLoss(bd("95")).takeProfit(bd("110"))
            .build();
        open.markToMarket(bd("103"));

        PortfolioMetrics m = engine.compute(MIXED, account, List.of(open)).metrics();

        assertThat(m.getTotalBalance()).isEqualByComparingTo("10500");
        assertThat(m.getUnrealizedPnl()).isEqualByComparingTo("6");
        assertThat(m.getTotalValue()).isEqualByComparingTo("10506");
        assertThat(m.getTotalReturnPct()).isCloseTo(5.0, within(1e-9));
        assertThat(m.getCurrentDrawdownPct()).isCloseTo(100.0 * 500 / 11000, within(1e-6));
        assertThat(m.getOpenPositions()).isEqualTo(1);
    }

    @Test
    @DisplayName("enough trades clears the low-sample warning")
    void reliableSample() {
        List<TradeRecord> trades = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            trades.add(i % 3 == 0 ? trade("-20", "-2") : trade("30", "3"));
        }

        assertThat(engine.compute(trades, flat, List.of()).metrics().isLowSampleWarning()).isFalse();
    }

    @Test
    @DisplayName("same inputs, same result")
    void deterministic() {
        assertThat(engine.compute(MIXED, flat, List.of()))
            .isEqualTo(engine.compute(MIXED, flat, List.of()));
    }

    @Test
    @DisplayName("drawdown curve starts at the first trade: an opening loss alone is no drawdown")
    void drawdownSeededByFirstTrade() {
        assertThat(PortfolioMetricsEngine.maxDrawdown(new double[]{-0.10, 0.05})).isZero();
        assertThat(PortfolioMetricsEngine.maxDrawdown(new double[]{-0.10, -0.10})).isCloseTo(0.10, within(1e-12));
        assertThat(PortfolioMetricsEngine.maxDrawdown(new double[]{0.05, -0.10})).isCloseTo(0.10, within(1e-12));
    }

    @Test
    @DisplayName("history opening with losses reports drawdown from the first mark")
    void openingLossesMetrics() {
        PortfolioMetrics m = engine.compute(List.of(trade("-100", "-10"), trade("50", "5")), flat, List.of()).metrics();

        assertThat(m.getMaxDrawdownPct()).isZero();
    }

    @Test
    @DisplayName("percentile interpolates between closest ranks")
    void percentile() {
        double[] values = {5, 1, 4, 2, 3};

        assertThat(PortfolioMetricsEngine.percentile(values, 0)).isEqualTo(1);
        assertThat(PortfolioMetricsEngine.percentile(values, 50)).isEqualTo(3);
        assertThat(PortfolioMetricsEngine.percentile(values, 100)).isEqualTo(5);
        assertThat(PortfolioMetricsEngine.percentile(values, 10)).isCloseTo(1.4, within(1e-12));
        assertThat(values).containsExactly(5, 1, 4, 2, 3);
    }
}
