package com.jay.riskengine.engine;

import com.jay.riskengine.account.AccountStateStore;
import com.jay.riskengine.layer2_ledger.PositionLedger;
import com.jay.riskengine.layer3_monitor.MarkToMarketMonitor;
import com.jay.riskengine.layer4_settlement.SettlementEngine;
import com.jay.riskengine.layer4_settlement.TradeHistory;
import com.jay.riskengine.layer5_metrics.PortfolioMetricsEngine;
import com.jay.riskengine.layer6_signals.RiskSignalEvaluator;
import com.jay.riskengine.model.AccountState;
import com.jay.riskengine.model.CloseResult;
import com.jay.riskengine.model.MetricsResult;
import com.jay.riskengine.model.OpenResult;
import com.jay.riskengine.model.Position;
import com.jay.riskengine.model.TradeRecord;
import com.jay.riskengine.model.enums.ExitReason;
import com.jay.riskengine.model.enums.PositionSide;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for strategies and the trading loop.
 *
 * One monitor guards the account, the ledger and history appends. Opening, marking
 * (with the settlements it triggers) and closing all run under it, so a size-then-open
 * can never interleave with a close that moves drawdown. Metrics and risk signals copy
 * a snapshot under it and compute outside it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskEngine {

    private final PositionLedger ledger;
    private final MarkToMarketMonitor monitor;
    private final SettlementEngine settlement;
    private final PortfolioMetricsEngine metricsEngine;
    private final RiskSignalEvaluator signalEvaluator;
    private final AccountStateStore accounts;
    private final TradeHistory history;

    private final Object lock = new Object();

    // ── Mutations ─────────────────────────────────────────────────────────────

    public OpenResult openPosition(String strategyName, String symbol, PositionSide side,
                                   BigDecimal entryPrice, BigDecimal volatility) {
        synchronized (lock) {
            return ledger.open(strategyName, symbol, side, entryPrice, volatility);
        }
    }

    /** Marks every open position priced in the batch; returns the trades it closed. */
    public List<TradeRecord> markToMarket(Map<String, BigDecimal> priceBySymbol) {
        synchronized (lock) {
            List<TradeRecord> closed = monitor.update(priceBySymbol);
            if (!closed.isEmpty()) {
                log.info("Mark-to-market closed {} position(s)", closed.size());
            }
            return closed;
        }
    }

    /** Closes at the last tracked price with reason MANUAL. */
    public CloseResult closeManually(long positionId) {
        synchronized (lock) {
            Optional<Position> position = ledger.get(positionId);
            if (position.isEmpty()) {
                log.warn("Manual close for position #{} — not open", positionId);
                return CloseResult.notFound(positionId);
            }
            return settlement.close(positionId, position.get().getCurrentPrice(), ExitReason.MANUAL);
        }
    }

    public CloseResult closePosition(long positionId, BigDecimal exitPrice, ExitReason exitReason) {
        synchronized (lock) {
            return settlement.close(positionId, exitPrice, exitReason);
        }
    }

    public void setTradingHalted(boolean halted) {
        synchronized (lock) {
            ledger.setHalted(halted);
        }
    }

    /** Startup recovery: replaces account, open book and history in one step. */
    public void restore(AccountState account, Collection<Position> openPositions,
                        List<TradeRecord> trades) {
        synchronized (lock) {
            accounts.replace(account);
            ledger.restore(openPositions);
            trades.forEach(t -> ledger.reserveIdsThrough(t.positionId()));
            history.restore(trades);
            log.info("Engine restored: balance {}, {} open positions, {} trades",
                account.currentBalance(), openPositions.size(), trades.size());
        }
    }

    /** Keeps ids below {@code positionId} from being handed out again, e.g. closed rows on disk. */
    public void reservePositionIds(long positionId) {
        synchronized (lock) {
            ledger.reserveIdsThrough(positionId);
        }
    }

    // ── Read-only views ───────────────────────────────────────────────────────

    public EngineSnapshot snapshot() {
        synchronized (lock) {
            return new EngineSnapshot(accounts.current(), ledger.listOpen(),
                history.snapshot(), ledger.isHalted());
        }
    }

    public MetricsResult metrics() {
        EngineSnapshot s = snapshot();
        return metricsEngine.compute(s.trades(), s.account(), s.openPositions());
    }

    public List<String> riskSignals() {
        EngineSnapshot s = snapshot();
        return signalEvaluator.signals(s.account(), s.openPositions(), s.halted());
    }

    public Optional<Position> getPosition(long positionId) {
        synchronized (lock) {
            return ledger.get(positionId);
        }
    }

    public List<Position> openPositions() {
        synchronized (lock) {
            return ledger.listOpen();
        }
    }

    public List<TradeRecord> tradeHistory() {
        return history.snapshot();
    }

    public AccountState accountState() {
        return accounts.current();
    }

    public boolean isTradingHalted() {
        return ledger.isHalted();
    }
}
