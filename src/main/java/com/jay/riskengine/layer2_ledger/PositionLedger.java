package com.jay.riskengine.layer2_ledger;

import com.jay.riskengine.account.AccountStateStore;
import com.jay.riskengine.config.EngineConfig;
import com.jay.riskengine.layer1_sizing.ExitCalculator;
import com.jay.riskengine.layer1_sizing.PositionSizer;
import com.jay.riskengine.model.AccountState;
import com.jay.riskengine.model.OpenResult;
import com.jay.riskengine.model.Position;
import com.jay.riskengine.model.enums.PositionSide;
import com.jay.riskengine.persistence.TradeJournal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Layer 2 — Position Ledger.
 * Sole creation point for positions and owner of the open set.
 *
 * Entry gates (any failure → rejected, nothing mutated):
 * - Trading halt engaged
 * - Drawdown at or beyond the configured limit
 * - Loss streak at or beyond the configured limit
 * - Sized position rounds to nothing (balance exhausted)
 *
 * Not thread-safe on its own; every call runs under the RiskEngine lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionLedger {

    private static final int QUANTITY_SCALE = 10;

    private final PositionSizer sizer;
    private final ExitCalculator exitCalculator;
    private final AccountStateStore accounts;
    private final EngineConfig config;
    private final TradeJournal journal;

    // Insertion order = open order; mark-to-market walks positions in this order
    private final Map<Long, Position> open = new LinkedHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);
    private volatile boolean halted;

    public OpenResult open(String strategyName, String symbol, PositionSide side,
                           BigDecimal entryPrice, BigDecimal volatility) {
        if (side == null) {
            throw new IllegalArgumentException("Side is required (LONG/SHORT)");
        }
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol is required");
        }
        if (entryPrice == null || entryPrice.signum() <= 0) {
            throw new IllegalArgumentException("Entry price must be positive, was " + entryPrice);
        }

        AccountState account = accounts.current();
        String refusal = checkEntryGates(account);
        if (refusal != null) {
            log.info("Open REJECTED for {} {} ({}): {}", side, symbol, strategyName, refusal);
            return OpenResult.rejected(refusal);
        }

        BigDecimal positionValue = sizer.size(entryPrice, volatility, account);
        BigDecimal quantity = positionValue.divide(entryPrice, QUANTITY_SCALE, RoundingMode.DOWN);
        if (quantity.signum() <= 0) {
            String reason = String.format("Position size %s too small for price %s", positionValue, entryPrice);
            log.info("Open REJECTED for {} {} ({}): {}", side, symbol, strategyName, reason);
            return OpenResult.rejected(reason);
        }

        Position position = Position.builder()
            .positionId(nextId.getAndIncrement())
            .strategyName(strategyName)
            .symbol(symbol)
            .side(side)
            .entryPrice(entryPrice)
            .currentPrice(entryPrice)
            .quantity(quantity)
            .stopLoss(exitCalculator.stopLoss(entryPrice, side))
            .takeProfit(exitCalculator.takeProfit(entryPrice, side))
            .entryTime(LocalDateTime.now())
            .build();

        open.put(position.getPositionId(), position);
        journal.positionOpened(position.snapshot());

        log.info("Position #{} opened: {} {} × {} @ {} | SL {} | TP {} | strategy {}",
            position.getPositionId(), side, symbol, quantity.stripTrailingZeros().toPlainString(),
            entryPrice, position.getStopLoss(), position.getTakeProfit(), strategyName);
        return OpenResult.opened(position.snapshot());
    }

    public Optional<Position> get(long positionId) {
        return Optional.ofNullable(open.get(positionId)).map(Position::snapshot);
    }

    /** Detached copies of every open position, in open order. */
    public List<Position> listOpen() {
        return open.values().stream().map(Position::snapshot).toList();
    }

    public int openCount() {
        return open.size();
    }

    /**
     * The live instances, for the mark-to-market pass only. The returned list is a copy
     * so positions may be removed while iterating it.
     */
    public List<Position> trackedPositions() {
        return new ArrayList<>(open.values());
    }

    /** Takes a position out of the open set; settlement is the only caller. */
    public Optional<Position> remove(long positionId) {
        return Optional.ofNullable(open.remove(positionId));
    }

    public boolean isHalted() {
        return halted;
    }

    public void setHalted(boolean halted) {
        if (this.halted != halted) {
            log.warn("Trading halt {}", halted ? "ENGAGED — new positions will be rejected" : "cleared");
        }
        this.halted = halted;
    }

    /** Replaces the open set with recovered positions and continues ids above the highest one. */
    public void restore(Collection<Position> positions) {
        open.clear();
        long maxId = 0;
        for (Position p : positions) {
            open.put(p.getPositionId(), p);
            maxId = Math.max(maxId, p.getPositionId());
        }
        nextId.set(Math.max(nextId.get(), maxId + 1));
        log.info("Ledger restored with {} open positions, next id {}", open.size(), nextId.get());
    }

    /** Ensures ids of already-closed positions are never handed out again. */
    public void reserveIdsThrough(long positionId) {
        nextId.accumulateAndGet(positionId + 1, Math::max);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private String checkEntryGates(AccountState account) {
        if (halted) {
            return "Trading halted";
        }
        BigDecimal limit = config.risk().getMaxDrawdownLimit();
        if (account.currentDrawdown().compareTo(limit) >= 0) {
            return String.format("Maximum drawdown limit exceeded: %.1f%% >= %.1f%%",
                account.currentDrawdown().doubleValue() * 100, limit.doubleValue() * 100);
        }
        int maxLosses = config.risk().getMaxConsecutiveLosses();
        if (account.consecutiveLosses() >= maxLosses) {
            return String.format("Too many consecutive losses: %d/%d", account.consecutiveLosses(), maxLosses);
        }
        return null;
    }
}
