package com.jay.riskengine.layer3_monitor;

import com.jay.riskengine.layer2_ledger.PositionLedger;
import com.jay.riskengine.layer4_settlement.SettlementEngine;
import com.jay.riskengine.model.CloseResult;
import com.jay.riskengine.model.Position;
import com.jay.riskengine.model.TradeRecord;
import com.jay.riskengine.model.enums.ExitReason;
import com.jay.riskengine.model.enums.PositionSide;
import com.jay.riskengine.persistence.TradeJournal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Layer 3 — Mark-to-Market Monitor.
 * Applies a batch of prices to the open positions and settles every position whose
 * protective stop or profit target has been crossed.
 *
 * Trigger order, first match wins, so a single pass never fires both exits:
 *   1. LONG  and price ≤ stop    → STOP_LOSS
 *   2. LONG  and price ≥ target  → TAKE_PROFIT
 *   3. SHORT and price ≥ stop    → STOP_LOSS
 *   4. SHORT and price ≤ target  → TAKE_PROFIT
 *
 * Positions whose symbol is missing from the batch are left as they were.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarkToMarketMonitor {

    private final PositionLedger ledger;
    private final SettlementEngine settlement;
    private final TradeJournal journal;

    public List<TradeRecord> update(Map<String, BigDecimal> priceBySymbol) {
        Objects.requireNonNull(priceBySymbol, "priceBySymbol");

        List<TradeRecord> closed = new ArrayList<>();
        List<Position> stillOpen = new ArrayList<>();

        for (Position position : ledger.trackedPositions()) {
            BigDecimal price = priceBySymbol.get(position.getSymbol());
            if (price == null) continue;
            if (price.signum() <= 0) {
                log.warn("Ignoring non-positive price {} for {} — position #{} left unchanged",
                    price, position.getSymbol(), position.getPositionId());
                continue;
            }

            position.markToMarket(price);
            log.debug("Marked #{} {} @ {} — unrealised {}",
                position.getPositionId(), position.getSymbol(), price, position.getUnrealizedPnl());

            Optional<ExitReason> trigger = evaluateTrigger(position);
            if (trigger.isEmpty()) {
                stillOpen.add(position.snapshot());
                continue;
            }

            if (trigger.get() == ExitReason.STOP_LOSS) {
                log.warn("STOP-LOSS HIT for #{} {} — price {} crossed stop {}",
                    position.getPositionId(), position.getSymbol(), price, position.getStopLoss());
            } else {
                log.info("TARGET REACHED for #{} {} — price {} crossed target {}",
                    position.getPositionId(), position.getSymbol(), price, position.getTakeProfit());
            }
            CloseResult result = settlement.close(position.getPositionId(), price, trigger.get());
            if (result.isClosed()) {
                closed.add(result.trade());
            }
        }

        if (!stillOpen.isEmpty()) {
            journal.positionsMarked(stillOpen);
        }
        return closed;
    }

    /** Exit due at the position's last mark, if any. Stop is always checked before target. */
    public static Optional<ExitReason> evaluateTrigger(Position position) {
        BigDecimal price = position.getCurrentPrice();
        if (price == null) return Optional.empty();

        if (position.getSide() == PositionSide.LONG) {
            if (price.compareTo(position.getStopLoss()) <= 0)   return Optional.of(ExitReason.STOP_LOSS);
            if (price.compareTo(position.getTakeProfit()) >= 0) return Optional.of(ExitReason.TAKE_PROFIT);
        } else {
            if (price.compareTo(position.getStopLoss()) >= 0)   return Optional.of(ExitReason.STOP_LOSS);
            if (price.compareTo(position.getTakeProfit()) <= 0) return Optional.of(ExitReason.TAKE_PROFIT);
        }
        return Optional.empty();
    }
}
