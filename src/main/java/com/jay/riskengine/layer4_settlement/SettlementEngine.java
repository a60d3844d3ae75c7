package com.jay.riskengine.layer4_settlement;

import com.jay.riskengine.account.AccountStateStore;
import com.jay.riskengine.layer2_ledger.PositionLedger;
import com.jay.riskengine.model.AccountState;
import com.jay.riskengine.model.CloseResult;
import com.jay.riskengine.model.Position;
import com.jay.riskengine.model.TradeRecord;
import com.jay.riskengine.model.enums.ExitReason;
import com.jay.riskengine.persistence.TradeJournal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Layer 4 — Settlement Engine.
 * Closes a position, books its P&L into the account and appends the trade to history.
 *
 * The only writer of account state during normal operation. One close = one
 * {@link AccountState#applyClose} = one balance change.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettlementEngine {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int PERCENT_SCALE = 8;

    private final PositionLedger ledger;
    private final AccountStateStore accounts;
    private final TradeHistory history;
    private final TradeJournal journal;

    public CloseResult close(long positionId, BigDecimal exitPrice, ExitReason exitReason) {
        Objects.requireNonNull(exitReason, "exitReason");
        if (exitPrice == null || exitPrice.signum() <= 0) {
            throw new IllegalArgumentException("Exit price must be positive, was " + exitPrice);
        }

        Optional<Position> removed = ledger.remove(positionId);
        if (removed.isEmpty()) {
            log.warn("Close requested for position #{} — not open (unknown or already closed)", positionId);
            return CloseResult.notFound(positionId);
        }

        Position position = removed.get();
        position.markToMarket(exitPrice);
        position.markClosed();

        BigDecimal pnl = position.pnlAt(exitPrice);
        BigDecimal pnlPercent = pnl.multiply(HUNDRED)
            .divide(position.entryNotional(), PERCENT_SCALE, RoundingMode.HALF_EVEN);

        TradeRecord trade = TradeRecord.builder()
            .positionId(position.getPositionId())
            .strategyName(position.getStrategyName())
            .symbol(position.getSymbol())
            .side(position.getSide())
            .entryPrice(position.getEntryPrice())
            .exitPrice(exitPrice)
            .quantity(position.getQuantity())
            .stopLoss(position.getStopLoss())
            .takeProfit(position.getTakeProfit())
            .entryTime(position.getEntryTime())
            .exitTime(LocalDateTime.now())
            .pnl(pnl)
            .pnlPercent(pnlPercent)
            .exitReason(exitReason)
            .build();

        AccountState after = accounts.current().applyClose(pnl);
        accounts.replace(after);
        history.append(trade);
        journal.tradeSettled(trade, after);

        log.info("Position #{} closed: {} {} @ {} | P&L: {} ({}%) | Reason: {} | Balance: {} | Losses in a row: {}",
            positionId, position.getSide(), position.getSymbol(), exitPrice,
            pnl.setScale(2, RoundingMode.HALF_EVEN).toPlainString(),
            pnlPercent.setScale(2, RoundingMode.HALF_EVEN).toPlainString(),
            exitReason, after.currentBalance().setScale(2, RoundingMode.HALF_EVEN).toPlainString(),
            after.consecutiveLosses());
        return CloseResult.closed(trade, after);
    }
}
