package com.jay.riskengine.model;

import com.jay.riskengine.model.enums.ExitReason;
import com.jay.riskengine.model.enums.PositionSide;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Immutable record of a closed position. Trade history is an append-only
 * sequence of these and is the only input the metrics engine reads.
 */
@Builder
public record TradeRecord(
    long positionId,
    String strategyName,
    String symbol,
    PositionSide side,
    BigDecimal entryPrice,
    BigDecimal exitPrice,
    BigDecimal quantity,
    BigDecimal stopLoss,
    BigDecimal takeProfit,
    LocalDateTime entryTime,
    LocalDateTime exitTime,
    BigDecimal pnl,
    BigDecimal pnlPercent,
    ExitReason exitReason
) {
    public boolean isWin() {
        return pnl.signum() > 0;
    }

    public boolean isLoss() {
        return pnl.signum() < 0;
    }

    /** Per-trade return as a fraction (pnlPercent / 100). */
    public double returnFraction() {
        return pnlPercent.doubleValue() / 100.0;
    }
}
