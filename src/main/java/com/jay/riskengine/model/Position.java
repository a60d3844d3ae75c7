package com.jay.riskengine.model;

import com.jay.riskengine.model.enums.PositionSide;
import com.jay.riskengine.model.enums.PositionStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * An open (or just-closed) position tracked by the ledger.
 *
 * Identity, sizing and protective levels are fixed at creation. Only the mark
 * (current price, unrealised P&L) and the one-way OPEN → CLOSED status change.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class Position {

    private final long positionId;
    private final String strategyName;
    private final String symbol;
    private final PositionSide side;

    // Entry details
    private final BigDecimal entryPrice;
    private final BigDecimal quantity;
    private final LocalDateTime entryTime;

    // Risk levels
    private final BigDecimal stopLoss;
    private final BigDecimal takeProfit;

    // Current state
    private BigDecimal currentPrice;
    @Builder.Default
    private BigDecimal unrealizedPnl = BigDecimal.ZERO;
    @Builder.Default
    private PositionStatus status = PositionStatus.OPEN;

    /** P&L this position would realise if it were closed at {@code price}. */
    public BigDecimal pnlAt(BigDecimal price) {
        BigDecimal move = side == PositionSide.LONG
            ? price.subtract(entryPrice)
            : entryPrice.subtract(price);
        return move.multiply(quantity);
    }

    /** Capital committed at entry: entry price × quantity. */
    public BigDecimal entryNotional() {
        return entryPrice.multiply(quantity);
    }

    /** Absolute exposure at the last mark. */
    public BigDecimal marketNotional() {
        BigDecimal price = currentPrice != null ? currentPrice : entryPrice;
        return price.multiply(quantity).abs();
    }

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    public void markToMarket(BigDecimal price) {
        this.currentPrice = price;
        this.unrealizedPnl = pnlAt(price);
    }

    public void markClosed() {
        if (status == PositionStatus.CLOSED) {
            throw new IllegalStateException("Position " + positionId + " is already closed");
        }
        this.status = PositionStatus.CLOSED;
    }

    /** Detached copy: later marks on this instance do not show through. */
    public Position snapshot() {
        return toBuilder().build();
    }
}
