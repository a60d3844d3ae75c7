package com.jay.riskengine.model;

/**
 * Outcome of a close request. {@code trade} is null when the position id is unknown
 * or the position was already closed.
 */
public record CloseResult(long positionId, TradeRecord trade, AccountState accountAfter) {

    public static CloseResult closed(TradeRecord trade, AccountState accountAfter) {
        return new CloseResult(trade.positionId(), trade, accountAfter);
    }

    public static CloseResult notFound(long positionId) {
        return new CloseResult(positionId, null, null);
    }

    public boolean isClosed() {
        return trade != null;
    }

    public boolean isNotFound() {
        return trade == null;
    }
}
