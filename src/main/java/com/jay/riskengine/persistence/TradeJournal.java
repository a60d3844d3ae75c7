package com.jay.riskengine.persistence;

import com.jay.riskengine.model.AccountState;
import com.jay.riskengine.model.PortfolioMetrics;
import com.jay.riskengine.model.Position;
import com.jay.riskengine.model.TradeRecord;

import java.util.List;

/**
 * Durable record of engine activity. Called under the engine lock, in the same order
 * the in-memory state changes. Implementations must not throw: a failed write is
 * logged and the in-memory engine stays authoritative.
 */
public interface TradeJournal {

    void positionOpened(Position position);

    void positionsMarked(List<Position> positions);

    void tradeSettled(TradeRecord trade, AccountState accountAfter);

    void metricsRecorded(PortfolioMetrics metrics, AccountState account);
}
