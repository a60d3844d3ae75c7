package com.jay.riskengine.persistence;

import com.jay.riskengine.model.AccountState;
import com.jay.riskengine.model.PortfolioMetrics;
import com.jay.riskengine.model.Position;
import com.jay.riskengine.model.TradeRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/** In-memory only mode: nothing is written. */
@Component
@ConditionalOnProperty(name = "engine.persistence.enabled", havingValue = "false", matchIfMissing = true)
public class NoopTradeJournal implements TradeJournal {

    @Override
    public void positionOpened(Position position) {}

    @Override
    public void positionsMarked(List<Position> positions) {}

    @Override
    public void tradeSettled(TradeRecord trade, AccountState accountAfter) {}

    @Override
    public void metricsRecorded(PortfolioMetrics metrics, AccountState account) {}
}
