package com.jay.riskengine.engine;

import com.jay.riskengine.model.AccountState;
import com.jay.riskengine.model.Position;
import com.jay.riskengine.model.TradeRecord;

import java.util.List;

/** Consistent point-in-time copy of everything the read-only views need. */
public record EngineSnapshot(
    AccountState account,
    List<Position> openPositions,
    List<TradeRecord> trades,
    boolean halted
) {}
