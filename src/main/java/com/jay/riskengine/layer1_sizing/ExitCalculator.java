package com.jay.riskengine.layer1_sizing;

import com.jay.riskengine.config.EngineConfig;
import com.jay.riskengine.model.enums.PositionSide;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Layer 1 — Exit Calculator.
 * Protective stop and profit target as fixed percentages of the entry price.
 * Long: stop below, target above. Short: mirrored.
 */
@Service
@RequiredArgsConstructor
public class ExitCalculator {

    private final EngineConfig config;

    public BigDecimal stopLoss(BigDecimal entryPrice, PositionSide side) {
        BigDecimal pct = config.exits().getStopLossPct();
        return side == PositionSide.LONG
            ? entryPrice.multiply(BigDecimal.ONE.subtract(pct))
            : entryPrice.multiply(BigDecimal.ONE.add(pct));
    }

    public BigDecimal takeProfit(BigDecimal entryPrice, PositionSide side) {
        BigDecimal pct = config.exits().getTakeProfitPct();
        return side == PositionSide.LONG
            ? entryPrice.multiply(BigDecimal.ONE.add(pct))
            : entryPrice.multiply(BigDecimal.ONE.subtract(pct));
    }
}
