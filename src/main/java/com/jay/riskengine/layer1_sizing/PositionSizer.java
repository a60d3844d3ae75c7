package com.jay.riskengine.layer1_sizing;

import com.jay.riskengine.config.EngineConfig;
import com.jay.riskengine.model.AccountState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Layer 1 — Position Sizer.
 * Turns price, optional volatility and account state into a position value in account currency.
 *
 * <pre>
 *   base      = balance × maxPositionSizePct
 *   × volatility factor   max(0.5, 1 − volatility × 2)       (only when volatility is given)
 *   × drawdown factor     max(0.5, 1 − currentDrawdown)       (only when in drawdown)
 *   × loss-streak factor  max(0.5, 1 − losses × 0.1)          (only after a loss)
 *   = size, clamped to [0, balance × maxPositionSizePct]
 * </pre>
 *
 * Pure: reads the account state it is handed, mutates nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionSizer {

    private static final BigDecimal FACTOR_FLOOR = new BigDecimal("0.5");
    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal LOSS_STEP = new BigDecimal("0.1");

    private final EngineConfig config;

    public BigDecimal size(BigDecimal price, BigDecimal volatility, AccountState account) {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Price must be positive, was " + price);
        }
        if (volatility != null && volatility.signum() < 0) {
            throw new IllegalArgumentException("Volatility must not be negative, was " + volatility);
        }

        BigDecimal cap = account.currentBalance().multiply(config.positionSizing().getMaxPositionSizePct());
        if (cap.signum() <= 0) return BigDecimal.ZERO;

        BigDecimal size = cap;
        if (volatility != null) {
            size = size.multiply(floored(BigDecimal.ONE.subtract(volatility.multiply(TWO))));
        }
        if (account.currentDrawdown().signum() > 0) {
            size = size.multiply(floored(BigDecimal.ONE.subtract(account.currentDrawdown())));
        }
        if (account.consecutiveLosses() > 0) {
            BigDecimal shrink = LOSS_STEP.multiply(BigDecimal.valueOf(account.consecutiveLosses()));
            size = size.multiply(floored(BigDecimal.ONE.subtract(shrink)));
        }

        BigDecimal clamped = size.min(cap).max(BigDecimal.ZERO);
        log.debug("Sized position: cap={} vol={} dd={} losses={} → {}",
            cap, volatility, account.currentDrawdown(), account.consecutiveLosses(), clamped);
        return clamped;
    }

    private static BigDecimal floored(BigDecimal factor) {
        return factor.max(FACTOR_FLOOR);
    }
}
