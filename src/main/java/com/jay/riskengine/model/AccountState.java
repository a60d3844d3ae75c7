package com.jay.riskengine.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Account-level state. Immutable: every close produces a new instance through
 * {@link #applyClose(BigDecimal)}, so a balance change is applied exactly once.
 *
 * @param initialBalance    balance the engine started with
 * @param currentBalance    realised balance after all closes
 * @param peakBalance       highest currentBalance seen so far
 * @param currentDrawdown   (peak − current) / peak, as a fraction, never negative
 * @param consecutiveLosses losing closes since the last non-losing close
 */
public record AccountState(
    BigDecimal initialBalance,
    BigDecimal currentBalance,
    BigDecimal peakBalance,
    BigDecimal currentDrawdown,
    int consecutiveLosses
) {
    private static final int RATIO_SCALE = 10;

    public static AccountState initial(BigDecimal initialBalance) {
        return new AccountState(initialBalance, initialBalance, initialBalance, BigDecimal.ZERO, 0);
    }

    /** Rebuilds a state from persisted balances; drawdown is always derived, never trusted. */
    public static AccountState of(BigDecimal initialBalance, BigDecimal currentBalance,
                                  BigDecimal peakBalance, int consecutiveLosses) {
        BigDecimal peak = peakBalance.max(currentBalance);
        return new AccountState(initialBalance, currentBalance, peak,
            drawdown(peak, currentBalance), Math.max(0, consecutiveLosses));
    }

    /**
     * The single state transition for a settled trade: balance moves by {@code pnl},
     * the loss streak grows on a loss and resets otherwise, the peak ratchets up,
     * drawdown is recomputed.
     */
    public AccountState applyClose(BigDecimal pnl) {
        BigDecimal balance = currentBalance.add(pnl);
        int losses = pnl.signum() < 0 ? consecutiveLosses + 1 : 0;
        BigDecimal peak = balance.compareTo(peakBalance) > 0 ? balance : peakBalance;
        return new AccountState(initialBalance, balance, peak, drawdown(peak, balance), losses);
    }

    public BigDecimal realizedPnl() {
        return currentBalance.subtract(initialBalance);
    }

    static BigDecimal drawdown(BigDecimal peak, BigDecimal current) {
        if (peak.signum() <= 0) return BigDecimal.ZERO;
        BigDecimal dd = peak.subtract(current).divide(peak, RATIO_SCALE, RoundingMode.HALF_EVEN);
        return dd.signum() < 0 ? BigDecimal.ZERO : dd;
    }
}
