package com.jay.riskengine.layer6_signals;

import com.jay.riskengine.config.EngineConfig;
import com.jay.riskengine.model.AccountState;
import com.jay.riskengine.model.Position;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Layer 6 — Risk Signal Evaluator.
 * Advisory warnings derived from the account and the open book. Never blocks a trade.
 */
@Service
@RequiredArgsConstructor
public class RiskSignalEvaluator {

    private final EngineConfig config;

    public List<String> signals(AccountState account, List<Position> openPositions, boolean halted) {
        EngineConfig.Signals limits = config.signals();
        List<String> signals = new ArrayList<>();

        if (account.currentDrawdown().compareTo(limits.getHighDrawdownThreshold()) > 0) {
            signals.add(String.format("HIGH DRAWDOWN WARNING: %.1f%%",
                account.currentDrawdown().doubleValue() * 100));
        }

        if (account.consecutiveLosses() >= limits.getConsecutiveLossesWarning()) {
            signals.add("CONSECUTIVE LOSSES: " + account.consecutiveLosses());
        }

        if (openPositions.size() > limits.getMaxOpenPositions()) {
            signals.add("HIGH POSITION COUNT: " + openPositions.size());
        }

        // Concentration proxy: absolute notional of the open book against the balance
        BigDecimal exposure = openPositions.stream()
            .map(Position::marketNotional)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal balance = account.currentBalance();
        if (exposure.signum() > 0
                && exposure.compareTo(balance.multiply(limits.getConcentrationThreshold())) > 0) {
            signals.add("HIGH PORTFOLIO CONCENTRATION");
        }

        if (balance.compareTo(account.initialBalance().multiply(limits.getCapitalLossFloor())) < 0) {
            signals.add("SIGNIFICANT CAPITAL LOSS");
        }

        if (halted) {
            signals.add("TRADING HALTED");
        }

        return signals;
    }
}
