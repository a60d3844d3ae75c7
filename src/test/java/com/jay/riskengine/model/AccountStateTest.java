package com.jay.riskengine.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.jay.riskengine.TestEngines.bd;
import static org.assertj.core.api.Assertions.assertThat;

class AccountStateTest {

    @Test
    @DisplayName("initial state: current = peak = initial, no drawdown, no losses")
    void initialState() {
        AccountState s = AccountState.initial(bd("10000"));

        assertThat(s.currentBalance()).isEqualByComparingTo("10000");
        assertThat(s.peakBalance()).isEqualByComparingTo("10000");
        assertThat(s.currentDrawdown()).isEqualByComparingTo("0");
        assertThat(s.consecutiveLosses()).isZero();
    }

    @Test
    @DisplayName("losing close: balance moves by pnl exactly, streak +1, drawdown from peak")
    void losingClose() {
        AccountState after = AccountState.initial(bd("10000")).applyClose(bd("-494"));

        assertThat(after.currentBalance()).isEqualByComparingTo("9506");
        assertThat(after.peakBalance()).isEqualByComparingTo("10000");
        assertThat(after.currentDrawdown()).isEqualByComparingTo("0.0494");
        assertThat(after.consecutiveLosses()).isEqualTo(1);
    }

    @Test
    @DisplayName("winning close resets the streak and ratchets the peak up")
    void winningCloseResetsStreak() {
        AccountState after = AccountState.initial(bd("10000"))
            .applyClose(bd("-100"))
            .applyClose(bd("-100"))
            .applyClose(bd("500"));

        assertThat(after.consecutiveLosses()).isZero();
        assertThat(after.currentBalance()).isEqualByComparingTo("10300");
        assertThat(after.peakBalance()).isEqualByComparingTo("10300");
        assertThat(after.currentDrawdown()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("break-even close counts as non-losing")
    void breakEvenResetsStreak() {
        AccountState after = AccountState.initial(bd("10000"))
            .applyClose(bd("-10"))
            .applyClose(BigDecimal.ZERO);

        assertThat(after.consecutiveLosses()).isZero();
    }

    @Test
    @DisplayName("applyClose never mutates the original")
    void immutable() {
        AccountState before = AccountState.initial(bd("10000"));
        before.applyClose(bd("-1000"));

        assertThat(before.currentBalance()).isEqualByComparingTo("10000");
        assertThat(before.consecutiveLosses()).isZero();
    }

    @Test
    @DisplayName("of(): drawdown is derived from the balances")
    void restoredStateDerivesDrawdown() {
        AccountState s = AccountState.of(bd("10000"), bd("7800"), bd("10000"), 2);

        assertThat(s.currentDrawdown()).isEqualByComparingTo("0.22");
        assertThat(s.consecutiveLosses()).isEqualTo(2);
        assertThat(s.realizedPnl()).isEqualByComparingTo("-2200");
    }
}
