package com.jay.riskengine.layer4_settlement;

import com.jay.riskengine.TestEngines;
import com.jay.riskengine.model.AccountState;
import com.jay.riskengine.model.CloseResult;
import com.jay.riskengine.model.TradeRecord;
import com.jay.riskengine.model.enums.ExitReason;
import com.jay.riskengine.model.enums.PositionSide;
import com.jay.riskengine.persistence.TradeJournal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.jay.riskengine.TestEngines.bd;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class SettlementEngineTest {

    private TestEngines t;

    @BeforeEach
    void setUp() {
        t = TestEngines.create();
    }

    private long open(PositionSide side, String price) {
        return t.ledger.open("test", "BTC", side, bd(price), null).position().getPositionId();
    }

    @Test
    @DisplayName("close books the P&L, records the trade and frees the slot")
    void closeSettles() {
        long id = open(PositionSide.LONG, "50000");

        CloseResult result = t.settlement.close(id, bd("52000"), ExitReason.MANUAL);

        assertThat(result.isClosed()).isTrue();
        TradeRecord trade = result.trade();
        assertThat(trade.positionId()).isEqualTo(id);
        assertThat(trade.exitPrice()).isEqualByComparingTo("52000");
        assertThat(trade.pnl()).isEqualByComparingTo("380");
        assertThat(trade.pnlPercent()).isEqualByComparingTo("4");
        assertThat(trade.exitReason()).isEqualTo(ExitReason.MANUAL);
        assertThat(trade.exitTime()).isAfterOrEqualTo(trade.entryTime());

        assertThat(result.accountAfter()).isEqualTo(t.accounts.current());
        assertThat(t.accounts.current().currentBalance()).isEqualByComparingTo("10380");
        assertThat(t.history.snapshot()).containsExactly(trade);
        assertThat(t.ledger.get(id)).isEmpty();
    }

    @Test
    @DisplayName("short P&L is entry minus exit")
    void shortPnl() {
        long id = open(PositionSide.SHORT, "100");

        CloseResult result = t.settlement.close(id, bd("98"), ExitReason.MANUAL);

        assertThat(result.trade().pnl()).isEqualByComparingTo("190");
        assertThat(result.trade().pnlPercent()).isEqualByComparingTo("2");
    }

    @Test
    @DisplayName("second close of the same id is not found and changes nothing")
    void closeIsOnce() {
        long id = open(PositionSide.LONG, "50000");
        t.settlement.close(id, bd("49000"), ExitReason.MANUAL);
        AccountState afterFirst = t.accounts.current();

        CloseResult second = t.settlement.close(id, bd("10000"), ExitReason.MANUAL);

        assertThat(second.isNotFound()).isTrue();
        assertThat(second.positionId()).isEqualTo(id);
        assertThat(t.accounts.current()).isEqualTo(afterFirst);
        assertThat(t.history.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("unknown id is not found")
    void unknownId() {
        assertThat(t.settlement.close(404, bd("1"), ExitReason.MANUAL).isNotFound()).isTrue();
        assertThat(t.history.size()).isZero();
    }

    @Test
    @DisplayName("invalid exit price throws and leaves the position open")
    void invalidPrice() {
        long id = open(PositionSide.LONG, "50000");

        assertThatThrownBy(() -> t.settlement.close(id, bd("-1"), ExitReason.MANUAL))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> t.settlement.close(id, null, ExitReason.MANUAL))
            .isInstanceOf(IllegalArgumentException.class);

        assertThat(t.ledger.get(id)).isPresent();
    }

    @Test
    @DisplayName("balance equals initial plus the sum of closed P&L")
    void balanceReconciles() {
        String[][] legs = {{"50000", "51000"}, {"50000", "48000"}, {"2000", "2100"}, {"10", "9.5"}};
        for (String[] leg : legs) {
            long id = open(PositionSide.LONG, leg[0]);
            t.settlement.close(id, bd(leg[1]), ExitReason.MANUAL);
        }

        BigDecimal realized = t.history.snapshot().stream()
            .map(TradeRecord::pnl)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(t.accounts.current().currentBalance()).isEqualByComparingTo(bd("10000").add(realized));
        assertThat(t.accounts.current().realizedPnl()).isEqualByComparingTo(realized);
    }

    @Test
    @DisplayName("journal receives the trade and the account it produced")
    void journalsSettlement() {
        TradeJournal journal = mock(TradeJournal.class);
        t = TestEngines.create(journal);
        long id = open(PositionSide.LONG, "50000");

        CloseResult result = t.settlement.close(id, bd("50500"), ExitReason.TAKE_PROFIT);

        verify(journal).tradeSettled(eq(result.trade()), eq(result.accountAfter()));
        verify(journal, times(1)).tradeSettled(any(), any());
    }
}
