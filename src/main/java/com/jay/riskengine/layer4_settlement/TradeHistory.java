package com.jay.riskengine.layer4_settlement;

import com.jay.riskengine.model.TradeRecord;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only sequence of closed trades, in close order.
 * Appends are atomic; readers may snapshot at any time without the engine lock.
 */
@Component
public class TradeHistory {

    private final CopyOnWriteArrayList<TradeRecord> trades = new CopyOnWriteArrayList<>();

    void append(TradeRecord trade) {
        trades.add(trade);
    }

    public List<TradeRecord> snapshot() {
        return List.copyOf(trades);
    }

    public int size() {
        return trades.size();
    }

    /** Startup recovery only. */
    public void restore(Collection<TradeRecord> recovered) {
        trades.clear();
        trades.addAll(recovered);
    }
}
