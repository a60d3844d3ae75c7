package com.jay.riskengine.entity;

import com.jay.riskengine.model.TradeRecord;
import com.jay.riskengine.model.enums.ExitReason;
import com.jay.riskengine.model.enums.PositionSide;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/** Append-only; rows are inserted on settlement and never updated. */
@Entity
@Table(name = "trade_history")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeHistoryRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long positionId;
    private String strategyName;
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(length = 8)
    private PositionSide side;

    @Column(precision = 30, scale = 10) private BigDecimal entryPrice;
    @Column(precision = 30, scale = 10) private BigDecimal exitPrice;
    @Column(precision = 30, scale = 10) private BigDecimal quantity;
    @Column(precision = 30, scale = 10) private BigDecimal stopLoss;
    @Column(precision = 30, scale = 10) private BigDecimal takeProfit;
    private LocalDateTime entryTime;
    private LocalDateTime exitTime;
    @Column(precision = 30, scale = 10) private BigDecimal pnl;
    @Column(precision = 30, scale = 10) private BigDecimal pnlPercent;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private ExitReason exitReason;

    public static TradeHistoryRecord from(TradeRecord t) {
        return TradeHistoryRecord.builder()
            .positionId(t.positionId())
            .strategyName(t.strategyName())
            .symbol(t.symbol())
            .side(t.side())
            .entryPrice(t.entryPrice())
            .exitPrice(t.exitPrice())
            .quantity(t.quantity())
            .stopLoss(t.stopLoss())
            .takeProfit(t.takeProfit())
            .entryTime(t.entryTime())
            .exitTime(t.exitTime())
            .pnl(t.pnl())
            .pnlPercent(t.pnlPercent())
            .exitReason(t.exitReason())
            .build();
    }

    public TradeRecord toTradeRecord() {
        return TradeRecord.builder()
            .positionId(positionId)
            .strategyName(strategyName)
            .symbol(symbol)
            .side(side)
            .entryPrice(entryPrice)
            .exitPrice(exitPrice)
            .quantity(quantity)
            .stopLoss(stopLoss)
            .takeProfit(takeProfit)
            .entryTime(entryTime)
            .exitTime(exitTime)
            .pnl(pnl)
            .pnlPercent(pnlPercent)
            .exitReason(exitReason)
            .build();
    }
}
