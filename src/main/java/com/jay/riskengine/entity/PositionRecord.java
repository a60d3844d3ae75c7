package com.jay.riskengine.entity;

import com.jay.riskengine.model.Position;
import com.jay.riskengine.model.enums.PositionSide;
import com.jay.riskengine.model.enums.PositionStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "positions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionRecord {

    // Ledger-assigned id, not generated by the database
    @Id
    @Column(name = "position_id")
    private Long positionId;

    private String strategyName;
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(length = 8)
    private PositionSide side;

    @Column(precision = 30, scale = 10) private BigDecimal entryPrice;
    @Column(precision = 30, scale = 10) private BigDecimal currentPrice;
    @Column(precision = 30, scale = 10) private BigDecimal quantity;
    @Column(precision = 30, scale = 10) private BigDecimal stopLoss;
    @Column(precision = 30, scale = 10) private BigDecimal takeProfit;
    private LocalDateTime entryTime;

    @Enumerated(EnumType.STRING)
    @Column(length = 8)
    private PositionStatus status;   // OPEN until settled, then CLOSED

    @Column(precision = 30, scale = 10) private BigDecimal unrealizedPnl;

    public static PositionRecord from(Position p) {
        return PositionRecord.builder()
            .positionId(p.getPositionId())
            .strategyName(p.getStrategyName())
            .symbol(p.getSymbol())
            .side(p.getSide())
            .entryPrice(p.getEntryPrice())
            .currentPrice(p.getCurrentPrice())
            .quantity(p.getQuantity())
            .stopLoss(p.getStopLoss())
            .takeProfit(p.getTakeProfit())
            .entryTime(p.getEntryTime())
            .status(p.getStatus())
            .unrealizedPnl(p.getUnrealizedPnl())
            .build();
    }

    public Position toPosition() {
        return Position.builder()
            .positionId(positionId)
            .strategyName(strategyName)
            .symbol(symbol)
            .side(side)
            .entryPrice(entryPrice)
            .currentPrice(currentPrice != null ? currentPrice : entryPrice)
            .quantity(quantity)
            .stopLoss(stopLoss)
            .takeProfit(takeProfit)
            .entryTime(entryTime)
            .status(status)
            .unrealizedPnl(unrealizedPnl != null ? unrealizedPnl : BigDecimal.ZERO)
            .build();
    }
}
