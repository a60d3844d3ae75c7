package com.jay.riskengine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "risk_metrics")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskMetricsSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private LocalDateTime timestamp;
    @Column(precision = 30, scale = 10) private BigDecimal totalBalance;
    @Column(precision = 30, scale = 10) private BigDecimal unrealizedPnl;
    @Column(precision = 30, scale = 10) private BigDecimal realizedPnl;
    private double drawdownPct;
    @Column(precision = 30, scale = 10) private BigDecimal var95;
    private double sharpeRatio;
    private double volatility;
}
