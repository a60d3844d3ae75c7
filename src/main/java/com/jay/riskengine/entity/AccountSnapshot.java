package com.jay.riskengine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/** One row per settlement; the latest row is the account state to recover. */
@Entity
@Table(name = "account_snapshots")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private LocalDateTime recordedAt;
    @Column(precision = 30, scale = 10) private BigDecimal initialBalance;
    @Column(precision = 30, scale = 10) private BigDecimal currentBalance;
    @Column(precision = 30, scale = 10) private BigDecimal peakBalance;
    @Column(precision = 30, scale = 10) private BigDecimal currentDrawdown;
    private int consecutiveLosses;
}
