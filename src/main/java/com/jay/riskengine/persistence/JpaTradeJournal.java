package com.jay.riskengine.persistence;

import com.jay.riskengine.entity.AccountSnapshot;
import com.jay.riskengine.entity.PositionRecord;
import com.jay.riskengine.entity.RiskMetricsSnapshot;
import com.jay.riskengine.entity.TradeHistoryRecord;
import com.jay.riskengine.model.AccountState;
import com.jay.riskengine.model.PortfolioMetrics;
import com.jay.riskengine.model.Position;
import com.jay.riskengine.model.TradeRecord;
import com.jay.riskengine.model.enums.PositionStatus;
import com.jay.riskengine.repository.AccountSnapshotRepository;
import com.jay.riskengine.repository.PositionRecordRepository;
import com.jay.riskengine.repository.RiskMetricsSnapshotRepository;
import com.jay.riskengine.repository.TradeHistoryRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Writes engine activity to the positions / trade_history / account_snapshots /
 * risk_metrics tables. A settlement is written in one transaction (position status,
 * trade row, account row) so the tables never disagree about a close.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "engine.persistence.enabled", havingValue = "true")
public class JpaTradeJournal implements TradeJournal {

    private final PositionRecordRepository positionRepo;
    private final TradeHistoryRecordRepository tradeRepo;
    private final AccountSnapshotRepository accountRepo;
    private final RiskMetricsSnapshotRepository metricsRepo;
    private final TransactionTemplate tx;

    public JpaTradeJournal(PositionRecordRepository positionRepo,
                           TradeHistoryRecordRepository tradeRepo,
                           AccountSnapshotRepository accountRepo,
                           RiskMetricsSnapshotRepository metricsRepo,
                           PlatformTransactionManager transactionManager) {
        this.positionRepo = positionRepo;
        this.tradeRepo = tradeRepo;
        this.accountRepo = accountRepo;
        this.metricsRepo = metricsRepo;
        this.tx = new TransactionTemplate(transactionManager);
    }

    @Override
    public void positionOpened(Position position) {
        try {
            positionRepo.save(PositionRecord.from(position));
        } catch (Exception e) {
            log.error("Failed to persist opened position #{}: {}", position.getPositionId(), e.getMessage());
        }
    }

    @Override
    public void positionsMarked(List<Position> positions) {
        try {
            positionRepo.saveAll(positions.stream().map(PositionRecord::from).toList());
        } catch (Exception e) {
            log.error("Failed to persist marks for {} positions: {}", positions.size(), e.getMessage());
        }
    }

    @Override
    public void tradeSettled(TradeRecord trade, AccountState accountAfter) {
        try {
            tx.executeWithoutResult(status -> {
                positionRepo.findById(trade.positionId()).ifPresent(record -> {
                    record.setStatus(PositionStatus.CLOSED);
                    record.setCurrentPrice(trade.exitPrice());
                    record.setUnrealizedPnl(trade.pnl());
                    positionRepo.save(record);
                });
                tradeRepo.save(TradeHistoryRecord.from(trade));
                accountRepo.save(AccountSnapshot.builder()
                    .recordedAt(trade.exitTime())
                    .initialBalance(accountAfter.initialBalance())
                    .currentBalance(accountAfter.currentBalance())
                    .peakBalance(accountAfter.peakBalance())
                    .currentDrawdown(accountAfter.currentDrawdown())
                    .consecutiveLosses(accountAfter.consecutiveLosses())
                    .build());
            });
        } catch (Exception e) {
            log.error("Failed to persist settlement of position #{}: {}", trade.positionId(), e.getMessage());
        }
    }

    @Override
    public void metricsRecorded(PortfolioMetrics metrics, AccountState account) {
        try {
            metricsRepo.save(RiskMetricsSnapshot.builder()
                .timestamp(LocalDateTime.now())
                .totalBalance(metrics.getTotalBalance())
                .unrealizedPnl(metrics.getUnrealizedPnl())
                .realizedPnl(account.realizedPnl())
                .drawdownPct(metrics.getCurrentDrawdownPct())
                .var95(metrics.getVar95())
                .sharpeRatio(metrics.getSharpeRatio())
                .volatility(metrics.getReturnVolatility())
                .build());
        } catch (Exception e) {
            log.error("Failed to persist risk metrics snapshot: {}", e.getMessage());
        }
    }
}
