package com.jay.riskengine.persistence;

import com.jay.riskengine.engine.RiskEngine;
import com.jay.riskengine.entity.AccountSnapshot;
import com.jay.riskengine.entity.PositionRecord;
import com.jay.riskengine.entity.TradeHistoryRecord;
import com.jay.riskengine.model.AccountState;
import com.jay.riskengine.model.Position;
import com.jay.riskengine.model.TradeRecord;
import com.jay.riskengine.model.enums.PositionStatus;
import com.jay.riskengine.repository.AccountSnapshotRepository;
import com.jay.riskengine.repository.PositionRecordRepository;
import com.jay.riskengine.repository.TradeHistoryRecordRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Rebuilds the in-memory engine from the journal tables at startup:
 * latest account snapshot, every OPEN position, full trade history in close order.
 * An empty database leaves the engine at its configured initial balance.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "engine.persistence.enabled", havingValue = "true")
@RequiredArgsConstructor
public class EngineRecovery {

    private final RiskEngine engine;
    private final PositionRecordRepository positionRepo;
    private final TradeHistoryRecordRepository tradeRepo;
    private final AccountSnapshotRepository accountRepo;

    @PostConstruct
    public void recover() {
        Optional<AccountSnapshot> snapshot = accountRepo.findTopByOrderByIdDesc();
        List<Position> open = positionRepo.findByStatusOrderByPositionIdAsc(PositionStatus.OPEN).stream()
            .map(PositionRecord::toPosition)
            .toList();
        List<TradeRecord> trades = tradeRepo.findAllByOrderByIdAsc().stream()
            .map(TradeHistoryRecord::toTradeRecord)
            .toList();

        if (snapshot.isEmpty() && open.isEmpty() && trades.isEmpty()) {
            log.info("No persisted engine state — starting fresh");
            return;
        }

        AccountState account = snapshot
            .map(s -> AccountState.of(s.getInitialBalance(), s.getCurrentBalance(),
                s.getPeakBalance(), s.getConsecutiveLosses()))
            .orElse(engine.accountState());

        engine.restore(account, open, trades);

        Long maxId = positionRepo.findMaxPositionId();
        if (maxId != null) {
            engine.reservePositionIds(maxId);
        }
    }
}
