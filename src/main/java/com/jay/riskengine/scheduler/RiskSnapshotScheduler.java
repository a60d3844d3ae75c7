package com.jay.riskengine.scheduler;

import com.jay.riskengine.engine.EngineSnapshot;
import com.jay.riskengine.engine.RiskEngine;
import com.jay.riskengine.layer5_metrics.PortfolioMetricsEngine;
import com.jay.riskengine.layer6_signals.RiskSignalEvaluator;
import com.jay.riskengine.model.MetricsResult;
import com.jay.riskengine.persistence.TradeJournal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodic risk snapshot: surfaces active risk signals in the log and records
 * portfolio metrics to the risk_metrics journal (a no-op when persistence is off).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RiskSnapshotScheduler {

    private final RiskEngine engine;
    private final PortfolioMetricsEngine metricsEngine;
    private final RiskSignalEvaluator signalEvaluator;
    private final TradeJournal journal;

    @Scheduled(fixedDelayString = "${engine.snapshot-interval-ms:60000}",
               initialDelayString = "${engine.snapshot-interval-ms:60000}")
    public void recordSnapshot() {
        try {
            EngineSnapshot snapshot = engine.snapshot();

            List<String> signals = signalEvaluator.signals(
                snapshot.account(), snapshot.openPositions(), snapshot.halted());
            if (!signals.isEmpty()) {
                log.warn("Active risk signals: {}", String.join(" | ", signals));
            }

            MetricsResult metrics = metricsEngine.compute(
                snapshot.trades(), snapshot.account(), snapshot.openPositions());
            if (metrics.isInsufficientData()) {
                log.debug("Risk snapshot skipped — {} closed trades so far", metrics.tradeCount());
                return;
            }
            journal.metricsRecorded(metrics.metrics(), snapshot.account());
            log.info("Risk snapshot: balance {} | drawdown {}% | Sharpe {} | VaR95 {}",
                metrics.metrics().getTotalBalance(),
                String.format("%.2f", metrics.metrics().getCurrentDrawdownPct()),
                String.format("%.3f", metrics.metrics().getSharpeRatio()),
                metrics.metrics().getVar95());
        } catch (Exception e) {
            log.error("Risk snapshot failed: {}", e.getMessage(), e);
        }
    }
}
