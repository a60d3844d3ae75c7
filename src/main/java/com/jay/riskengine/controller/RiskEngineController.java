package com.jay.riskengine.controller;

import com.jay.riskengine.engine.RiskEngine;
import com.jay.riskengine.model.AccountState;
import com.jay.riskengine.model.CloseResult;
import com.jay.riskengine.model.MetricsResult;
import com.jay.riskengine.model.OpenResult;
import com.jay.riskengine.model.Position;
import com.jay.riskengine.model.TradeRecord;
import com.jay.riskengine.model.enums.ExitReason;
import com.jay.riskengine.model.enums.PositionSide;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * REST API: thin adapter over {@link RiskEngine} for the trading loop and dashboards.
 *
 * Endpoints:
 *   POST   /api/positions             — Open a risk-sized position
 *   GET    /api/positions             — Open positions
 *   GET    /api/positions/{id}        — One open position
 *   POST   /api/positions/{id}/close  — Manual close (tracked price, or body exitPrice)
 *   POST   /api/prices                — Mark-to-market with {symbol: price}
 *   GET    /api/trades                — Closed trade history
 *   GET    /api/account               — Balance, peak, drawdown, loss streak
 *   GET    /api/metrics               — Portfolio metrics
 *   GET    /api/risk-signals          — Advisory warnings
 *   POST   /api/halt, DELETE /api/halt — Engage / clear the trading halt
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RiskEngineController {

    private final RiskEngine engine;

    public record OpenPositionRequest(String strategyName, String symbol, PositionSide side,
                                      BigDecimal entryPrice, BigDecimal volatility) {}

    public record ClosePositionRequest(BigDecimal exitPrice) {}

    // ── Positions ──────────────────────────────────────────────────────────────

    @PostMapping("/positions")
    public ResponseEntity<Map<String, Object>> open(@RequestBody OpenPositionRequest request) {
        OpenResult result = engine.openPosition(request.strategyName(), request.symbol(),
            request.side(), request.entryPrice(), request.volatility());
        if (result.isRejected()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                "status", "REJECTED",
                "reason", result.rejectionReason()));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
            "status", "OPENED",
            "position", result.position()));
    }

    @GetMapping("/positions")
    public ResponseEntity<List<Position>> openPositions() {
        return ResponseEntity.ok(engine.openPositions());
    }

    @GetMapping("/positions/{id}")
    public ResponseEntity<Position> position(@PathVariable long id) {
        return engine.getPosition(id)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/positions/{id}/close")
    public ResponseEntity<Map<String, Object>> close(@PathVariable long id,
                                                     @RequestBody(required = false) ClosePositionRequest request) {
        CloseResult result = request != null && request.exitPrice() != null
            ? engine.closePosition(id, request.exitPrice(), ExitReason.MANUAL)
            : engine.closeManually(id);
        if (result.isNotFound()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                "status", "NOT_FOUND",
                "positionId", id));
        }
        return ResponseEntity.ok(Map.of(
            "status", "CLOSED",
            "trade", result.trade(),
            "account", result.accountAfter()));
    }

    // ── Prices ─────────────────────────────────────────────────────────────────

    @PostMapping("/prices")
    public ResponseEntity<List<TradeRecord>> markToMarket(@RequestBody Map<String, BigDecimal> prices) {
        return ResponseEntity.ok(engine.markToMarket(prices));
    }

    // ── History / account / analytics ─────────────────────────────────────────

    @GetMapping("/trades")
    public ResponseEntity<List<TradeRecord>> trades() {
        return ResponseEntity.ok(engine.tradeHistory());
    }

    @GetMapping("/account")
    public ResponseEntity<AccountState> account() {
        return ResponseEntity.ok(engine.accountState());
    }

    @GetMapping("/metrics")
    public ResponseEntity<Map<String, Object>> metrics() {
        MetricsResult result = engine.metrics();
        if (result.isInsufficientData()) {
            return ResponseEntity.ok(Map.of(
                "status", "INSUFFICIENT_DATA",
                "totalTrades", result.tradeCount()));
        }
        return ResponseEntity.ok(Map.of(
            "status", "OK",
            "metrics", result.metrics()));
    }

    @GetMapping("/risk-signals")
    public ResponseEntity<List<String>> riskSignals() {
        return ResponseEntity.ok(engine.riskSignals());
    }

    // ── Trading halt ───────────────────────────────────────────────────────────

    @PostMapping("/halt")
    public ResponseEntity<Map<String, Object>> halt() {
        engine.setTradingHalted(true);
        return ResponseEntity.ok(Map.of("halted", true));
    }

    @DeleteMapping("/halt")
    public ResponseEntity<Map<String, Object>> resume() {
        engine.setTradingHalted(false);
        return ResponseEntity.ok(Map.of("halted", false));
    }

    // ── Errors ─────────────────────────────────────────────────────────────────

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> badRequest(Exception e) {
        log.info("Bad request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of(
            "status", "BAD_REQUEST",
            "error", String.valueOf(e.getMessage())));
    }
}
