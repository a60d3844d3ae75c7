package com.jay.riskengine.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;

/**
 * Loads and exposes all risk parameters from engine.yaml.
 * Values are read once at startup and cached. Edit engine.yaml and restart to apply changes.
 *
 * A plain {@code new EngineConfig()} carries the built-in defaults, which is what the
 * components see when they are constructed outside Spring.
 */
@Slf4j
@Component
public class EngineConfig {

    @Value("${engine.config-file:engine.yaml}")
    private String configFile = "engine.yaml";

    // ── Sections ──────────────────────────────────────────────────────────────
    private Account account = new Account();
    private PositionSizing positionSizing = new PositionSizing();
    private Exits exits = new Exits();
    private Risk risk = new Risk();
    private Metrics metrics = new Metrics();
    private Signals signals = new Signals();

    @PostConstruct
    public void load() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(configFile)) {
            if (is == null) {
                log.warn("Config file '{}' not found on classpath — using defaults", configFile);
            } else {
                ConfigRoot root = mapper.readValue(is, ConfigRoot.class);
                if (root.getAccount() != null)        this.account        = root.getAccount();
                if (root.getPositionSizing() != null) this.positionSizing = root.getPositionSizing();
                if (root.getExits() != null)          this.exits          = root.getExits();
                if (root.getRisk() != null)           this.risk           = root.getRisk();
                if (root.getMetrics() != null)        this.metrics        = root.getMetrics();
                if (root.getSignals() != null)        this.signals        = root.getSignals();
                log.info("EngineConfig loaded from '{}'. Initial balance: {}, max position: {}",
                    configFile, account.getInitialBalance(), positionSizing.getMaxPositionSizePct());
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + configFile + ": " + e.getMessage(), e);
        }
        validate();
    }

    /** Rejects parameter sets that would let the engine size or exit nonsensically. */
    public void validate() {
        requirePositive("account.initial_balance", account.getInitialBalance());
        requireFraction("position_sizing.max_position_size_pct", positionSizing.getMaxPositionSizePct());
        requirePositive("exits.stop_loss_pct", exits.getStopLossPct());
        if (exits.getStopLossPct().compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalStateException("exits.stop_loss_pct must be below 1, was " + exits.getStopLossPct());
        }
        requirePositive("exits.take_profit_pct", exits.getTakeProfitPct());
        if (exits.getTakeProfitPct().compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalStateException("exits.take_profit_pct must be below 1, was " + exits.getTakeProfitPct());
        }
        requireFraction("risk.max_drawdown_limit", risk.getMaxDrawdownLimit());
        if (risk.getMaxConsecutiveLosses() < 1) {
            throw new IllegalStateException("risk.max_consecutive_losses must be at least 1");
        }
        if (metrics.getVarPercentile() <= 0 || metrics.getVarPercentile() >= 100) {
            throw new IllegalStateException("metrics.var_percentile must be in (0, 100), was "
                + metrics.getVarPercentile());
        }
    }

    private static void requirePositive(String name, BigDecimal value) {
        if (value == null || value.signum() <= 0) {
            throw new IllegalStateException(name + " must be > 0, was " + value);
        }
    }

    private static void requireFraction(String name, BigDecimal value) {
        requirePositive(name, value);
        if (value.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalStateException(name + " must not exceed 1, was " + value);
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Account account()               { return account; }
    public PositionSizing positionSizing() { return positionSizing; }
    public Exits exits()                   { return exits; }
    public Risk risk()                     { return risk; }
    public Metrics metrics()               { return metrics; }
    public Signals signals()               { return signals; }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Account account;
        private PositionSizing positionSizing;
        private Exits exits;
        private Risk risk;
        private Metrics metrics;
        private Signals signals;
    }

    @Data public static class Account {
        private BigDecimal initialBalance = new BigDecimal("10000");
    }

    @Data public static class PositionSizing {
        private BigDecimal maxPositionSizePct = new BigDecimal("0.95");
    }

    @Data public static class Exits {
        private BigDecimal stopLossPct = new BigDecimal("0.05");
        private BigDecimal takeProfitPct = new BigDecimal("0.10");
    }

    @Data public static class Risk {
        private BigDecimal maxDrawdownLimit = new BigDecimal("0.20");
        private int maxConsecutiveLosses = 5;
    }

    @Data public static class Metrics {
        private double riskFreeRatePerTrade = 0.000003;
        private double varPercentile = 5;
        private int minReliableSampleSize = 30;
    }

    @Data public static class Signals {
        private BigDecimal highDrawdownThreshold = new BigDecimal("0.15");
        private int consecutiveLossesWarning = 3;
        private int maxOpenPositions = 10;
        private BigDecimal concentrationThreshold = new BigDecimal("0.5");
        private BigDecimal capitalLossFloor = new BigDecimal("0.8");
    }
}
