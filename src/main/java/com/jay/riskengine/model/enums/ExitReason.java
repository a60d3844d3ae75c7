package com.jay.riskengine.model.enums;

public enum ExitReason {
    STOP_LOSS,      // price crossed the protective stop
    TAKE_PROFIT,    // price reached the profit target
    MANUAL          // closed on request by the caller
}
