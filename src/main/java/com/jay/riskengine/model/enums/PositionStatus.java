package com.jay.riskengine.model.enums;

public enum PositionStatus {
    OPEN,
    CLOSED
}
