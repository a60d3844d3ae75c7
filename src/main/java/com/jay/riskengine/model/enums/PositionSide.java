package com.jay.riskengine.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum PositionSide {
    LONG,
    SHORT;

    /** Accepts "long", "LONG", " Short " and so on. */
    @JsonCreator
    public static PositionSide parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Position side is required (long/short)");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown position side '" + value + "' — expected long or short", e);
        }
    }
}
