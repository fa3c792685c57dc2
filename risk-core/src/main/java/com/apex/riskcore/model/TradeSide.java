package com.apex.riskcore.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TradeSide {
    BUY,
    SELL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TradeSide from(String side) {
        if (side == null) {
            throw new IllegalArgumentException("Trade side is required");
        }
        return TradeSide.valueOf(side.trim().toUpperCase(Locale.ROOT));
    }
}
