package com.apex.riskcore.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discrete market regime. {@link #UNKNOWN} is only produced while indicators are warming up.
 */
public enum Regime {
    STRONG_TREND_UP("strong_trend_up"),
    WEAK_TREND_UP("weak_trend_up"),
    RANGING("ranging"),
    WEAK_TREND_DOWN("weak_trend_down"),
    STRONG_TREND_DOWN("strong_trend_down"),
    HIGH_VOLATILITY("high_volatility"),
    UNKNOWN("unknown");

    private final String value;

    Regime(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
