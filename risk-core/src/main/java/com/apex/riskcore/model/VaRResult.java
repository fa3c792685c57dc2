package com.apex.riskcore.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Portfolio Value-at-Risk and Conditional VaR, in currency units.
 */
public record VaRResult(
        @JsonProperty("var_95") double var95,
        @JsonProperty("var_99") double var99,
        @JsonProperty("cvar_95") double cvar95,
        @JsonProperty("cvar_99") double cvar99,
        VarMethod method,
        @JsonProperty("window_days") int windowDays
) {
    public static VaRResult empty(VarMethod method) {
        return empty(method, 0);
    }

    public static VaRResult empty(VarMethod method, int windowDays) {
        return new VaRResult(0.0, 0.0, 0.0, 0.0, method, windowDays);
    }
}
