package com.apex.riskcore.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RiskStatus(
        double equity,
        @JsonProperty("peak_equity") double peakEquity,
        double drawdown,
        @JsonProperty("daily_pnl") double dailyPnl,
        @JsonProperty("total_pnl") double totalPnl,
        @JsonProperty("open_positions") int openPositions,
        @JsonProperty("is_halted") boolean halted,
        @JsonProperty("halt_reason") String haltReason
) {}
