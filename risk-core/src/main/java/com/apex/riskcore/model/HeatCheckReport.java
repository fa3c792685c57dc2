package com.apex.riskcore.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate portfolio health assessment. {@code healthy} is true exactly when {@code issues} is empty.
 */
public record HeatCheckReport(
        boolean healthy,
        List<String> issues,
        double drawdown,
        @JsonProperty("daily_pnl") double dailyPnl,
        @JsonProperty("open_positions") int openPositions,
        @JsonProperty("max_correlation") double maxCorrelation,
        @JsonProperty("high_corr_pairs") List<CorrelationPair> highCorrPairs,
        @JsonProperty("max_concentration") double maxConcentration,
        @JsonProperty("position_weights") Map<String, Double> positionWeights,
        @JsonProperty("var_95") double var95,
        @JsonProperty("var_99") double var99,
        @JsonProperty("cvar_95") double cvar95,
        @JsonProperty("cvar_99") double cvar99,
        @JsonProperty("is_halted") boolean halted
) {
    public HeatCheckReport {
        issues = List.copyOf(issues);
        highCorrPairs = List.copyOf(highCorrPairs);
        positionWeights = Collections.unmodifiableMap(new LinkedHashMap<>(positionWeights));
    }
}
