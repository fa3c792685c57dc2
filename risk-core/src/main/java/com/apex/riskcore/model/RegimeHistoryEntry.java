package com.apex.riskcore.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record RegimeHistoryEntry(
        Instant timestamp,
        Regime regime,
        double confidence,
        @JsonProperty("adx_value") double adxValue,
        @JsonProperty("bb_width_percentile") double bbWidthPercentile
) {}
