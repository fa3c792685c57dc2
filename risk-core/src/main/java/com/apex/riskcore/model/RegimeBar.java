package com.apex.riskcore.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One row of a per-bar regime series. Indicator fields are {@code NaN} during warmup.
 */
public record RegimeBar(
        Instant timestamp,
        Regime regime,
        double confidence,
        @JsonProperty("adx_value") double adxValue,
        @JsonProperty("bb_width_percentile") double bbWidthPercentile,
        @JsonProperty("ema_slope") double emaSlope,
        @JsonProperty("trend_alignment") double trendAlignment,
        @JsonProperty("price_structure_score") double priceStructureScore
) {}
