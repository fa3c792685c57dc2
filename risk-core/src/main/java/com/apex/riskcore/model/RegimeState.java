package com.apex.riskcore.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Regime classification for a single point in time together with the sub-indicators behind it.
 */
public record RegimeState(
        Regime regime,
        double confidence,
        @JsonProperty("adx_value") double adxValue,
        @JsonProperty("bb_width_percentile") double bbWidthPercentile,
        @JsonProperty("ema_slope") double emaSlope,
        @JsonProperty("trend_alignment") double trendAlignment,
        @JsonProperty("price_structure_score") double priceStructureScore,
        @JsonProperty("transition_probabilities") Map<String, Double> transitionProbabilities
) {
    public RegimeState {
        transitionProbabilities = transitionProbabilities == null ? Map.of() : Map.copyOf(transitionProbabilities);
    }

    public RegimeState(Regime regime, double confidence, double adxValue, double bbWidthPercentile,
                       double emaSlope, double trendAlignment, double priceStructureScore) {
        this(regime, confidence, adxValue, bbWidthPercentile, emaSlope, trendAlignment, priceStructureScore, Map.of());
    }
}
