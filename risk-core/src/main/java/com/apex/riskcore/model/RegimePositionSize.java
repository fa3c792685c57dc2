package com.apex.riskcore.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RegimePositionSize(
        String symbol,
        Regime regime,
        @JsonProperty("regime_modifier") double regimeModifier,
        @JsonProperty("position_size") double positionSize,
        @JsonProperty("entry_price") double entryPrice,
        @JsonProperty("stop_loss_price") double stopLossPrice,
        @JsonProperty("primary_strategy") String primaryStrategy
) {}
