package com.apex.riskcore.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RoutingDecision(
        Regime regime,
        double confidence,
        @JsonProperty("primary_strategy") String primaryStrategy,
        List<StrategyWeight> weights,
        @JsonProperty("position_size_modifier") double positionSizeModifier,
        String reasoning
) {
    public RoutingDecision {
        weights = List.copyOf(weights);
    }
}
