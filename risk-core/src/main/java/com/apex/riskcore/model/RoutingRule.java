package com.apex.riskcore.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Static allocation for one regime: primary strategy, weighted blend and sizing modifier.
 */
public record RoutingRule(
        String primary,
        List<StrategyWeight> weights,
        @JsonProperty("position_modifier") double positionModifier,
        String reasoning
) {
    public RoutingRule {
        weights = List.copyOf(weights);
    }
}
