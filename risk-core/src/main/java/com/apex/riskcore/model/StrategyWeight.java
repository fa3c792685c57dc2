package com.apex.riskcore.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StrategyWeight(
        @JsonProperty("strategy_name") String strategyName,
        double weight,
        @JsonProperty("position_size_factor") double positionSizeFactor
) {}
