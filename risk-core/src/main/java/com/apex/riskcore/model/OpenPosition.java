package com.apex.riskcore.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record OpenPosition(
        TradeSide side,
        double size,
        @JsonProperty("entry_price") double entryPrice,
        @JsonProperty("entry_time") Instant entryTime,
        double value
) {}
