package com.apex.riskcore.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Audit row written for every trade gate evaluation.
 */
public record TradeCheckRecord(
        String symbol,
        TradeSide side,
        double size,
        @JsonProperty("entry_price") double entryPrice,
        @JsonProperty("stop_loss_price") Double stopLossPrice,
        boolean approved,
        String reason,
        @JsonProperty("equity_at_check") double equityAtCheck,
        @JsonProperty("drawdown_at_check") double drawdownAtCheck,
        @JsonProperty("open_positions_at_check") int openPositionsAtCheck,
        @JsonProperty("checked_at") Instant checkedAt
) {}
