package com.apex.riskcore.model;

import lombok.Builder;
import lombok.Value;

/**
 * Global risk parameters for one portfolio.
 *
 * <p>{@code minRiskReward} and {@code maxLeverage} are carried for callers but are not consulted by
 * the trade gate.
 */
@Value
@Builder(toBuilder = true)
public class RiskLimits {

    @Builder.Default
    double maxPortfolioDrawdown = 0.15;

    @Builder.Default
    double maxSingleTradeRisk = 0.02;

    @Builder.Default
    double maxDailyLoss = 0.05;

    @Builder.Default
    int maxOpenPositions = 10;

    @Builder.Default
    double maxPositionSizePct = 0.20;

    @Builder.Default
    double maxCorrelation = 0.70;

    @Builder.Default
    double minRiskReward = 1.5;

    @Builder.Default
    double maxLeverage = 1.0;

    public static RiskLimits defaults() {
        return RiskLimits.builder().build();
    }
}
