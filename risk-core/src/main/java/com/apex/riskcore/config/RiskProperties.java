package com.apex.riskcore.config;

import com.apex.riskcore.model.RiskLimits;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "risk")
@Data
@Validated
public class RiskProperties {

    @Valid
    private Limits limits = new Limits();

    @Positive
    private double initialEquity = 10_000.0;

    @Min(2)
    private int maxHistory = 252;

    @Min(1)
    private int tradeLogCapacity = 500;

    @Data
    public static class Limits {
        @Positive
        @DecimalMax("1.0")
        private double maxPortfolioDrawdown = 0.15;

        @Positive
        @DecimalMax("1.0")
        private double maxSingleTradeRisk = 0.02;

        @Positive
        @DecimalMax("1.0")
        private double maxDailyLoss = 0.05;

        @Min(1)
        private int maxOpenPositions = 10;

        @Positive
        @DecimalMax("1.0")
        private double maxPositionSizePct = 0.20;

        @Positive
        @DecimalMax("1.0")
        private double maxCorrelation = 0.70;

        @Positive
        private double minRiskReward = 1.5;

        @Positive
        private double maxLeverage = 1.0;
    }

    public RiskLimits toRiskLimits() {
        return RiskLimits.builder()
                .maxPortfolioDrawdown(limits.getMaxPortfolioDrawdown())
                .maxSingleTradeRisk(limits.getMaxSingleTradeRisk())
                .maxDailyLoss(limits.getMaxDailyLoss())
                .maxOpenPositions(limits.getMaxOpenPositions())
                .maxPositionSizePct(limits.getMaxPositionSizePct())
                .maxCorrelation(limits.getMaxCorrelation())
                .minRiskReward(limits.getMinRiskReward())
                .maxLeverage(limits.getMaxLeverage())
                .build();
    }
}
