package com.apex.riskcore.config;

import com.apex.riskcore.service.regime.RegimeAdvisor;
import com.apex.riskcore.service.regime.RegimeDetector;
import com.apex.riskcore.service.regime.RoutingTable;
import com.apex.riskcore.service.regime.StrategyRouter;
import com.apex.riskcore.service.risk.ReturnTracker;
import com.apex.riskcore.service.risk.RiskManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Builds caller-owned risk and regime components from the bound properties. Every call returns a
 * new instance; nothing is shared between portfolios.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RiskCoreFactory {

    private final RiskProperties riskProperties;
    private final RegimeProperties regimeProperties;
    private final RouterProperties routerProperties;

    public ReturnTracker newReturnTracker() {
        return new ReturnTracker(riskProperties.getMaxHistory());
    }

    public RiskManager newRiskManager() {
        return newRiskManager(Clock.systemUTC());
    }

    public RiskManager newRiskManager(Clock clock) {
        return new RiskManager(
                riskProperties.toRiskLimits(),
                newReturnTracker(),
                riskProperties.getInitialEquity(),
                riskProperties.getTradeLogCapacity(),
                clock);
    }

    public RegimeDetector newRegimeDetector() {
        return new RegimeDetector(regimeProperties.toConfig());
    }

    public StrategyRouter newStrategyRouter() {
        return newStrategyRouter(RoutingTable.defaults());
    }

    public StrategyRouter newStrategyRouter(RoutingTable routingTable) {
        return new StrategyRouter(
                routingTable,
                routerProperties.getLowConfidenceThreshold(),
                routerProperties.getLowConfidencePenalty());
    }

    public RegimeAdvisor newRegimeAdvisor() {
        log.debug("Creating regime advisor with {}", regimeProperties);
        return new RegimeAdvisor(newRegimeDetector(), newStrategyRouter());
    }
}
