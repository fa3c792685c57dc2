package com.apex.riskcore.service.regime;

import com.apex.riskcore.exception.RiskCoreException;
import com.apex.riskcore.model.Regime;
import com.apex.riskcore.model.RoutingRule;
import com.apex.riskcore.model.StrategyWeight;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Regime to {@link RoutingRule} mapping. Every table must define {@link Regime#RANGING}, which is
 * the fallback for regimes without an entry.
 */
public final class RoutingTable {

    public static final String CRYPTO_INVESTOR_V1 = "CryptoInvestorV1";
    public static final String BOLLINGER_MEAN_REVERSION = "BollingerMeanReversion";
    public static final String VOLATILITY_BREAKOUT = "VolatilityBreakout";

    private final Map<Regime, RoutingRule> rules;

    private RoutingTable(Map<Regime, RoutingRule> rules) {
        if (rules == null || !rules.containsKey(Regime.RANGING)) {
            throw new RiskCoreException("Routing table must define a rule for " + Regime.RANGING.value());
        }
        this.rules = Collections.unmodifiableMap(new EnumMap<>(rules));
    }

    public static RoutingTable of(Map<Regime, RoutingRule> rules) {
        return new RoutingTable(rules);
    }

    public static RoutingTable defaults() {
        Map<Regime, RoutingRule> rules = new EnumMap<>(Regime.class);
        rules.put(Regime.STRONG_TREND_UP, new RoutingRule(
                CRYPTO_INVESTOR_V1,
                List.of(new StrategyWeight(CRYPTO_INVESTOR_V1, 1.0, 1.0)),
                1.0,
                "Strong uptrend favors trend-following with full position sizing"));
        rules.put(Regime.WEAK_TREND_UP, new RoutingRule(
                CRYPTO_INVESTOR_V1,
                List.of(new StrategyWeight(CRYPTO_INVESTOR_V1, 0.7, 0.8),
                        new StrategyWeight(VOLATILITY_BREAKOUT, 0.3, 0.6)),
                0.8,
                "Weak uptrend: primary trend-following, secondary breakout at reduced size"));
        rules.put(Regime.RANGING, new RoutingRule(
                BOLLINGER_MEAN_REVERSION,
                List.of(new StrategyWeight(BOLLINGER_MEAN_REVERSION, 1.0, 1.0)),
                1.0,
                "Ranging market is ideal for mean-reversion with full sizing"));
        rules.put(Regime.WEAK_TREND_DOWN, new RoutingRule(
                BOLLINGER_MEAN_REVERSION,
                List.of(new StrategyWeight(BOLLINGER_MEAN_REVERSION, 0.5, 0.5),
                        new StrategyWeight(VOLATILITY_BREAKOUT, 0.5, 0.5)),
                0.5,
                "Weak downtrend: split between mean-reversion and breakout at half size"));
        rules.put(Regime.STRONG_TREND_DOWN, new RoutingRule(
                BOLLINGER_MEAN_REVERSION,
                List.of(new StrategyWeight(BOLLINGER_MEAN_REVERSION, 1.0, 0.3)),
                0.3,
                "Strong downtrend: defensive, mean-reversion only at 30% size"));
        rules.put(Regime.HIGH_VOLATILITY, new RoutingRule(
                VOLATILITY_BREAKOUT,
                List.of(new StrategyWeight(VOLATILITY_BREAKOUT, 1.0, 0.8)),
                0.8,
                "High volatility: breakout strategy at 80% size to manage risk"));
        rules.put(Regime.UNKNOWN, new RoutingRule(
                BOLLINGER_MEAN_REVERSION,
                List.of(new StrategyWeight(BOLLINGER_MEAN_REVERSION, 1.0, 0.3)),
                0.3,
                "Unknown regime (warmup/insufficient data): conservative at 30% size"));
        return new RoutingTable(rules);
    }

    /**
     * Rule for the regime, falling back to the ranging rule.
     */
    public RoutingRule ruleFor(Regime regime) {
        RoutingRule rule = rules.get(regime);
        return rule != null ? rule : rules.get(Regime.RANGING);
    }

    public Map<Regime, RoutingRule> asMap() {
        return rules;
    }
}
