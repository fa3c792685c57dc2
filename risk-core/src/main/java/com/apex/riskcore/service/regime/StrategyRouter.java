package com.apex.riskcore.service.regime;

import com.apex.riskcore.model.Regime;
import com.apex.riskcore.model.RegimeState;
import com.apex.riskcore.model.RoutingDecision;
import com.apex.riskcore.model.RoutingRule;
import com.apex.riskcore.model.StrategyWeight;
import com.apex.riskcore.util.MathUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

import static com.apex.riskcore.service.regime.RoutingTable.BOLLINGER_MEAN_REVERSION;

/**
 * Maps a detected regime to a weighted strategy allocation and a position-size modifier.
 */
@Slf4j
public class StrategyRouter {

    public static final double DEFAULT_LOW_CONFIDENCE_THRESHOLD = 0.4;
    public static final double DEFAULT_LOW_CONFIDENCE_PENALTY = 0.5;

    static final RoutingRule BEARISH_HIGH_VOLATILITY = new RoutingRule(
            BOLLINGER_MEAN_REVERSION,
            List.of(new StrategyWeight(BOLLINGER_MEAN_REVERSION, 1.0, 0.5)),
            0.5,
            "High volatility + bearish alignment: defensive BMR at 50%");

    private final RoutingTable routingTable;
    @Getter
    private final double lowConfidenceThreshold;
    @Getter
    private final double lowConfidencePenalty;

    public StrategyRouter() {
        this(RoutingTable.defaults());
    }

    public StrategyRouter(RoutingTable routingTable) {
        this(routingTable, DEFAULT_LOW_CONFIDENCE_THRESHOLD, DEFAULT_LOW_CONFIDENCE_PENALTY);
    }

    public StrategyRouter(RoutingTable routingTable, double lowConfidenceThreshold, double lowConfidencePenalty) {
        this.routingTable = routingTable != null ? routingTable : RoutingTable.defaults();
        this.lowConfidenceThreshold = lowConfidenceThreshold;
        this.lowConfidencePenalty = lowConfidencePenalty;
    }

    public RoutingDecision route(RegimeState state) {
        RoutingRule rule = routingTable.ruleFor(state.regime());

        if (state.regime() == Regime.HIGH_VOLATILITY && state.trendAlignment() < 0) {
            rule = BEARISH_HIGH_VOLATILITY;
        }

        double modifier = rule.positionModifier();
        if (state.confidence() < lowConfidenceThreshold) {
            modifier *= lowConfidencePenalty;
        }

        return new RoutingDecision(
                state.regime(),
                state.confidence(),
                rule.primary(),
                rule.weights(),
                MathUtils.round(modifier, 3),
                rule.reasoning());
    }

    /**
     * A new decision when the current strategy is neither the primary nor weighted at 0.5 or more
     * in the routed blend.
     */
    public Optional<RoutingDecision> suggestStrategySwitch(String currentStrategy, RegimeState state) {
        RoutingDecision decision = route(state);
        if (decision.primaryStrategy().equals(currentStrategy)) {
            return Optional.empty();
        }
        boolean stillDominant = decision.weights().stream()
                .anyMatch(w -> w.strategyName().equals(currentStrategy) && w.weight() >= 0.5);
        if (stillDominant) {
            return Optional.empty();
        }
        log.info("Strategy switch suggested for {}: {} -> {}", state.regime().value(), currentStrategy,
                decision.primaryStrategy());
        return Optional.of(decision);
    }

    public List<String> getAllStrategies() {
        TreeSet<String> names = new TreeSet<>();
        routingTable.asMap().values().forEach(rule -> rule.weights().forEach(w -> names.add(w.strategyName())));
        return List.copyOf(names);
    }

    /**
     * Routing table keyed by regime value, for display.
     */
    public Map<String, RoutingRule> getRoutingTable() {
        Map<String, RoutingRule> table = new LinkedHashMap<>();
        routingTable.asMap().forEach((regime, rule) -> table.put(regime.value(), rule));
        return Collections.unmodifiableMap(table);
    }
}
