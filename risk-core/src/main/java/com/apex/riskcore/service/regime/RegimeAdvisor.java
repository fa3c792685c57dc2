package com.apex.riskcore.service.regime;

import com.apex.riskcore.model.Candle;
import com.apex.riskcore.model.RegimeHistoryEntry;
import com.apex.riskcore.model.RegimePositionSize;
import com.apex.riskcore.model.RegimeState;
import com.apex.riskcore.model.RoutingDecision;
import com.apex.riskcore.service.risk.RiskManager;
import com.apex.riskcore.util.MathUtils;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-symbol front end over {@link RegimeDetector} and {@link StrategyRouter}: caches the latest
 * regime per symbol, keeps a bounded history and turns regimes into routing and sizing advice.
 *
 * <p>Candle history is supplied by the caller. When a call has no candles the cached regime is
 * used instead.
 */
@Slf4j
@RequiredArgsConstructor
public class RegimeAdvisor {

    static final int HISTORY_LIMIT = 1000;
    static final int HISTORY_RETAINED = 500;

    @Getter
    private final RegimeDetector detector;
    @Getter
    private final StrategyRouter router;
    private final Clock clock;

    private final Map<String, TimedState> cache = new HashMap<>();
    private final Map<String, List<TimedState>> history = new HashMap<>();

    private record TimedState(RegimeState state, Instant timestamp) {}

    public RegimeAdvisor(RegimeDetector detector, StrategyRouter router) {
        this(detector, router, Clock.systemUTC());
    }

    /**
     * Detects and caches the regime for {@code symbol}, recording it in the history.
     *
     * @return the fresh state, the cached state when no candles were given, or empty if neither exists
     */
    public Optional<RegimeState> assess(String symbol, List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return getCurrentRegime(symbol);
        }

        RegimeState state = detector.detect(candles);
        TimedState timed = new TimedState(state, clock.instant());
        cache.put(symbol, timed);

        List<TimedState> entries = history.computeIfAbsent(symbol, s -> new ArrayList<>());
        entries.add(timed);
        if (entries.size() > HISTORY_LIMIT) {
            entries.subList(0, entries.size() - HISTORY_RETAINED).clear();
        }
        log.debug("{} regime {} (confidence {})", symbol, state.regime().value(), state.confidence());
        return Optional.of(state);
    }

    public Optional<RegimeState> getCurrentRegime(String symbol) {
        return Optional.ofNullable(cache.get(symbol)).map(TimedState::state);
    }

    /**
     * Up to {@code limit} most recent history entries, oldest first.
     */
    public List<RegimeHistoryEntry> getRegimeHistory(String symbol, int limit) {
        List<TimedState> entries = history.getOrDefault(symbol, List.of());
        int from = Math.max(0, entries.size() - Math.max(0, limit));
        List<RegimeHistoryEntry> result = new ArrayList<>(entries.size() - from);
        for (TimedState entry : entries.subList(from, entries.size())) {
            RegimeState state = entry.state();
            result.add(new RegimeHistoryEntry(
                    entry.timestamp(),
                    state.regime(),
                    MathUtils.round(state.confidence(), 3),
                    MathUtils.round(state.adxValue(), 2),
                    MathUtils.round(state.bbWidthPercentile(), 2)));
        }
        return result;
    }

    /**
     * Routing decision for the symbol. Fresh candles are detected without touching the cache.
     */
    public Optional<RoutingDecision> recommend(String symbol, List<Candle> candles) {
        return resolveState(symbol, candles).map(router::route);
    }

    /**
     * Risk-based position size scaled by the routed regime modifier.
     */
    public Optional<RegimePositionSize> positionSize(String symbol, List<Candle> candles, double entryPrice,
                                                     double stopLossPrice, RiskManager riskManager) {
        Optional<RegimeState> state = resolveState(symbol, candles);
        if (state.isEmpty()) {
            log.warn("No regime available for {}, cannot size position", symbol);
            return Optional.empty();
        }

        RoutingDecision decision = router.route(state.get());
        double modifier = decision.positionSizeModifier();
        double size = riskManager.calculatePositionSize(entryPrice, stopLossPrice, null, modifier);
        return Optional.of(new RegimePositionSize(
                symbol,
                state.get().regime(),
                modifier,
                MathUtils.round(size, 8),
                entryPrice,
                stopLossPrice,
                decision.primaryStrategy()));
    }

    private Optional<RegimeState> resolveState(String symbol, List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return getCurrentRegime(symbol);
        }
        return Optional.of(detector.detect(candles));
    }
}
