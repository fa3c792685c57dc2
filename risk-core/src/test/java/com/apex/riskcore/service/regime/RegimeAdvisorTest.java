package com.apex.riskcore.service.regime;

import com.apex.riskcore.model.Candle;
import com.apex.riskcore.model.Regime;
import com.apex.riskcore.model.RegimeHistoryEntry;
import com.apex.riskcore.model.RegimePositionSize;
import com.apex.riskcore.model.RegimeState;
import com.apex.riskcore.model.RoutingDecision;
import com.apex.riskcore.service.risk.RiskManager;
import com.apex.riskcore.util.TestCandleFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RegimeAdvisorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T08:00:00Z");

    private final List<Candle> candles = TestCandleFactory.trendingCandles(10, 100, 1);
    private RegimeDetector detector;
    private RegimeAdvisor advisor;

    @BeforeEach
    void setUp() {
        detector = mock(RegimeDetector.class);
        advisor = new RegimeAdvisor(detector, new StrategyRouter(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static RegimeState state(Regime regime, double confidence) {
        return new RegimeState(regime, confidence, 31.23456, 64.5678, 0.002, 0.5, 0.1);
    }

    @Test
    void assessCachesLatestRegime() {
        when(detector.detect(anyList())).thenReturn(state(Regime.RANGING, 0.7));

        Optional<RegimeState> assessed = advisor.assess("BTC/USDT", candles);

        assertThat(assessed).map(RegimeState::regime).contains(Regime.RANGING);
        assertThat(advisor.getCurrentRegime("BTC/USDT")).isEqualTo(assessed);
        assertThat(advisor.getCurrentRegime("ETH/USDT")).isEmpty();
    }

    @Test
    void assessWithoutCandlesReturnsCachedState() {
        when(detector.detect(anyList())).thenReturn(state(Regime.HIGH_VOLATILITY, 0.9));
        advisor.assess("BTC/USDT", candles);

        assertThat(advisor.assess("BTC/USDT", List.of())).map(RegimeState::regime).contains(Regime.HIGH_VOLATILITY);
        assertThat(advisor.assess("ETH/USDT", null)).isEmpty();
        verify(detector, times(1)).detect(anyList());
        assertThat(advisor.getRegimeHistory("BTC/USDT", 10)).hasSize(1);
    }

    @Test
    void historyIsRoundedAndOldestFirst() {
        when(detector.detect(anyList()))
                .thenReturn(state(Regime.RANGING, 0.71234))
                .thenReturn(state(Regime.WEAK_TREND_UP, 0.65))
                .thenReturn(state(Regime.STRONG_TREND_UP, 0.9));
        for (int i = 0; i < 3; i++) {
            advisor.assess("BTC/USDT", candles);
        }

        List<RegimeHistoryEntry> history = advisor.getRegimeHistory("BTC/USDT", 2);

        assertThat(history).extracting(RegimeHistoryEntry::regime)
                .containsExactly(Regime.WEAK_TREND_UP, Regime.STRONG_TREND_UP);
        assertThat(history.get(0).adxValue()).isEqualTo(31.23);
        assertThat(history.get(0).bbWidthPercentile()).isEqualTo(64.57);
        assertThat(history.get(0).timestamp()).isEqualTo(NOW);
        assertThat(advisor.getRegimeHistory("BTC/USDT", 10).get(0).confidence()).isEqualTo(0.712);
        assertThat(advisor.getRegimeHistory("SOL/USDT", 10)).isEmpty();
    }

    @Test
    void historyIsTrimmedPastLimit() {
        when(detector.detect(anyList())).thenReturn(state(Regime.RANGING, 0.7));
        for (int i = 0; i <= RegimeAdvisor.HISTORY_LIMIT; i++) {
            advisor.assess("BTC/USDT", candles);
        }

        assertThat(advisor.getRegimeHistory("BTC/USDT", 5_000)).hasSize(RegimeAdvisor.HISTORY_RETAINED);
    }

    @Test
    void recommendDoesNotTouchCache() {
        when(detector.detect(anyList())).thenReturn(state(Regime.STRONG_TREND_DOWN, 0.9));

        Optional<RoutingDecision> decision = advisor.recommend("BTC/USDT", candles);

        assertThat(decision).map(RoutingDecision::positionSizeModifier).contains(0.3);
        assertThat(advisor.getCurrentRegime("BTC/USDT")).isEmpty();
        assertThat(advisor.recommend("BTC/USDT", List.of())).isEmpty();
    }

    @Test
    void positionSizeAppliesRegimeModifier() {
        when(detector.detect(anyList())).thenReturn(state(Regime.WEAK_TREND_DOWN, 0.8));
        RiskManager riskManager = new RiskManager();

        Optional<RegimePositionSize> sized = advisor.positionSize("BTC/USDT", candles, 100, 80, riskManager);

        assertThat(sized).isPresent();
        assertThat(sized.get().regimeModifier()).isEqualTo(0.5);
        assertThat(sized.get().positionSize()).isCloseTo(5.0, within(1e-8));
        assertThat(sized.get().primaryStrategy()).isEqualTo(RoutingTable.BOLLINGER_MEAN_REVERSION);
        assertThat(sized.get().regime()).isEqualTo(Regime.WEAK_TREND_DOWN);
    }

    @Test
    void positionSizeWithoutRegimeIsEmpty() {
        assertThat(advisor.positionSize("BTC/USDT", List.of(), 100, 80, new RiskManager())).isEmpty();
        verify(detector, never()).detect(anyList());
    }
}
