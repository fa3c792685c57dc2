package com.apex.riskcore.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ModelJsonTest {

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    void regimeStateUsesSnakeCaseAndLowercaseRegime() {
        RegimeState state = new RegimeState(Regime.STRONG_TREND_UP, 0.9, 45.5, 60.0, 0.01, 1.0, 0.8,
                Map.of("strong_trend_up", 1.0));

        JsonNode json = mapper.valueToTree(state);

        assertThat(json.get("regime").asText()).isEqualTo("strong_trend_up");
        assertThat(json.get("adx_value").asDouble()).isEqualTo(45.5);
        assertThat(json.get("bb_width_percentile").asDouble()).isEqualTo(60.0);
        assertThat(json.get("price_structure_score").asDouble()).isEqualTo(0.8);
        assertThat(json.get("transition_probabilities").get("strong_trend_up").asDouble()).isEqualTo(1.0);
    }

    @Test
    void routingDecisionSerializesWeights() {
        RoutingDecision decision = new RoutingDecision(Regime.WEAK_TREND_DOWN, 0.7, "BollingerMeanReversion",
                List.of(new StrategyWeight("BollingerMeanReversion", 0.5, 0.5)), 0.5, "split");

        JsonNode json = mapper.valueToTree(decision);

        assertThat(json.get("regime").asText()).isEqualTo("weak_trend_down");
        assertThat(json.get("primary_strategy").asText()).isEqualTo("BollingerMeanReversion");
        assertThat(json.get("position_size_modifier").asDouble()).isEqualTo(0.5);
        assertThat(json.get("weights").get(0).get("strategy_name").asText()).isEqualTo("BollingerMeanReversion");
    }

    @Test
    void riskStatusAndVarUseWireNames() {
        JsonNode status = mapper.valueToTree(new RiskStatus(9_000, 10_000, 0.1, -50, -1_000, 2, true, "Manual halt"));
        JsonNode var = mapper.valueToTree(new VaRResult(100, 150, 120, 180, VarMethod.HISTORICAL, 60));

        assertThat(status.get("is_halted").asBoolean()).isTrue();
        assertThat(status.get("halt_reason").asText()).isEqualTo("Manual halt");
        assertThat(status.get("peak_equity").asDouble()).isEqualTo(10_000);
        assertThat(var.get("var_99").asDouble()).isEqualTo(150);
        assertThat(var.get("method").asText()).isEqualTo("historical");
        assertThat(var.get("window_days").asInt()).isEqualTo(60);
    }

    @Test
    void tradeCheckRecordWritesLowercaseSide() {
        TradeCheckRecord record = new TradeCheckRecord("BTC/USDT", TradeSide.SELL, 0.1, 50_000, null, true,
                "approved", 10_000, 0, 0, Instant.parse("2024-01-01T00:00:00Z"));

        JsonNode json = mapper.valueToTree(record);

        assertThat(json.get("side").asText()).isEqualTo("sell");
        assertThat(json.get("stop_loss_price").isNull()).isTrue();
        assertThat(json.get("open_positions_at_check").asInt()).isZero();
    }

    @Test
    void tradeSideParsesCaseInsensitively() {
        assertThat(TradeSide.from(" buy ")).isEqualTo(TradeSide.BUY);
        assertThat(TradeSide.from("SELL")).isEqualTo(TradeSide.SELL);
    }
}
