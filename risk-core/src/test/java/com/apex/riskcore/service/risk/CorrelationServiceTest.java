package com.apex.riskcore.service.risk;

import com.apex.riskcore.model.CorrelationMatrix;
import com.apex.riskcore.model.CorrelationPair;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CorrelationServiceTest {

    private final CorrelationService service = new CorrelationService();

    @Test
    void correlationIsScaleInvariant() {
        Map<String, double[]> returns = new LinkedHashMap<>();
        returns.put("BASE", new double[]{0.01, -0.02, 0.015, 0.003, -0.007, 0.02});
        returns.put("SCALED", new double[]{0.02, -0.04, 0.03, 0.006, -0.014, 0.04});

        CorrelationMatrix matrix = service.buildCorrelationMatrix(returns);

        assertThat(matrix.getSymbols()).containsExactly("BASE", "SCALED");
        assertThat(matrix.get("BASE", "SCALED")).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void constantSeriesCorrelatesAsNan() {
        Map<String, double[]> returns = new LinkedHashMap<>();
        returns.put("FLAT", new double[]{0.0, 0.0, 0.0, 0.0});
        returns.put("MOVING", new double[]{0.01, -0.01, 0.02, 0.0});

        CorrelationMatrix matrix = service.buildCorrelationMatrix(returns);

        assertThat(matrix.get("FLAT", "MOVING")).isNaN();
        assertThat(service.maxAbsoluteCorrelation(matrix)).isZero();
        assertThat(service.highlyCorrelatedPairs(matrix, 0.7)).isEmpty();
    }

    @Test
    void reportsPairsAboveThreshold() {
        Map<String, double[]> returns = new LinkedHashMap<>();
        returns.put("A", new double[]{0.01, -0.02, 0.015, 0.003, -0.007});
        returns.put("B", new double[]{-0.01, 0.02, -0.015, -0.003, 0.007});
        returns.put("C", new double[]{0.002, 0.001, -0.001, 0.004, -0.003});

        CorrelationMatrix matrix = service.buildCorrelationMatrix(returns);
        List<CorrelationPair> pairs = service.highlyCorrelatedPairs(matrix, 0.7);

        assertThat(pairs).hasSize(1);
        assertThat(pairs.get(0).first()).isEqualTo("A");
        assertThat(pairs.get(0).second()).isEqualTo("B");
        assertThat(pairs.get(0).correlation()).isEqualTo(1.0);
        assertThat(service.maxAbsoluteCorrelation(matrix)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void singleSeriesGivesEmptyMatrix() {
        assertThat(service.buildCorrelationMatrix(Map.of("A", new double[]{0.1, 0.2})).isEmpty()).isTrue();
    }

    @Test
    void rejectsMisalignedSeries() {
        Map<String, double[]> returns = new LinkedHashMap<>();
        returns.put("A", new double[]{0.01, 0.02, 0.03});
        returns.put("B", new double[]{0.01, 0.02});

        assertThatThrownBy(() -> service.buildCorrelationMatrix(returns))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
