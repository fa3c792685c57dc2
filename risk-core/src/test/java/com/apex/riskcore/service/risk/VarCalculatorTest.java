package com.apex.riskcore.service.risk;

import com.apex.riskcore.model.VaRResult;
import com.apex.riskcore.model.VarMethod;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class VarCalculatorTest {

    private final VarCalculator calculator = new VarCalculator();

    @Test
    void historicalUsesLowerTailOfSortedReturns() {
        double[] returns = new double[20];
        Arrays.fill(returns, 0.01);
        returns[7] = -0.03;
        returns[12] = -0.05;

        VaRResult result = calculator.calculate(returns, 10_000, VarMethod.HISTORICAL);

        // n=20: 95% index 1, 99% index 0
        assertThat(result.var95()).isEqualTo(300.0);
        assertThat(result.cvar95()).isEqualTo(400.0);
        assertThat(result.var99()).isEqualTo(500.0);
        assertThat(result.cvar99()).isEqualTo(500.0);
        assertThat(result.method()).isEqualTo(VarMethod.HISTORICAL);
        assertThat(result.windowDays()).isEqualTo(20);
    }

    @Test
    void parametricMatchesGaussianFormulas() {
        double[] returns = new double[20];
        for (int i = 0; i < returns.length; i++) {
            returns[i] = i % 2 == 0 ? 0.01 : -0.01;
        }

        VaRResult result = calculator.calculate(returns, 10_000, VarMethod.PARAMETRIC);

        assertThat(result.var95()).isEqualTo(164.49);
        assertThat(result.var99()).isEqualTo(232.63);
        assertThat(result.cvar95()).isEqualTo(206.27);
        assertThat(result.cvar99()).isEqualTo(266.52);
        assertThat(result.windowDays()).isEqualTo(20);
    }

    @Test
    void parametricIncludesMean() {
        double[] returns = new double[20];
        for (int i = 0; i < returns.length; i++) {
            returns[i] = i % 2 == 0 ? 0.02 : -0.01;
        }

        VaRResult result = calculator.parametric(returns, 10_000);

        assertThat(result.var95()).isEqualTo(196.73);
        assertThat(result.cvar99()).isEqualTo(349.78);
    }

    @Test
    void zeroVarianceGivesZeroedResultWithWindow() {
        double[] returns = new double[25];
        Arrays.fill(returns, 0.004);

        VaRResult result = calculator.calculate(returns, 10_000, VarMethod.PARAMETRIC);

        assertThat(result).isEqualTo(VaRResult.empty(VarMethod.PARAMETRIC, 25));
    }

    @Test
    void emptySeriesGivesEmptyResult() {
        assertThat(calculator.calculate(new double[0], 10_000, VarMethod.HISTORICAL))
                .isEqualTo(VaRResult.empty(VarMethod.HISTORICAL));
    }

    @Test
    void historicalDoesNotMutateInput() {
        double[] returns = {0.03, -0.02, 0.01, -0.04, 0.0, 0.02, 0.01, -0.01, 0.02, 0.01,
                0.03, -0.02, 0.01, -0.04, 0.0, 0.02, 0.01, -0.01, 0.02, 0.01};
        double[] copy = returns.clone();

        calculator.historical(returns, 1_000);

        assertThat(returns).containsExactly(copy);
    }
}
