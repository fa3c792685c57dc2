package com.apex.riskcore.service.risk;

import com.apex.riskcore.model.VaRResult;
import com.apex.riskcore.model.VarMethod;
import com.apex.riskcore.util.MathUtils;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.Arrays;

/**
 * Value-at-Risk and Expected Shortfall at the 95% and 99% levels for a portfolio return series.
 * Losses are reported as positive currency amounts.
 */
public class VarCalculator {

    static final double TAIL_95 = 0.05;
    static final double TAIL_99 = 0.01;

    private final NormalDistribution standardNormal = new NormalDistribution(0.0, 1.0);

    public VaRResult calculate(double[] portfolioReturns, double portfolioValue, VarMethod method) {
        if (portfolioReturns.length == 0) {
            return VaRResult.empty(method);
        }
        return method == VarMethod.HISTORICAL
                ? historical(portfolioReturns, portfolioValue)
                : parametric(portfolioReturns, portfolioValue);
    }

    public VaRResult historical(double[] portfolioReturns, double portfolioValue) {
        double[] sorted = portfolioReturns.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        int idx95 = Math.max(0, (int) Math.floor(n * TAIL_95));
        int idx99 = Math.max(0, (int) Math.floor(n * TAIL_99));

        double var95 = -sorted[idx95] * portfolioValue;
        double var99 = -sorted[idx99] * portfolioValue;
        double cvar95 = idx95 > 0 ? -tailMean(sorted, idx95) * portfolioValue : var95;
        double cvar99 = idx99 > 0 ? -tailMean(sorted, idx99) * portfolioValue : var99;

        return rounded(var95, var99, cvar95, cvar99, VarMethod.HISTORICAL, n);
    }

    public VaRResult parametric(double[] portfolioReturns, double portfolioValue) {
        int n = portfolioReturns.length;
        double mu = new Mean().evaluate(portfolioReturns);
        double sigma = new StandardDeviation(false).evaluate(portfolioReturns);
        if (sigma == 0) {
            return VaRResult.empty(VarMethod.PARAMETRIC, n);
        }

        double z95 = standardNormal.inverseCumulativeProbability(TAIL_95);
        double z99 = standardNormal.inverseCumulativeProbability(TAIL_99);

        double var95 = -(mu + z95 * sigma) * portfolioValue;
        double var99 = -(mu + z99 * sigma) * portfolioValue;
        double cvar95 = -(mu - sigma * standardNormal.density(z95) / TAIL_95) * portfolioValue;
        double cvar99 = -(mu - sigma * standardNormal.density(z99) / TAIL_99) * portfolioValue;

        return rounded(var95, var99, cvar95, cvar99, VarMethod.PARAMETRIC, n);
    }

    // mean of sorted[0..lastIndex] inclusive
    private static double tailMean(double[] sorted, int lastIndex) {
        return new Mean().evaluate(sorted, 0, lastIndex + 1);
    }

    private static VaRResult rounded(double var95, double var99, double cvar95, double cvar99,
                                     VarMethod method, int windowDays) {
        return new VaRResult(
                MathUtils.round(var95, 2),
                MathUtils.round(var99, 2),
                MathUtils.round(cvar95, 2),
                MathUtils.round(cvar99, 2),
                method,
                windowDays);
    }
}
