package com.apex.riskcore.service.indicator;

import java.util.Arrays;

/**
 * Recursive exponential smoothing over a series that may contain {@code NaN} gaps.
 */
final class Smoothing {

    private Smoothing() {
    }

    /**
     * {@code y[0] = x[first valid]}, {@code y[t] = (1 - alpha) * y[t-1] + alpha * x[t]}. Positions
     * before {@code minPeriods} valid observations are {@code NaN}. Across a {@code NaN} gap the
     * previous value is carried forward, and the next observation weighs it by
     * {@code (1 - alpha)^(gap + 1)} against {@code alpha}, normalized.
     */
    static double[] exponential(double[] values, double alpha, int minPeriods) {
        double[] out = new double[values.length];
        Arrays.fill(out, Double.NaN);
        double state = Double.NaN;
        double stateWeight = 1.0;
        int observations = 0;
        for (int i = 0; i < values.length; i++) {
            double x = values[i];
            boolean observed = !Double.isNaN(x);
            if (Double.isNaN(state)) {
                state = x;
            } else {
                stateWeight *= 1.0 - alpha;
                if (observed) {
                    state = (stateWeight * state + alpha * x) / (stateWeight + alpha);
                    stateWeight = 1.0;
                }
            }
            if (observed) {
                observations++;
            }
            if (observations >= minPeriods && !Double.isNaN(state)) {
                out[i] = state;
            }
        }
        return out;
    }

    static double[] wilder(double[] values, int period) {
        return exponential(values, 1.0 / period, period);
    }
}
