package com.apex.riskcore.service.indicator;

import java.util.Arrays;
import java.util.List;

public class EmaService {

    public double[] ema(double[] values, int period) {
        return Smoothing.exponential(values, 2.0 / (period + 1), 1);
    }

    /**
     * Relative change of the EMA over {@code lookback} bars.
     */
    public double[] slope(double[] closes, int period, int lookback) {
        double[] ema = ema(closes, period);
        double[] out = new double[ema.length];
        Arrays.fill(out, Double.NaN);
        for (int i = lookback; i < ema.length; i++) {
            double previous = ema[i - lookback];
            if (previous == 0 || Double.isNaN(previous)) {
                continue;
            }
            out[i] = (ema[i] - previous) / previous;
        }
        return out;
    }

    /**
     * Mean sign of (faster EMA - slower EMA) over every pair of the given periods, in [-1, 1].
     */
    public double[] alignment(double[] closes, List<Integer> periods) {
        List<Integer> sorted = periods.stream().sorted().toList();
        double[][] emas = new double[sorted.size()][];
        for (int i = 0; i < sorted.size(); i++) {
            emas[i] = ema(closes, sorted.get(i));
        }
        double[] out = new double[closes.length];
        int pairs = 0;
        for (int fast = 0; fast < sorted.size(); fast++) {
            for (int slow = fast + 1; slow < sorted.size(); slow++) {
                for (int bar = 0; bar < closes.length; bar++) {
                    out[bar] += Math.signum(emas[fast][bar] - emas[slow][bar]);
                }
                pairs++;
            }
        }
        if (pairs > 0) {
            for (int bar = 0; bar < out.length; bar++) {
                out[bar] /= pairs;
            }
        }
        return out;
    }
}
