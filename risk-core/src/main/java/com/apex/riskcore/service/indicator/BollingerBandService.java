package com.apex.riskcore.service.indicator;

import lombok.RequiredArgsConstructor;

import java.util.Arrays;

@RequiredArgsConstructor
public class BollingerBandService {

    static final int PERCENTILE_WINDOW = 100;
    static final int PERCENTILE_MIN_PERIODS = 20;

    private final int period;
    private final double deviation;

    /**
     * Normalized band width {@code (upper - lower) / middle} using the sample standard deviation.
     */
    public double[] width(double[] closes) {
        double[] out = new double[closes.length];
        Arrays.fill(out, Double.NaN);
        for (int end = period - 1; end < closes.length; end++) {
            double mean = 0.0;
            for (int i = end - period + 1; i <= end; i++) {
                mean += closes[i];
            }
            mean /= period;
            double squares = 0.0;
            for (int i = end - period + 1; i <= end; i++) {
                double diff = closes[i] - mean;
                squares += diff * diff;
            }
            double standardDeviation = period > 1 ? Math.sqrt(squares / (period - 1)) : Double.NaN;
            if (mean == 0 || Double.isNaN(standardDeviation)) {
                continue;
            }
            double upper = mean + standardDeviation * deviation;
            double lower = mean - standardDeviation * deviation;
            out[end] = (upper - lower) / mean;
        }
        return out;
    }

    /**
     * Rolling percentile rank (0-100) of the band width: the share of valid widths in the trailing
     * window that are at or below the current one.
     *
     * <p>The denominator counts valid widths only; warmup {@code NaN}s inside the window are not
     * counted, so early values are not biased low.
     */
    public double[] widthPercentile(double[] closes) {
        double[] width = width(closes);
        int window = Math.min(PERCENTILE_WINDOW, width.length);
        int minPeriods = Math.min(PERCENTILE_MIN_PERIODS, window);
        double[] out = new double[width.length];
        Arrays.fill(out, Double.NaN);
        for (int end = 0; end < width.length; end++) {
            double current = width[end];
            if (Double.isNaN(current)) {
                continue;
            }
            int valid = 0;
            int atOrBelow = 0;
            for (int i = Math.max(0, end - window + 1); i <= end; i++) {
                if (Double.isNaN(width[i])) {
                    continue;
                }
                valid++;
                if (width[i] <= current) {
                    atOrBelow++;
                }
            }
            if (valid >= minPeriods) {
                out[end] = (double) atOrBelow / valid * 100.0;
            }
        }
        return out;
    }
}
