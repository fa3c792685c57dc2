package com.apex.riskcore.service.indicator;

import com.apex.riskcore.model.Candle;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.List;

/**
 * Wilder's Average Directional Index (0-100), one value per bar.
 */
@RequiredArgsConstructor
public class AdxService {

    private final int period;

    public double[] calculate(List<Candle> candles) {
        int n = candles.size();
        if (n == 0) {
            return new double[0];
        }

        double[] tr = new double[n];
        double[] dmPlus = new double[n];
        double[] dmMinus = new double[n];

        tr[0] = candles.get(0).getHigh() - candles.get(0).getLow();
        for (int i = 1; i < n; i++) {
            Candle curr = candles.get(i);
            Candle prev = candles.get(i - 1);
            double highDiff = curr.getHigh() - prev.getHigh();
            double lowDiff = prev.getLow() - curr.getLow();
            tr[i] = Math.max(curr.getHigh() - curr.getLow(),
                    Math.max(Math.abs(curr.getHigh() - prev.getClose()), Math.abs(curr.getLow() - prev.getClose())));
            dmPlus[i] = (highDiff > lowDiff && highDiff > 0) ? highDiff : 0.0;
            // compared against the already filtered +DM, so an equal move counts as -DM
            dmMinus[i] = (lowDiff > dmPlus[i] && lowDiff > 0) ? lowDiff : 0.0;
        }

        double[] atr = Smoothing.wilder(tr, period);
        double[] smoothPlus = Smoothing.wilder(dmPlus, period);
        double[] smoothMinus = Smoothing.wilder(dmMinus, period);

        double[] dx = new double[n];
        Arrays.fill(dx, Double.NaN);
        for (int i = 0; i < n; i++) {
            double plusDI = 100.0 * smoothPlus[i] / atr[i];
            double minusDI = 100.0 * smoothMinus[i] / atr[i];
            double diSum = plusDI + minusDI;
            if (Double.isNaN(diSum) || Double.isInfinite(diSum) || diSum == 0) {
                continue;
            }
            dx[i] = 100.0 * Math.abs(plusDI - minusDI) / diSum;
        }
        return Smoothing.wilder(dx, period);
    }
}
