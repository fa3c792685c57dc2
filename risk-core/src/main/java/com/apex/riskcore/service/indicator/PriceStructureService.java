package com.apex.riskcore.service.indicator;

import com.apex.riskcore.util.MathUtils;
import lombok.RequiredArgsConstructor;

/**
 * Position of the close inside its trailing high/low range, scaled to [-1, 1].
 */
@RequiredArgsConstructor
public class PriceStructureService {

    private final int lookback;

    public double[] calculate(double[] closes) {
        double[] out = new double[closes.length];
        for (int end = 0; end < closes.length; end++) {
            double high = Double.NEGATIVE_INFINITY;
            double low = Double.POSITIVE_INFINITY;
            for (int i = Math.max(0, end - lookback + 1); i <= end; i++) {
                high = Math.max(high, closes[i]);
                low = Math.min(low, closes[i]);
            }
            double range = high - low;
            if (range == 0) {
                continue;
            }
            double midpoint = (high + low) / 2.0;
            out[end] = MathUtils.clamp(2.0 * (closes[end] - midpoint) / range, -1.0, 1.0);
        }
        return out;
    }
}
