package com.apex.riskcore.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

public final class MathUtils {

    private MathUtils() {
    }

    /**
     * Half-even rounding of the exact binary value, so 2.675 (stored just below) becomes 2.67.
     */
    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double nanToZero(double value) {
        return Double.isNaN(value) ? 0.0 : value;
    }

    public static String percent(double fraction) {
        return String.format(Locale.ROOT, "%.2f%%", fraction * 100.0);
    }
}
