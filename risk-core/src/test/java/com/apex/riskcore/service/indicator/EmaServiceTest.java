package com.apex.riskcore.service.indicator;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EmaServiceTest {

    private final EmaService emaService = new EmaService();

    @Test
    void emaIsSeededWithFirstValue() {
        assertThat(emaService.ema(new double[]{1, 2, 3}, 3)).containsExactly(1.0, 1.5, 2.25);
    }

    @Test
    void slopeIsRelativeChangeOverLookback() {
        double[] closes = new double[30];
        for (int i = 0; i < closes.length; i++) {
            closes[i] = 100 + i;
        }

        double[] slope = emaService.slope(closes, 20, 5);
        double[] ema = emaService.ema(closes, 20);

        for (int i = 0; i < 5; i++) {
            assertThat(slope[i]).isNaN();
        }
        assertThat(slope[29]).isCloseTo((ema[29] - ema[24]) / ema[24], within(1e-12));
        assertThat(slope[29]).isPositive();
    }

    @Test
    void slopeIsUndefinedForZeroBase() {
        double[] slope = emaService.slope(new double[]{0, 0, 0, 1}, 2, 1);

        assertThat(slope[1]).isNaN();
        assertThat(slope[3]).isNaN();
    }

    @Test
    void alignmentIsBullishWhenFastEmasLeadInUptrend() {
        double[] closes = new double[250];
        for (int i = 0; i < closes.length; i++) {
            closes[i] = 100 + i * 0.5;
        }

        double[] alignment = emaService.alignment(closes, List.of(200, 21, 100, 50));

        assertThat(alignment[0]).isZero();
        assertThat(alignment[249]).isEqualTo(1.0);
    }

    @Test
    void alignmentIsBearishInDowntrend() {
        double[] closes = new double[250];
        for (int i = 0; i < closes.length; i++) {
            closes[i] = 300 - i * 0.5;
        }

        double[] alignment = emaService.alignment(closes, List.of(21, 50, 100, 200));

        assertThat(alignment[249]).isEqualTo(-1.0);
    }
}
