package com.apex.riskcore.service.indicator;

import com.apex.riskcore.model.Candle;
import com.apex.riskcore.util.TestCandleFactory;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BollingerBandServiceTest {

    private final BollingerBandService service = new BollingerBandService(20, 2.0);

    @Test
    void widthUsesSampleDeviationOverMiddleBand() {
        double[] closes = new double[20];
        for (int i = 0; i < 20; i++) {
            closes[i] = i % 2 == 0 ? 99.0 : 101.0;
        }

        double[] width = service.width(closes);

        assertThat(width[18]).isNaN();
        // sample std of +-1 over 20 values is sqrt(20/19)
        assertThat(width[19]).isCloseTo(4 * Math.sqrt(20.0 / 19.0) / 100.0, within(1e-12));
    }

    @Test
    void flatPricesHaveZeroWidth() {
        double[] closes = new double[25];
        Arrays.fill(closes, 50.0);

        assertThat(service.width(closes)[24]).isZero();
    }

    @Test
    void percentileNeedsTwentyWidths() {
        double[] closes = TestCandleFactory.trendingCandles(60, 100, 1.5).stream()
                .mapToDouble(Candle::getClose).toArray();

        double[] pct = service.widthPercentile(closes);

        assertThat(pct[37]).isNaN();
        // a linear trend has constant deviation over a rising mean, so every new width is the narrowest
        assertThat(pct[38]).isCloseTo(5.0, within(1e-9));
        assertThat(pct[59]).isCloseTo(100.0 / 41.0, within(1e-9));
    }

    @Test
    void expandingWidthRanksAtTheTop() {
        double[] closes = TestCandleFactory.volatilityBurstCandles(300, 100, 1, 15, 5).stream()
                .mapToDouble(Candle::getClose).toArray();

        double[] pct = service.widthPercentile(closes);

        assertThat(pct[299]).isEqualTo(100.0);
        for (double value : pct) {
            if (!Double.isNaN(value)) {
                assertThat(value).isBetween(0.0, 100.0);
            }
        }
    }
}
