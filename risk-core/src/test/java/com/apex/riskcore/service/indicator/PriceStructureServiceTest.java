package com.apex.riskcore.service.indicator;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PriceStructureServiceTest {

    private final PriceStructureService service = new PriceStructureService(5);

    @Test
    void scoresPositionInsideTrailingRange() {
        double[] score = service.calculate(new double[]{10, 12, 14, 16, 18, 14, 10});

        assertThat(score[4]).isEqualTo(1.0);
        // close of 10 is the new window low
        assertThat(score[6]).isEqualTo(-1.0);
        // window 12..18, close 14
        assertThat(score[5]).isCloseTo(2 * (14 - 15.0) / 6.0, within(1e-12));
    }

    @Test
    void flatRangeScoresZero() {
        double[] score = service.calculate(new double[]{5, 5, 5});

        assertThat(score).containsExactly(0.0, 0.0, 0.0);
    }

    @Test
    void firstBarHasNoRange() {
        assertThat(service.calculate(new double[]{42})[0]).isZero();
    }
}
