package com.apex.riskcore.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Thresholds and lookbacks used by the regime detector.
 */
@Value
@Builder(toBuilder = true)
public class RegimeConfig {

    @Builder.Default
    double adxStrong = 40.0;

    @Builder.Default
    double adxWeak = 25.0;

    @Builder.Default
    double bbHighVolPct = 80.0;

    @Builder.Default
    int emaSlopePeriod = 20;

    @Builder.Default
    int emaSlopeLookback = 5;

    @Builder.Default
    List<Integer> alignmentEmaPeriods = List.of(21, 50, 100, 200);

    @Builder.Default
    int structureLookback = 20;

    @Builder.Default
    double strongAlignmentThreshold = 0.5;

    @Builder.Default
    double strongStructureThreshold = 0.3;

    @Builder.Default
    int transitionLookback = 50;

    @Builder.Default
    int bbPeriod = 20;

    @Builder.Default
    double bbStd = 2.0;

    @Builder.Default
    int adxPeriod = 14;

    @Builder.Default
    int hysteresisBars = 3;

    public static RegimeConfig defaults() {
        return RegimeConfig.builder().build();
    }
}
