package com.apex.riskcore.config;

import com.apex.riskcore.model.RegimeConfig;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "regime")
@Data
@Validated
public class RegimeProperties {

    @Positive
    private double adxStrong = 40.0;

    @Positive
    private double adxWeak = 25.0;

    @Positive
    private double bbHighVolPct = 80.0;

    @Min(1)
    private int emaSlopePeriod = 20;

    @Min(1)
    private int emaSlopeLookback = 5;

    @NotEmpty
    private List<Integer> alignmentEmaPeriods = new ArrayList<>(List.of(21, 50, 100, 200));

    @Min(1)
    private int structureLookback = 20;

    private double strongAlignmentThreshold = 0.5;

    private double strongStructureThreshold = 0.3;

    @Min(2)
    private int transitionLookback = 50;

    @Min(2)
    private int bbPeriod = 20;

    @Positive
    private double bbStd = 2.0;

    @Min(1)
    private int adxPeriod = 14;

    @Min(1)
    private int hysteresisBars = 3;

    public RegimeConfig toConfig() {
        return RegimeConfig.builder()
                .adxStrong(adxStrong)
                .adxWeak(adxWeak)
                .bbHighVolPct(bbHighVolPct)
                .emaSlopePeriod(emaSlopePeriod)
                .emaSlopeLookback(emaSlopeLookback)
                .alignmentEmaPeriods(List.copyOf(alignmentEmaPeriods))
                .structureLookback(structureLookback)
                .strongAlignmentThreshold(strongAlignmentThreshold)
                .strongStructureThreshold(strongStructureThreshold)
                .transitionLookback(transitionLookback)
                .bbPeriod(bbPeriod)
                .bbStd(bbStd)
                .adxPeriod(adxPeriod)
                .hysteresisBars(hysteresisBars)
                .build();
    }
}
