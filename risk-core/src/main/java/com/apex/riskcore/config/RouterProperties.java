package com.apex.riskcore.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "router")
@Data
@Validated
public class RouterProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double lowConfidenceThreshold = 0.4;

    @Positive
    @DecimalMax("1.0")
    private double lowConfidencePenalty = 0.5;
}
