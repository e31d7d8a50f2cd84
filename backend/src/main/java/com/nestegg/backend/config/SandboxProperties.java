package com.nestegg.backend.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.ZoneId;

@Configuration
@ConfigurationProperties(prefix = "sandbox")
@Data
@Validated
public class SandboxProperties {

    // Current-price cache lifetime
    @Positive
    private long quoteTtlSeconds = 300;

    // Computed equity curve cache lifetime
    @Positive
    private long historyTtlSeconds = 900;

    @Positive
    private BigDecimal lotEpsilon = new BigDecimal("0.000001");

    @DecimalMin(value = "0.01")
    private BigDecimal defaultInitialCash = new BigDecimal("10000.00");

    @NotBlank
    private String zone = "UTC";

    @Positive
    private long lockTimeoutMillis = 5000;

    @Min(1)
    private int tradeConflictRetries = 3;

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }
}
