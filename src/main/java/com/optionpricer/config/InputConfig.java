package com.optionpricer.config;

import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Conventions applied when turning caller-facing inputs into model parameters.
 *
 * <p>Properties prefix: {@code optionpricer.input.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "optionpricer.input")
@Validated
@Getter
@Setter
public class InputConfig {

    /** Divisor converting days to expiry into a year fraction. */
    @Positive
    private double daysPerYear = 365.0;

    /** Dividend yield used when a request omits it. */
    private double defaultDividendYield = 0.0;

    /** Largest number of queries accepted in one batch implied volatility request. */
    @Positive
    private int maxBatchQueries = 500;
}
