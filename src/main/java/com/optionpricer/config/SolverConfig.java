package com.optionpricer.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Search bracket and stopping rules for the implied volatility root finder.
 *
 * <p>Properties prefix: {@code optionpricer.solver.*}. The defaults span 0.0001% to 500%
 * annualised volatility, which covers every quote the model can rationalise in practice.
 */
@Configuration
@ConfigurationProperties(prefix = "optionpricer.solver")
@Validated
@Getter
@Setter
public class SolverConfig {

    /** Lower end of the volatility bracket. Must stay above zero where d1 is undefined. */
    @Positive
    private double lowerBound = 1e-6;

    /** Upper end of the volatility bracket. */
    @Positive
    private double upperBound = 5.0;

    /** Absolute tolerance on sigma at which the search stops. */
    @Positive
    private double absoluteAccuracy = 1e-10;

    /** Objective evaluation budget per query. */
    @Positive
    private int maxEvaluations = 200;

    @AssertTrue(message = "lowerBound must be below upperBound")
    public boolean isBracketOrdered() {
        return lowerBound < upperBound;
    }
}
