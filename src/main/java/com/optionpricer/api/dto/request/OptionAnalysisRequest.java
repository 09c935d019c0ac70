package com.optionpricer.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Full analysis request: prices and Greeks for both option types, plus call-side and
 * put-side implied volatility when a market price is given.
 *
 * <p>Expiry is given in calendar days and converted to a year fraction server-side.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptionAnalysisRequest {

    @NotNull(message = "spot is required")
    @Positive(message = "spot must be positive")
    private Double spot;

    @NotNull(message = "strike is required")
    @Positive(message = "strike must be positive")
    private Double strike;

    @NotNull(message = "daysToExpiry is required")
    @Positive(message = "daysToExpiry must be positive")
    private Double daysToExpiry;

    /** Continuously compounded, as a decimal. May be negative. */
    @NotNull(message = "riskFreeRate is required")
    private Double riskFreeRate;

    @NotNull(message = "volatility is required")
    @Positive(message = "volatility must be positive")
    private Double volatility;

    /** Optional. Defaults to optionpricer.input.default-dividend-yield. */
    private Double dividendYield;

    /** Optional. When present, implied volatilities are solved for both option types. */
    @Positive(message = "marketPrice must be positive")
    private Double marketPrice;
}
