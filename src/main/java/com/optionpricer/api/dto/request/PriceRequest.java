package com.optionpricer.api.dto.request;

import com.optionpricer.domain.enums.OptionType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Single-type pricing request. Time to expiry is already a year fraction here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceRequest {

    @NotNull(message = "spot is required")
    @Positive(message = "spot must be positive")
    private Double spot;

    @NotNull(message = "strike is required")
    @Positive(message = "strike must be positive")
    private Double strike;

    @NotNull(message = "timeToExpiry is required")
    @Positive(message = "timeToExpiry must be positive")
    private Double timeToExpiry;

    @NotNull(message = "riskFreeRate is required")
    private Double riskFreeRate;

    private Double dividendYield;

    @NotNull(message = "volatility is required")
    @Positive(message = "volatility must be positive")
    private Double volatility;

    @NotNull(message = "optionType is required")
    private OptionType optionType;
}
