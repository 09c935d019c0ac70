package com.optionpricer.api.dto.request;

import com.optionpricer.domain.enums.OptionType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImpliedVolatilityRequest {

    @NotNull(message = "marketPrice is required")
    @Positive(message = "marketPrice must be positive")
    private Double marketPrice;

    @NotNull(message = "spot is required")
    @Positive(message = "spot must be positive")
    private Double spot;

    @NotNull(message = "strike is required")
    @Positive(message = "strike must be positive")
    private Double strike;

    /** Year fraction. */
    @NotNull(message = "timeToExpiry is required")
    @Positive(message = "timeToExpiry must be positive")
    private Double timeToExpiry;

    @NotNull(message = "riskFreeRate is required")
    private Double riskFreeRate;

    private Double dividendYield;

    @NotNull(message = "optionType is required")
    private OptionType optionType;
}
