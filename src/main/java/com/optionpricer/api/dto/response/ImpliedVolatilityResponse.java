package com.optionpricer.api.dto.response;

import com.optionpricer.domain.enums.ImpliedVolatilityStatus;
import com.optionpricer.domain.enums.OptionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Implied volatility outcome. {@code volatility} is null unless {@code status} is CONVERGED.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImpliedVolatilityResponse {

    private OptionType optionType;
    private ImpliedVolatilityStatus status;
    private Double volatility;
    private double intrinsicValue;
    private int evaluations;
}
