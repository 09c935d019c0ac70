package com.optionpricer.api.dto.response;

import com.optionpricer.domain.enums.OptionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PricingResultResponse {

    private OptionType optionType;
    private double price;
    private double delta;
    private double gamma;
    private double vega;
    private double theta;
    private double rho;
    private double d1;
    private double d2;
}
