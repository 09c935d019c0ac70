package com.optionpricer.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptionAnalysisResponse {

    /** Year fraction the request's days to expiry resolved to. */
    private double timeToExpiry;

    private double dividendYield;
    private double d1;
    private double d2;
    private PricingResultResponse call;
    private PricingResultResponse put;
    private Double marketPrice;

    /** Call first, then put. Empty when no market price was given. */
    private List<ImpliedVolatilityResponse> impliedVolatilities;
}
