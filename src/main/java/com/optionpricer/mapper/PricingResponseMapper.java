package com.optionpricer.mapper;

import com.optionpricer.api.dto.response.ImpliedVolatilityResponse;
import com.optionpricer.api.dto.response.OptionAnalysisResponse;
import com.optionpricer.api.dto.response.PricingResultResponse;
import com.optionpricer.domain.model.GreeksReport;
import com.optionpricer.domain.model.ImpliedVolatilityResult;
import com.optionpricer.domain.model.OptionAnalysis;
import com.optionpricer.domain.model.PricingResult;
import java.util.ArrayList;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper from pricing domain results to REST response DTOs.
 *
 * <p>Values pass through unformatted. Rounding, percentage signs and currency symbols are
 * the client's concern.
 */
@Mapper
public interface PricingResponseMapper {

    PricingResultResponse toResponse(PricingResult result);

    ImpliedVolatilityResponse toResponse(ImpliedVolatilityResult result);

    List<ImpliedVolatilityResponse> toResponseList(List<ImpliedVolatilityResult> results);

    default OptionAnalysisResponse toResponse(OptionAnalysis analysis) {
        GreeksReport greeks = analysis.getGreeks();
        return OptionAnalysisResponse.builder()
                .timeToExpiry(greeks.getParameters().getTimeToExpiry())
                .dividendYield(greeks.getParameters().getDividendYield())
                .d1(greeks.getD1())
                .d2(greeks.getD2())
                .call(toResponse(greeks.getCall()))
                .put(toResponse(greeks.getPut()))
                .marketPrice(analysis.getMarketPrice())
                .impliedVolatilities(toResponseList(new ArrayList<>(analysis.getImpliedVolatilities().values())))
                .build();
    }
}
