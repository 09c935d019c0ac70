package com.optionpricer.service;

import com.optionpricer.api.dto.request.ImpliedVolatilityRequest;
import com.optionpricer.api.dto.request.OptionAnalysisRequest;
import com.optionpricer.api.dto.request.PriceRequest;
import com.optionpricer.core.processor.BlackScholesCalculator;
import com.optionpricer.core.processor.ImpliedVolatilitySolver;
import com.optionpricer.domain.enums.OptionType;
import com.optionpricer.domain.model.GreeksReport;
import com.optionpricer.domain.model.ImpliedVolatilityResult;
import com.optionpricer.domain.model.MarketParameters;
import com.optionpricer.domain.model.OptionAnalysis;
import com.optionpricer.domain.model.PricingResult;
import java.util.EnumMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for single-contract pricing work.
 *
 * <p>Resolves request inputs through {@link MarketInputResolver}, then runs the pricing engine
 * and, when a market price is supplied, the implied volatility solver for both option types.
 */
@Slf4j
@Service
public class OptionAnalysisService {

    private final BlackScholesCalculator calculator;
    private final ImpliedVolatilitySolver solver;
    private final MarketInputResolver inputResolver;

    public OptionAnalysisService(
            BlackScholesCalculator calculator, ImpliedVolatilitySolver solver, MarketInputResolver inputResolver) {
        this.calculator = calculator;
        this.solver = solver;
        this.inputResolver = inputResolver;
    }

    public OptionAnalysis analyze(OptionAnalysisRequest request) {
        MarketParameters params = inputResolver.resolve(request);
        GreeksReport greeks = calculator.greeks(params);

        Double marketPrice = request.getMarketPrice();
        Map<OptionType, ImpliedVolatilityResult> impliedVolatilities = marketPrice != null
                ? solver.solveBoth(marketPrice, params)
                : new EnumMap<>(OptionType.class);

        log.debug(
                "Analyzed S={}, K={}, T={}, sigma={}: call={}, put={}, ivSolved={}",
                params.getSpot(),
                params.getStrike(),
                params.getTimeToExpiry(),
                params.getVolatility(),
                greeks.getCall().getPrice(),
                greeks.getPut().getPrice(),
                !impliedVolatilities.isEmpty());

        return OptionAnalysis.builder()
                .greeks(greeks)
                .marketPrice(marketPrice)
                .impliedVolatilities(impliedVolatilities)
                .build();
    }

    public PricingResult price(PriceRequest request) {
        MarketParameters params = inputResolver.resolve(request);
        return calculator.evaluate(params, request.getOptionType());
    }

    public ImpliedVolatilityResult impliedVolatility(ImpliedVolatilityRequest request) {
        return solver.solve(inputResolver.resolve(request));
    }
}
