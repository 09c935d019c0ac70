package com.optionpricer.service;

import com.optionpricer.api.dto.request.ImpliedVolatilityRequest;
import com.optionpricer.api.dto.request.OptionAnalysisRequest;
import com.optionpricer.api.dto.request.PriceRequest;
import com.optionpricer.config.InputConfig;
import com.optionpricer.domain.model.ImpliedVolatilityQuery;
import com.optionpricer.domain.model.MarketParameterValidator;
import com.optionpricer.domain.model.MarketParameters;
import com.optionpricer.exception.InvalidMarketParametersException;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Turns request payloads into validated model inputs: fills in the default dividend yield
 * and converts days to expiry into years.
 */
@Component
public class MarketInputResolver {

    private final InputConfig inputConfig;

    public MarketInputResolver(InputConfig inputConfig) {
        this.inputConfig = inputConfig;
    }

    public MarketParameters resolve(OptionAnalysisRequest request) {
        double days =
                MarketParameterValidator.requirePositive("daysToExpiry", required("daysToExpiry", request.getDaysToExpiry()));
        return MarketParameters.of(
                required("spot", request.getSpot()),
                required("strike", request.getStrike()),
                toYears(days),
                required("riskFreeRate", request.getRiskFreeRate()),
                dividendYieldOrDefault(request.getDividendYield()),
                required("volatility", request.getVolatility()));
    }

    public MarketParameters resolve(PriceRequest request) {
        return MarketParameters.of(
                required("spot", request.getSpot()),
                required("strike", request.getStrike()),
                required("timeToExpiry", request.getTimeToExpiry()),
                required("riskFreeRate", request.getRiskFreeRate()),
                dividendYieldOrDefault(request.getDividendYield()),
                required("volatility", request.getVolatility()));
    }

    public ImpliedVolatilityQuery resolve(ImpliedVolatilityRequest request) {
        return ImpliedVolatilityQuery.of(
                required("marketPrice", request.getMarketPrice()),
                required("spot", request.getSpot()),
                required("strike", request.getStrike()),
                required("timeToExpiry", request.getTimeToExpiry()),
                required("riskFreeRate", request.getRiskFreeRate()),
                dividendYieldOrDefault(request.getDividendYield()),
                required("optionType", request.getOptionType()));
    }

    double toYears(double days) {
        return days / inputConfig.getDaysPerYear();
    }

    private static <T> T required(String field, T value) {
        if (value == null) {
            throw new InvalidMarketParametersException(field + " is required", Map.of(field, "is required"));
        }
        return value;
    }

    private double dividendYieldOrDefault(Double dividendYield) {
        return dividendYield != null ? dividendYield : inputConfig.getDefaultDividendYield();
    }
}
