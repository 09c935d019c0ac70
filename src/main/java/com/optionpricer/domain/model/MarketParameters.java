package com.optionpricer.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Market and contract inputs for one Black-Scholes-Merton evaluation.
 *
 * <p>Spot, strike, time to expiry (in years) and volatility must be strictly positive.
 * Risk-free rate and dividend yield may take any finite value, negative included, so that
 * negative-rate regimes price correctly. All rates are continuously compounded decimals
 * (0.05 = 5%).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MarketParameters {

    double spot;
    double strike;
    double timeToExpiry;
    double riskFreeRate;
    double dividendYield;
    double volatility;

    /**
     * @throws com.optionpricer.exception.InvalidMarketParametersException if any precondition fails
     */
    public static MarketParameters of(
            double spot,
            double strike,
            double timeToExpiry,
            double riskFreeRate,
            double dividendYield,
            double volatility) {
        MarketParameterValidator.validate(spot, strike, timeToExpiry, riskFreeRate, dividendYield, volatility);
        return new MarketParameters(spot, strike, timeToExpiry, riskFreeRate, dividendYield, volatility);
    }
}
