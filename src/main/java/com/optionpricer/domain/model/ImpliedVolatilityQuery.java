package com.optionpricer.domain.model;

import com.optionpricer.domain.enums.OptionType;
import java.util.Objects;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * An observed option price to be inverted for volatility, with the contract and market
 * terms it was quoted under.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ImpliedVolatilityQuery {

    double marketPrice;
    double spot;
    double strike;
    double timeToExpiry;
    double riskFreeRate;
    double dividendYield;
    OptionType optionType;

    public static ImpliedVolatilityQuery of(
            double marketPrice,
            double spot,
            double strike,
            double timeToExpiry,
            double riskFreeRate,
            double dividendYield,
            OptionType optionType) {
        MarketParameterValidator.requirePositive("marketPrice", marketPrice);
        MarketParameterValidator.validateContract(spot, strike, timeToExpiry, riskFreeRate, dividendYield);
        Objects.requireNonNull(optionType, "optionType");
        return new ImpliedVolatilityQuery(
                marketPrice, spot, strike, timeToExpiry, riskFreeRate, dividendYield, optionType);
    }

    /** Builds a query from full parameters. The volatility in {@code params} is ignored. */
    public static ImpliedVolatilityQuery of(double marketPrice, MarketParameters params, OptionType optionType) {
        return of(
                marketPrice,
                params.getSpot(),
                params.getStrike(),
                params.getTimeToExpiry(),
                params.getRiskFreeRate(),
                params.getDividendYield(),
                optionType);
    }
}
