package com.optionpricer.domain.model;

import com.optionpricer.exception.InvalidMarketParametersException;
import java.util.Map;

/**
 * Precondition checks shared by the value types and the pricing engine's primitive entry points.
 */
public final class MarketParameterValidator {

    private MarketParameterValidator() {}

    public static double requirePositive(String field, double value) {
        if (!Double.isFinite(value) || value <= 0) {
            throw InvalidMarketParametersException.field(field, value, "must be a positive finite number");
        }
        return value;
    }

    public static double requireFinite(String field, double value) {
        if (!Double.isFinite(value)) {
            throw InvalidMarketParametersException.field(field, value, "must be a finite number");
        }
        return value;
    }

    /**
     * Validates a full parameter set in field order: spot, strike, time to expiry, rates, volatility.
     */
    public static void validate(double spot, double strike, double timeToExpiry, double riskFreeRate,
            double dividendYield, double volatility) {
        validateContract(spot, strike, timeToExpiry, riskFreeRate, dividendYield);
        requirePositive("volatility", volatility);
    }

    /** Same as {@link #validate} without the volatility, for implied volatility queries. */
    public static void validateContract(
            double spot, double strike, double timeToExpiry, double riskFreeRate, double dividendYield) {
        requirePositive("spot", spot);
        requirePositive("strike", strike);
        requirePositive("timeToExpiry", timeToExpiry);
        requireFinite("riskFreeRate", riskFreeRate);
        requireFinite("dividendYield", dividendYield);
    }

    /**
     * Rejects a rate whose discount factor e^(-rate * T) overflows. Finite rates pass
     * {@link #requireFinite} but can still do this over long maturities.
     */
    public static double requireFiniteDiscount(String field, double rate, double timeToExpiry, double factor) {
        if (!Double.isFinite(factor)) {
            throw InvalidMarketParametersException.field(
                    field, rate, "overflows its discount factor at timeToExpiry " + timeToExpiry);
        }
        return factor;
    }

    /** Rejects a computed quantity that came out NaN or infinite despite valid inputs. */
    public static double requireFiniteResult(String quantity, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidMarketParametersException(
                    "Inputs produce a non-finite " + quantity + ": " + value,
                    Map.of(quantity, "not finite for these inputs"));
        }
        return value;
    }
}
