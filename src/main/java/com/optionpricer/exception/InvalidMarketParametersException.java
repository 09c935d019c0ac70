package com.optionpricer.exception;

import java.util.Map;

/**
 * Thrown when pricing inputs break the model's preconditions: non-positive spot, strike,
 * time to expiry or volatility, a non-positive market price, or any non-finite number.
 *
 * <p>Raised before any computation so that no partial or NaN result escapes the engine.
 */
public class InvalidMarketParametersException extends BaseException {

    public InvalidMarketParametersException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public InvalidMarketParametersException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }

    public static InvalidMarketParametersException field(String field, double value, String rule) {
        return new InvalidMarketParametersException(
                field + " " + rule + ", got: " + value, Map.of(field, rule + ", got: " + value));
    }
}
