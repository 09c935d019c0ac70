package com.optionpricer.domain.model;

import com.optionpricer.domain.enums.ImpliedVolatilityStatus;
import com.optionpricer.domain.enums.OptionType;
import java.util.OptionalDouble;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of inverting the pricing formula for volatility.
 *
 * <p>A volatility is present only for {@link ImpliedVolatilityStatus#CONVERGED}. Failures carry
 * no number at all, so a caller can never mistake NaN or a bracket end point for a solution.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ImpliedVolatilityResult {

    OptionType optionType;
    ImpliedVolatilityStatus status;
    Double volatility;

    /** Discounted intrinsic value the market price was checked against. */
    double intrinsicValue;

    /** Objective evaluations spent by the root finder. Zero when the search never started. */
    int evaluations;

    public static ImpliedVolatilityResult converged(
            OptionType optionType, double volatility, double intrinsicValue, int evaluations) {
        return new ImpliedVolatilityResult(
                optionType, ImpliedVolatilityStatus.CONVERGED, volatility, intrinsicValue, evaluations);
    }

    public static ImpliedVolatilityResult belowIntrinsic(OptionType optionType, double intrinsicValue) {
        return new ImpliedVolatilityResult(optionType, ImpliedVolatilityStatus.BELOW_INTRINSIC, null, intrinsicValue, 0);
    }

    public static ImpliedVolatilityResult notConverged(OptionType optionType, double intrinsicValue, int evaluations) {
        return new ImpliedVolatilityResult(
                optionType, ImpliedVolatilityStatus.NOT_CONVERGED, null, intrinsicValue, evaluations);
    }

    public boolean isConverged() {
        return status == ImpliedVolatilityStatus.CONVERGED;
    }

    public OptionalDouble volatilityValue() {
        return volatility != null ? OptionalDouble.of(volatility) : OptionalDouble.empty();
    }
}
