package com.optionpricer.domain.model;

import com.optionpricer.domain.enums.OptionType;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Everything computed for one set of inputs: both option types' prices and Greeks, plus the
 * call-side and put-side implied volatilities when a market price was supplied.
 */
@Value
@Builder
public class OptionAnalysis {

    GreeksReport greeks;

    /** Market price used for the implied volatility search, or null when none was given. */
    Double marketPrice;

    /** Empty when no market price was given. Call and put are solved independently. */
    Map<OptionType, ImpliedVolatilityResult> impliedVolatilities;
}
