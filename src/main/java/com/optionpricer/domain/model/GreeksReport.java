package com.optionpricer.domain.model;

import com.optionpricer.domain.enums.OptionType;
import lombok.Builder;
import lombok.Value;

/**
 * Call and put results computed together from one set of d1/d2 terms.
 * Delta, theta and rho differ by type; gamma and vega are shared.
 */
@Value
@Builder
public class GreeksReport {

    MarketParameters parameters;
    PricingResult call;
    PricingResult put;

    public PricingResult get(OptionType optionType) {
        return optionType.isCall() ? call : put;
    }

    public double getD1() {
        return call.getD1();
    }

    public double getD2() {
        return call.getD2();
    }
}
