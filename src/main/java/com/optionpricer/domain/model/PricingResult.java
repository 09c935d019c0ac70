package com.optionpricer.domain.model;

import com.optionpricer.domain.enums.OptionType;
import lombok.Builder;
import lombok.Value;

/**
 * Black-Scholes-Merton price and Greeks for one option type.
 *
 * <p>All sensitivities are raw model derivatives, not market-convention scaled:
 * vega per 1.00 change in volatility, theta per year, rho per 1.00 change in rate.
 * Display layers that want per-day theta or per-1% vega divide themselves.
 */
@Value
@Builder
public class PricingResult {

    OptionType optionType;

    /** Raw model value. May be a tiny negative number for worthless options; not clamped. */
    double price;

    /** dV/dS. In [0, e^(-qT)] for calls and [-e^(-qT), 0] for puts. */
    double delta;

    /** d2V/dS2. Same for calls and puts. */
    double gamma;

    /** dV/d-sigma. Same for calls and puts. */
    double vega;

    /** dV/dt per year of calendar time. */
    double theta;

    /** dV/dr. */
    double rho;

    double d1;
    double d2;
}
