package com.optionpricer.domain.enums;

/**
 * Outcome of an implied volatility search.
 *
 * <p>BELOW_INTRINSIC and NOT_CONVERGED are kept apart because they call for different
 * actions: the first means the quote itself violates the no-arbitrage floor, the second
 * means the numerical search gave up.
 */
public enum ImpliedVolatilityStatus {
    /** Root found strictly inside the search bracket. */
    CONVERGED,

    /** Market price is below the discounted intrinsic value. No volatility can explain it. */
    BELOW_INTRINSIC,

    /** Bracket did not straddle a root, or the evaluation budget ran out. */
    NOT_CONVERGED
}
