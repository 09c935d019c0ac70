package com.optionpricer.core.processor;

import com.optionpricer.config.SolverConfig;
import com.optionpricer.domain.enums.OptionType;
import com.optionpricer.domain.model.ImpliedVolatilityQuery;
import com.optionpricer.domain.model.ImpliedVolatilityResult;
import com.optionpricer.domain.model.MarketParameters;
import java.util.EnumMap;
import java.util.Map;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.exception.NoBracketingException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Brent's-method implied volatility solver for European options.
 *
 * <p>Inverts {@link BlackScholesCalculator#price} over sigma. The price is strictly increasing in
 * sigma for both calls and puts, so the bracket holds at most one root. The solver:
 * <ol>
 *   <li>Rejects quotes below the discounted intrinsic value up front ({@code BELOW_INTRINSIC})
 *   <li>Runs commons-math3's {@link BrentSolver} on the configured bracket (default 1e-6 to 5.0)
 *   <li>Reports {@code NOT_CONVERGED} when the bracket has no sign change, the evaluation budget
 *       runs out, or the root lands on a bracket end point
 * </ol>
 *
 * <p>A converged volatility always lies strictly inside the bracket. Failures are returned as
 * typed results, never as NaN, zero or a clamped end point.
 *
 * <p>This class is stateless and thread-safe: a fresh {@link BrentSolver} is created per query.
 *
 * @see BlackScholesCalculator which provides the objective function
 */
@Component
public class ImpliedVolatilitySolver {

    private static final Logger log = LoggerFactory.getLogger(ImpliedVolatilitySolver.class);

    private final BlackScholesCalculator calculator;
    private final double lowerBound;
    private final double upperBound;
    private final double absoluteAccuracy;
    private final int maxEvaluations;

    public ImpliedVolatilitySolver(BlackScholesCalculator calculator, SolverConfig solverConfig) {
        if (!(solverConfig.getLowerBound() > 0) || !solverConfig.isBracketOrdered()) {
            throw new IllegalArgumentException("Volatility bracket must satisfy 0 < lower < upper, got ["
                    + solverConfig.getLowerBound() + ", " + solverConfig.getUpperBound() + "]");
        }
        if (!(solverConfig.getAbsoluteAccuracy() > 0) || solverConfig.getMaxEvaluations() <= 0) {
            throw new IllegalArgumentException("Solver accuracy and evaluation budget must be positive");
        }
        this.calculator = calculator;
        this.lowerBound = solverConfig.getLowerBound();
        this.upperBound = solverConfig.getUpperBound();
        this.absoluteAccuracy = solverConfig.getAbsoluteAccuracy();
        this.maxEvaluations = solverConfig.getMaxEvaluations();
    }

    /**
     * Solves for the volatility that reproduces the query's market price.
     *
     * @param query market price plus contract terms; validated at construction
     * @return converged volatility, or a BELOW_INTRINSIC / NOT_CONVERGED outcome
     */
    public ImpliedVolatilityResult solve(ImpliedVolatilityQuery query) {
        double S = query.getSpot();
        double K = query.getStrike();
        double T = query.getTimeToExpiry();
        double r = query.getRiskFreeRate();
        double q = query.getDividendYield();
        double marketPrice = query.getMarketPrice();
        OptionType optionType = query.getOptionType();

        double intrinsic = calculator.discountedIntrinsicValue(S, K, T, r, q, optionType);
        if (marketPrice < intrinsic) {
            log.debug(
                    "Market price {} below intrinsic {} for {} S={}, K={}, T={}",
                    marketPrice,
                    intrinsic,
                    optionType,
                    S,
                    K,
                    T);
            return ImpliedVolatilityResult.belowIntrinsic(optionType, intrinsic);
        }

        UnivariateFunction objective = sigma -> calculator.price(S, K, T, r, q, sigma, optionType) - marketPrice;
        BrentSolver brent = new BrentSolver(absoluteAccuracy);

        double sigma;
        try {
            sigma = brent.solve(maxEvaluations, objective, lowerBound, upperBound);
        } catch (NoBracketingException e) {
            log.debug(
                    "No sign change on [{}, {}] for {} price={}, S={}, K={}, T={}",
                    lowerBound,
                    upperBound,
                    optionType,
                    marketPrice,
                    S,
                    K,
                    T);
            return ImpliedVolatilityResult.notConverged(optionType, intrinsic, brent.getEvaluations());
        } catch (TooManyEvaluationsException e) {
            log.debug("Brent search exhausted {} evaluations for {} price={}", maxEvaluations, optionType, marketPrice);
            return ImpliedVolatilityResult.notConverged(optionType, intrinsic, brent.getEvaluations());
        }

        // BrentSolver may hand back an end point when the objective vanishes there
        if (!(sigma > lowerBound && sigma < upperBound)) {
            log.debug("Root {} on bracket edge [{}, {}], reporting no convergence", sigma, lowerBound, upperBound);
            return ImpliedVolatilityResult.notConverged(optionType, intrinsic, brent.getEvaluations());
        }

        return ImpliedVolatilityResult.converged(optionType, sigma, intrinsic, brent.getEvaluations());
    }

    /**
     * Solves the call-side and put-side volatilities independently for one market price.
     * Under violated put-call parity the two will differ; that is expected.
     */
    public Map<OptionType, ImpliedVolatilityResult> solveBoth(double marketPrice, MarketParameters params) {
        Map<OptionType, ImpliedVolatilityResult> results = new EnumMap<>(OptionType.class);
        for (OptionType optionType : OptionType.values()) {
            results.put(optionType, solve(ImpliedVolatilityQuery.of(marketPrice, params, optionType)));
        }
        return results;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }
}
