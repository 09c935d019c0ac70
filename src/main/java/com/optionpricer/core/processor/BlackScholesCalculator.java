package com.optionpricer.core.processor;

import com.optionpricer.domain.enums.OptionType;
import com.optionpricer.domain.model.GreeksReport;
import com.optionpricer.domain.model.MarketParameterValidator;
import com.optionpricer.domain.model.MarketParameters;
import com.optionpricer.domain.model.PricingResult;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

/**
 * Closed-form Black-Scholes-Merton pricer for European options with a continuous dividend yield.
 *
 * <p>Key formulas:
 * <ul>
 *   <li>d1 = [ln(S/K) + (r - q + sigma^2/2) * T] / (sigma * sqrt(T))
 *   <li>d2 = d1 - sigma * sqrt(T)
 *   <li>Call: S * e^(-qT) * N(d1) - K * e^(-rT) * N(d2)
 *   <li>Put: K * e^(-rT) * N(-d2) - S * e^(-qT) * N(-d1)
 *   <li>Delta: e^(-qT) * N(d1) for calls, e^(-qT) * [N(d1) - 1] for puts
 *   <li>Gamma: e^(-qT) * n(d1) / (S * sigma * sqrt(T))
 *   <li>Vega: S * e^(-qT) * n(d1) * sqrt(T)
 *   <li>Theta: per year, separate formulas for calls and puts
 *   <li>Rho: K * T * e^(-rT) * N(d2) for calls, -K * T * e^(-rT) * N(-d2) for puts
 * </ul>
 *
 * <p>Greeks are raw derivatives. Nothing is rescaled per day or per 1% here.
 *
 * <p>Every entry point validates its inputs first and throws
 * {@link com.optionpricer.exception.InvalidMarketParametersException} when spot, strike, time or
 * volatility is not strictly positive, or when any input is NaN or infinite. The same exception
 * is raised when a finite rate overflows its discount factor or a result is not finite. The calculator is
 * stateless and thread-safe.
 */
@Component
public class BlackScholesCalculator {

    // Reusable standard normal distribution (thread-safe in commons-math3)
    private static final NormalDistribution NORM = new NormalDistribution();

    /**
     * Theoretical price of one option type. Returned raw: deep out-of-the-money values can
     * round to a tiny negative number, which display code should clamp.
     */
    public double price(MarketParameters params, OptionType optionType) {
        return price(
                params.getSpot(),
                params.getStrike(),
                params.getTimeToExpiry(),
                params.getRiskFreeRate(),
                params.getDividendYield(),
                params.getVolatility(),
                optionType);
    }

    /**
     * Primitive form of {@link #price(MarketParameters, OptionType)}. The implied volatility
     * solver calls this in its inner loop to avoid allocating a parameter object per trial sigma.
     */
    public double price(double S, double K, double T, double r, double q, double sigma, OptionType optionType) {
        MarketParameterValidator.validate(S, K, T, r, q, sigma);

        double sqrtT = Math.sqrt(T);
        double d1 = d1(S, K, T, r, q, sigma, sqrtT);
        double d2 = d1 - sigma * sqrtT;
        double discR = MarketParameterValidator.requireFiniteDiscount("riskFreeRate", r, T, Math.exp(-r * T));
        double discQ = MarketParameterValidator.requireFiniteDiscount("dividendYield", q, T, Math.exp(-q * T));

        double price = optionType.isCall()
                ? S * discQ * NORM.cumulativeProbability(d1) - K * discR * NORM.cumulativeProbability(d2)
                : K * discR * NORM.cumulativeProbability(-d2) - S * discQ * NORM.cumulativeProbability(-d1);
        return MarketParameterValidator.requireFiniteResult("price", price);
    }

    /**
     * Prices and Greeks for both the call and the put, sharing d1, d2, gamma and vega.
     */
    public GreeksReport greeks(MarketParameters params) {
        double S = params.getSpot();
        double K = params.getStrike();
        double T = params.getTimeToExpiry();
        double r = params.getRiskFreeRate();
        double q = params.getDividendYield();
        double sigma = params.getVolatility();
        MarketParameterValidator.validate(S, K, T, r, q, sigma);

        double sqrtT = Math.sqrt(T);
        double d1 = d1(S, K, T, r, q, sigma, sqrtT);
        double d2 = d1 - sigma * sqrtT;
        double discR = MarketParameterValidator.requireFiniteDiscount("riskFreeRate", r, T, Math.exp(-r * T));
        double discQ = MarketParameterValidator.requireFiniteDiscount("dividendYield", q, T, Math.exp(-q * T));

        double nd1 = NORM.density(d1); // PDF at d1
        double Nd1 = NORM.cumulativeProbability(d1);
        double Nd2 = NORM.cumulativeProbability(d2);
        double NminusD1 = NORM.cumulativeProbability(-d1);
        double NminusD2 = NORM.cumulativeProbability(-d2);

        // Gamma and vega are the same for calls and puts
        double gamma = discQ * nd1 / (S * sigma * sqrtT);
        double vega = S * discQ * nd1 * sqrtT;

        // Time-decay term common to both thetas
        double decay = -(S * discQ * nd1 * sigma) / (2.0 * sqrtT);

        PricingResult call = PricingResult.builder()
                .optionType(OptionType.CALL)
                .price(S * discQ * Nd1 - K * discR * Nd2)
                .delta(discQ * Nd1)
                .gamma(gamma)
                .vega(vega)
                .theta(decay - r * K * discR * Nd2 + q * S * discQ * Nd1)
                .rho(K * T * discR * Nd2)
                .d1(d1)
                .d2(d2)
                .build();

        PricingResult put = PricingResult.builder()
                .optionType(OptionType.PUT)
                .price(K * discR * NminusD2 - S * discQ * NminusD1)
                .delta(discQ * (Nd1 - 1.0))
                .gamma(gamma)
                .vega(vega)
                .theta(decay + r * K * discR * NminusD2 - q * S * discQ * NminusD1)
                .rho(-K * T * discR * NminusD2)
                .d1(d1)
                .d2(d2)
                .build();

        requireFiniteRow(call);
        requireFiniteRow(put);
        return GreeksReport.builder().parameters(params).call(call).put(put).build();
    }

    /**
     * Price and Greeks of the requested option type only.
     */
    public PricingResult evaluate(MarketParameters params, OptionType optionType) {
        return greeks(params).get(optionType);
    }

    /**
     * No-arbitrage floor of the option price under continuous carry:
     * max(0, S*e^(-qT) - K*e^(-rT)) for calls and max(0, K*e^(-rT) - S*e^(-qT)) for puts.
     * This is the sigma -> 0 limit of {@link #price}.
     */
    public double discountedIntrinsicValue(double S, double K, double T, double r, double q, OptionType optionType) {
        MarketParameterValidator.validateContract(S, K, T, r, q);

        double forwardSpot =
                S * MarketParameterValidator.requireFiniteDiscount("dividendYield", q, T, Math.exp(-q * T));
        double discountedStrike =
                K * MarketParameterValidator.requireFiniteDiscount("riskFreeRate", r, T, Math.exp(-r * T));
        double payoff = optionType.isCall() ? forwardSpot - discountedStrike : discountedStrike - forwardSpot;
        return Math.max(0.0, MarketParameterValidator.requireFiniteResult("intrinsicValue", payoff));
    }

    private static void requireFiniteRow(PricingResult row) {
        String side = row.getOptionType().isCall() ? "call" : "put";
        MarketParameterValidator.requireFiniteResult(side + "Price", row.getPrice());
        MarketParameterValidator.requireFiniteResult(side + "Delta", row.getDelta());
        MarketParameterValidator.requireFiniteResult("gamma", row.getGamma());
        MarketParameterValidator.requireFiniteResult("vega", row.getVega());
        MarketParameterValidator.requireFiniteResult(side + "Theta", row.getTheta());
        MarketParameterValidator.requireFiniteResult(side + "Rho", row.getRho());
    }

    private static double d1(double S, double K, double T, double r, double q, double sigma, double sqrtT) {
        return (Math.log(S / K) + (r - q + 0.5 * sigma * sigma) * T) / (sigma * sqrtT);
    }
}
