package com.optionpricer.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.optionpricer.domain.enums.ImpliedVolatilityStatus;
import com.optionpricer.domain.enums.OptionType;
import com.optionpricer.domain.model.ImpliedVolatilityQuery;
import com.optionpricer.domain.model.ImpliedVolatilityResult;
import com.optionpricer.domain.model.MarketParameters;
import com.optionpricer.exception.InvalidMarketParametersException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MarketInputsTest {

    @Nested
    @DisplayName("MarketParameters")
    class Parameters {

        @Test
        @DisplayName("Infinite spot is rejected with the field name in the details")
        void infiniteSpotRejected() {
            assertThatThrownBy(() -> MarketParameters.of(Double.POSITIVE_INFINITY, 100, 1, 0.05, 0, 0.2))
                    .isInstanceOfSatisfying(InvalidMarketParametersException.class, ex -> assertThat(ex.getDetails())
                            .containsKey("spot"));
        }
    }

    @Nested
    @DisplayName("ImpliedVolatilityQuery")
    class Query {

        @Test
        @DisplayName("Built from parameters, the volatility is dropped")
        void fromParameters() {
            MarketParameters params = MarketParameters.of(100, 100, 1, 0.05, 0.02, 0.2);

            ImpliedVolatilityQuery query = ImpliedVolatilityQuery.of(9.5, params, OptionType.PUT);

            assertThat(query.getMarketPrice()).isEqualTo(9.5);
            assertThat(query.getDividendYield()).isEqualTo(0.02);
            assertThat(query.getOptionType()).isEqualTo(OptionType.PUT);
        }

        @Test
        @DisplayName("Zero market price is rejected")
        void zeroMarketPriceRejected() {
            assertThatThrownBy(() -> ImpliedVolatilityQuery.of(0.0, 100, 100, 1, 0.05, 0, OptionType.CALL))
                    .isInstanceOf(InvalidMarketParametersException.class)
                    .hasMessageContaining("marketPrice");
        }

        @Test
        @DisplayName("Missing option type is rejected")
        void nullOptionTypeRejected() {
            assertThatThrownBy(() -> ImpliedVolatilityQuery.of(5.0, 100, 100, 1, 0.05, 0, null))
                    .isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    @DisplayName("ImpliedVolatilityResult")
    class Result {

        @Test
        @DisplayName("Only a converged result carries a volatility")
        void onlyConvergedHasVolatility() {
            ImpliedVolatilityResult converged = ImpliedVolatilityResult.converged(OptionType.CALL, 0.2, 0.0, 12);
            ImpliedVolatilityResult below = ImpliedVolatilityResult.belowIntrinsic(OptionType.CALL, 52.4);
            ImpliedVolatilityResult failed = ImpliedVolatilityResult.notConverged(OptionType.PUT, 0.0, 7);

            assertThat(converged.isConverged()).isTrue();
            assertThat(converged.volatilityValue()).hasValue(0.2);

            assertThat(below.getStatus()).isEqualTo(ImpliedVolatilityStatus.BELOW_INTRINSIC);
            assertThat(below.getVolatility()).isNull();
            assertThat(below.getEvaluations()).isZero();
            assertThat(below.volatilityValue()).isEmpty();

            assertThat(failed.isConverged()).isFalse();
            assertThat(failed.getEvaluations()).isEqualTo(7);
            assertThat(failed.volatilityValue()).isEmpty();
        }
    }
}
