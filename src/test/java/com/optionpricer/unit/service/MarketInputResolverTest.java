package com.optionpricer.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.optionpricer.api.dto.request.ImpliedVolatilityRequest;
import com.optionpricer.api.dto.request.OptionAnalysisRequest;
import com.optionpricer.config.InputConfig;
import com.optionpricer.domain.enums.OptionType;
import com.optionpricer.domain.model.ImpliedVolatilityQuery;
import com.optionpricer.domain.model.MarketParameters;
import com.optionpricer.exception.InvalidMarketParametersException;
import com.optionpricer.service.MarketInputResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for MarketInputResolver: day-count conversion, dividend yield defaulting,
 * and rejection of missing or non-positive inputs.
 */
class MarketInputResolverTest {

    private InputConfig inputConfig;
    private MarketInputResolver resolver;

    @BeforeEach
    void setUp() {
        inputConfig = new InputConfig();
        resolver = new MarketInputResolver(inputConfig);
    }

    private OptionAnalysisRequest.OptionAnalysisRequestBuilder baseRequest() {
        return OptionAnalysisRequest.builder()
                .spot(100.0)
                .strike(105.0)
                .daysToExpiry(73.0)
                .riskFreeRate(0.04)
                .volatility(0.25);
    }

    @Test
    @DisplayName("Days to expiry are divided by 365")
    void daysConvertedToYears() {
        MarketParameters params = resolver.resolve(baseRequest().build());

        assertThat(params.getTimeToExpiry()).isCloseTo(0.2, within(1e-15));
        assertThat(params.getSpot()).isEqualTo(100.0);
        assertThat(params.getStrike()).isEqualTo(105.0);
        assertThat(params.getVolatility()).isEqualTo(0.25);
    }

    @Test
    @DisplayName("Missing dividend yield defaults to zero")
    void missingDividendYieldDefaultsToZero() {
        MarketParameters params = resolver.resolve(baseRequest().build());

        assertThat(params.getDividendYield()).isZero();
    }

    @Test
    @DisplayName("Configured default dividend yield is applied when omitted")
    void configuredDefaultDividendYield() {
        inputConfig.setDefaultDividendYield(0.015);

        MarketParameters params = resolver.resolve(baseRequest().build());

        assertThat(params.getDividendYield()).isEqualTo(0.015);
    }

    @Test
    @DisplayName("Explicit dividend yield wins over the default, negative values included")
    void explicitDividendYieldKept() {
        inputConfig.setDefaultDividendYield(0.015);

        MarketParameters params = resolver.resolve(baseRequest().dividendYield(-0.002).build());

        assertThat(params.getDividendYield()).isEqualTo(-0.002);
    }

    @Test
    @DisplayName("Non-positive days to expiry is rejected")
    void zeroDaysRejected() {
        assertThatThrownBy(() -> resolver.resolve(baseRequest().daysToExpiry(0.0).build()))
                .isInstanceOf(InvalidMarketParametersException.class)
                .hasMessageContaining("daysToExpiry");
    }

    @Test
    @DisplayName("Missing spot is rejected with the field name")
    void missingSpotRejected() {
        assertThatThrownBy(() -> resolver.resolve(baseRequest().spot(null).build()))
                .isInstanceOf(InvalidMarketParametersException.class)
                .hasMessageContaining("spot");
    }

    @Test
    @DisplayName("Implied volatility request keeps its year fraction as given")
    void impliedVolatilityRequestResolved() {
        ImpliedVolatilityRequest request = ImpliedVolatilityRequest.builder()
                .marketPrice(4.2)
                .spot(100.0)
                .strike(100.0)
                .timeToExpiry(0.5)
                .riskFreeRate(0.03)
                .optionType(OptionType.PUT)
                .build();

        ImpliedVolatilityQuery query = resolver.resolve(request);

        assertThat(query.getTimeToExpiry()).isEqualTo(0.5);
        assertThat(query.getMarketPrice()).isEqualTo(4.2);
        assertThat(query.getDividendYield()).isZero();
        assertThat(query.getOptionType()).isEqualTo(OptionType.PUT);
    }

    @Test
    @DisplayName("Missing option type is rejected")
    void missingOptionTypeRejected() {
        ImpliedVolatilityRequest request = ImpliedVolatilityRequest.builder()
                .marketPrice(4.2)
                .spot(100.0)
                .strike(100.0)
                .timeToExpiry(0.5)
                .riskFreeRate(0.03)
                .build();

        assertThatThrownBy(() -> resolver.resolve(request))
                .isInstanceOf(InvalidMarketParametersException.class)
                .hasMessageContaining("optionType");
    }
}
