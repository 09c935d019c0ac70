package com.optionpricer.unit.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.optionpricer.config.SolverConfig;
import com.optionpricer.core.processor.BlackScholesCalculator;
import com.optionpricer.core.processor.ImpliedVolatilitySolver;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.util.Set;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Bean validation of the solver properties, and the solver's own guard when handed a bad bracket.
 */
class SolverConfigTest {

    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @Test
    @DisplayName("Defaults are valid")
    void defaultsValid() {
        SolverConfig config = new SolverConfig();

        assertThat(validator.validate(config)).isEmpty();
        assertThat(config.getLowerBound()).isEqualTo(1e-6);
        assertThat(config.getUpperBound()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Inverted bracket fails validation")
    void invertedBracketInvalid() {
        SolverConfig config = new SolverConfig();
        config.setLowerBound(2.0);
        config.setUpperBound(1.0);

        Set<ConstraintViolation<SolverConfig>> violations = validator.validate(config);

        assertThat(violations)
                .extracting(ConstraintViolation::getMessage)
                .contains("lowerBound must be below upperBound");
    }

    @Test
    @DisplayName("Zero lower bound fails validation and is refused by the solver")
    void zeroLowerBoundRefused() {
        SolverConfig config = new SolverConfig();
        config.setLowerBound(0.0);

        assertThat(validator.validate(config)).isNotEmpty();
        assertThatThrownBy(() -> new ImpliedVolatilitySolver(new BlackScholesCalculator(), config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("0 < lower < upper");
    }

    @Test
    @DisplayName("Non-positive evaluation budget is refused by the solver")
    void zeroEvaluationsRefused() {
        SolverConfig config = new SolverConfig();
        config.setMaxEvaluations(0);

        assertThatThrownBy(() -> new ImpliedVolatilitySolver(new BlackScholesCalculator(), config))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
