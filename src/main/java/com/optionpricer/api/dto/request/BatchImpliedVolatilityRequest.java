package com.optionpricer.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A batch of independent implied volatility queries. Results come back in request order.
 * The size cap is enforced by the service from optionpricer.input.max-batch-queries.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchImpliedVolatilityRequest {

    @NotEmpty(message = "queries must not be empty")
    private List<@NotNull(message = "query must not be null") @Valid ImpliedVolatilityRequest> queries;
}
