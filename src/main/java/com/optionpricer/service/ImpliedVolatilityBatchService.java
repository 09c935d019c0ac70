package com.optionpricer.service;

import com.optionpricer.api.dto.request.ImpliedVolatilityRequest;
import com.optionpricer.config.InputConfig;
import com.optionpricer.core.processor.ImpliedVolatilitySolver;
import com.optionpricer.domain.enums.ImpliedVolatilityStatus;
import com.optionpricer.domain.model.ImpliedVolatilityQuery;
import com.optionpricer.domain.model.ImpliedVolatilityResult;
import com.optionpricer.exception.InvalidMarketParametersException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Solves many implied volatility queries concurrently.
 *
 * <p>Each query is an independent unit of work on the {@code pricingExecutor} pool: the solver
 * shares no state between queries, so no coordination is needed. Inputs are validated up front
 * so that one bad query rejects the batch before any work is scheduled. Results are joined back
 * in request order.
 */
@Slf4j
@Service
public class ImpliedVolatilityBatchService {

    private final ImpliedVolatilitySolver solver;
    private final MarketInputResolver inputResolver;
    private final InputConfig inputConfig;
    private final Executor pricingExecutor;

    public ImpliedVolatilityBatchService(
            ImpliedVolatilitySolver solver,
            MarketInputResolver inputResolver,
            InputConfig inputConfig,
            @Qualifier("pricingExecutor") Executor pricingExecutor) {
        this.solver = solver;
        this.inputResolver = inputResolver;
        this.inputConfig = inputConfig;
        this.pricingExecutor = pricingExecutor;
    }

    public List<ImpliedVolatilityResult> solveAll(List<ImpliedVolatilityRequest> requests) {
        if (requests.size() > inputConfig.getMaxBatchQueries()) {
            throw new InvalidMarketParametersException(
                    "Batch of " + requests.size() + " exceeds limit of " + inputConfig.getMaxBatchQueries(),
                    Map.of("queries", "at most " + inputConfig.getMaxBatchQueries() + " per request"));
        }

        List<ImpliedVolatilityQuery> queries = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            ImpliedVolatilityRequest request = requests.get(i);
            if (request == null) {
                throw new InvalidMarketParametersException(
                        "Batch entry " + i + " is null", Map.of("queries[" + i + "]", "query must not be null"));
            }
            queries.add(inputResolver.resolve(request));
        }

        List<CompletableFuture<ImpliedVolatilityResult>> futures = queries.stream()
                .map(query -> CompletableFuture.supplyAsync(() -> solver.solve(query), pricingExecutor))
                .toList();

        List<ImpliedVolatilityResult> results =
                futures.stream().map(ImpliedVolatilityBatchService::await).toList();

        if (log.isDebugEnabled()) {
            long converged = results.stream()
                    .filter(result -> result.getStatus() == ImpliedVolatilityStatus.CONVERGED)
                    .count();
            log.debug("Solved IV batch of {}: {} converged, {} failed", results.size(), converged,
                    results.size() - converged);
        }
        return results;
    }

    /** Joins one task, rethrowing the task's own runtime failure rather than its CompletionException. */
    private static ImpliedVolatilityResult await(CompletableFuture<ImpliedVolatilityResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
