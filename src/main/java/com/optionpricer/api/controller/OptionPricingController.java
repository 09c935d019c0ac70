package com.optionpricer.api.controller;

import com.optionpricer.api.dto.request.BatchImpliedVolatilityRequest;
import com.optionpricer.api.dto.request.ImpliedVolatilityRequest;
import com.optionpricer.api.dto.request.OptionAnalysisRequest;
import com.optionpricer.api.dto.request.PriceRequest;
import com.optionpricer.api.dto.response.ImpliedVolatilityResponse;
import com.optionpricer.api.dto.response.OptionAnalysisResponse;
import com.optionpricer.api.dto.response.PricingResultResponse;
import com.optionpricer.mapper.PricingResponseMapper;
import com.optionpricer.service.ImpliedVolatilityBatchService;
import com.optionpricer.service.OptionAnalysisService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for Black-Scholes-Merton pricing and implied volatility.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/pricing/analyze -- call and put prices and Greeks, optional IVs</li>
 *   <li>POST /api/pricing/price -- price and Greeks of one option type</li>
 *   <li>POST /api/pricing/implied-volatility -- solve one IV</li>
 *   <li>POST /api/pricing/implied-volatility/batch -- solve many IVs concurrently</li>
 * </ul>
 *
 * <p>IV failures (below intrinsic, no convergence) are normal 200 responses with a status
 * field. Only invalid inputs produce error responses.
 */
@RestController
@RequestMapping("/api/pricing")
public class OptionPricingController {

    private final OptionAnalysisService optionAnalysisService;
    private final ImpliedVolatilityBatchService batchService;
    private final PricingResponseMapper pricingResponseMapper;

    public OptionPricingController(
            OptionAnalysisService optionAnalysisService,
            ImpliedVolatilityBatchService batchService,
            PricingResponseMapper pricingResponseMapper) {
        this.optionAnalysisService = optionAnalysisService;
        this.batchService = batchService;
        this.pricingResponseMapper = pricingResponseMapper;
    }

    @PostMapping("/analyze")
    public ResponseEntity<OptionAnalysisResponse> analyze(@Valid @RequestBody OptionAnalysisRequest request) {
        return ResponseEntity.ok(pricingResponseMapper.toResponse(optionAnalysisService.analyze(request)));
    }

    @PostMapping("/price")
    public ResponseEntity<PricingResultResponse> price(@Valid @RequestBody PriceRequest request) {
        return ResponseEntity.ok(pricingResponseMapper.toResponse(optionAnalysisService.price(request)));
    }

    @PostMapping("/implied-volatility")
    public ResponseEntity<ImpliedVolatilityResponse> impliedVolatility(
            @Valid @RequestBody ImpliedVolatilityRequest request) {
        return ResponseEntity.ok(pricingResponseMapper.toResponse(optionAnalysisService.impliedVolatility(request)));
    }

    /**
     * Results are returned in the same order as the submitted queries.
     */
    @PostMapping("/implied-volatility/batch")
    public ResponseEntity<List<ImpliedVolatilityResponse>> impliedVolatilityBatch(
            @Valid @RequestBody BatchImpliedVolatilityRequest request) {
        return ResponseEntity.ok(pricingResponseMapper.toResponseList(batchService.solveAll(request.getQueries())));
    }
}
