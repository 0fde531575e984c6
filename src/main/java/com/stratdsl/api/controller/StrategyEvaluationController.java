package com.stratdsl.api.controller;

import com.stratdsl.api.dto.request.EvaluateStrategyRequest;
import com.stratdsl.api.dto.response.EvaluationResponse;
import com.stratdsl.engine.EvaluationRequest;
import com.stratdsl.engine.EvaluationResult;
import com.stratdsl.engine.StrategyEngine;
import com.stratdsl.exception.BusinessException;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for evaluating strategies on demand.
 *
 * <p>Evaluation failures are not HTTP errors: the engine answers with the cash fallback and a
 * failure trace, returned with status 200 and {@code status=FALLBACK}. A repeated request id
 * returns {@code status=DUPLICATE} without weights.
 */
@RestController
@RequestMapping("/api/strategies")
public class StrategyEvaluationController {

    private static final Logger log = LoggerFactory.getLogger(StrategyEvaluationController.class);

    private final StrategyEngine strategyEngine;

    public StrategyEvaluationController(StrategyEngine strategyEngine) {
        this.strategyEngine = strategyEngine;
    }

    @PostMapping("/evaluate")
    public ResponseEntity<EvaluationResponse> evaluate(@Valid @RequestBody EvaluateStrategyRequest request) {
        if (isBlank(request.getSource()) && isBlank(request.getStrategyPath())) {
            throw new BusinessException("Either source or strategyPath must be provided");
        }
        log.debug("Evaluation requested via API: {}", request.getCorrelationId());

        EvaluationResult result = strategyEngine.evaluate(EvaluationRequest.builder()
                .correlationId(request.getCorrelationId())
                .causationId(request.getCausationId())
                .eventId(request.getEventId())
                .source(request.getSource())
                .strategyPath(request.getStrategyPath())
                .asOf(request.getAsOf())
                .build());
        return ResponseEntity.ok(EvaluationResponse.from(result));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
