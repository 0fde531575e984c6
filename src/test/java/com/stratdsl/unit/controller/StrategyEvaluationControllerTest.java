package com.stratdsl.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.stratdsl.api.controller.StrategyEvaluationController;
import com.stratdsl.domain.model.StrategyAllocation;
import com.stratdsl.engine.EvaluationResult;
import com.stratdsl.engine.EvaluationStatus;
import com.stratdsl.engine.StrategyEngine;
import com.stratdsl.exception.GlobalExceptionHandler;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the StrategyEvaluationController.
 * Covers the evaluated, fallback and duplicate responses and request validation.
 */
@ExtendWith(MockitoExtension.class)
class StrategyEvaluationControllerTest {

    private static final Instant AS_OF = Instant.parse("2024-06-03T20:00:00Z");

    private MockMvc mockMvc;

    @Mock
    private StrategyEngine strategyEngine;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new StrategyEvaluationController(strategyEngine))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("POST /api/strategies/evaluate returns the allocation")
    void evaluate() throws Exception {
        when(strategyEngine.evaluate(any()))
                .thenReturn(EvaluationResult.builder()
                        .requestId("api-1")
                        .correlationId("api-1")
                        .status(EvaluationStatus.EVALUATED)
                        .allocation(new StrategyAllocation(
                                "api-1",
                                AS_OF,
                                Map.of("SPY", new BigDecimal("0.600000"), "TLT", new BigDecimal("0.400000")),
                                false))
                        .build());

        String json = """
                {
                    "correlationId": "api-1",
                    "source": "(weight-specified 0.6 \\"SPY\\" 0.4 \\"TLT\\")",
                    "asOf": "2024-06-03T20:00:00Z"
                }
                """;

        mockMvc.perform(post("/api/strategies/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("EVALUATED"))
                .andExpect(jsonPath("$.weights.SPY").value(0.6))
                .andExpect(jsonPath("$.weights.TLT").value(0.4));

        verify(strategyEngine)
                .evaluate(argThat(request -> "api-1".equals(request.getCorrelationId())
                        && request.getSource().contains("weight-specified")
                        && AS_OF.equals(request.getAsOf())));
    }

    @Test
    @DisplayName("fallback is reported with status 200 and the error code")
    void fallback() throws Exception {
        when(strategyEngine.evaluate(any()))
                .thenReturn(EvaluationResult.builder()
                        .requestId("api-2")
                        .correlationId("api-2")
                        .status(EvaluationStatus.FALLBACK)
                        .allocation(StrategyAllocation.cashFallback("CASH", "api-2", AS_OF))
                        .errorCode("PARSE_ERROR")
                        .errorMessage("Unclosed '(' at line 1, column 1")
                        .build());

        mockMvc.perform(post("/api/strategies/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"correlationId\": \"api-2\", \"source\": \"(asset\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FALLBACK"))
                .andExpect(jsonPath("$.weights.CASH").value(1))
                .andExpect(jsonPath("$.errorCode").value("PARSE_ERROR"));
    }

    @Test
    @DisplayName("duplicate request returns DUPLICATE without weights")
    void duplicate() throws Exception {
        when(strategyEngine.evaluate(any())).thenReturn(EvaluationResult.duplicate("api-3", "api-3"));

        mockMvc.perform(post("/api/strategies/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"correlationId\": \"api-3\", \"strategyPath\": \"core.clj\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DUPLICATE"))
                .andExpect(jsonPath("$.weights").doesNotExist());
    }

    @Test
    @DisplayName("missing correlationId returns 400")
    void missingCorrelationId() throws Exception {
        mockMvc.perform(post("/api/strategies/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\": \"(asset \\\"SPY\\\")\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verify(strategyEngine, never()).evaluate(any());
    }

    @Test
    @DisplayName("neither source nor strategyPath returns 400")
    void noSource() throws Exception {
        mockMvc.perform(post("/api/strategies/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"correlationId\": \"api-5\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Either source or strategyPath must be provided"));
    }

    @Test
    @DisplayName("malformed body returns 400 BAD_REQUEST")
    void malformedBody() throws Exception {
        mockMvc.perform(post("/api/strategies/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }
}
