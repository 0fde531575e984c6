package com.stratdsl.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for POST /api/strategies/evaluate.
 *
 * <p>Either {@code source} (inline strategy text) or {@code strategyPath} (file under the
 * strategies directory) must be given.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluateStrategyRequest {

    @NotBlank(message = "correlationId is required")
    @Size(max = 128)
    private String correlationId;

    private String causationId;

    private String eventId;

    private String source;

    private String strategyPath;

    private Instant asOf;
}
