package com.stratdsl.engine;

import com.stratdsl.allocation.AllocationConverter;
import com.stratdsl.domain.model.PortfolioFragment;
import com.stratdsl.domain.model.StrategyAllocation;
import com.stratdsl.exception.BusinessException;
import com.stratdsl.exception.ErrorCode;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Combines several strategy files into one allocation.
 *
 * <p>Each file configured under {@code strategy-engine.blend} is evaluated through the
 * {@link StrategyEngine} (so each publishes its own events, keyed
 * {@code <correlationId>:<file>}), scaled by its share of the total configured weight, and the
 * scaled allocations are summed and normalized. A file that falls back contributes its cash
 * allocation.
 */
@Service
public class StrategyBlendService {

    private static final Logger log = LoggerFactory.getLogger(StrategyBlendService.class);

    private final StrategyEngine strategyEngine;
    private final AllocationConverter allocationConverter;
    private final EngineConfig engineConfig;

    public StrategyBlendService(
            StrategyEngine strategyEngine, AllocationConverter allocationConverter, EngineConfig engineConfig) {
        this.strategyEngine = strategyEngine;
        this.allocationConverter = allocationConverter;
        this.engineConfig = engineConfig;
    }

    public StrategyAllocation blend(String correlationId, Instant asOf) {
        Map<String, BigDecimal> weights = new TreeMap<>(engineConfig.getBlend());
        BigDecimal total = weights.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        if (weights.isEmpty() || total.signum() <= 0) {
            throw new BusinessException("No strategy files with positive weight are configured for blending");
        }

        PortfolioFragment combined = PortfolioFragment.empty();
        boolean allFallback = true;
        for (Map.Entry<String, BigDecimal> entry : weights.entrySet()) {
            String file = entry.getKey();
            EvaluationResult result = strategyEngine.evaluate(EvaluationRequest.builder()
                    .correlationId(correlationId)
                    .causationId(correlationId)
                    .eventId(correlationId + ":" + file)
                    .strategyPath(file)
                    .asOf(asOf)
                    .build());
            StrategyAllocation allocation = result.allocation()
                    .orElseThrow(() -> new BusinessException(
                            ErrorCode.VALIDATION_ERROR,
                            "Blend " + correlationId + " was already evaluated",
                            Map.of("file", file)));
            BigDecimal share = entry.getValue().divide(total, PortfolioFragment.ARITHMETIC);
            combined = combined.merge(PortfolioFragment.of(allocation.getWeights()).scale(share));
            allFallback &= allocation.isFallback();
            log.debug("Blended {} with share {} (status {})", file, share, result.getStatus());
        }

        StrategyAllocation blended =
                new StrategyAllocation(correlationId, asOf, allocationConverter.normalize(combined.getWeights()), allFallback);
        log.info("Blended {} strategies for {}: {}", weights.size(), correlationId, blended.getWeights());
        return blended;
    }
}
