package com.stratdsl.config;

import com.stratdsl.allocation.AllocationConverter;
import com.stratdsl.engine.EngineConfig;
import com.stratdsl.engine.ProcessedRequestCache;
import com.stratdsl.engine.StrategySourceLoader;
import com.stratdsl.evaluator.StrategyEvaluator;
import com.stratdsl.indicator.InMemoryMarketDataPort;
import com.stratdsl.indicator.IndicatorConfig;
import com.stratdsl.indicator.IndicatorService;
import com.stratdsl.indicator.MarketDataPort;
import com.stratdsl.indicator.Ta4jIndicatorService;
import com.stratdsl.operator.OperatorRegistry;
import com.stratdsl.parser.StrategyParser;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the interpreter: parser, operator registry, evaluator, converter, the processed request
 * cache, and default market data and indicator collaborators.
 *
 * <p>The {@link MarketDataPort} and {@link IndicatorService} beans back off when the application
 * provides its own. The default port is an empty {@link InMemoryMarketDataPort} that callers load
 * snapshots into.
 */
@Configuration
@EnableConfigurationProperties({EngineConfig.class, IndicatorConfig.class})
public class DslEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(DslEngineConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OperatorRegistry operatorRegistry() {
        OperatorRegistry registry = OperatorRegistry.standard();
        log.info("Registered {} strategy operators", registry.size());
        return registry;
    }

    @Bean
    public StrategyParser strategyParser(EngineConfig engineConfig) {
        return new StrategyParser(
                engineConfig.getParser().getMaxDepth(), engineConfig.getParser().getMaxNodes());
    }

    @Bean
    public StrategyEvaluator strategyEvaluator(OperatorRegistry operatorRegistry) {
        return new StrategyEvaluator(operatorRegistry);
    }

    @Bean
    public AllocationConverter allocationConverter(EngineConfig engineConfig) {
        return new AllocationConverter(engineConfig.getAllocation().getScale());
    }

    @Bean
    public ProcessedRequestCache processedRequestCache(EngineConfig engineConfig) {
        return new ProcessedRequestCache(
                engineConfig.getIdempotency().getMaxSize(), engineConfig.getIdempotency().getTtl());
    }

    @Bean
    public StrategySourceLoader strategySourceLoader(EngineConfig engineConfig) {
        return new StrategySourceLoader(Path.of(engineConfig.getStrategiesDirectory()));
    }

    @Bean
    @ConditionalOnMissingBean(MarketDataPort.class)
    public InMemoryMarketDataPort marketDataPort() {
        return new InMemoryMarketDataPort();
    }

    @Bean
    @ConditionalOnMissingBean(IndicatorService.class)
    public Ta4jIndicatorService indicatorService(MarketDataPort marketDataPort, IndicatorConfig indicatorConfig) {
        return new Ta4jIndicatorService(marketDataPort, indicatorConfig);
    }
}
