package com.stratdsl.engine;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the strategy engine under the {@code strategy-engine} prefix.
 *
 * <ul>
 *   <li>{@code cashSymbol} -- symbol receiving 100 % when evaluation fails</li>
 *   <li>{@code strategiesDirectory} -- root that strategy file paths are resolved against</li>
 *   <li>{@code parser.*} -- nesting depth and node count limits for source text</li>
 *   <li>{@code evaluation.*} -- node visit budget and depth limit per evaluation</li>
 *   <li>{@code allocation.scale} -- decimal places of final weights</li>
 *   <li>{@code idempotency.*} -- size and retention of the processed request cache</li>
 *   <li>{@code blend} -- strategy file to weight, for blended allocations</li>
 * </ul>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "strategy-engine")
public class EngineConfig {

    private String cashSymbol = "CASH";
    private String strategiesDirectory = "strategies";
    private Parser parser = new Parser();
    private Evaluation evaluation = new Evaluation();
    private Allocation allocation = new Allocation();
    private Idempotency idempotency = new Idempotency();
    private Map<String, BigDecimal> blend = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Parser {
        private int maxDepth = 64;
        private int maxNodes = 10_000;
    }

    @Getter
    @Setter
    public static class Evaluation {
        private int maxNodeVisits = 50_000;
        private int maxDepth = 256;
    }

    @Getter
    @Setter
    public static class Allocation {
        private int scale = 6;
    }

    @Getter
    @Setter
    public static class Idempotency {
        private long maxSize = 10_000;
        private Duration ttl = Duration.ofHours(1);
    }
}
