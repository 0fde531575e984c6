package com.stratdsl.engine;

import com.stratdsl.exception.BusinessException;
import com.stratdsl.exception.ResourceNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the source text of an {@link EvaluationRequest}: the inline source if present,
 * otherwise the strategy file under the configured strategies directory.
 *
 * <p>Paths may not leave the strategies directory.
 */
public class StrategySourceLoader {

    private static final Logger log = LoggerFactory.getLogger(StrategySourceLoader.class);

    private final Path strategiesDirectory;

    public StrategySourceLoader(Path strategiesDirectory) {
        this.strategiesDirectory = strategiesDirectory.toAbsolutePath().normalize();
    }

    public String load(EvaluationRequest request) {
        if (request.getSource() != null && !request.getSource().isBlank()) {
            return request.getSource();
        }
        if (request.getStrategyPath() != null && !request.getStrategyPath().isBlank()) {
            return loadFile(request.getStrategyPath());
        }
        throw new BusinessException("Evaluation request " + request.getCorrelationId() + " has no strategy source");
    }

    public String loadFile(String strategyPath) {
        Path resolved = strategiesDirectory.resolve(strategyPath).normalize();
        if (!resolved.startsWith(strategiesDirectory)) {
            throw new BusinessException("Strategy path is outside the strategies directory: " + strategyPath);
        }
        if (!Files.isRegularFile(resolved)) {
            throw new ResourceNotFoundException("Strategy file", strategyPath);
        }
        try {
            String source = Files.readString(resolved, StandardCharsets.UTF_8);
            log.debug("Loaded strategy {} ({} chars)", resolved, source.length());
            return source;
        } catch (IOException e) {
            throw new ResourceNotFoundException("Strategy file", strategyPath, e);
        }
    }

    public Path getStrategiesDirectory() {
        return strategiesDirectory;
    }
}
