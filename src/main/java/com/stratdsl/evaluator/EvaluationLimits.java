package com.stratdsl.evaluator;

/**
 * Per-evaluation budget. Exceeding either bound fails the evaluation deterministically.
 */
public record EvaluationLimits(int maxNodeVisits, int maxDepth) {

    public static final EvaluationLimits DEFAULTS = new EvaluationLimits(50_000, 256);

    public EvaluationLimits {
        if (maxNodeVisits < 1 || maxDepth < 1) {
            throw new IllegalArgumentException("Evaluation limits must be positive");
        }
    }
}
