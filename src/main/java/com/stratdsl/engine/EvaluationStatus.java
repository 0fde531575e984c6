package com.stratdsl.engine;

public enum EvaluationStatus {
    /** The strategy evaluated to a valid allocation. */
    EVALUATED,
    /** Evaluation failed; the allocation is the cash fallback. */
    FALLBACK,
    /** The request id was already processed; nothing was evaluated or published. */
    DUPLICATE
}
