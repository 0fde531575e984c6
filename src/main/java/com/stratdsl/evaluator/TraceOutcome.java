package com.stratdsl.evaluator;

public enum TraceOutcome {
    SUCCESS,
    FAILURE,
    /** Informational entry that is not a node visit, e.g. a null map key replaced by a sentinel. */
    NOTICE
}
