package com.stratdsl.operator;

public enum OperatorCategory {
    COMPARISON,
    CONTROL_FLOW,
    INDICATOR,
    PORTFOLIO,
    SELECTION
}
