package com.stratdsl.operator;

import com.stratdsl.domain.value.BoolValue;
import java.math.BigDecimal;
import java.util.function.IntPredicate;

/**
 * Numeric comparisons: {@code > < >= <= =}. Both operands must be numbers; {@code =} compares
 * by value, so {@code 1} equals {@code 1.00}.
 */
public final class ComparisonOperators {

    private ComparisonOperators() {}

    public static void register(OperatorRegistry.Builder builder) {
        builder.register(comparison(">", cmp -> cmp > 0))
                .register(comparison("<", cmp -> cmp < 0))
                .register(comparison(">=", cmp -> cmp >= 0))
                .register(comparison("<=", cmp -> cmp <= 0))
                .register(comparison("=", cmp -> cmp == 0));
    }

    private static OperatorDefinition comparison(String name, IntPredicate test) {
        return OperatorDefinition.eager(name, OperatorCategory.COMPARISON, 2, 2, (args, context) -> {
            BigDecimal left = OperatorArguments.number(name, args.get(0));
            BigDecimal right = OperatorArguments.number(name, args.get(1));
            return BoolValue.of(test.test(left.compareTo(right)));
        });
    }
}
