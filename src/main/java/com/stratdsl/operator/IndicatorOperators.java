package com.stratdsl.operator;

import com.stratdsl.domain.value.DslValue;
import com.stratdsl.domain.value.MapValue;
import com.stratdsl.domain.value.NumberValue;
import com.stratdsl.exception.DslEvaluationException;
import com.stratdsl.exception.ErrorCode;
import com.stratdsl.indicator.IndicatorRequest;
import com.stratdsl.indicator.IndicatorType;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One operator per {@link IndicatorType}: {@code (rsi "SPY" {:window 10})}.
 *
 * <p>The params map is optional; a missing {@code :window} takes the indicator's default.
 * Values come from the evaluation context, which memoizes them per evaluation.
 */
public final class IndicatorOperators {

    private IndicatorOperators() {}

    public static void register(OperatorRegistry.Builder builder) {
        for (IndicatorType type : IndicatorType.values()) {
            String name = type.getDslName();
            builder.register(OperatorDefinition.eager(name, OperatorCategory.INDICATOR, 1, 2, (args, context) -> {
                String symbol = OperatorArguments.symbol(name, args.get(0));
                Map<String, BigDecimal> params = params(name, type, args);
                IndicatorRequest request = IndicatorRequest.of(symbol, type, params, context.getAsOf());
                return NumberValue.of(context.indicator(request));
            }));
        }
    }

    private static Map<String, BigDecimal> params(String name, IndicatorType type, List<DslValue> args) {
        Map<String, BigDecimal> params = new TreeMap<>();
        if (args.size() > 1) {
            MapValue map = OperatorArguments.map(name, args.get(1));
            map.entries().forEach((key, value) -> params.put(key, OperatorArguments.number(name + " :" + key, value)));
        }
        params.putIfAbsent(IndicatorRequest.WINDOW, BigDecimal.valueOf(type.getDefaultWindow()));
        BigDecimal window = params.get(IndicatorRequest.WINDOW);
        if (window.signum() <= 0 || window.stripTrailingZeros().scale() > 0) {
            throw new DslEvaluationException(
                    ErrorCode.TYPE_MISMATCH, name + " :window must be a positive integer but got " + window.toPlainString());
        }
        return params;
    }
}
