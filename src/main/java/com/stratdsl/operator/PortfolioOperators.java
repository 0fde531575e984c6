package com.stratdsl.operator;

import com.stratdsl.domain.model.PortfolioFragment;
import com.stratdsl.domain.value.DslValue;
import com.stratdsl.domain.value.FragmentValue;
import com.stratdsl.domain.value.SymbolValue;
import com.stratdsl.evaluator.EvaluationContext;
import com.stratdsl.exception.DslEvaluationException;
import com.stratdsl.exception.ErrorCode;
import com.stratdsl.indicator.IndicatorRequest;
import com.stratdsl.indicator.IndicatorType;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operators building portfolio fragments. Whenever two parts name the same symbol their weights
 * are summed.
 *
 * <ul>
 *   <li>{@code asset} - a ticker, optionally with a display name</li>
 *   <li>{@code weight-equal} - every child gets 1/n of the total</li>
 *   <li>{@code weight-specified} - {@code w1 child1 w2 child2 ...}, children scaled by their weight</li>
 *   <li>{@code weight-inverse-volatility} - assets weighted by 1 / annualized return volatility</li>
 *   <li>{@code group} - named block whose fragments are summed</li>
 *   <li>{@code merge} - sum of fragments</li>
 * </ul>
 */
public final class PortfolioOperators {

    private static final Logger log = LoggerFactory.getLogger(PortfolioOperators.class);

    private PortfolioOperators() {}

    public static void register(OperatorRegistry.Builder builder) {
        builder.register(portfolio("asset", 1, 2, PortfolioOperators::asset));
        builder.register(portfolio("weight-equal", 1, OperatorDefinition.VARIADIC, (args, context) ->
                FragmentValue.of(OperatorArguments.equalWeight("weight-equal", OperatorArguments.flatten(args)))));
        builder.register(portfolio("weight-specified", 2, OperatorDefinition.VARIADIC, (args, context) ->
                weightSpecified(args)));
        builder.register(portfolio("weight-inverse-volatility", 2, OperatorDefinition.VARIADIC,
                PortfolioOperators::weightInverseVolatility));
        builder.register(portfolio("group", 2, OperatorDefinition.VARIADIC, (args, context) -> group(args)));
        builder.register(portfolio("merge", 1, OperatorDefinition.VARIADIC, (args, context) -> merge(args)));
    }

    private static OperatorDefinition portfolio(String name, int minArity, int maxArity, EagerOperator operator) {
        return OperatorDefinition.eager(name, OperatorCategory.PORTFOLIO, minArity, maxArity, operator);
    }

    private static DslValue asset(List<DslValue> args, EvaluationContext context) {
        String ticker = OperatorArguments.symbol("asset", args.get(0));
        if (args.size() > 1) {
            OperatorArguments.symbol("asset", args.get(1));
        }
        return SymbolValue.of(ticker);
    }

    private static DslValue weightSpecified(List<DslValue> args) {
        if (args.size() % 2 != 0) {
            throw new DslEvaluationException(
                    ErrorCode.ARITY_MISMATCH, "weight-specified expects weight/child pairs but got " + args.size() + " arguments");
        }
        PortfolioFragment result = PortfolioFragment.empty();
        for (int i = 0; i < args.size(); i += 2) {
            BigDecimal weight = OperatorArguments.number("weight-specified", args.get(i));
            PortfolioFragment child = OperatorArguments.normalizedChild("weight-specified", args.get(i + 1));
            result = result.merge(child.scale(weight));
        }
        return FragmentValue.of(result);
    }

    private static DslValue weightInverseVolatility(
            List<DslValue> args, EvaluationContext context) {
        int window = OperatorArguments.positiveInt("weight-inverse-volatility", args.get(0));
        Map<String, BigDecimal> inverseVolatility = new LinkedHashMap<>();
        for (DslValue child : args.subList(1, args.size())) {
            for (String symbol : OperatorArguments.symbols("weight-inverse-volatility", child)) {
                BigDecimal volatility = volatility(symbol, window, context);
                if (volatility == null || volatility.signum() <= 0) {
                    log.debug("Skipping {} in weight-inverse-volatility: volatility {}", symbol, volatility);
                    continue;
                }
                inverseVolatility.put(symbol, BigDecimal.ONE.divide(volatility, PortfolioFragment.ARITHMETIC));
            }
        }
        if (inverseVolatility.isEmpty()) {
            throw new DslEvaluationException(
                    ErrorCode.INDICATOR_UNAVAILABLE, "weight-inverse-volatility found no asset with a usable volatility");
        }
        return FragmentValue.of(PortfolioFragment.of(inverseVolatility).normalized());
    }

    private static BigDecimal volatility(String symbol, int window, EvaluationContext context) {
        IndicatorRequest request = IndicatorRequest.of(
                symbol, IndicatorType.STDEV_RETURN, Map.of(IndicatorRequest.WINDOW, BigDecimal.valueOf(window)),
                context.getAsOf());
        try {
            return context.indicator(request);
        } catch (DslEvaluationException e) {
            if (e.getErrorCode() != ErrorCode.INDICATOR_UNAVAILABLE) {
                throw e;
            }
            log.debug("No volatility for {}: {}", symbol, e.getMessage());
            return null;
        }
    }

    private static DslValue group(List<DslValue> args) {
        OperatorArguments.symbol("group", args.get(0));
        List<DslValue> body = OperatorArguments.flatten(args.subList(1, args.size()));
        PortfolioFragment merged = null;
        for (DslValue value : body) {
            if (value instanceof SymbolValue || value instanceof FragmentValue) {
                PortfolioFragment fragment = OperatorArguments.fragment("group", value);
                merged = merged == null ? fragment : merged.merge(fragment);
            }
        }
        if (merged == null) {
            return body.isEmpty() ? args.get(args.size() - 1) : body.get(body.size() - 1);
        }
        return FragmentValue.of(merged);
    }

    private static DslValue merge(List<DslValue> args) {
        PortfolioFragment merged = PortfolioFragment.empty();
        for (DslValue value : OperatorArguments.flatten(args)) {
            merged = merged.merge(OperatorArguments.fragment("merge", value));
        }
        return FragmentValue.of(merged);
    }
}
