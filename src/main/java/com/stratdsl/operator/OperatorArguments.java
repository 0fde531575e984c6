package com.stratdsl.operator;

import com.stratdsl.domain.model.PortfolioFragment;
import com.stratdsl.domain.value.BoolValue;
import com.stratdsl.domain.value.DslValue;
import com.stratdsl.domain.value.FragmentValue;
import com.stratdsl.domain.value.ListValue;
import com.stratdsl.domain.value.MapValue;
import com.stratdsl.domain.value.NumberValue;
import com.stratdsl.domain.value.SymbolValue;
import com.stratdsl.exception.DslEvaluationException;
import com.stratdsl.exception.ErrorCode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Argument coercions shared by the operator families. Every failed coercion is a
 * {@link ErrorCode#TYPE_MISMATCH} naming the operator and the kind it received.
 */
final class OperatorArguments {

    private static final Logger log = LoggerFactory.getLogger(OperatorArguments.class);

    private OperatorArguments() {}

    static BigDecimal number(String operator, DslValue value) {
        if (value instanceof NumberValue number) {
            return number.value();
        }
        throw DslEvaluationException.typeMismatch(operator, "a number", value.kind());
    }

    static boolean bool(String operator, DslValue value) {
        if (value instanceof BoolValue bool) {
            return bool.value();
        }
        throw DslEvaluationException.typeMismatch(operator, "a boolean", value.kind());
    }

    static String symbol(String operator, DslValue value) {
        if (value instanceof SymbolValue symbol) {
            return symbol.name();
        }
        throw DslEvaluationException.typeMismatch(operator, "a symbol", value.kind());
    }

    static MapValue map(String operator, DslValue value) {
        if (value instanceof MapValue map) {
            return map;
        }
        throw DslEvaluationException.typeMismatch(operator, "a keyword map", value.kind());
    }

    static int positiveInt(String operator, DslValue value) {
        BigDecimal number = number(operator, value);
        try {
            int result = number.intValueExact();
            if (result > 0) {
                return result;
            }
        } catch (ArithmeticException e) {
            throw new DslEvaluationException(
                    ErrorCode.TYPE_MISMATCH, operator + " expects a positive integer but got " + number.toPlainString(), e);
        }
        throw new DslEvaluationException(
                ErrorCode.TYPE_MISMATCH, operator + " expects a positive integer but got " + number.toPlainString());
    }

    /** Expands list values, recursively, into their items. */
    static List<DslValue> flatten(List<DslValue> values) {
        List<DslValue> flat = new ArrayList<>();
        for (DslValue value : values) {
            if (value instanceof ListValue list) {
                flat.addAll(flatten(list.items()));
            } else {
                flat.add(value);
            }
        }
        return flat;
    }

    /** Symbols named by a value, in first-occurrence order without duplicates. */
    static Set<String> symbols(String operator, DslValue value) {
        Set<String> symbols = new LinkedHashSet<>();
        collectSymbols(operator, value, symbols);
        return symbols;
    }

    private static void collectSymbols(String operator, DslValue value, Set<String> into) {
        switch (value.kind()) {
            case SYMBOL -> into.add(((SymbolValue) value).name());
            case FRAGMENT -> into.addAll(((FragmentValue) value).fragment().symbols());
            case LIST -> ((ListValue) value).items().forEach(item -> collectSymbols(operator, item, into));
            case NUMBER, BOOL, MAP -> throw DslEvaluationException.typeMismatch(
                    operator, "assets or portfolio fragments", value.kind());
        }
    }

    /** Raw weights of a symbol (100 %) or a fragment. */
    static PortfolioFragment fragment(String operator, DslValue value) {
        return switch (value.kind()) {
            case SYMBOL -> PortfolioFragment.single(((SymbolValue) value).name());
            case FRAGMENT -> ((FragmentValue) value).fragment();
            case NUMBER, BOOL, LIST, MAP -> throw DslEvaluationException.typeMismatch(
                    operator, "an asset or portfolio fragment", value.kind());
        };
    }

    /**
     * Child of a weighting operator scaled to a total of one. A list child is weighted equally
     * across its items.
     */
    static PortfolioFragment normalizedChild(String operator, DslValue value) {
        if (value instanceof ListValue list) {
            return equalWeight(operator, flatten(list.items()));
        }
        PortfolioFragment fragment = fragment(operator, value);
        if (fragment.totalWeight().signum() == 0) {
            throw new DslEvaluationException(
                    ErrorCode.EVALUATION_ERROR, operator + " received a portfolio fragment with zero total weight");
        }
        return fragment.normalized();
    }

    /**
     * Equal split across the children. Fragments with zero total weight are skipped; the call fails
     * only when no child carries any weight.
     */
    static PortfolioFragment equalWeight(String operator, List<DslValue> children) {
        List<DslValue> weighted = new ArrayList<>();
        for (DslValue child : children) {
            if (child instanceof FragmentValue fragment && fragment.fragment().totalWeight().signum() == 0) {
                log.debug("{} skipped a portfolio fragment with zero total weight", operator);
                continue;
            }
            weighted.add(child);
        }
        if (weighted.isEmpty()) {
            throw new DslEvaluationException(ErrorCode.EVALUATION_ERROR, operator + " received no assets");
        }
        BigDecimal share = BigDecimal.ONE.divide(BigDecimal.valueOf(weighted.size()), PortfolioFragment.ARITHMETIC);
        PortfolioFragment result = PortfolioFragment.empty();
        for (DslValue child : weighted) {
            result = result.merge(normalizedChild(operator, child).scale(share));
        }
        return result;
    }
}
