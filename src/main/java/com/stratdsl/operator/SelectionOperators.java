package com.stratdsl.operator;

import com.stratdsl.ast.AstNode;
import com.stratdsl.ast.AtomNode;
import com.stratdsl.ast.ListKind;
import com.stratdsl.ast.ListNode;
import com.stratdsl.ast.SymbolNode;
import com.stratdsl.domain.value.DslValue;
import com.stratdsl.domain.value.ListValue;
import com.stratdsl.domain.value.NumberValue;
import com.stratdsl.domain.value.SymbolValue;
import com.stratdsl.exception.DslEvaluationException;
import com.stratdsl.exception.ErrorCode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ranking of candidate assets by a metric.
 *
 * <p>{@code (filter (rsi {:window 10}) (select-top 2) [(asset "A") (asset "B") (asset "C")])}
 * evaluates the metric once per candidate, with the candidate injected as the metric's first
 * argument, and keeps the best two. {@code select-top} ranks descending and {@code select-bottom}
 * ascending; equal scores are always ordered by ascending symbol name. Without a selector every
 * candidate is kept, ranked descending.
 *
 * <p>A metric that fails for any single candidate, including a missing indicator value, fails the
 * whole {@code filter}. Candidates are never dropped from the ranking.
 */
public final class SelectionOperators {

    public static final String DECISION_CATEGORY = "SELECTION";

    private SelectionOperators() {}

    public static void register(OperatorRegistry.Builder builder) {
        builder.register(OperatorDefinition.lazy("filter", OperatorCategory.SELECTION, 2, 3, SelectionOperators::filter));
        builder.register(OperatorDefinition.eager("select-top", OperatorCategory.SELECTION, 1, 1, (args, context) ->
                NumberValue.of(OperatorArguments.positiveInt("select-top", args.get(0)))));
        builder.register(OperatorDefinition.eager("select-bottom", OperatorCategory.SELECTION, 1, 1, (args, context) ->
                NumberValue.of(OperatorArguments.positiveInt("select-bottom", args.get(0)))));
    }

    private static DslValue filter(List<AstNode> args, OperatorScope scope) {
        AstNode metric = args.get(0);
        Optional<AstNode> selector = args.size() == 3 ? Optional.of(args.get(1)) : Optional.empty();

        List<String> candidates = new ArrayList<>(
                OperatorArguments.symbols("filter", scope.evaluate(args.get(args.size() - 1))));

        boolean descending = true;
        int limit = candidates.size();
        if (selector.isPresent()) {
            descending = isSelectTop(selector.get());
            limit = OperatorArguments.positiveInt("filter", scope.evaluate(selector.get()));
        }

        List<Scored> scored = new ArrayList<>();
        for (String candidate : candidates) {
            AstNode expression = withCandidate(metric, candidate, scope.registry());
            scored.add(new Scored(candidate, OperatorArguments.number("filter", scope.evaluate(expression))));
        }

        Comparator<Scored> byScore = Comparator.comparing(Scored::score);
        if (descending) {
            byScore = byScore.reversed();
        }
        List<SymbolValue> selected = scored.stream()
                .sorted(byScore.thenComparing(Scored::symbol))
                .limit(limit)
                .map(s -> SymbolValue.of(s.symbol()))
                .collect(Collectors.toList());

        String selectedNames = selected.stream().map(SymbolValue::name).collect(Collectors.joining(","));
        scope.annotate("selected", selectedNames);
        scope.context()
                .publishDecision(
                        SelectionOperators.class,
                        DECISION_CATEGORY,
                        String.format("Selected [%s] from %d candidates by %s", selectedNames, candidates.size(),
                                metric.render()),
                        Map.of("metric", metric.render(), "selected", selectedNames));
        return ListValue.of(selected);
    }

    private static boolean isSelectTop(AstNode selector) {
        if (selector instanceof ListNode list) {
            Optional<SymbolNode> head = list.callHead();
            if (head.isPresent() && "select-top".equals(head.get().getName())) {
                return true;
            }
            if (head.isPresent() && "select-bottom".equals(head.get().getName())) {
                return false;
            }
        }
        throw new DslEvaluationException(
                ErrorCode.EVALUATION_ERROR, "filter selector must be (select-top n) or (select-bottom n) but got "
                        + selector.render());
    }

    /**
     * Injects the candidate as first argument when the metric is an indicator call that names no
     * symbol of its own, e.g. {@code (rsi {:window 10})}. Any other metric is evaluated as written.
     */
    private static AstNode withCandidate(AstNode metric, String candidate, OperatorRegistry registry) {
        if (!(metric instanceof ListNode call)) {
            return metric;
        }
        Optional<SymbolNode> head = call.callHead();
        if (head.isEmpty() || !registry.isCategory(head.get().getName(), OperatorCategory.INDICATOR)) {
            return metric;
        }
        List<AstNode> arguments = call.arguments();
        boolean namesSymbol = !arguments.isEmpty()
                && !(arguments.get(0) instanceof ListNode first && first.getListKind() == ListKind.MAP_LITERAL);
        if (namesSymbol) {
            return metric;
        }
        return call.withArgumentPrepended(AtomNode.string(candidate, call.getPosition()));
    }

    private record Scored(String symbol, BigDecimal score) {}
}
