package com.stratdsl.evaluator;

import com.stratdsl.ast.AstNode;
import com.stratdsl.ast.AtomNode;
import com.stratdsl.ast.ListKind;
import com.stratdsl.ast.ListNode;
import com.stratdsl.ast.SymbolNode;
import com.stratdsl.domain.model.PortfolioFragment;
import com.stratdsl.domain.value.BoolValue;
import com.stratdsl.domain.value.DslValue;
import com.stratdsl.domain.value.FragmentValue;
import com.stratdsl.domain.value.ListValue;
import com.stratdsl.domain.value.MapValue;
import com.stratdsl.domain.value.NumberValue;
import com.stratdsl.domain.value.SymbolValue;
import com.stratdsl.exception.BaseException;
import com.stratdsl.exception.DslEvaluationException;
import com.stratdsl.exception.ErrorCode;
import com.stratdsl.exception.UnknownOperatorException;
import com.stratdsl.operator.OperatorDefinition;
import com.stratdsl.operator.OperatorRegistry;
import com.stratdsl.operator.OperatorScope;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive tree-walking evaluator for strategy ASTs.
 *
 * <p>Evaluation rules by node:
 * <ul>
 *   <li>Atoms become numbers, booleans or symbols (string literals)</li>
 *   <li>A bare symbol is opaque data, e.g. a ticker, unless it heads a call</li>
 *   <li>{@code (op args...)} resolves {@code op} in the {@link OperatorRegistry}, checks the
 *       argument count and applies it; eager operators get their arguments evaluated left to
 *       right, lazy operators decide themselves</li>
 *   <li>A plain list with a non-symbol head, and any vector, evaluates to a list</li>
 *   <li>A map literal becomes a keyword map or, when it maps tickers to numbers, a fragment</li>
 * </ul>
 *
 * <p>Every visited node appends exactly one entry to the {@link EvaluationTrace}, in completion
 * order, whether it succeeds or fails. The first failure stops evaluation: it is recorded on the
 * failing node and on each enclosing node, then rethrown to the caller unchanged apart from the
 * source position being attached.
 *
 * <p>Stateless and thread-safe; all per-evaluation state lives in the {@link EvaluationContext}
 * and the trace.
 */
public class StrategyEvaluator {

    private static final Logger log = LoggerFactory.getLogger(StrategyEvaluator.class);

    /** Key used for map entries whose key is nil or empty. */
    public static final String UNKNOWN_KEY = "unknown";

    private final OperatorRegistry registry;

    public StrategyEvaluator(OperatorRegistry registry) {
        this.registry = registry;
    }

    public DslValue evaluate(AstNode root, EvaluationContext context, EvaluationTrace trace) {
        context.reset();
        return visit(root, context, trace, 1);
    }

    public OperatorRegistry getRegistry() {
        return registry;
    }

    private DslValue visit(AstNode node, EvaluationContext context, EvaluationTrace trace, int depth) {
        Visit visit = new Visit();
        try {
            context.recordVisit(depth);
            DslValue result = dispatch(node, context, trace, depth, visit);
            if (result == null) {
                throw new DslEvaluationException(
                        ErrorCode.EVALUATION_ERROR, "Operator " + visit.operator + " produced no value");
            }
            if (result instanceof FragmentValue fragment && fragment.fragment().getSourceOperator() == null) {
                result = FragmentValue.of(fragment.fragment()
                        .withProvenance(visit.operator != null ? visit.operator : "map-literal", node.getPosition()));
            }
            trace.success(node, depth, visit.operator, visit.inputs, result, visit.annotations);
            return result;
        } catch (DslEvaluationException e) {
            e.attachPosition(node.getPosition());
            trace.failure(node, depth, visit.operator, e);
            throw e;
        } catch (BaseException e) {
            trace.failure(node, depth, visit.operator, e);
            throw e;
        } catch (RuntimeException e) {
            log.debug("Unexpected failure evaluating {} at {}", node.render(), node.getPosition(), e);
            DslEvaluationException wrapped = new DslEvaluationException(
                            ErrorCode.EVALUATION_ERROR, "Evaluation failed: " + e.getMessage(), e)
                    .attachPosition(node.getPosition());
            trace.failure(node, depth, visit.operator, wrapped);
            throw wrapped;
        }
    }

    private DslValue dispatch(AstNode node, EvaluationContext context, EvaluationTrace trace, int depth, Visit visit) {
        if (node instanceof AtomNode atom) {
            return atomValue(atom);
        }
        if (node instanceof SymbolNode symbol) {
            return SymbolValue.of(symbol.getName());
        }
        ListNode list = (ListNode) node;
        return switch (list.getListKind()) {
            case MAP_LITERAL -> mapLiteral(list, context, trace, depth);
            case VECTOR -> ListValue.of(visitAll(list.getChildren(), context, trace, depth));
            case PLAIN -> list.callHead().isPresent()
                    ? call(list, list.callHead().get(), context, trace, depth, visit)
                    : ListValue.of(visitAll(list.getChildren(), context, trace, depth));
        };
    }

    private static DslValue atomValue(AtomNode atom) {
        Object value = atom.getValue();
        if (value instanceof BigDecimal number) {
            return NumberValue.of(number);
        }
        if (value instanceof Boolean bool) {
            return BoolValue.of(bool);
        }
        return SymbolValue.of((String) value);
    }

    private DslValue call(
            ListNode list, SymbolNode head, EvaluationContext context, EvaluationTrace trace, int depth, Visit visit) {
        String name = head.getName();
        OperatorDefinition definition;
        try {
            definition = registry.resolve(name);
        } catch (UnknownOperatorException e) {
            throw e.attachPosition(head.getPosition());
        }
        visit.operator = name;

        List<AstNode> args = list.arguments();
        if (!definition.acceptsArity(args.size())) {
            throw new DslEvaluationException(
                    ErrorCode.ARITY_MISMATCH,
                    String.format("%s expects %s argument(s) but got %d", name, definition.describeArity(), args.size()),
                    head.getPosition());
        }

        if (definition.isLazy()) {
            OperatorScope scope = new OperatorScope(
                    child -> visit(child, context, trace, depth + 1), context, registry, list);
            DslValue result = definition.getLazy().apply(args, scope);
            visit.annotations = scope.annotations();
            return result;
        }

        List<DslValue> values = visitAll(args, context, trace, depth);
        visit.inputs = values;
        return definition.getEager().apply(values, context);
    }

    private List<DslValue> visitAll(List<AstNode> nodes, EvaluationContext context, EvaluationTrace trace, int depth) {
        List<DslValue> values = new ArrayList<>(nodes.size());
        for (AstNode child : nodes) {
            values.add(visit(child, context, trace, depth + 1));
        }
        return values;
    }

    /**
     * Keys written as keywords produce a {@link MapValue}. Otherwise a map whose values are all
     * numbers is read as ticker weights and becomes a fragment; duplicate tickers are summed.
     */
    private DslValue mapLiteral(ListNode list, EvaluationContext context, EvaluationTrace trace, int depth) {
        List<AstNode> children = list.getChildren();
        Map<String, DslValue> entries = new LinkedHashMap<>();
        Map<String, BigDecimal> weights = new LinkedHashMap<>();
        boolean allKeywords = true;
        boolean allNumbers = true;

        for (int i = 0; i < children.size(); i += 2) {
            AstNode keyNode = children.get(i);
            DslValue keyValue = visit(keyNode, context, trace, depth + 1);
            DslValue value = visit(children.get(i + 1), context, trace, depth + 1);
            String key = mapKey(keyNode, keyValue, trace, depth + 1);

            allKeywords &= keyNode instanceof SymbolNode symbol && symbol.isKeyword();
            entries.put(key, value);
            if (value instanceof NumberValue number) {
                weights.merge(key, number.value(), BigDecimal::add);
            } else {
                allNumbers = false;
            }
        }

        if (!allKeywords && allNumbers) {
            return FragmentValue.of(PortfolioFragment.of(weights));
        }
        return new MapValue(entries);
    }

    private String mapKey(AstNode keyNode, DslValue keyValue, EvaluationTrace trace, int depth) {
        String key = switch (keyValue.kind()) {
            case SYMBOL -> {
                String name = ((SymbolValue) keyValue).name();
                if (keyNode instanceof SymbolNode symbol && symbol.isNil()) {
                    yield "";
                }
                yield name.startsWith(":") ? name.substring(1) : name;
            }
            case NUMBER -> ((NumberValue) keyValue).value().toPlainString();
            case BOOL -> keyValue.render();
            case FRAGMENT, LIST, MAP -> throw DslEvaluationException.typeMismatch(
                    "map literal", "a scalar key", keyValue.kind());
        };
        if (key.isEmpty()) {
            log.debug("Null map key at {} replaced with '{}'", keyNode.getPosition(), UNKNOWN_KEY);
            trace.notice(keyNode, depth, "Null map key replaced with '" + UNKNOWN_KEY + "'");
            return UNKNOWN_KEY;
        }
        return key;
    }

    /** What the current node contributes to its trace entry. */
    private static final class Visit {
        private String operator;
        private List<DslValue> inputs = List.of();
        private Map<String, String> annotations = Map.of();
    }
}
