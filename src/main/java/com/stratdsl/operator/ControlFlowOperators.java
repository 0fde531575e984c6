package com.stratdsl.operator;

import com.stratdsl.ast.AstNode;
import com.stratdsl.ast.AtomNode;
import com.stratdsl.domain.value.BoolValue;
import com.stratdsl.domain.value.DslValue;
import com.stratdsl.exception.DslEvaluationException;
import com.stratdsl.exception.ErrorCode;
import java.util.List;
import java.util.Map;

/**
 * Branching and boolean logic. All but {@code not} are lazy: an argument that does not decide
 * the result is never evaluated, so it produces no trace entry and no indicator lookup.
 */
public final class ControlFlowOperators {

    public static final String DECISION_CATEGORY = "BRANCH";

    private ControlFlowOperators() {}

    public static void register(OperatorRegistry.Builder builder) {
        builder.register(controlFlow("if", 2, 3, ControlFlowOperators::ifThenElse));
        builder.register(controlFlow("and", 1, OperatorDefinition.VARIADIC, (args, scope) ->
                shortCircuit("and", args, scope, false)));
        builder.register(controlFlow("or", 1, OperatorDefinition.VARIADIC, (args, scope) ->
                shortCircuit("or", args, scope, true)));
        builder.register(OperatorDefinition.eager("not", OperatorCategory.CONTROL_FLOW, 1, 1, (args, context) ->
                BoolValue.of(!OperatorArguments.bool("not", args.get(0)))));
        builder.register(controlFlow("defsymphony", 2, 3, ControlFlowOperators::defsymphony));
    }

    private static OperatorDefinition controlFlow(String name, int minArity, int maxArity, LazyOperator operator) {
        return OperatorDefinition.lazy(name, OperatorCategory.CONTROL_FLOW, minArity, maxArity, operator);
    }

    private static DslValue ifThenElse(List<AstNode> args, OperatorScope scope) {
        AstNode conditionNode = args.get(0);
        boolean condition = OperatorArguments.bool("if", scope.evaluate(conditionNode));
        String branch = condition ? "then" : "else";
        if (!condition && args.size() < 3) {
            throw new DslEvaluationException(
                    ErrorCode.EVALUATION_ERROR, "if condition " + conditionNode.render() + " is false and there is no else branch");
        }
        scope.annotate("branch", branch);
        scope.context()
                .publishDecision(
                        ControlFlowOperators.class,
                        DECISION_CATEGORY,
                        String.format("Condition %s is %s, taking %s branch", conditionNode.render(), condition, branch),
                        Map.of(
                                "condition", conditionNode.render(),
                                "branch", branch,
                                "position", scope.call().getPosition().toString()));
        return scope.evaluate(args.get(condition ? 1 : 2));
    }

    private static DslValue shortCircuit(String name, List<AstNode> args, OperatorScope scope, boolean decisive) {
        int evaluated = 0;
        for (AstNode arg : args) {
            evaluated++;
            if (OperatorArguments.bool(name, scope.evaluate(arg)) == decisive) {
                scope.annotate("evaluated", evaluated + "/" + args.size());
                return BoolValue.of(decisive);
            }
        }
        scope.annotate("evaluated", evaluated + "/" + args.size());
        return BoolValue.of(!decisive);
    }

    /** {@code (defsymphony "name" {metadata} body)}: only the body is evaluated. */
    private static DslValue defsymphony(List<AstNode> args, OperatorScope scope) {
        AstNode nameNode = args.get(0);
        String name = nameNode instanceof AtomNode atom && atom.isString() ? (String) atom.getValue() : nameNode.render();
        scope.annotate("strategy", name);
        return scope.evaluate(args.get(args.size() - 1));
    }
}
