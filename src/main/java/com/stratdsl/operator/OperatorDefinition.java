package com.stratdsl.operator;

import java.util.Objects;

/**
 * Registry entry: operator name, category, accepted argument count and implementation.
 *
 * <p>Exactly one of {@link #getEager()} and {@link #getLazy()} is set. Lazy operators are the
 * ones that must not evaluate all their arguments up front, such as {@code if}.
 */
public final class OperatorDefinition {

    public static final int VARIADIC = Integer.MAX_VALUE;

    private final String name;
    private final OperatorCategory category;
    private final int minArity;
    private final int maxArity;
    private final EagerOperator eager;
    private final LazyOperator lazy;

    private OperatorDefinition(
            String name, OperatorCategory category, int minArity, int maxArity, EagerOperator eager, LazyOperator lazy) {
        if (minArity < 0 || maxArity < minArity) {
            throw new IllegalArgumentException("Invalid arity range for " + name);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.category = Objects.requireNonNull(category, "category");
        this.minArity = minArity;
        this.maxArity = maxArity;
        this.eager = eager;
        this.lazy = lazy;
    }

    public static OperatorDefinition eager(
            String name, OperatorCategory category, int minArity, int maxArity, EagerOperator operator) {
        return new OperatorDefinition(name, category, minArity, maxArity, Objects.requireNonNull(operator), null);
    }

    public static OperatorDefinition lazy(
            String name, OperatorCategory category, int minArity, int maxArity, LazyOperator operator) {
        return new OperatorDefinition(name, category, minArity, maxArity, null, Objects.requireNonNull(operator));
    }

    public String getName() {
        return name;
    }

    public OperatorCategory getCategory() {
        return category;
    }

    public int getMinArity() {
        return minArity;
    }

    public int getMaxArity() {
        return maxArity;
    }

    public EagerOperator getEager() {
        return eager;
    }

    public LazyOperator getLazy() {
        return lazy;
    }

    public boolean isLazy() {
        return lazy != null;
    }

    public boolean acceptsArity(int argumentCount) {
        return argumentCount >= minArity && argumentCount <= maxArity;
    }

    public String describeArity() {
        if (minArity == maxArity) {
            return "exactly " + minArity;
        }
        if (maxArity == VARIADIC) {
            return "at least " + minArity;
        }
        return "between " + minArity + " and " + maxArity;
    }

    @Override
    public String toString() {
        return name + "/" + category;
    }
}
