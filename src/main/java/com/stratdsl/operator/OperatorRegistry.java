package com.stratdsl.operator;

import com.stratdsl.exception.UnknownOperatorException;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable table of operators, built once at start-up and shared by every evaluation.
 *
 * <p>Operator families register themselves through {@link Builder}; {@link #standard()} holds
 * the full built-in set. There is no reflection or string-based class lookup: an operator name
 * either has an entry here or is unknown.
 */
public final class OperatorRegistry {

    private final Map<String, OperatorDefinition> operators;

    private OperatorRegistry(Map<String, OperatorDefinition> operators) {
        this.operators = Collections.unmodifiableMap(new TreeMap<>(operators));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Registry with every built-in operator family. */
    public static OperatorRegistry standard() {
        Builder builder = builder();
        ComparisonOperators.register(builder);
        ControlFlowOperators.register(builder);
        IndicatorOperators.register(builder);
        PortfolioOperators.register(builder);
        SelectionOperators.register(builder);
        return builder.build();
    }

    /**
     * @throws UnknownOperatorException when no operator has this name
     */
    public OperatorDefinition resolve(String name) {
        OperatorDefinition definition = operators.get(name);
        if (definition == null) {
            throw new UnknownOperatorException(name);
        }
        return definition;
    }

    public Optional<OperatorDefinition> find(String name) {
        return Optional.ofNullable(operators.get(name));
    }

    public boolean isCategory(String name, OperatorCategory category) {
        OperatorDefinition definition = operators.get(name);
        return definition != null && definition.getCategory() == category;
    }

    public Set<String> names() {
        return operators.keySet();
    }

    public int size() {
        return operators.size();
    }

    public static final class Builder {

        private final Map<String, OperatorDefinition> operators = new TreeMap<>();

        private Builder() {}

        public Builder register(OperatorDefinition definition) {
            if (operators.putIfAbsent(definition.getName(), definition) != null) {
                throw new IllegalStateException("Operator already registered: " + definition.getName());
            }
            return this;
        }

        public OperatorRegistry build() {
            return new OperatorRegistry(operators);
        }
    }
}
