package com.stratdsl.domain.value;

import java.util.List;
import java.util.stream.Collectors;

public record ListValue(List<DslValue> items) implements DslValue {

    public static final ListValue EMPTY = new ListValue(List.of());

    public ListValue {
        items = List.copyOf(items);
    }

    public static ListValue of(List<? extends DslValue> items) {
        return new ListValue(List.copyOf(items));
    }

    @Override
    public Kind kind() {
        return Kind.LIST;
    }

    @Override
    public String render() {
        return items.stream().map(DslValue::render).collect(Collectors.joining(" ", "[", "]"));
    }
}
