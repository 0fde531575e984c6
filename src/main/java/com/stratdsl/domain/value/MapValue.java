package com.stratdsl.domain.value;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Keyword-keyed structure such as indicator parameters ({@code {:window 14}}) or strategy
 * metadata. Keys are stored without the leading colon; insertion order is preserved.
 */
public record MapValue(Map<String, DslValue> entries) implements DslValue {

    public MapValue {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public Optional<DslValue> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public Optional<BigDecimal> getNumber(String key) {
        DslValue value = entries.get(key);
        return value instanceof NumberValue number ? Optional.of(number.value()) : Optional.empty();
    }

    @Override
    public Kind kind() {
        return Kind.MAP;
    }

    @Override
    public String render() {
        return entries.entrySet().stream()
                .map(e -> ":" + e.getKey() + " " + e.getValue().render())
                .collect(Collectors.joining(" ", "{", "}"));
    }
}
