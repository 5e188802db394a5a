package com.huntflow.statement;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

public enum AggregationFunction {
    SUM,
    COUNT,
    NUNIQUE,
    MAX,
    MIN,
    AVG;

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<AggregationFunction> fromName(String name) {
        return Arrays.stream(values())
                .filter(f -> f.name().equalsIgnoreCase(name))
                .findFirst();
    }

    public static List<String> names() {
        return Arrays.stream(values()).map(Enum::name).collect(Collectors.toList());
    }
}
