package com.huntflow.statement;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Built-in result transforms usable as {@code TRANSFORM(var)}
 */
public enum Transform {
    TIMESTAMPED,
    ADDOBSID,
    RECORDS;

    public static Optional<Transform> fromName(String name) {
        return Arrays.stream(values())
                .filter(t -> t.name().equalsIgnoreCase(name))
                .findFirst();
    }

    public static List<String> names() {
        return Arrays.stream(values()).map(Enum::name).collect(Collectors.toList());
    }
}
