package com.huntflow.store;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Read-only row view that follows reference attributes.
 *
 * <p>{@code src_ref.value} reads {@code value} of the entity whose id is stored in
 * {@code src_ref}; through a {@code *_refs} list the result is the list of values of every
 * referenced entity. Index selectors such as {@code [*]} or {@code [0]} are accepted and
 * ignored.
 */
public class LinkedRowView extends AbstractMap<String, Object> {

    private static final Pattern INDEX = Pattern.compile("\\[(\\*|\\d+)]");
    private static final int MAX_HOPS = 8;

    private final Map<String, Object> row;
    private final Function<Object, Map<String, Object>> entityById;

    public LinkedRowView(Map<String, Object> row, Function<Object, Map<String, Object>> entityById) {
        this.row = row;
        this.entityById = entityById;
    }

    @Override
    public Object get(Object key) {
        return lookup(row, INDEX.matcher(String.valueOf(key)).replaceAll(""), 0);
    }

    @Override
    public boolean containsKey(Object key) {
        return get(key) != null;
    }

    private Object lookup(Map<String, Object> current, String path, int hops) {
        if (current.containsKey(path) || hops > MAX_HOPS) {
            return current.get(path);
        }
        int dot = path.indexOf('.');
        while (dot > 0) {
            String head = path.substring(0, dot);
            if (EntityRows.isReferenceAttribute(head) && current.containsKey(head)) {
                return follow(current.get(head), path.substring(dot + 1), head.endsWith("_refs"), hops);
            }
            dot = path.indexOf('.', dot + 1);
        }
        return null;
    }

    private Object follow(Object cell, String remainder, boolean many, int hops) {
        List<Object> results = new ArrayList<>();
        for (Object id : EntityRows.referencedIds(cell)) {
            Map<String, Object> target = entityById.apply(id);
            if (target == null) {
                continue;
            }
            Object value = lookup(target, remainder, hops + 1);
            if (value instanceof Collection) {
                results.addAll((Collection<?>) value);
            } else if (value != null) {
                results.add(value);
            }
        }
        if (!many) {
            if (results.isEmpty()) {
                return null;
            }
            return results.size() == 1 ? results.get(0) : results;
        }
        return results.isEmpty() ? null : results;
    }

    @Override
    public Set<Entry<String, Object>> entrySet() {
        return Collections.unmodifiableMap(row).entrySet();
    }
}
