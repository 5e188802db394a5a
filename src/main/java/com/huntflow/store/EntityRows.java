package com.huntflow.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Row shaping shared by stores and connectors
 */
public final class EntityRows {

    public static final String ID = "id";
    public static final String TYPE = "type";
    public static final String FIRST_OBSERVED = "first_observed";
    public static final String LAST_OBSERVED = "last_observed";
    public static final String OBSERVATION_ID = "observation_id";

    private EntityRows() {
    }

    /**
     * Nested objects become dotted keys; lists of scalars stay lists
     */
    public static Map<String, Object> flatten(Map<?, ?> row) {
        Map<String, Object> flat = new LinkedHashMap<>();
        flattenInto("", row, flat);
        return flat;
    }

    private static void flattenInto(String prefix, Map<?, ?> source, Map<String, Object> target) {
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            String key = prefix + entry.getKey();
            Object value = entry.getValue();
            if (value instanceof Map) {
                flattenInto(key + ".", (Map<?, ?>) value, target);
            } else if (value instanceof Collection) {
                target.put(key, new ArrayList<>((Collection<?>) value));
            } else {
                target.put(key, value);
            }
        }
    }

    /**
     * Copy of the row carrying an id, generating {@code type--uuid} when missing
     */
    public static Map<String, Object> withId(String entityType, Map<String, Object> row) {
        Map<String, Object> copy = new LinkedHashMap<>(row);
        Object id = copy.get(ID);
        if (id == null || String.valueOf(id).isEmpty()) {
            copy.put(ID, entityType + "--" + UUID.randomUUID());
        }
        return copy;
    }

    public static boolean isReferenceAttribute(String attribute) {
        return attribute.endsWith("_ref") || attribute.endsWith("_refs");
    }

    /**
     * Referenced ids of a {@code *_ref} (scalar) or {@code *_refs} (list) cell
     */
    public static List<Object> referencedIds(Object cell) {
        List<Object> ids = new ArrayList<>();
        if (cell instanceof Collection) {
            for (Object item : (Collection<?>) cell) {
                if (item != null) {
                    ids.add(item);
                }
            }
        } else if (cell != null) {
            ids.add(cell);
        }
        return ids;
    }
}
