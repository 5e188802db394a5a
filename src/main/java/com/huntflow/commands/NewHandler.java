package com.huntflow.commands;

import com.huntflow.HuntflowException;
import com.huntflow.session.HuntSession;
import com.huntflow.statement.Command;
import com.huntflow.statement.NewStatement;
import com.huntflow.store.EntityRows;
import com.huntflow.store.EntityTypeMismatchException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * NEW: entities from inline data, either objects or plain values.
 *
 * <p>An explicit type overrides the {@code type} field of objects. Plain values need an
 * explicit type and become the type's identifying attribute.
 */
public class NewHandler extends AbstractCommandHandler<NewStatement> {

    private static final Map<String, String> VALUE_ATTRIBUTES = Map.of(
            "process", "name",
            "file", "name",
            "directory", "path",
            "user-account", "user_id",
            "software", "name",
            "mutex", "name");
    private static final String DEFAULT_VALUE_ATTRIBUTE = "value";

    public NewHandler() {
        super(Command.NEW, NewStatement.class);
    }

    @Override
    protected CommandResult doHandle(NewStatement statement, HuntSession session) {
        String entityType = entityType(statement);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Object item : statement.getData()) {
            Map<String, Object> row = new LinkedHashMap<>();
            if (item instanceof Map) {
                ((Map<?, ?>) item).forEach((key, value) -> row.put(String.valueOf(key), value));
            } else {
                row.put(valueAttribute(entityType), item);
            }
            row.put(EntityRows.TYPE, entityType);
            rows.add(row);
        }
        return bind(session.getStore().insert(entityType, rows), session);
    }

    static String valueAttribute(String entityType) {
        return VALUE_ATTRIBUTES.getOrDefault(entityType, DEFAULT_VALUE_ATTRIBUTE);
    }

    private static String entityType(NewStatement statement) {
        if (statement.getEntityType() != null) {
            return statement.getEntityType();
        }
        String found = null;
        for (Object item : statement.getData()) {
            Object type = item instanceof Map ? ((Map<?, ?>) item).get(EntityRows.TYPE) : null;
            if (type == null) {
                throw new HuntflowException("NEW without an entity type requires a \"type\" field on every entity");
            }
            if (found != null && !found.equals(type.toString())) {
                throw new EntityTypeMismatchException(found, type.toString());
            }
            found = type.toString();
        }
        if (found == null) {
            throw new HuntflowException("NEW without an entity type requires at least one entity");
        }
        return found;
    }
}
