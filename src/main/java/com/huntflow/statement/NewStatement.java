package com.huntflow.statement;

import java.util.List;
import java.util.Map;

/**
 * {@code NEW [type] [..]}: entities given inline as strings or JSON objects
 */
public class NewStatement extends Statement {

    private final String entityType;
    private final List<Object> data;

    public NewStatement(String entityType, List<Object> data) {
        super(Command.NEW);
        this.entityType = entityType;
        this.data = data;
    }

    public String getEntityType() {
        return entityType;
    }

    public List<Object> getData() {
        return data;
    }

    @Override
    public List<String> getInputVariables() {
        return List.of();
    }

    @Override
    protected void collectStringFields(Map<String, String> fields) {
        fields.put("type", entityType);
    }
}
