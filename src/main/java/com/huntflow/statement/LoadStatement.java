package com.huntflow.statement;

import java.util.List;
import java.util.Map;

public class LoadStatement extends Statement {

    private String path;
    private final String entityType;

    public LoadStatement(String path, String entityType) {
        super(Command.LOAD);
        this.path = path;
        this.entityType = entityType;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    /**
     * Declared entity type, or null when every record carries its own {@code type}
     */
    public String getEntityType() {
        return entityType;
    }

    @Override
    public List<String> getInputVariables() {
        return List.of();
    }

    @Override
    protected void collectStringFields(Map<String, String> fields) {
        fields.put("path", path);
        fields.put("type", entityType);
    }
}
