package com.huntflow.statement;

import java.util.List;
import java.util.Map;

public class SaveStatement extends Statement {

    private final String input;
    private String path;

    public SaveStatement(String input, String path) {
        super(Command.SAVE);
        this.input = input;
        this.path = path;
    }

    public String getInput() {
        return input;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    @Override
    public List<String> getInputVariables() {
        return List.of(input);
    }

    @Override
    protected void collectStringFields(Map<String, String> fields) {
        fields.put("input", input);
        fields.put("path", path);
    }
}
