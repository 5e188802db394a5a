package com.huntflow.statement;

import java.util.List;
import java.util.Map;

public class InfoStatement extends Statement {

    private final String input;

    public InfoStatement(String input) {
        super(Command.INFO);
        this.input = input;
    }

    public String getInput() {
        return input;
    }

    @Override
    public List<String> getInputVariables() {
        return List.of(input);
    }

    @Override
    protected void collectStringFields(Map<String, String> fields) {
        fields.put("input", input);
    }
}
