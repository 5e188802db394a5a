package com.huntflow.statement;

import java.util.List;
import java.util.Map;

public class MergeStatement extends Statement {

    private final List<String> inputs;

    public MergeStatement(List<String> inputs) {
        super(Command.MERGE);
        this.inputs = List.copyOf(inputs);
    }

    public List<String> getInputs() {
        return inputs;
    }

    @Override
    public List<String> getInputVariables() {
        return inputs;
    }

    @Override
    protected void collectStringFields(Map<String, String> fields) {
        for (int i = 0; i < inputs.size(); i++) {
            fields.put("input[" + i + "]", inputs.get(i));
        }
    }
}
