package com.huntflow.statement;

import java.util.List;
import java.util.Map;

public class JoinStatement extends Statement {

    private final String input;
    private final String secondInput;
    private final String attribute;
    private final String secondAttribute;

    public JoinStatement(String input, String secondInput, String attribute, String secondAttribute) {
        super(Command.JOIN);
        this.input = input;
        this.secondInput = secondInput;
        this.attribute = attribute;
        this.secondAttribute = secondAttribute;
    }

    public String getInput() {
        return input;
    }

    public String getSecondInput() {
        return secondInput;
    }

    /**
     * Join attribute of the first input, or null to join on {@code id}
     */
    public String getAttribute() {
        return attribute;
    }

    public String getSecondAttribute() {
        return secondAttribute;
    }

    @Override
    public List<String> getInputVariables() {
        return List.of(input, secondInput);
    }

    @Override
    protected void collectStringFields(Map<String, String> fields) {
        fields.put("input", input);
        fields.put("input2", secondInput);
        fields.put("attribute", attribute);
        fields.put("attribute2", secondAttribute);
    }
}
