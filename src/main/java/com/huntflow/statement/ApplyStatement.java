package com.huntflow.statement;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code APPLY uri ON var, .. [WITH k=v, ..]}
 *
 * <p>Argument values are literals, lists of literals or references until resolution
 * replaces the references with concrete values.
 */
public class ApplyStatement extends Statement {

    private final String analyticsUri;
    private final List<String> inputs;
    private final Map<String, Object> arguments;

    public ApplyStatement(String analyticsUri, List<String> inputs, Map<String, Object> arguments) {
        super(Command.APPLY);
        this.analyticsUri = analyticsUri;
        this.inputs = List.copyOf(inputs);
        this.arguments = new LinkedHashMap<>(arguments);
    }

    public String getAnalyticsUri() {
        return analyticsUri;
    }

    public List<String> getInputs() {
        return inputs;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    public void setArgument(String name, Object value) {
        arguments.put(name, value);
    }

    @Override
    public List<String> getInputVariables() {
        return inputs;
    }

    @Override
    protected void collectStringFields(Map<String, String> fields) {
        fields.put("analytics", analyticsUri);
        for (int n = 0; n < inputs.size(); n++) {
            fields.put("input[" + n + "]", inputs.get(n));
        }
        int i = 0;
        for (String name : arguments.keySet()) {
            fields.put("argument[" + i++ + "]", name);
        }
    }
}
