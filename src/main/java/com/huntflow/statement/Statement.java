package com.huntflow.statement;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One parsed huntflow statement.
 *
 * <p>Built once by the parser, normalized in place by the semantic resolver and
 * discarded after execution; only the variable binding it produces outlives it.
 */
public abstract class Statement {

    private final Command command;
    private String output;

    protected Statement(Command command) {
        this.command = command;
    }

    public Command getCommand() {
        return command;
    }

    /**
     * Output variable, or null for commands that bind nothing
     */
    public String getOutput() {
        return output;
    }

    public void setOutput(String output) {
        this.output = output;
    }

    /**
     * Variables this statement reads directly, in source order
     */
    public abstract List<String> getInputVariables();

    /**
     * Every string-valued field with its name; values that are absent are left out
     */
    public Map<String, String> getStringFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("output", output);
        collectStringFields(fields);
        fields.values().removeIf(v -> v == null);
        return fields;
    }

    protected abstract void collectStringFields(Map<String, String> fields);

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(command.keyword());
        getStringFields().forEach((k, v) -> sb.append(' ').append(k).append('=').append(v));
        return sb.toString();
    }
}
