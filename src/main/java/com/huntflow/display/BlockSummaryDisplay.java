package com.huntflow.display;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Appended after a block that produced new variables
 */
public class BlockSummaryDisplay implements Display {

    @JsonProperty("variables")
    private final List<Entry> variables;

    @JsonProperty("execution_time_sec")
    private final long executionTimeSeconds;

    public BlockSummaryDisplay(List<Entry> variables, long executionTimeSeconds) {
        this.variables = List.copyOf(variables);
        this.executionTimeSeconds = executionTimeSeconds;
    }

    public List<Entry> getVariables() {
        return variables;
    }

    /**
     * Whole seconds, rounded up
     */
    public long getExecutionTimeSeconds() {
        return executionTimeSeconds;
    }

    @Override
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (Entry entry : variables) {
            sb.append(String.format("%-16s %-20s %8d%n", entry.getName(), entry.getEntityType(), entry.getCount()));
        }
        sb.append("Execution time: ").append(executionTimeSeconds).append(" second(s)\n");
        return sb.toString();
    }

    /**
     * Summary line for one variable
     */
    public static class Entry {
        @JsonProperty("name")
        private final String name;

        @JsonProperty("entity_type")
        private final String entityType;

        @JsonProperty("count")
        private final long count;

        public Entry(String name, String entityType, long count) {
            this.name = name;
            this.entityType = entityType;
            this.count = count;
        }

        public String getName() {
            return name;
        }

        public String getEntityType() {
            return entityType;
        }

        public long getCount() {
            return count;
        }
    }
}
