package com.huntflow.display;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.huntflow.statement.TimeRange;

import java.util.List;

/**
 * Result of INFO: what a variable holds
 */
public class VariableInfoDisplay implements Display {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("entity_type")
    private final String entityType;

    @JsonProperty("count")
    private final long count;

    @JsonProperty("time_range")
    private final TimeRange timeRange;

    @JsonProperty("attributes")
    private final List<String> attributes;

    public VariableInfoDisplay(String name, String entityType, long count, TimeRange timeRange,
                               List<String> attributes) {
        this.name = name;
        this.entityType = entityType;
        this.count = count;
        this.timeRange = timeRange;
        this.attributes = List.copyOf(attributes);
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

    /**
     * Observation window of the rows, or null when they carry no timestamps
     */
    public TimeRange getTimeRange() {
        return timeRange;
    }

    public List<String> getAttributes() {
        return attributes;
    }

    @Override
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Entity Type: ").append(entityType).append('\n');
        sb.append("Number of Entities: ").append(count).append('\n');
        if (timeRange != null) {
            sb.append("First Observed: ").append(timeRange.getStart()).append('\n');
            sb.append("Last Observed: ").append(timeRange.getStop()).append('\n');
        }
        sb.append("Entity Attributes: ").append(String.join(", ", attributes)).append('\n');
        return sb.toString();
    }
}
