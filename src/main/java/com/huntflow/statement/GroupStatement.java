package com.huntflow.statement;

import java.util.List;
import java.util.Map;

public class GroupStatement extends Statement {

    private final String input;
    private final List<GroupingSpec> groupings;
    private final List<Aggregation> aggregations;

    public GroupStatement(String input, List<GroupingSpec> groupings, List<Aggregation> aggregations) {
        super(Command.GROUP);
        this.input = input;
        this.groupings = List.copyOf(groupings);
        this.aggregations = aggregations != null ? List.copyOf(aggregations) : List.of();
    }

    public String getInput() {
        return input;
    }

    public List<GroupingSpec> getGroupings() {
        return groupings;
    }

    /**
     * Aggregations of the WITH list; empty when the clause was omitted
     */
    public List<Aggregation> getAggregations() {
        return aggregations;
    }

    @Override
    public List<String> getInputVariables() {
        return List.of(input);
    }

    @Override
    protected void collectStringFields(Map<String, String> fields) {
        fields.put("input", input);
        for (int i = 0; i < groupings.size(); i++) {
            fields.put("groupBy[" + i + "]", groupings.get(i).getAttribute());
        }
        for (int i = 0; i < aggregations.size(); i++) {
            fields.put("aggregation[" + i + "]", aggregations.get(i).getAttribute());
        }
    }
}
