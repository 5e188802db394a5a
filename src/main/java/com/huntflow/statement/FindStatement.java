package com.huntflow.statement;

import com.huntflow.pattern.CenteredPattern;
import com.huntflow.store.StoreFilter;

import java.util.List;
import java.util.Map;

/**
 * {@code FIND type relation [BY] var [WHERE pattern] [timespan] [LIMIT n]}
 */
public class FindStatement extends Statement implements PatternStatement {

    private final String entityType;
    private final String relation;
    private final boolean reversed;
    private final String input;
    private CenteredPattern where;
    private final TimeRange timeRange;
    private final Integer limit;
    private StoreFilter filter;

    public FindStatement(String entityType, String relation, boolean reversed, String input,
                         CenteredPattern where, TimeRange timeRange, Integer limit) {
        super(Command.FIND);
        this.entityType = entityType;
        this.relation = relation;
        this.reversed = reversed;
        this.input = input;
        this.where = where;
        this.timeRange = timeRange;
        this.limit = limit;
    }

    /**
     * Type of the entities returned
     */
    public String getEntityType() {
        return entityType;
    }

    public String getRelation() {
        return relation;
    }

    /**
     * True when written with BY: the input is the subject of the relation
     */
    public boolean isReversed() {
        return reversed;
    }

    public String getInput() {
        return input;
    }

    @Override
    public CenteredPattern getWhere() {
        return where;
    }

    @Override
    public void setWhere(CenteredPattern where) {
        this.where = where;
    }

    public TimeRange getTimeRange() {
        return timeRange;
    }

    public Integer getLimit() {
        return limit;
    }

    /**
     * WHERE compiled against the input variable's entities
     */
    public StoreFilter getFilter() {
        return filter;
    }

    public void setFilter(StoreFilter filter) {
        this.filter = filter;
    }

    @Override
    public List<String> getInputVariables() {
        return List.of(input);
    }

    @Override
    protected void collectStringFields(Map<String, String> fields) {
        fields.put("type", entityType);
        fields.put("relation", relation);
        fields.put("input", input);
    }
}
