package com.huntflow.statement;

import com.huntflow.pattern.CenteredPattern;
import com.huntflow.store.StoreFilter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@code GET type [FROM source] WHERE pattern [timespan] [LIMIT n]}
 */
public class GetStatement extends Statement implements PatternStatement {

    private final String entityType;
    private String datasource;
    private String variableSource;
    private CenteredPattern where;
    private final TimeRange timeRange;
    private final Integer limit;
    private String wirePattern;
    private StoreFilter filter;

    public GetStatement(String entityType, String datasource, CenteredPattern where, TimeRange timeRange,
                        Integer limit) {
        super(Command.GET);
        this.entityType = entityType;
        this.datasource = datasource;
        this.where = where;
        this.timeRange = timeRange;
        this.limit = limit;
    }

    public String getEntityType() {
        return entityType;
    }

    /**
     * Source URI(s), comma separated; null when FROM was omitted and not yet defaulted
     */
    public String getDatasource() {
        return datasource;
    }

    public void setDatasource(String datasource) {
        this.datasource = datasource;
    }

    /**
     * Session variable used as source instead of an external URI
     */
    public String getVariableSource() {
        return variableSource;
    }

    public void setVariableSource(String variableSource) {
        this.variableSource = variableSource;
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

    public String getWirePattern() {
        return wirePattern;
    }

    public void setWirePattern(String wirePattern) {
        this.wirePattern = wirePattern;
    }

    public StoreFilter getFilter() {
        return filter;
    }

    public void setFilter(StoreFilter filter) {
        this.filter = filter;
    }

    @Override
    public List<String> getInputVariables() {
        List<String> inputs = new ArrayList<>();
        if (variableSource != null) {
            inputs.add(variableSource);
        }
        return inputs;
    }

    @Override
    protected void collectStringFields(Map<String, String> fields) {
        fields.put("type", entityType);
        fields.put("datasource", datasource);
        fields.put("variableSource", variableSource);
        fields.put("wirePattern", wirePattern);
    }
}
