package com.huntflow.statement;

import com.huntflow.pattern.CenteredPattern;
import com.huntflow.store.StoreFilter;

import java.util.List;
import java.util.Map;

/**
 * Shared shape of assignments and DISP:
 * {@code (var | TRANSFORM(var)) [WHERE ..] [ATTR ..] [SORT BY ..] [LIMIT n] [OFFSET m]}
 */
public abstract class ProjectionStatement extends Statement implements PatternStatement {

    private final String input;
    private final Transform transform;
    private CenteredPattern where;
    private AttributeSelector attributes;
    private final SortSpec sort;
    private final Paging paging;
    private StoreFilter filter;

    protected ProjectionStatement(Command command, String input, Transform transform, CenteredPattern where,
                                  AttributeSelector attributes, SortSpec sort, Paging paging) {
        super(command);
        this.input = input;
        this.transform = transform;
        this.where = where;
        this.attributes = attributes != null ? attributes : AttributeSelector.all();
        this.sort = sort;
        this.paging = paging != null ? paging : Paging.none();
    }

    public String getInput() {
        return input;
    }

    /**
     * Transform applied to the input before filtering, or null
     */
    public Transform getTransform() {
        return transform;
    }

    @Override
    public CenteredPattern getWhere() {
        return where;
    }

    @Override
    public void setWhere(CenteredPattern where) {
        this.where = where;
    }

    public AttributeSelector getAttributes() {
        return attributes;
    }

    public void setAttributes(AttributeSelector attributes) {
        this.attributes = attributes;
    }

    public SortSpec getSort() {
        return sort;
    }

    public Paging getPaging() {
        return paging;
    }

    /**
     * Backend filter compiled from the WHERE pattern during resolution
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
        fields.put("input", input);
        if (sort != null) {
            fields.put("sort", sort.getAttribute());
        }
    }
}
