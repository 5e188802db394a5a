package com.huntflow.statement;

import java.util.List;
import java.util.Map;

public class SortStatement extends Statement {

    private final String input;
    private final SortSpec sort;
    private final Paging paging;

    public SortStatement(String input, SortSpec sort, Paging paging) {
        super(Command.SORT);
        this.input = input;
        this.sort = sort;
        this.paging = paging != null ? paging : Paging.none();
    }

    public String getInput() {
        return input;
    }

    public SortSpec getSort() {
        return sort;
    }

    public Paging getPaging() {
        return paging;
    }

    @Override
    public List<String> getInputVariables() {
        return List.of(input);
    }

    @Override
    protected void collectStringFields(Map<String, String> fields) {
        fields.put("input", input);
        fields.put("attribute", sort.getAttribute());
    }
}
