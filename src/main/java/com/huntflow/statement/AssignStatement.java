package com.huntflow.statement;

import com.huntflow.pattern.CenteredPattern;

public class AssignStatement extends ProjectionStatement {

    public AssignStatement(String input, Transform transform, CenteredPattern where,
                           AttributeSelector attributes, SortSpec sort, Paging paging) {
        super(Command.ASSIGN, input, transform, where, attributes, sort, paging);
    }

    /**
     * True for a plain {@code x} or {@code y = x} with no transform or clause
     */
    public boolean isBare() {
        return getTransform() == null && getWhere() == null && getAttributes().isAll()
                && getSort() == null && getPaging().isEmpty();
    }
}
