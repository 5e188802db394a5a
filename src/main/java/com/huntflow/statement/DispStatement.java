package com.huntflow.statement;

import com.huntflow.pattern.CenteredPattern;

public class DispStatement extends ProjectionStatement {

    public DispStatement(String input, Transform transform, CenteredPattern where,
                         AttributeSelector attributes, SortSpec sort, Paging paging) {
        super(Command.DISP, input, transform, where, attributes, sort, paging);
    }
}
