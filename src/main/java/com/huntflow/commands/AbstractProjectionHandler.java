package com.huntflow.commands;

import com.huntflow.session.HuntSession;
import com.huntflow.session.VariableBinding;
import com.huntflow.statement.Command;
import com.huntflow.statement.ProjectionStatement;
import com.huntflow.store.EntityStore;
import com.huntflow.store.ResultSetHandle;

/**
 * Shared pipeline of assignment and DISP: transform, filter, sort and page
 */
abstract class AbstractProjectionHandler<S extends ProjectionStatement> extends AbstractCommandHandler<S> {

    protected AbstractProjectionHandler(Command command, Class<S> statementType) {
        super(command, statementType);
    }

    /**
     * @return the input binding's handle when the statement neither transforms nor filters
     */
    protected ResultSetHandle select(S statement, HuntSession session) {
        EntityStore store = session.getStore();
        VariableBinding input = session.getSymbolTable().require(statement.getInput());
        ResultSetHandle handle = input.getHandle();
        if (statement.getTransform() != null) {
            handle = store.transform(handle, statement.getTransform());
        }
        boolean paged = statement.getPaging() != null && !statement.getPaging().isEmpty();
        if (statement.getFilter() != null || statement.getSort() != null || paged) {
            handle = store.filter(handle, statement.getFilter(), statement.getSort(), statement.getPaging());
        }
        return handle;
    }
}
