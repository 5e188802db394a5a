package com.huntflow.commands;

import com.huntflow.session.HuntSession;
import com.huntflow.session.VariableBinding;
import com.huntflow.statement.AssignStatement;
import com.huntflow.statement.Command;
import com.huntflow.store.ResultSetHandle;

/**
 * {@code out = [TRANSFORM(]in[)] [WHERE ..] [ATTR ..] [SORT BY ..] [LIMIT n] [OFFSET m]}
 */
public class AssignHandler extends AbstractProjectionHandler<AssignStatement> {

    public AssignHandler() {
        super(Command.ASSIGN, AssignStatement.class);
    }

    @Override
    protected CommandResult doHandle(AssignStatement statement, HuntSession session) {
        VariableBinding input = session.getSymbolTable().require(statement.getInput());
        ResultSetHandle handle = select(statement, session);
        if (!statement.getAttributes().isAll()) {
            handle = session.getStore().project(handle, statement.getAttributes());
        }
        // Plain aliasing shares the binding itself
        if (handle.equals(input.getHandle())) {
            return CommandResult.of(input);
        }
        return bind(handle, session);
    }
}
