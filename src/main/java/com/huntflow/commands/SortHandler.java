package com.huntflow.commands;

import com.huntflow.session.HuntSession;
import com.huntflow.session.VariableBinding;
import com.huntflow.statement.Command;
import com.huntflow.statement.SortStatement;

public class SortHandler extends AbstractCommandHandler<SortStatement> {

    public SortHandler() {
        super(Command.SORT, SortStatement.class);
    }

    @Override
    protected CommandResult doHandle(SortStatement statement, HuntSession session) {
        VariableBinding input = session.getSymbolTable().require(statement.getInput());
        return bind(session.getStore().filter(input.getHandle(), null, statement.getSort(), statement.getPaging()),
                session);
    }
}
