package com.huntflow.commands;

import com.huntflow.session.HuntSession;
import com.huntflow.session.VariableBinding;
import com.huntflow.statement.Command;
import com.huntflow.statement.JoinStatement;
import com.huntflow.store.EntityRows;

/**
 * Joins two variables on an attribute pair; without BY the rows are matched on {@code id}
 */
public class JoinHandler extends AbstractCommandHandler<JoinStatement> {

    public JoinHandler() {
        super(Command.JOIN, JoinStatement.class);
    }

    @Override
    protected CommandResult doHandle(JoinStatement statement, HuntSession session) {
        VariableBinding left = session.getSymbolTable().require(statement.getInput());
        VariableBinding right = session.getSymbolTable().require(statement.getSecondInput());
        String leftAttribute = statement.getAttribute() != null ? statement.getAttribute() : EntityRows.ID;
        String rightAttribute = statement.getSecondAttribute() != null ? statement.getSecondAttribute() : EntityRows.ID;
        return bind(session.getStore().join(left.getHandle(), right.getHandle(), leftAttribute, rightAttribute),
                session);
    }
}
