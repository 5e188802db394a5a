package com.huntflow.commands;

import com.huntflow.session.HuntSession;
import com.huntflow.session.VariableBinding;
import com.huntflow.statement.Command;
import com.huntflow.statement.GroupStatement;

/**
 * GROUP BY attributes and bins; without WITH each group reports its row count
 */
public class GroupHandler extends AbstractCommandHandler<GroupStatement> {

    public GroupHandler() {
        super(Command.GROUP, GroupStatement.class);
    }

    @Override
    protected CommandResult doHandle(GroupStatement statement, HuntSession session) {
        VariableBinding input = session.getSymbolTable().require(statement.getInput());
        return bind(session.getStore().group(input.getHandle(), statement.getGroupings(),
                statement.getAggregations()), session);
    }
}
