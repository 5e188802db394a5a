package com.huntflow.commands;

import com.huntflow.display.DisplayRows;
import com.huntflow.session.HuntSession;
import com.huntflow.statement.Command;
import com.huntflow.statement.DispStatement;
import com.huntflow.store.ResultSetHandle;

/**
 * Renders the selected rows of a variable as a table
 */
public class DispHandler extends AbstractProjectionHandler<DispStatement> {

    public DispHandler() {
        super(Command.DISP, DispStatement.class);
    }

    @Override
    protected CommandResult doHandle(DispStatement statement, HuntSession session) {
        ResultSetHandle handle = select(statement, session);
        return CommandResult.display(new DisplayRows(session.getStore().rows(handle, statement.getAttributes())));
    }
}
