package com.huntflow.commands;

import com.huntflow.InternalInvariantException;
import com.huntflow.session.HuntSession;
import com.huntflow.session.VariableBinding;
import com.huntflow.statement.Command;
import com.huntflow.statement.Statement;
import com.huntflow.store.ResultSetHandle;

/**
 * Base handler that checks the statement variant before dispatching to {@link #doHandle}
 *
 * @param <S> statement variant this handler executes
 */
public abstract class AbstractCommandHandler<S extends Statement> implements CommandHandler {

    private final Command command;
    private final Class<S> statementType;

    protected AbstractCommandHandler(Command command, Class<S> statementType) {
        this.command = command;
        this.statementType = statementType;
    }

    @Override
    public Command getCommand() {
        return command;
    }

    @Override
    public CommandResult handle(Statement statement, HuntSession session) {
        if (!statementType.isInstance(statement)) {
            throw new InternalInvariantException(
                    command + " handler cannot execute " + statement.getClass().getSimpleName());
        }
        return doHandle(statementType.cast(statement), session);
    }

    protected abstract CommandResult doHandle(S statement, HuntSession session);

    protected static CommandResult bind(ResultSetHandle handle, HuntSession session) {
        return CommandResult.of(new VariableBinding(handle, session.getStore()));
    }
}
