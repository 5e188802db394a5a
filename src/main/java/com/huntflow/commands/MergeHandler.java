package com.huntflow.commands;

import com.huntflow.session.HuntSession;
import com.huntflow.statement.Command;
import com.huntflow.statement.MergeStatement;
import com.huntflow.store.ResultSetHandle;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code a + b (+ c)*}: union of variables of one entity type
 */
public class MergeHandler extends AbstractCommandHandler<MergeStatement> {

    public MergeHandler() {
        super(Command.MERGE, MergeStatement.class);
    }

    @Override
    protected CommandResult doHandle(MergeStatement statement, HuntSession session) {
        List<ResultSetHandle> handles = statement.getInputs().stream()
                .map(name -> session.getSymbolTable().require(name).getHandle())
                .collect(Collectors.toList());
        return bind(session.getStore().merge(handles), session);
    }
}
