package com.huntflow.commands;

import com.huntflow.display.VariableInfoDisplay;
import com.huntflow.session.HuntSession;
import com.huntflow.session.VariableBinding;
import com.huntflow.statement.Command;
import com.huntflow.statement.InfoStatement;

public class InfoHandler extends AbstractCommandHandler<InfoStatement> {

    public InfoHandler() {
        super(Command.INFO, InfoStatement.class);
    }

    @Override
    protected CommandResult doHandle(InfoStatement statement, HuntSession session) {
        VariableBinding binding = session.getSymbolTable().require(statement.getInput());
        return CommandResult.display(new VariableInfoDisplay(
                statement.getInput(),
                binding.getEntityType(),
                binding.getCount(),
                binding.getTimeBounds().orElse(null),
                session.getStore().attributes(binding.getEntityType())));
    }
}
