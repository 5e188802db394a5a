package com.huntflow.commands;

import com.huntflow.session.HuntSession;
import com.huntflow.statement.Command;
import com.huntflow.statement.Statement;

/**
 * Executes one kind of resolved statement against a session
 */
public interface CommandHandler {

    Command getCommand();

    CommandResult handle(Statement statement, HuntSession session);
}
