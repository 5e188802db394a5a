package com.huntflow.commands;

import com.huntflow.display.Display;
import com.huntflow.session.HuntSession;
import com.huntflow.statement.ApplyStatement;
import com.huntflow.statement.Command;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Hands the input variables and dereferenced arguments to the analytics behind the URI
 */
public class ApplyHandler extends AbstractCommandHandler<ApplyStatement> {

    private static final Logger log = LoggerFactory.getLogger(ApplyHandler.class);

    public ApplyHandler() {
        super(Command.APPLY, ApplyStatement.class);
    }

    @Override
    protected CommandResult doHandle(ApplyStatement statement, HuntSession session) {
        log.debug("Applying {} on {} with {}", statement.getAnalyticsUri(), statement.getInputs(),
                statement.getArguments());
        Optional<Display> display = session.getAnalytics().execute(statement.getAnalyticsUri(),
                statement.getInputs(), statement.getArguments(), session);
        return display.map(CommandResult::display).orElseGet(CommandResult::empty);
    }
}
