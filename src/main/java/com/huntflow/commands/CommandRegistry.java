package com.huntflow.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.huntflow.InternalInvariantException;
import com.huntflow.statement.Command;

import java.util.EnumMap;
import java.util.Map;

/**
 * Registry of command handlers by command tag
 */
public class CommandRegistry {

    private final Map<Command, CommandHandler> handlers = new EnumMap<>(Command.class);

    /**
     * Registry with a handler for every command, backed by the session's entity store
     *
     * @param objectMapper JSON mapper for LOAD and SAVE
     */
    public static CommandRegistry standard(ObjectMapper objectMapper) {
        CommandRegistry registry = new CommandRegistry();
        registry.register(new AssignHandler());
        registry.register(new GetHandler());
        registry.register(new FindHandler());
        registry.register(new JoinHandler());
        registry.register(new GroupHandler());
        registry.register(new SortHandler());
        registry.register(new DispHandler());
        registry.register(new ApplyHandler());
        registry.register(new LoadHandler(objectMapper));
        registry.register(new SaveHandler(objectMapper));
        registry.register(new NewHandler());
        registry.register(new MergeHandler());
        registry.register(new InfoHandler());
        return registry;
    }

    /**
     * Registers a handler, replacing any previous handler for the same command
     */
    public void register(CommandHandler handler) {
        handlers.put(handler.getCommand(), handler);
    }

    public CommandHandler getHandler(Command command) {
        CommandHandler handler = handlers.get(command);
        if (handler == null) {
            throw new InternalInvariantException("no handler registered for " + command);
        }
        return handler;
    }
}
