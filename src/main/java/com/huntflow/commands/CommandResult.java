package com.huntflow.commands;

import com.huntflow.display.Display;
import com.huntflow.session.VariableBinding;

import java.util.Optional;

/**
 * What a handler returns: a binding for the output variable, a display, or neither
 */
public class CommandResult {

    private static final CommandResult EMPTY = new CommandResult(null, null);

    private final VariableBinding binding;
    private final Display display;

    private CommandResult(VariableBinding binding, Display display) {
        this.binding = binding;
        this.display = display;
    }

    public static CommandResult of(VariableBinding binding) {
        return new CommandResult(binding, null);
    }

    public static CommandResult display(Display display) {
        return new CommandResult(null, display);
    }

    public static CommandResult empty() {
        return EMPTY;
    }

    public Optional<VariableBinding> getBinding() {
        return Optional.ofNullable(binding);
    }

    public Optional<Display> getDisplay() {
        return Optional.ofNullable(display);
    }
}
