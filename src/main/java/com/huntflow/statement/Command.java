package com.huntflow.statement;

/**
 * Command tag carried by every statement
 */
public enum Command {
    ASSIGN(true),
    GET(true),
    FIND(true),
    JOIN(true),
    GROUP(true),
    SORT(true),
    LOAD(true),
    NEW(true),
    MERGE(true),
    DISP(false),
    INFO(false),
    SAVE(false),
    APPLY(false);

    private final boolean producesOutput;

    Command(boolean producesOutput) {
        this.producesOutput = producesOutput;
    }

    /**
     * Whether the command binds a result to an output variable
     */
    public boolean producesOutput() {
        return producesOutput;
    }

    public String keyword() {
        return name().toLowerCase();
    }
}
