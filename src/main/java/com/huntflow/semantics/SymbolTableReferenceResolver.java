package com.huntflow.semantics;

import com.huntflow.pattern.Reference;
import com.huntflow.pattern.ReferenceResolver;
import com.huntflow.session.SymbolTable;
import com.huntflow.statement.TimeRange;

import java.util.List;
import java.util.Optional;

/**
 * Dereferences {@code variable.attribute} through the session's bindings
 */
public class SymbolTableReferenceResolver implements ReferenceResolver {

    private final SymbolTable symbolTable;

    public SymbolTableReferenceResolver(SymbolTable symbolTable) {
        this.symbolTable = symbolTable;
    }

    @Override
    public List<Object> values(Reference reference) {
        return symbolTable.require(reference.getVariable()).getValues(reference.getAttribute());
    }

    @Override
    public Optional<TimeRange> timeBounds(String variable) {
        return symbolTable.require(variable).getTimeBounds();
    }
}
