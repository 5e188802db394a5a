package com.huntflow.session;

import com.huntflow.semantics.UndefinedVariableException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Variable name to binding, in order of first definition
 */
public class SymbolTable {

    private final Map<String, VariableBinding> bindings = new LinkedHashMap<>();
    private final String defaultVariable;

    public SymbolTable(String defaultVariable) {
        this.defaultVariable = defaultVariable;
    }

    public boolean contains(String name) {
        return bindings.containsKey(name);
    }

    /**
     * @throws UndefinedVariableException if the name is not bound
     */
    public VariableBinding require(String name) {
        VariableBinding binding = bindings.get(name);
        if (binding == null) {
            throw new UndefinedVariableException(name);
        }
        return binding;
    }

    /**
     * Bind {@code name} and point the default variable at the same binding
     */
    public void bind(String name, VariableBinding binding) {
        bindings.put(name, binding);
        bindings.put(defaultVariable, binding);
    }

    public List<String> names() {
        return new ArrayList<>(bindings.keySet());
    }

    public String getDefaultVariable() {
        return defaultVariable;
    }
}
