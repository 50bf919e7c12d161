package com.ciro.remi.template;

import com.ciro.remi.expr.Bindings;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Nombre → variable. La última declaración de un nombre pisa a las anteriores. */
public class SymbolTable implements Bindings {

    private static final Logger log = LoggerFactory.getLogger(SymbolTable.class);

    private final Map<String, Variable> variables = new LinkedHashMap<>();

    public void declare(Variable variable) {
        Variable previous = variables.put(variable.getName(), variable);
        if (previous != null) {
            log.debug("Variable '{}' redeclared at line {} (previous at line {})",
                    variable.getName(), variable.getLine(), previous.getLine());
        }
    }

    public Optional<Variable> get(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public boolean contains(String name) {
        return variables.containsKey(name);
    }

    public Collection<Variable> variables() {
        return Collections.unmodifiableCollection(variables.values());
    }

    public int size() {
        return variables.size();
    }

    @Override
    public Optional<JsonNode> lookup(String name) {
        Variable v = variables.get(name);
        if (v == null || !v.isInitialized()) return Optional.empty();
        return Optional.of(v.getValue());
    }
}
