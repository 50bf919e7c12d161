package com.ciro.remi.template;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Entrada de la tabla de símbolos. Si no está inicializada su valor no existe:
 * {@link #getValue()} falla en vez de devolver algo inventado.
 */
public class Variable {

    private final String name;
    private final VariableAnnotation annotation;
    private final DeclarationKind declarationKind;
    private final int line;
    private final JsonNode value;

    private Variable(String name, VariableAnnotation annotation, DeclarationKind declarationKind, int line, JsonNode value) {
        this.name = name;
        this.annotation = annotation;
        this.declarationKind = declarationKind;
        this.line = line;
        this.value = value;
    }

    public static Variable uninitialized(String name, VariableAnnotation annotation, DeclarationKind kind, int line) {
        return new Variable(name, annotation, kind, line, null);
    }

    public static Variable initialized(String name, VariableAnnotation annotation, DeclarationKind kind, int line, JsonNode value) {
        if (value == null || value.isMissingNode()) {
            throw new IllegalArgumentException("Variable '" + name + "' cannot be initialized to undefined");
        }
        return new Variable(name, annotation, kind, line, value);
    }

    public String getName() {
        return name;
    }

    public VariableAnnotation getAnnotation() {
        return annotation;
    }

    public DeclarationKind getDeclarationKind() {
        return declarationKind;
    }

    public int getLine() {
        return line;
    }

    public boolean isInitialized() {
        return value != null;
    }

    public JsonNode getValue() {
        if (value == null) {
            throw new IllegalStateException("Variable '" + name + "' has no compile-time value");
        }
        return value;
    }

    @Override
    public String toString() {
        return "@" + annotation.keyword() + " " + name + (isInitialized() ? " = " + value : "");
    }
}
