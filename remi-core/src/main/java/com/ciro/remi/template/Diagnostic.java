package com.ciro.remi.template;

/** Error de compilación de plantilla con su línea (1-based) en el fichero. */
public record Diagnostic(int lineNumber, String message) {

    public String format() {
        return "Line " + lineNumber + ": " + message;
    }
}
