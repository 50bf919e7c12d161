package com.ciro.remi.error;

/**
 * La expresión no pertenece a la gramática literal (sintaxis inválida,
 * demasiado larga o demasiado anidada).
 */
public class ExpressionParseException extends RemiException {

    private final int position;

    public ExpressionParseException(String message, int position) {
        super(message + " (at " + position + ")");
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
