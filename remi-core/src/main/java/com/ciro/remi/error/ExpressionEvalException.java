package com.ciro.remi.error;

/**
 * Fallo al evaluar una expresión literal bien formada: identificador libre,
 * acceso a propiedad sobre null/undefined, etc.
 */
public class ExpressionEvalException extends RemiException {

    public ExpressionEvalException(String message) {
        super(message);
    }
}
