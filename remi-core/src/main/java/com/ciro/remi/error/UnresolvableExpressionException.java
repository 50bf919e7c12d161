package com.ciro.remi.error;

/**
 * Ni la evaluación literal ni la búsqueda en la tabla de símbolos dieron un valor.
 * Los llamadores lo tratan como "no resoluble en compilación", nunca como error fatal.
 */
public class UnresolvableExpressionException extends RemiException {

    private final String expression;

    public UnresolvableExpressionException(String expression, Throwable cause) {
        super("Cannot evaluate expression: " + expression, cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
