package com.ciro.remi.expr;

import com.ciro.remi.error.RemiException;
import com.ciro.remi.error.UnresolvableExpressionException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Evalúa expresiones de plantilla en tiempo de compilación.
 *
 * <ol>
 * <li>Primero como expresión literal autocontenida (sin estado externo).</li>
 * <li>Si falla, como nombre exacto de una variable ya inicializada.</li>
 * </ol>
 *
 * Nunca ejecuta código arbitrario: la gramática literal es cerrada y acotada.
 */
public final class ExpressionEvaluator {

    private ExpressionEvaluator() {}

    /**
     * Evalúa solo la parte literal, sin tabla de símbolos.
     *
     * @throws com.ciro.remi.error.ExpressionParseException si no es una expresión válida
     * @throws com.ciro.remi.error.ExpressionEvalException si referencia nombres libres
     */
    public static JsonNode evaluateLiteral(String expression) {
        return ExpressionParser.parse(expression).eval();
    }

    /**
     * Literal primero; si falla, búsqueda exacta del nombre.
     * Puede devolver {@code undefined} (MissingNode) si el literal lo produce.
     *
     * @throws UnresolvableExpressionException si ninguna de las dos vías resuelve
     */
    public static JsonNode evaluate(String expression, Bindings bindings) {
        try {
            return evaluateLiteral(expression);
        } catch (RemiException literalFailure) {
            String name = expression == null ? "" : expression.trim();
            return bindings.lookup(name)
                    .orElseThrow(() -> new UnresolvableExpressionException(expression, literalFailure));
        }
    }

    /** Resoluble = evalúa sin error y el resultado no es {@code undefined}. */
    public static boolean isResolvable(String expression, Bindings bindings) {
        try {
            return !JsValues.isUndefined(evaluate(expression, bindings));
        } catch (UnresolvableExpressionException e) {
            return false;
        }
    }
}
