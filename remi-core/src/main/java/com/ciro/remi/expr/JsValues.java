package com.ciro.remi.expr;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.math.BigDecimal;
import java.util.Iterator;

/**
 * Reglas de coerción estilo JavaScript sobre valores {@link JsonNode}.
 *
 * <ul>
 * <li>{@code MissingNode} representa {@code undefined}</li>
 * <li>{@code NullNode} representa {@code null}</li>
 * <li>Todos los números son {@code DoubleNode}</li>
 * </ul>
 *
 * <p>
 * Thread-safe, sin estado.
 */
public final class JsValues {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsValues() {}

    public static JsonNode undefined() {
        return MissingNode.getInstance();
    }

    public static JsonNode number(double d) {
        return NODES.numberNode(d);
    }

    public static JsonNode string(String s) {
        return NODES.textNode(s);
    }

    public static JsonNode bool(boolean b) {
        return NODES.booleanNode(b);
    }

    public static boolean isUndefined(JsonNode v) {
        return v == null || v.isMissingNode();
    }

    public static boolean isNullish(JsonNode v) {
        return isUndefined(v) || v.isNull();
    }

    public static boolean isTruthy(JsonNode v) {
        if (isNullish(v)) return false;
        if (v.isBoolean()) return v.booleanValue();
        if (v.isNumber()) {
            double d = v.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (v.isTextual()) return !v.textValue().isEmpty();
        // arrays y objetos siempre son truthy
        return true;
    }

    public static String typeOf(JsonNode v) {
        if (isUndefined(v)) return "undefined";
        if (v.isBoolean()) return "boolean";
        if (v.isNumber()) return "number";
        if (v.isTextual()) return "string";
        return "object";
    }

    /** Equivalente a {@code String(v)}. */
    public static String toDisplayString(JsonNode v) {
        if (isUndefined(v)) return "undefined";
        if (v.isNull()) return "null";
        if (v.isBoolean()) return v.booleanValue() ? "true" : "false";
        if (v.isNumber()) return formatNumber(v.doubleValue());
        if (v.isTextual()) return v.textValue();
        if (v.isArray()) {
            StringBuilder sb = new StringBuilder();
            Iterator<JsonNode> it = v.elements();
            boolean first = true;
            while (it.hasNext()) {
                JsonNode el = it.next();
                if (!first) sb.append(',');
                first = false;
                if (!isNullish(el)) sb.append(toDisplayString(el));
            }
            return sb.toString();
        }
        return "[object Object]";
    }

    /** Equivalente a {@code Number(v)}. */
    public static double toNumber(JsonNode v) {
        if (isUndefined(v)) return Double.NaN;
        if (v.isNull()) return 0;
        if (v.isBoolean()) return v.booleanValue() ? 1 : 0;
        if (v.isNumber()) return v.doubleValue();
        if (v.isTextual()) return parseNumber(v.textValue());
        if (v.isArray()) return parseNumber(toDisplayString(v));
        return Double.NaN;
    }

    /** Arrays y objetos se convierten a string; el resto queda igual. */
    public static JsonNode toPrimitive(JsonNode v) {
        if (v != null && v.isContainerNode()) return string(toDisplayString(v));
        return v;
    }

    public static boolean strictEquals(JsonNode a, JsonNode b) {
        if (isUndefined(a) || isUndefined(b)) return isUndefined(a) && isUndefined(b);
        if (a.isNull() || b.isNull()) return a.isNull() && b.isNull();
        if (a.isNumber() && b.isNumber()) return a.doubleValue() == b.doubleValue();
        if (a.isTextual() && b.isTextual()) return a.textValue().equals(b.textValue());
        if (a.isBoolean() && b.isBoolean()) return a.booleanValue() == b.booleanValue();
        // contenedores: identidad, como en JS
        return a == b;
    }

    public static boolean looseEquals(JsonNode a, JsonNode b) {
        if (isNullish(a) || isNullish(b)) return isNullish(a) && isNullish(b);
        if (sameType(a, b)) return strictEquals(a, b);
        JsonNode pa = toPrimitive(a);
        JsonNode pb = toPrimitive(b);
        if (pa.isTextual() && pb.isTextual()) return pa.textValue().equals(pb.textValue());
        return toNumber(pa) == toNumber(pb);
    }

    /**
     * Formatea un double como lo hace {@code Number.prototype.toString()}:
     * enteros sin decimales, notación exponencial fuera de [1e-6, 1e21).
     */
    public static String formatNumber(double d) {
        if (Double.isNaN(d)) return "NaN";
        if (Double.isInfinite(d)) return d > 0 ? "Infinity" : "-Infinity";
        if (d == 0) return "0";

        double abs = Math.abs(d);
        String sign = d < 0 ? "-" : "";
        BigDecimal bd = BigDecimal.valueOf(abs).stripTrailingZeros();

        if (abs >= 1e-6 && abs < 1e21) {
            return sign + bd.toPlainString();
        }

        String digits = bd.unscaledValue().toString();
        int exponent = digits.length() - 1 - bd.scale();
        StringBuilder sb = new StringBuilder(sign).append(digits.charAt(0));
        if (digits.length() > 1) sb.append('.').append(digits, 1, digits.length());
        sb.append('e').append(exponent >= 0 ? '+' : '-').append(Math.abs(exponent));
        return sb.toString();
    }

    static double parseNumber(String raw) {
        String s = raw.trim();
        if (s.isEmpty()) return 0;
        if (s.equals("Infinity") || s.equals("+Infinity")) return Double.POSITIVE_INFINITY;
        if (s.equals("-Infinity")) return Double.NEGATIVE_INFINITY;
        String lower = s.toLowerCase();
        try {
            if (lower.startsWith("0x")) return Long.parseLong(s.substring(2), 16);
            if (lower.startsWith("0b")) return Long.parseLong(s.substring(2), 2);
            if (lower.startsWith("0o")) return Long.parseLong(s.substring(2), 8);
            // Double.parseDouble acepta sufijos como "1d" o "1f" que JS rechaza
            if (!s.matches("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?")) return Double.NaN;
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    private static boolean sameType(JsonNode a, JsonNode b) {
        return typeOf(a).equals(typeOf(b)) && a.isContainerNode() == b.isContainerNode();
    }
}
