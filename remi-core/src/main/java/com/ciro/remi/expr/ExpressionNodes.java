package com.ciro.remi.expr;

import com.ciro.remi.error.ExpressionEvalException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;

// 1. Literal ya evaluado: número, string, booleano, null, undefined
record LiteralExpr(JsonNode value) implements ExprNode {
    @Override public JsonNode eval() { return value; }
}

// 2. Identificador libre -> en JS sería un ReferenceError
record IdentifierExpr(String name) implements ExprNode {
    @Override public JsonNode eval() {
        throw new ExpressionEvalException(name + " is not defined");
    }
}

// 3. [a, b, c]
record ArrayExpr(List<ExprNode> elements) implements ExprNode {
    @Override public JsonNode eval() {
        ArrayNode arr = JsonNodeFactory.instance.arrayNode();
        for (ExprNode e : elements) arr.add(e.eval());
        return arr;
    }
}

// 4. { clave: valor } (la última clave repetida gana)
record ObjectExpr(List<Map.Entry<String, ExprNode>> entries) implements ExprNode {
    @Override public JsonNode eval() {
        ObjectNode obj = JsonNodeFactory.instance.objectNode();
        for (Map.Entry<String, ExprNode> e : entries) obj.set(e.getKey(), e.getValue().eval());
        return obj;
    }
}

// 5. Operadores unarios: ! - + typeof
record UnaryExpr(String op, ExprNode operand) implements ExprNode {
    @Override public JsonNode eval() {
        // typeof sobre un nombre no declarado no falla
        if (op.equals("typeof") && operand instanceof IdentifierExpr) {
            return JsValues.string("undefined");
        }
        JsonNode v = operand.eval();
        return switch (op) {
            case "!" -> JsValues.bool(!JsValues.isTruthy(v));
            case "-" -> JsValues.number(-JsValues.toNumber(v));
            case "+" -> JsValues.number(JsValues.toNumber(v));
            case "typeof" -> JsValues.string(JsValues.typeOf(v));
            default -> throw new ExpressionEvalException("Unknown unary operator " + op);
        };
    }
}

// 6. Operadores binarios aritméticos, relacionales y de igualdad
record BinaryExpr(String op, ExprNode left, ExprNode right) implements ExprNode {
    @Override public JsonNode eval() {
        JsonNode l = left.eval();
        JsonNode r = right.eval();
        return switch (op) {
            case "+" -> add(l, r);
            case "-" -> JsValues.number(JsValues.toNumber(l) - JsValues.toNumber(r));
            case "*" -> JsValues.number(JsValues.toNumber(l) * JsValues.toNumber(r));
            case "/" -> JsValues.number(JsValues.toNumber(l) / JsValues.toNumber(r));
            case "%" -> JsValues.number(JsValues.toNumber(l) % JsValues.toNumber(r));
            case "**" -> JsValues.number(Math.pow(JsValues.toNumber(l), JsValues.toNumber(r)));
            case "===" -> JsValues.bool(JsValues.strictEquals(l, r));
            case "!==" -> JsValues.bool(!JsValues.strictEquals(l, r));
            case "==" -> JsValues.bool(JsValues.looseEquals(l, r));
            case "!=" -> JsValues.bool(!JsValues.looseEquals(l, r));
            case "<", ">", "<=", ">=" -> JsValues.bool(compare(l, r));
            default -> throw new ExpressionEvalException("Unknown operator " + op);
        };
    }

    private static JsonNode add(JsonNode l, JsonNode r) {
        JsonNode pl = JsValues.toPrimitive(l);
        JsonNode pr = JsValues.toPrimitive(r);
        if ((pl != null && pl.isTextual()) || (pr != null && pr.isTextual())) {
            return JsValues.string(JsValues.toDisplayString(pl) + JsValues.toDisplayString(pr));
        }
        return JsValues.number(JsValues.toNumber(pl) + JsValues.toNumber(pr));
    }

    private boolean compare(JsonNode l, JsonNode r) {
        JsonNode pl = JsValues.toPrimitive(l);
        JsonNode pr = JsValues.toPrimitive(r);
        if (pl != null && pr != null && pl.isTextual() && pr.isTextual()) {
            int c = pl.textValue().compareTo(pr.textValue());
            return switch (op) {
                case "<" -> c < 0;
                case ">" -> c > 0;
                case "<=" -> c <= 0;
                default -> c >= 0;
            };
        }
        double a = JsValues.toNumber(pl);
        double b = JsValues.toNumber(pr);
        // cualquier comparación con NaN es false
        return switch (op) {
            case "<" -> a < b;
            case ">" -> a > b;
            case "<=" -> a <= b;
            default -> a >= b;
        };
    }
}

// 7. && || ?? con cortocircuito (el lado derecho no se evalúa si no hace falta)
record LogicalExpr(String op, ExprNode left, ExprNode right) implements ExprNode {
    @Override public JsonNode eval() {
        JsonNode l = left.eval();
        return switch (op) {
            case "&&" -> JsValues.isTruthy(l) ? right.eval() : l;
            case "||" -> JsValues.isTruthy(l) ? l : right.eval();
            default -> JsValues.isNullish(l) ? right.eval() : l;
        };
    }
}

// 8. cond ? a : b
record ConditionalExpr(ExprNode test, ExprNode whenTrue, ExprNode whenFalse) implements ExprNode {
    @Override public JsonNode eval() {
        return JsValues.isTruthy(test.eval()) ? whenTrue.eval() : whenFalse.eval();
    }
}

// 9. obj.prop / obj[expr] sobre valores literales
record MemberExpr(ExprNode target, ExprNode property) implements ExprNode {
    @Override public JsonNode eval() {
        JsonNode t = target.eval();
        if (JsValues.isNullish(t)) {
            throw new ExpressionEvalException("Cannot read properties of " + JsValues.toDisplayString(t));
        }
        String key = JsValues.toDisplayString(JsValues.toPrimitive(property.eval()));

        if (t.isTextual()) {
            String s = t.textValue();
            if (key.equals("length")) return JsValues.number(s.length());
            int idx = index(key);
            return idx >= 0 && idx < s.length() ? JsValues.string(String.valueOf(s.charAt(idx))) : JsValues.undefined();
        }
        if (t.isArray()) {
            if (key.equals("length")) return JsValues.number(t.size());
            int idx = index(key);
            return idx >= 0 && idx < t.size() ? t.get(idx) : JsValues.undefined();
        }
        if (t.isObject()) {
            JsonNode v = t.get(key);
            return v == null ? JsValues.undefined() : v;
        }
        return JsValues.undefined();
    }

    private static int index(String key) {
        if (!key.matches("0|[1-9]\\d{0,8}")) return -1;
        return Integer.parseInt(key);
    }
}
