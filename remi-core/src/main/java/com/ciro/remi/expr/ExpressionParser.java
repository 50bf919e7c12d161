package com.ciro.remi.expr;

import com.ciro.remi.error.ExpressionParseException;
import com.ciro.remi.expr.ExpressionLexer.Token;
import com.ciro.remi.expr.ExpressionLexer.TokenType;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parser descendente recursivo para la gramática literal.
 *
 * <pre>
 * expr        := conditional
 * conditional := nullish ( '?' expr ':' expr )?
 * nullish     := or ( '??' or )*
 * or          := and ( '||' and )*
 * and         := equality ( '&amp;&amp;' equality )*
 * equality    := relational ( ('===' | '!==' | '==' | '!=') relational )*
 * relational  := additive ( ('&lt;' | '&gt;' | '&lt;=' | '&gt;=') additive )*
 * additive    := term ( ('+' | '-') term )*
 * term        := power ( ('*' | '/' | '%') power )*
 * power       := unary ( '**' power )?
 * unary       := ('!' | '-' | '+' | 'typeof') unary | postfix
 * postfix     := primary ( '.' IDENT | '[' expr ']' )*
 * primary     := NUMBER | STRING | literal-keyword | IDENT | array | object | '(' expr ')'
 * </pre>
 *
 * La profundidad de anidamiento y el tamaño de la entrada están acotados,
 * así que el parseo siempre termina.
 */
final class ExpressionParser {

    static final int MAX_DEPTH = 64;
    static final int MAX_LENGTH = 10_000;

    private final List<Token> tokens;
    private int pos = 0;
    private int depth = 0;

    private ExpressionParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    static ExprNode parse(String src) {
        if (src == null || src.isBlank()) {
            throw new ExpressionParseException("Empty expression", 0);
        }
        if (src.length() > MAX_LENGTH) {
            throw new ExpressionParseException("Expression too long", MAX_LENGTH);
        }
        ExpressionParser p = new ExpressionParser(ExpressionLexer.lex(src));
        ExprNode node = p.expression();
        if (p.peek().type() != TokenType.EOF) {
            throw new ExpressionParseException("Unexpected token '" + p.peek().text() + "'", p.peek().pos());
        }
        return node;
    }

    private ExprNode expression() {
        enter();
        try {
            return conditional();
        } finally {
            depth--;
        }
    }

    private ExprNode conditional() {
        ExprNode test = nullish();
        if (accept("?")) {
            ExprNode whenTrue = expression();
            expect(":");
            ExprNode whenFalse = expression();
            return new ConditionalExpr(test, whenTrue, whenFalse);
        }
        return test;
    }

    private ExprNode nullish() {
        ExprNode left = or();
        while (accept("??")) left = new LogicalExpr("??", left, or());
        return left;
    }

    private ExprNode or() {
        ExprNode left = and();
        while (accept("||")) left = new LogicalExpr("||", left, and());
        return left;
    }

    private ExprNode and() {
        ExprNode left = equality();
        while (accept("&&")) left = new LogicalExpr("&&", left, equality());
        return left;
    }

    private ExprNode equality() {
        ExprNode left = relational();
        while (true) {
            String op = acceptAny("===", "!==", "==", "!=");
            if (op == null) return left;
            left = new BinaryExpr(op, left, relational());
        }
    }

    private ExprNode relational() {
        ExprNode left = additive();
        while (true) {
            String op = acceptAny("<=", ">=", "<", ">");
            if (op == null) return left;
            left = new BinaryExpr(op, left, additive());
        }
    }

    private ExprNode additive() {
        ExprNode left = term();
        while (true) {
            String op = acceptAny("+", "-");
            if (op == null) return left;
            left = new BinaryExpr(op, left, term());
        }
    }

    private ExprNode term() {
        ExprNode left = power();
        while (true) {
            String op = acceptAny("*", "/", "%");
            if (op == null) return left;
            left = new BinaryExpr(op, left, power());
        }
    }

    private ExprNode power() {
        ExprNode base = unary();
        if (accept("**")) {
            enter();
            try {
                return new BinaryExpr("**", base, power());
            } finally {
                depth--;
            }
        }
        return base;
    }

    private ExprNode unary() {
        Token t = peek();
        boolean isTypeof = t.type() == TokenType.IDENT && t.text().equals("typeof");
        if (t.is("!") || t.is("-") || t.is("+") || isTypeof) {
            pos++;
            enter();
            try {
                return new UnaryExpr(t.text(), unary());
            } finally {
                depth--;
            }
        }
        return postfix();
    }

    private ExprNode postfix() {
        ExprNode node = primary();
        while (true) {
            if (accept(".")) {
                Token name = next();
                if (name.type() != TokenType.IDENT) {
                    throw new ExpressionParseException("Expected property name", name.pos());
                }
                node = new MemberExpr(node, new LiteralExpr(JsValues.string(name.text())));
            } else if (accept("[")) {
                ExprNode index = expression();
                expect("]");
                node = new MemberExpr(node, index);
            } else {
                return node;
            }
        }
    }

    private ExprNode primary() {
        Token t = next();
        switch (t.type()) {
            case NUMBER:
                return new LiteralExpr(JsValues.number(t.number()));
            case STRING:
                return new LiteralExpr(JsValues.string(t.text()));
            case IDENT:
                return keywordOrIdentifier(t);
            case PUNCT:
                if (t.is("(")) {
                    ExprNode inner = expression();
                    expect(")");
                    return inner;
                }
                if (t.is("[")) return arrayLiteral();
                if (t.is("{")) return objectLiteral();
                break;
            default:
                break;
        }
        throw new ExpressionParseException("Unexpected token '" + t.text() + "'", t.pos());
    }

    private ExprNode keywordOrIdentifier(Token t) {
        return switch (t.text()) {
            case "true" -> new LiteralExpr(JsValues.bool(true));
            case "false" -> new LiteralExpr(JsValues.bool(false));
            case "null" -> new LiteralExpr(NullNode.getInstance());
            case "undefined" -> new LiteralExpr(JsValues.undefined());
            case "NaN" -> new LiteralExpr(JsValues.number(Double.NaN));
            case "Infinity" -> new LiteralExpr(JsValues.number(Double.POSITIVE_INFINITY));
            default -> new IdentifierExpr(t.text());
        };
    }

    private ExprNode arrayLiteral() {
        enter();
        try {
            List<ExprNode> elements = new ArrayList<>();
            while (!accept("]")) {
                elements.add(expression());
                if (!accept(",")) {
                    expect("]");
                    break;
                }
            }
            return new ArrayExpr(elements);
        } finally {
            depth--;
        }
    }

    private ExprNode objectLiteral() {
        enter();
        try {
            List<Map.Entry<String, ExprNode>> entries = new ArrayList<>();
            while (!accept("}")) {
                Token key = next();
                String name = switch (key.type()) {
                    case IDENT, STRING -> key.text();
                    case NUMBER -> JsValues.formatNumber(key.number());
                    default -> throw new ExpressionParseException("Expected property key", key.pos());
                };
                if (key.type() == TokenType.IDENT && !peek().is(":")) {
                    // shorthand {a} -> necesita la variable a
                    entries.add(new AbstractMap.SimpleImmutableEntry<>(name, new IdentifierExpr(name)));
                } else {
                    expect(":");
                    entries.add(new AbstractMap.SimpleImmutableEntry<>(name, expression()));
                }
                if (!accept(",")) {
                    expect("}");
                    break;
                }
            }
            return new ObjectExpr(entries);
        } finally {
            depth--;
        }
    }

    // ------------------------------------------------------------------

    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw new ExpressionParseException("Expression nested too deeply", peek().pos());
        }
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.type() != TokenType.EOF) pos++;
        return t;
    }

    private boolean accept(String punct) {
        if (peek().is(punct)) {
            pos++;
            return true;
        }
        return false;
    }

    private String acceptAny(String... puncts) {
        for (String p : puncts) {
            if (accept(p)) return p;
        }
        return null;
    }

    private void expect(String punct) {
        Token t = peek();
        if (!accept(punct)) {
            throw new ExpressionParseException("Expected '" + punct + "' but found '" + t.text() + "'", t.pos());
        }
    }
}
