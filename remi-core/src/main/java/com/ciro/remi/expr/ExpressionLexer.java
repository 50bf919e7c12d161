package com.ciro.remi.expr;

import com.ciro.remi.error.ExpressionParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Lexer O(N) de un solo paso para la gramática literal.
 * Strings con comillas simples, dobles o backticks (sin {@code ${}}),
 * números decimales/hex, identificadores y puntuación.
 */
final class ExpressionLexer {

    enum TokenType {
        NUMBER,
        STRING,
        IDENT,
        PUNCT,
        EOF
    }

    record Token(TokenType type, String text, double number, int pos) {
        boolean is(String punct) {
            return type == TokenType.PUNCT && text.equals(punct);
        }
    }

    // Ordenados de mayor a menor longitud para que gane el operador más largo
    private static final String[] PUNCTUATORS = {
        "===", "!==", "**", "==", "!=", "<=", ">=", "&&", "||", "??",
        "+", "-", "*", "/", "%", "<", ">", "!", "?", ":", ",", ".",
        "(", ")", "[", "]", "{", "}"
    };

    private ExpressionLexer() {}

    static List<Token> lex(String src) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int len = src.length();

        while (i < len) {
            char c = src.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            if (Character.isDigit(c) || (c == '.' && i + 1 < len && Character.isDigit(src.charAt(i + 1)))) {
                i = lexNumber(src, i, tokens);
                continue;
            }

            if (c == '"' || c == '\'' || c == '`') {
                i = lexString(src, i, tokens);
                continue;
            }

            if (Character.isJavaIdentifierStart(c)) {
                int start = i;
                while (i < len && Character.isJavaIdentifierPart(src.charAt(i))) i++;
                tokens.add(new Token(TokenType.IDENT, src.substring(start, i), 0, start));
                continue;
            }

            String punct = matchPunctuator(src, i);
            if (punct == null) {
                throw new ExpressionParseException("Unexpected character '" + c + "'", i);
            }
            tokens.add(new Token(TokenType.PUNCT, punct, 0, i));
            i += punct.length();
        }

        tokens.add(new Token(TokenType.EOF, "", 0, len));
        return tokens;
    }

    private static int lexNumber(String src, int start, List<Token> tokens) {
        int len = src.length();
        int i = start;

        if (src.charAt(i) == '0' && i + 1 < len && "xXbBoO".indexOf(src.charAt(i + 1)) >= 0) {
            int radix = switch (Character.toLowerCase(src.charAt(i + 1))) {
                case 'x' -> 16;
                case 'b' -> 2;
                default -> 8;
            };
            i += 2;
            int digitsStart = i;
            while (i < len && Character.digit(src.charAt(i), radix) >= 0) i++;
            if (i == digitsStart) throw new ExpressionParseException("Invalid number literal", start);
            try {
                double value = Long.parseLong(src.substring(digitsStart, i), radix);
                tokens.add(new Token(TokenType.NUMBER, src.substring(start, i), value, start));
            } catch (NumberFormatException e) {
                throw new ExpressionParseException("Number literal out of range", start);
            }
            return checkNumberEnd(src, i, start);
        }

        while (i < len && Character.isDigit(src.charAt(i))) i++;
        if (i < len && src.charAt(i) == '.') {
            i++;
            while (i < len && Character.isDigit(src.charAt(i))) i++;
        }
        if (i < len && (src.charAt(i) == 'e' || src.charAt(i) == 'E')) {
            int mark = i;
            i++;
            if (i < len && (src.charAt(i) == '+' || src.charAt(i) == '-')) i++;
            if (i >= len || !Character.isDigit(src.charAt(i))) {
                throw new ExpressionParseException("Invalid exponent", mark);
            }
            while (i < len && Character.isDigit(src.charAt(i))) i++;
        }

        String text = src.substring(start, i);
        tokens.add(new Token(TokenType.NUMBER, text, Double.parseDouble(text), start));
        return checkNumberEnd(src, i, start);
    }

    // "3in" o "1.2.3" no son números válidos en JS
    private static int checkNumberEnd(String src, int i, int start) {
        if (i < src.length()) {
            char next = src.charAt(i);
            if (Character.isJavaIdentifierPart(next) || next == '.' && i + 1 < src.length() && Character.isDigit(src.charAt(i + 1))) {
                throw new ExpressionParseException("Invalid number literal", start);
            }
        }
        return i;
    }

    private static int lexString(String src, int start, List<Token> tokens) {
        char quote = src.charAt(start);
        StringBuilder sb = new StringBuilder();
        int len = src.length();
        int i = start + 1;

        while (i < len) {
            char c = src.charAt(i);
            if (c == quote) {
                tokens.add(new Token(TokenType.STRING, sb.toString(), 0, start));
                return i + 1;
            }
            if (c == '\\') {
                i = readEscape(src, i, sb);
                continue;
            }
            if (quote == '`' && c == '$' && i + 1 < len && src.charAt(i + 1) == '{') {
                throw new ExpressionParseException("Template interpolation is not a literal", i);
            }
            if (quote != '`' && (c == '\n' || c == '\r')) {
                throw new ExpressionParseException("Unterminated string literal", start);
            }
            sb.append(c);
            i++;
        }
        throw new ExpressionParseException("Unterminated string literal", start);
    }

    private static int readEscape(String src, int backslash, StringBuilder sb) {
        int i = backslash + 1;
        if (i >= src.length()) throw new ExpressionParseException("Unterminated escape", backslash);
        char e = src.charAt(i);
        switch (e) {
            case 'n' -> sb.append('\n');
            case 't' -> sb.append('\t');
            case 'r' -> sb.append('\r');
            case 'b' -> sb.append('\b');
            case 'f' -> sb.append('\f');
            case 'v' -> sb.append('\u000B');
            case '0' -> sb.append('\0');
            case 'x' -> {
                sb.append((char) parseHex(src, i + 1, 2, backslash));
                return i + 3;
            }
            case 'u' -> {
                sb.append((char) parseHex(src, i + 1, 4, backslash));
                return i + 5;
            }
            case '\n' -> { } // continuación de línea
            default -> sb.append(e);
        }
        return i + 1;
    }

    private static int parseHex(String src, int from, int digits, int escapePos) {
        if (from + digits > src.length()) throw new ExpressionParseException("Invalid escape", escapePos);
        try {
            return Integer.parseInt(src.substring(from, from + digits), 16);
        } catch (NumberFormatException ex) {
            throw new ExpressionParseException("Invalid escape", escapePos);
        }
    }

    private static String matchPunctuator(String src, int i) {
        for (String p : PUNCTUATORS) {
            if (src.startsWith(p, i)) return p;
        }
        return null;
    }
}
