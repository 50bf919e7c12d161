package com.ciro.remi.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Lexer O(N) para el bloque {@code <render>}.
 * Lee HTML, placeholders {@code {...}} y ternarios {@code (c ? a : b)} en una sola
 * pasada. Las llaves dentro de strings no cierran un placeholder y el '>' dentro de
 * comillas o llaves no cierra una etiqueta.
 *
 * <p>Todos los offsets son absolutos respecto al fichero completo, así cada nodo
 * sabe su línea exacta sin volver a buscar el texto.
 */
public class RemiLexer {

    public enum TokenType {
        TEXT,
        PLACEHOLDER,
        TAG_OPEN,
        TAG_CLOSE,
        COND_OPEN,
        COND_ELSE,
        COND_CLOSE
    }

    public record Token(TokenType type, String name, String content, boolean selfClosing, int offset,
                        List<RawAttribute> attributes) {
        static Token of(TokenType type, String content, int offset) {
            return new Token(type, "", content, false, offset, List.of());
        }
    }

    /** {@code value} es null para atributos booleanos; si no, tokens TEXT/PLACEHOLDER/COND_*. */
    public record RawAttribute(String name, int offset, char quote, List<Token> value) {}

    private record TernaryShape(int open, int question, int colon, int close) {}

    private final String src;
    private final int end;
    private final List<Token> tokens = new ArrayList<>();
    private final StringBuilder textBuffer = new StringBuilder();
    private int textStart = -1;
    private final Deque<TernaryShape> openTernaries = new ArrayDeque<>();

    private RemiLexer(String src, int end) {
        this.src = src;
        this.end = end;
    }

    public static List<Token> lex(String input) {
        if (input == null || input.isEmpty()) return new ArrayList<>();
        return lex(input, 0, input.length());
    }

    /** Lexea solo {@code [start, end)} de {@code source}, conservando offsets absolutos. */
    public static List<Token> lex(String source, int start, int end) {
        return new RemiLexer(source, end).run(start);
    }

    private List<Token> run(int start) {
        int i = start;

        while (i < end) {
            // ==============================================================
            // 1. Separadores del ternario abierto (posiciones ya calculadas)
            // ==============================================================
            TernaryShape top = openTernaries.peek();
            if (top != null && i == top.colon()) {
                flushText();
                tokens.add(Token.of(TokenType.COND_ELSE, ":", i));
                i++;
                continue;
            }
            if (top != null && i == top.close()) {
                flushText();
                tokens.add(Token.of(TokenType.COND_CLOSE, ")", i));
                openTernaries.pop();
                i++;
                continue;
            }

            char c = src.charAt(i);

            // ==============================================================
            // 2. Placeholder: { ... } (vacío "{}" es texto)
            // ==============================================================
            if (c == '{') {
                int j = skipBraces(i);
                if (j != -1 && j - i > 2) {
                    flushText();
                    tokens.add(Token.of(TokenType.PLACEHOLDER, src.substring(i + 1, j - 1), i));
                    i = j;
                    continue;
                }
            }

            // ==============================================================
            // 3. Etiquetas: < ... >
            // ==============================================================
            else if (c == '<' && isTagStart(i)) {
                int j = skipTag(i);
                if (j != -1) {
                    lexTag(i, j);
                    i = j;
                    continue;
                }
            }

            // ==============================================================
            // 4. Ternario: (cond ? a : b)
            // ==============================================================
            else if (c == '(') {
                TernaryShape shape = scanTernary(i, end);
                if (shape != null) {
                    flushText();
                    tokens.add(Token.of(TokenType.COND_OPEN, src.substring(i + 1, shape.question()), i));
                    openTernaries.push(shape);
                    i = shape.question() + 1;
                    continue;
                }
            }

            // ==============================================================
            // 5. Texto plano
            // ==============================================================
            appendText(c, i);
            i++;
        }

        flushText();
        return tokens;
    }

    private void lexTag(int start, int tagEnd) {
        char second = src.charAt(start + 1);

        // <!DOCTYPE>, <!-- -->, <?xml ?> se conservan como texto crudo
        if (second == '!' || second == '?') {
            for (int k = start; k < tagEnd; k++) appendText(src.charAt(k), k);
            return;
        }

        flushText();
        boolean isClose = second == '/';
        int j = isClose ? start + 2 : start + 1;
        int inner = tagEnd - 1; // posición del '>'

        int nameStart = j;
        while (j < inner && isTagNameChar(src.charAt(j))) j++;
        String tagName = src.substring(nameStart, j);

        if (isClose) {
            tokens.add(new Token(TokenType.TAG_CLOSE, tagName, src.substring(start, tagEnd), false, start, List.of()));
            return;
        }

        int attrsEnd = inner;
        while (attrsEnd > j && Character.isWhitespace(src.charAt(attrsEnd - 1))) attrsEnd--;
        boolean selfClosing = false;
        // Detectar si el usuario escribió explícitamente "/>"
        if (attrsEnd > j && src.charAt(attrsEnd - 1) == '/') {
            selfClosing = true;
            attrsEnd--;
        }

        List<RawAttribute> attrs = lexAttributes(j, attrsEnd);
        tokens.add(new Token(TokenType.TAG_OPEN, tagName, src.substring(j, attrsEnd).trim(), selfClosing, start, attrs));
    }

    private List<RawAttribute> lexAttributes(int from, int to) {
        List<RawAttribute> attrs = new ArrayList<>();
        int k = from;

        while (k < to) {
            char c = src.charAt(k);
            if (Character.isWhitespace(c) || c == '/') {
                k++;
                continue;
            }

            int nameStart = k;
            while (k < to && !Character.isWhitespace(src.charAt(k)) && src.charAt(k) != '=' && src.charAt(k) != '/') k++;
            if (k == nameStart) {
                k++; // '=' suelto u otra basura
                continue;
            }
            String name = src.substring(nameStart, k);

            int afterName = k;
            k = skipWhitespace(k, to);
            if (k >= to || src.charAt(k) != '=') {
                attrs.add(new RawAttribute(name, nameStart, (char) 0, null));
                k = afterName;
                continue;
            }

            k = skipWhitespace(k + 1, to);
            if (k >= to) {
                attrs.add(new RawAttribute(name, nameStart, (char) 0, List.of()));
                break;
            }

            char q = src.charAt(k);
            if (q == '"' || q == '\'') {
                int close = src.indexOf(q, k + 1);
                if (close == -1 || close > to) close = to;
                attrs.add(new RawAttribute(name, nameStart, q, interpolate(k + 1, close)));
                k = close + 1;
            } else if (q == '{' && skipBraces(k) != -1 && skipBraces(k) <= to && skipBraces(k) - k > 2) {
                int b = skipBraces(k);
                Token expr = Token.of(TokenType.PLACEHOLDER, src.substring(k + 1, b - 1), k);
                attrs.add(new RawAttribute(name, nameStart, '{', List.of(expr)));
                k = b;
            } else {
                int valueStart = k;
                while (k < to && !Character.isWhitespace(src.charAt(k))) k++;
                attrs.add(new RawAttribute(name, nameStart, (char) 0, interpolate(valueStart, k)));
            }
        }
        return attrs;
    }

    /**
     * Parte un valor de atributo en trozos TEXT, PLACEHOLDER y COND_*.
     * Los ternarios no salen de {@code [from, to)}.
     */
    private List<Token> interpolate(int from, int to) {
        List<Token> parts = new ArrayList<>();
        Deque<TernaryShape> open = new ArrayDeque<>();
        StringBuilder text = new StringBuilder();
        int textOffset = from;
        int k = from;

        while (k < to) {
            TernaryShape top = open.peek();
            if (top != null && (k == top.colon() || k == top.close())) {
                flushPart(parts, text, textOffset);
                if (k == top.colon()) {
                    parts.add(Token.of(TokenType.COND_ELSE, ":", k));
                } else {
                    parts.add(Token.of(TokenType.COND_CLOSE, ")", k));
                    open.pop();
                }
                k++;
                continue;
            }

            char c = src.charAt(k);
            if (c == '{') {
                int b = skipBraces(k);
                if (b != -1 && b <= to && b - k > 2) {
                    flushPart(parts, text, textOffset);
                    parts.add(Token.of(TokenType.PLACEHOLDER, src.substring(k + 1, b - 1), k));
                    k = b;
                    continue;
                }
            } else if (c == '(') {
                TernaryShape shape = scanTernary(k, to);
                if (shape != null) {
                    flushPart(parts, text, textOffset);
                    parts.add(Token.of(TokenType.COND_OPEN, src.substring(k + 1, shape.question()), k));
                    open.push(shape);
                    k = shape.question() + 1;
                    continue;
                }
            }
            if (text.isEmpty()) textOffset = k;
            text.append(c);
            k++;
        }
        flushPart(parts, text, textOffset);
        return parts;
    }

    private static void flushPart(List<Token> parts, StringBuilder text, int offset) {
        if (!text.isEmpty()) {
            parts.add(Token.of(TokenType.TEXT, text.toString(), offset));
            text.setLength(0);
        }
    }

    // ------------------------------------------------------------------
    // Escáneres compartidos (el lexer y scanTernary deben coincidir)
    // ------------------------------------------------------------------

    private boolean isTagStart(int i) {
        if (i + 1 >= end) return false;
        char next = src.charAt(i + 1);
        if (Character.isLetter(next) || next == '!' || next == '?') return true;
        return next == '/' && i + 2 < end && Character.isLetter(src.charAt(i + 2));
    }

    /** Índice justo después del '>' que cierra la etiqueta, o -1. */
    private int skipTag(int start) {
        char quote = 0;
        int j = start + 1;
        while (j < end) {
            char c = src.charAt(j);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '{') {
                int b = skipBraces(j);
                if (b != -1) {
                    j = b;
                    continue;
                }
            } else if (c == '>') {
                return j + 1;
            }
            j++;
        }
        return -1;
    }

    /** Índice justo después de la '}' que balancea la '{' en {@code start}, o -1. */
    private int skipBraces(int start) {
        int depth = 0;
        char quote = 0;
        int k = start;
        while (k < end) {
            char c = src.charAt(k);
            if (quote != 0) {
                // Proteger comillas escapadas
                if (c == '\\') {
                    k += 2;
                    continue;
                }
                if (c == quote) quote = 0;
            } else if (c == '"' || c == '\'' || c == '`') {
                quote = c;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) return k + 1;
            }
            k++;
        }
        return -1;
    }

    /**
     * Un '(' abre un ternario si le sigue una condición sin {@code (){}:} ni
     * etiquetas, un '?', un ':' de primer nivel y el ')' que lo cierra, todo antes
     * de {@code limit}. Comparaciones como {@code a > 0} o {@code n < 3} sí valen.
     */
    private TernaryShape scanTernary(int open, int limit) {
        int q = open + 1;
        while (q < limit) {
            char c = src.charAt(q);
            if (c == '?') break;
            if ("(){}:".indexOf(c) >= 0) return null;
            if (c == '<' && isTagStart(q)) return null;
            q++;
        }
        if (q >= limit || src.substring(open + 1, q).isBlank()) return null;
        // "??" y "?." no son el separador del ternario
        if (q + 1 < limit && (src.charAt(q + 1) == '?' || src.charAt(q + 1) == '.')) return null;

        int colon = findSeparator(q + 1, ':', limit);
        if (colon == -1) return null;
        int close = findSeparator(colon + 1, ')', limit);
        if (close == -1) return null;
        return new TernaryShape(open, q, colon, close);
    }

    private int findSeparator(int from, char target, int limit) {
        int depth = 0;
        int k = from;
        while (k < limit) {
            char c = src.charAt(k);
            if (c == '<' && isTagStart(k)) {
                int t = skipTag(k);
                if (t != -1 && t <= limit) {
                    k = t;
                    continue;
                }
            } else if (c == '{') {
                int b = skipBraces(k);
                if (b != -1 && b <= limit) {
                    k = b;
                    continue;
                }
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (depth == 0) return target == ')' ? k : -1;
                depth--;
            } else if (c == target && depth == 0) {
                return k;
            }
            k++;
        }
        return -1;
    }

    private int skipWhitespace(int k, int to) {
        while (k < to && Character.isWhitespace(src.charAt(k))) k++;
        return k;
    }

    private void appendText(char c, int offset) {
        if (textBuffer.isEmpty()) textStart = offset;
        textBuffer.append(c);
    }

    private void flushText() {
        if (!textBuffer.isEmpty()) {
            tokens.add(Token.of(TokenType.TEXT, textBuffer.toString(), textStart));
            textBuffer.setLength(0);
        }
    }

    private static boolean isTagNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '-' || c == ':' || c == '.' || c == '_';
    }

    static boolean isHtml5Void(String tag) {
        String t = tag.toLowerCase();
        return t.equals("br") || t.equals("hr") || t.equals("input") || t.equals("img") ||
               t.equals("link") || t.equals("meta") || t.equals("area") || t.equals("base") ||
               t.equals("col") || t.equals("embed") || t.equals("param") || t.equals("source") ||
               t.equals("track") || t.equals("wbr");
    }
}
