package com.ciro.remi.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Stack;
import java.util.function.Consumer;

/**
 * Ensamblador O(N). Convierte los Tokens del Lexer en un árbol de {@link RemiNode}.
 * Tolera HTML mal formado: un cierre sin apertura queda como texto y una
 * etiqueta sin cerrar se cierra sola al terminar su padre.
 */
public class RemiParser {

    public static List<RemiNode> parse(String html) {
        if (html == null || html.isEmpty()) return new ArrayList<>();
        return parse(html, 0, html.length(), new SourceLines(html));
    }

    /** Parsea {@code [start, end)} de {@code source}; las líneas salen de {@code lines}. */
    public static List<RemiNode> parse(String source, int start, int end, SourceLines lines) {
        return parseTokens(RemiLexer.lex(source, start, end), lines);
    }

    public static List<RemiNode> parseTokens(List<RemiLexer.Token> tokens, SourceLines lines) {
        List<RemiNode> rootNodes = new ArrayList<>();
        Stack<RemiNode> stack = new Stack<>();

        // Decide a quién pertenece el nuevo nodo (raíz, elemento o rama del ternario)
        Consumer<RemiNode> addNode = (node) -> {
            if (stack.isEmpty()) {
                rootNodes.add(node);
            } else {
                RemiNode parent = stack.peek();
                if (parent instanceof ElementNode el) {
                    el.children.add(node);
                } else if (parent instanceof ConditionalNode cond) {
                    if (cond.inElse) {
                        cond.falseBranch.add(node);
                    } else {
                        cond.trueBranch.add(node);
                    }
                }
            }
        };

        for (RemiLexer.Token t : tokens) {
            SourceSpan span = lines.spanOf(t.offset());
            switch (t.type()) {
                case TEXT -> addNode.accept(new TextNode(t.content(), span));

                case PLACEHOLDER -> addNode.accept(new PlaceholderNode(t.content(), span));

                case COND_OPEN -> {
                    ConditionalNode cond = new ConditionalNode(t.content(), span);
                    addNode.accept(cond);
                    stack.push(cond);
                }

                case COND_ELSE -> {
                    popUntilConditional(stack);
                    if (!stack.isEmpty()) ((ConditionalNode) stack.peek()).inElse = true;
                }

                case COND_CLOSE -> {
                    popUntilConditional(stack);
                    if (!stack.isEmpty()) stack.pop();
                }

                case TAG_OPEN -> {
                    ElementNode el = new ElementNode(t.name(), t.selfClosing(), RemiLexer.isHtml5Void(t.name()), span);
                    for (RemiLexer.RawAttribute raw : t.attributes()) {
                        el.attributes.add(toAttribute(raw, lines));
                    }
                    addNode.accept(el);
                    // <br>, <input/>... no reciben hijos
                    if (el.acceptsChildren()) {
                        stack.push(el);
                    }
                }

                case TAG_CLOSE -> {
                    // Buscar la apertura correspondiente sin salir del ternario actual
                    int popCount = -1;
                    for (int i = stack.size() - 1; i >= 0; i--) {
                        RemiNode node = stack.get(i);
                        if (node instanceof ConditionalNode) break;
                        if (node instanceof ElementNode el && el.tagName.equals(t.name())) {
                            popCount = stack.size() - i;
                            break;
                        }
                    }
                    if (popCount == -1) {
                        addNode.accept(new TextNode(t.content(), span));
                        continue;
                    }
                    for (int i = 0; i < popCount; i++) {
                        RemiNode popped = stack.pop();
                        if (i == popCount - 1) ((ElementNode) popped).closed = true;
                    }
                }
            }
        }

        return rootNodes;
    }

    private static void popUntilConditional(Stack<RemiNode> stack) {
        while (!stack.isEmpty() && !(stack.peek() instanceof ConditionalNode)) {
            stack.pop();
        }
    }

    private static RemiNode toAttribute(RemiLexer.RawAttribute raw, SourceLines lines) {
        SourceSpan span = lines.spanOf(raw.offset());

        if (raw.name().startsWith(EventBindingNode.PREFIX)) {
            String event = raw.name().substring(EventBindingNode.PREFIX.length());
            return new EventBindingNode(event, handlerText(raw), raw.quote(), span);
        }

        if (raw.value() == null) {
            return new AttributeNode(raw.name(), raw.quote(), null, span);
        }
        // el valor puede llevar ternarios: mismo ensamblado que el contenido
        return new AttributeNode(raw.name(), raw.quote(), parseTokens(raw.value(), lines), span);
    }

    // El handler se guarda tal cual; nunca se evalúa en compilación
    private static String handlerText(RemiLexer.RawAttribute raw) {
        if (raw.value() == null) return null;
        if (raw.quote() == '{') return raw.value().get(0).content();
        StringBuilder sb = new StringBuilder();
        for (RemiLexer.Token part : raw.value()) {
            switch (part.type()) {
                case PLACEHOLDER -> sb.append('{').append(part.content()).append('}');
                case COND_OPEN -> sb.append('(').append(part.content()).append('?');
                default -> sb.append(part.content());
            }
        }
        return sb.toString();
    }
}
