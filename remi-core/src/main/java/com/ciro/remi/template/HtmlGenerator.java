package com.ciro.remi.template;

import com.ciro.remi.ast.AttributeNode;
import com.ciro.remi.ast.ConditionalNode;
import com.ciro.remi.ast.ElementNode;
import com.ciro.remi.ast.PlaceholderNode;
import com.ciro.remi.ast.RemiNode;
import com.ciro.remi.ast.TextNode;
import com.ciro.remi.error.UnresolvableExpressionException;
import com.ciro.remi.expr.JsValues;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Renderiza el árbol ya validado a HTML estático: sin {@code on:evento},
 * ternarios plegados (política permisiva) y placeholders sustituidos.
 * Los valores se insertan tal cual, sin escapar.
 */
public final class HtmlGenerator {

    // Segunda pasada: cualquier on:x=valor que haya quedado en el texto
    private static final Pattern EVENT_ATTR = Pattern.compile(
            "\\s+on:[a-z0-9_-]+\\s*=\\s*(\"[^\"]*\"|'[^']*'|[^>\\s]*)", Pattern.CASE_INSENSITIVE);

    private HtmlGenerator() {}

    public static String generate(List<RemiNode> nodes, CompileState state) {
        StringBuilder sb = new StringBuilder();
        renderNodes(nodes, sb, state);
        String html = EVENT_ATTR.matcher(sb).replaceAll("");
        return HtmlFormatter.format("<div>" + html + "</div>");
    }

    static void renderNodes(List<RemiNode> nodes, StringBuilder sb, CompileState state) {
        for (RemiNode n : nodes) renderNode(n, sb, state);
    }

    private static void renderNode(RemiNode n, StringBuilder sb, CompileState state) {
        if (n instanceof TextNode t) {
            sb.append(t.text);
        } else if (n instanceof PlaceholderNode p) {
            sb.append(substitute(p, state));
        } else if (n instanceof ConditionalNode cond) {
            renderNodes(ConditionalFolder.branchToRender(cond, state), sb, state);
        } else if (n instanceof ElementNode el) {
            renderElement(el, sb, state);
        } else {
            n.renderRaw(sb);
        }
    }

    private static void renderElement(ElementNode el, StringBuilder sb, CompileState state) {
        sb.append('<').append(el.tagName);

        for (RemiNode attr : el.attributes) {
            // EventBindingNode no llega al HTML
            if (!(attr instanceof AttributeNode a)) continue;
            sb.append(' ').append(a.name);
            if (a.isBoolean()) continue;
            sb.append('=');
            boolean quoted = a.quote == '"' || a.quote == '\'';
            if (quoted) sb.append(a.quote);
            renderNodes(a.value, sb, state);
            if (quoted) sb.append(a.quote);
        }

        if (el.isSelfClosing) {
            sb.append("/>");
            return;
        }

        sb.append('>');
        renderNodes(el.children, sb, state);
        if (el.closed) sb.append("</").append(el.tagName).append('>');
    }

    static String substitute(PlaceholderNode p, CompileState state) {
        if (p.isDeferred()) {
            Optional<Variable> deferred = state.symbols().get(p.deferredName());
            if (deferred.isPresent() && deferred.get().isInitialized()) {
                // valor conocido: se usa aunque sea falsy
                return JsValues.toDisplayString(deferred.get().getValue());
            }
            return truthyOrEmpty(p.fallbackExpression(), state);
        }
        return truthyOrEmpty(p.expression, state);
    }

    private static String truthyOrEmpty(String expression, CompileState state) {
        try {
            JsonNode value = state.resolve(expression);
            return JsValues.isTruthy(value) ? JsValues.toDisplayString(value) : "";
        } catch (UnresolvableExpressionException e) {
            return "";
        }
    }
}
