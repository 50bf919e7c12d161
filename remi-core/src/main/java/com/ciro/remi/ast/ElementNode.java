package com.ciro.remi.ast;

import java.util.ArrayList;
import java.util.List;

public class ElementNode implements RemiNode {
    public final String tagName;
    public final List<RemiNode> attributes = new ArrayList<>(); // AttributeNode | EventBindingNode
    public final List<RemiNode> children = new ArrayList<>();
    public final boolean isSelfClosing;   // escrito como "/>"
    public final boolean isVoid;          // <br>, <input>... nunca tienen hijos
    public boolean closed = false;        // false si el HTML no cerró la etiqueta
    private final SourceSpan span;

    public ElementNode(String tagName, boolean isSelfClosing, boolean isVoid, SourceSpan span) {
        this.tagName = tagName;
        this.isSelfClosing = isSelfClosing;
        this.isVoid = isVoid;
        this.span = span;
    }

    public boolean acceptsChildren() {
        return !isSelfClosing && !isVoid;
    }

    @Override
    public SourceSpan span() {
        return span;
    }

    @Override
    public void renderRaw(StringBuilder sb) {
        sb.append('<').append(tagName);
        for (RemiNode attr : attributes) {
            sb.append(' ');
            attr.renderRaw(sb);
        }
        if (isSelfClosing) {
            sb.append("/>");
            return;
        }
        sb.append('>');
        for (RemiNode child : children) child.renderRaw(sb);
        if (closed) sb.append("</").append(tagName).append('>');
    }
}
