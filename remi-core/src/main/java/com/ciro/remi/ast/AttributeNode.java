package com.ciro.remi.ast;

import java.util.List;

/**
 * Atributo normal. {@code value} es null para atributos booleanos ({@code disabled});
 * si no, son trozos de texto, placeholders y ternarios. {@code quote} es la comilla original,
 * '{' para {@code attr={expr}} o 0 si iba sin comillas.
 */
public class AttributeNode implements RemiNode {
    public final String name;
    public final char quote;
    public final List<RemiNode> value;
    private final SourceSpan span;

    public AttributeNode(String name, char quote, List<RemiNode> value, SourceSpan span) {
        this.name = name;
        this.quote = quote;
        this.value = value;
        this.span = span;
    }

    public boolean isBoolean() {
        return value == null;
    }

    @Override
    public SourceSpan span() {
        return span;
    }

    @Override
    public void renderRaw(StringBuilder sb) {
        sb.append(name);
        if (value == null) return;
        sb.append('=');
        boolean quoted = quote == '"' || quote == '\'';
        if (quoted) sb.append(quote);
        for (RemiNode part : value) part.renderRaw(sb);
        if (quoted) sb.append(quote);
    }
}
