package com.ciro.remi.ast;

public class TextNode implements RemiNode {
    public final String text;
    private final SourceSpan span;

    public TextNode(String text, SourceSpan span) {
        this.text = text;
        this.span = span;
    }

    @Override
    public SourceSpan span() {
        return span;
    }

    @Override
    public void renderRaw(StringBuilder sb) {
        sb.append(text);
    }
}
