package com.ciro.remi.ast;

/**
 * {@code on:evento={handler}}. Solo se ejecuta en runtime: nunca se valida
 * y nunca aparece en el HTML generado.
 */
public class EventBindingNode implements RemiNode {
    public static final String PREFIX = "on:";

    public final String event;
    public final String handler;
    public final char quote;
    private final SourceSpan span;

    public EventBindingNode(String event, String handler, char quote, SourceSpan span) {
        this.event = event;
        this.handler = handler;
        this.quote = quote;
        this.span = span;
    }

    @Override
    public SourceSpan span() {
        return span;
    }

    @Override
    public void renderRaw(StringBuilder sb) {
        sb.append(PREFIX).append(event);
        if (handler == null) return;
        sb.append('=');
        switch (quote) {
            case '{' -> sb.append('{').append(handler).append('}');
            case '"', '\'' -> sb.append(quote).append(handler).append(quote);
            default -> sb.append(handler);
        }
    }
}
