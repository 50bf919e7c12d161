package com.ciro.remi.ast;

/**
 * Expresión de plantilla {@code {expr}}. La forma diferida
 * {@code {fallback until variable}} se detecta por el infijo literal " until ".
 */
public class PlaceholderNode implements RemiNode {

    public static final String UNTIL = " until ";

    public final String expression;
    private final SourceSpan span;

    public PlaceholderNode(String expression, SourceSpan span) {
        this.expression = expression;
        this.span = span;
    }

    public boolean isDeferred() {
        return expression.contains(UNTIL);
    }

    public String fallbackExpression() {
        return untilParts()[0].trim();
    }

    public String deferredName() {
        return untilParts()[1].trim();
    }

    private String[] untilParts() {
        if (!isDeferred()) {
            throw new IllegalStateException("Placeholder {" + expression + "} has no until clause");
        }
        return expression.split(UNTIL, -1);
    }

    @Override
    public SourceSpan span() {
        return span;
    }

    @Override
    public void renderRaw(StringBuilder sb) {
        sb.append('{').append(expression).append('}');
    }
}
