package com.ciro.remi.ast;

import java.util.ArrayList;
import java.util.List;

/** Ternario de markup: {@code (cond ? ramaTrue : ramaFalse)}. */
public class ConditionalNode implements RemiNode {
    public final String condition;
    public final List<RemiNode> trueBranch = new ArrayList<>();
    public final List<RemiNode> falseBranch = new ArrayList<>();
    public boolean inElse = false;
    private final SourceSpan span;

    public ConditionalNode(String condition, SourceSpan span) {
        this.condition = condition;
        this.span = span;
    }

    @Override
    public SourceSpan span() {
        return span;
    }

    @Override
    public void renderRaw(StringBuilder sb) {
        sb.append('(').append(condition).append('?');
        for (RemiNode n : trueBranch) n.renderRaw(sb);
        sb.append(':');
        for (RemiNode n : falseBranch) n.renderRaw(sb);
        sb.append(')');
    }
}
