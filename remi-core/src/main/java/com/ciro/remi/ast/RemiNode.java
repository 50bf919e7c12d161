package com.ciro.remi.ast;

public interface RemiNode {
    SourceSpan span();
    void renderRaw(StringBuilder sb); // reconstruye la forma fuente del nodo
}
