package com.ciro.remi.ast;

/** Posición de un nodo en el fichero fuente completo (offset 0-based, línea 1-based). */
public record SourceSpan(int offset, int line) {}
