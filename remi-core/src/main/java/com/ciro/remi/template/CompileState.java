package com.ciro.remi.template;

import com.ciro.remi.ast.SourceLines;
import com.ciro.remi.ast.SourceSpan;
import com.ciro.remi.expr.ExpressionEvaluator;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Estado de una compilación: tabla de símbolos + diagnósticos en orden.
 * Se crea para un único fichero, se pasa a cada fase y se descarta al final.
 */
public class CompileState {

    private final String source;
    private final String fileId;
    private final SourceLines lines;
    private final SymbolTable symbols = new SymbolTable();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public CompileState(String source, String fileId) {
        this.source = source;
        this.fileId = fileId;
        this.lines = new SourceLines(source);
    }

    public String source() {
        return source;
    }

    public String fileId() {
        return fileId;
    }

    public SourceLines lines() {
        return lines;
    }

    public SymbolTable symbols() {
        return symbols;
    }

    /**
     * @throws com.ciro.remi.error.UnresolvableExpressionException si no resuelve
     */
    public JsonNode resolve(String expression) {
        return ExpressionEvaluator.evaluate(expression, symbols);
    }

    public boolean isResolvable(String expression) {
        return ExpressionEvaluator.isResolvable(expression, symbols);
    }

    public void report(SourceSpan span, String message) {
        diagnostics.add(new Diagnostic(span.line(), message));
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
