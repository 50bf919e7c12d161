package com.ciro.remi;

import com.ciro.remi.error.RemiException;
import com.ciro.remi.template.Diagnostic;
import java.util.List;

/** Lanzada cuando alguna expresión de plantilla no se puede resolver en compilación. */
public class TemplateCheckException extends RemiException {

    private final List<Diagnostic> diagnostics;

    public TemplateCheckException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
