package com.ciro.remi;

import com.ciro.remi.template.Diagnostic;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Resultado de compilar un fichero.
 *
 * @param output fuente sin cambios si {@link Status#NO_TEMPLATE}, HTML si {@link Status#SUCCESS}, null si falló
 * @param diagnostics vacío salvo en {@link Status#FAILURE}
 */
public record CompileResult(Status status, String fileId, String output, List<Diagnostic> diagnostics) {

    public enum Status {
        /** sin bloque {@code <render>} */
        NO_TEMPLATE,
        SUCCESS,
        FAILURE
    }

    public CompileResult {
        diagnostics = List.copyOf(diagnostics);
    }

    static CompileResult noTemplate(String fileId, String source) {
        return new CompileResult(Status.NO_TEMPLATE, fileId, source, List.of());
    }

    static CompileResult success(String fileId, String html) {
        return new CompileResult(Status.SUCCESS, fileId, html, List.of());
    }

    static CompileResult failure(String fileId, List<Diagnostic> diagnostics) {
        return new CompileResult(Status.FAILURE, fileId, null, diagnostics);
    }

    public boolean isFailure() {
        return status == Status.FAILURE;
    }

    /** {@code Template checking failed:\nLine N: ...}, una línea por diagnóstico. */
    public String failureMessage() {
        return diagnostics.stream()
                .map(Diagnostic::format)
                .collect(Collectors.joining("\n", "Template checking failed:\n", ""));
    }
}
