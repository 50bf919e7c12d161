package com.ciro.remi.cli;

import com.ciro.remi.CompileResult;
import java.util.List;

/** Informe JSON de una ejecución del CLI. {@code outputFile} es null si no se escribió nada. */
public record CompileReport(String file, String status, String outputFile, List<Entry> diagnostics) {

    /** Status de un fallo de lectura/escritura, fuera de {@link CompileResult.Status} */
    public static final String IO_ERROR = "IO_ERROR";

    public record Entry(int line, String message) {}

    static CompileReport of(CompileResult result, String outputFile) {
        List<Entry> entries = result.diagnostics().stream()
                .map(d -> new Entry(d.lineNumber(), d.message()))
                .toList();
        return new CompileReport(result.fileId(), result.status().name(), outputFile, entries);
    }

    static CompileReport ioError(String file) {
        return new CompileReport(file, IO_ERROR, null, List.of());
    }
}
