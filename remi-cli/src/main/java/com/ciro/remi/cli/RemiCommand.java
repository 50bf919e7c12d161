package com.ciro.remi.cli;

import com.ciro.remi.CompileResult;
import com.ciro.remi.RemiCompiler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code remi <fichero>}: lee {@code <inputDir>/<fichero>}, compila y, si hay
 * plantilla válida, escribe {@code <outputDir>/<nombre>.html}.
 * Devuelve el código de salida en vez de llamar a {@code System.exit}.
 */
public class RemiCommand {

    private static final Logger log = LoggerFactory.getLogger(RemiCommand.class);

    private final RemiCliConfig config;
    private final RemiCompiler compiler = new RemiCompiler();
    private final ObjectMapper mapper = ObjectMapperFactory.create();
    private final PrintStream out;
    private final PrintStream err;

    public RemiCommand(RemiCliConfig config, PrintStream out, PrintStream err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    public int run(String[] args) {
        if (args == null || args.length == 0) {
            err.println("Please provide a filename");
            return 1;
        }

        String filename = args[0];
        Path inputPath = Path.of(config.getInputDir()).resolve(filename);
        Path outDir = Path.of(config.getOutputDir());

        try {
            // 1. Leer
            Files.createDirectories(outDir);
            String code = Files.readString(inputPath, StandardCharsets.UTF_8);

            // 2. Compilar
            CompileResult result = compiler.compile(code, filename);

            // 3. Escribir solo si se generó HTML
            Path written = null;
            if (result.status() == CompileResult.Status.SUCCESS) {
                written = outDir.resolve(htmlName(filename));
                Files.writeString(written, result.output(), StandardCharsets.UTF_8);
                log.info("Wrote {}", written);
            }

            if (config.getReport() == RemiCliConfig.ReportFormat.JSON) {
                printJson(CompileReport.of(result, written == null ? null : written.toString()));
            }

            if (result.isFailure()) {
                err.println("Error processing " + filename + ":");
                err.println(result.failureMessage());
                return 1;
            }

            if (config.getReport() == RemiCliConfig.ReportFormat.TEXT) {
                out.println("Successfully processed " + filename);
            }
            return 0;
        } catch (IOException e) {
            log.debug("I/O failure processing {}", filename, e);
            if (config.getReport() == RemiCliConfig.ReportFormat.JSON) {
                printJson(CompileReport.ioError(filename));
            }
            err.println("Error processing " + filename + ":");
            err.println(describe(e));
            return 1;
        }
    }

    /** {@code pages/home.remi} → {@code home.html} */
    static String htmlName(String filename) {
        String base = Path.of(filename).getFileName().toString();
        int dot = base.lastIndexOf('.');
        return (dot > 0 ? base.substring(0, dot) : base) + ".html";
    }

    private void printJson(CompileReport report) {
        try {
            out.println(mapper.writeValueAsString(report));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize report for " + report.file(), e);
        }
    }

    private static String describe(IOException e) {
        if (e instanceof NoSuchFileException) return "File not found: " + e.getMessage();
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
