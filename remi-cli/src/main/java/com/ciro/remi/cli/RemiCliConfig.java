package com.ciro.remi.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Properties;

/**
 * Configuración del CLI. Se lee de {@code remi-cli.properties} en el classpath y
 * cada clave se puede pisar con una propiedad de sistema ({@code -Dremi.output-dir=build}).
 */
public class RemiCliConfig {

    public static final String RESOURCE = "remi-cli.properties";

    static final String INPUT_DIR = "remi.input-dir";
    static final String OUTPUT_DIR = "remi.output-dir";
    static final String REPORT = "remi.report";

    public enum ReportFormat {
        TEXT,
        JSON;

        static ReportFormat fromValue(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new RemiConfigException("Unknown " + REPORT + " '" + value + "' (expected text or json)", e);
            }
        }
    }

    /** Carpeta de donde se leen los .remi */
    private String inputDir = "examples";
    /** Carpeta donde se escriben los .html generados */
    private String outputDir = "out";
    /** Formato del informe por stdout */
    private ReportFormat report = ReportFormat.TEXT;

    public String getInputDir() { return inputDir; }
    public void setInputDir(String inputDir) { this.inputDir = requireDir(INPUT_DIR, inputDir); }

    public String getOutputDir() { return outputDir; }
    public void setOutputDir(String outputDir) { this.outputDir = requireDir(OUTPUT_DIR, outputDir); }

    public ReportFormat getReport() { return report; }
    public void setReport(ReportFormat report) { this.report = report; }

    public static RemiCliConfig load() {
        return load(System.getProperties());
    }

    static RemiCliConfig load(Properties overrides) {
        Properties props = new Properties();
        try (InputStream in = RemiCliConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            throw new RemiConfigException("Cannot read " + RESOURCE, e);
        }
        for (String key : new String[] { INPUT_DIR, OUTPUT_DIR, REPORT }) {
            String value = overrides.getProperty(key);
            if (value != null) props.setProperty(key, value);
        }

        RemiCliConfig config = new RemiCliConfig();
        if (props.containsKey(INPUT_DIR)) config.setInputDir(props.getProperty(INPUT_DIR));
        if (props.containsKey(OUTPUT_DIR)) config.setOutputDir(props.getProperty(OUTPUT_DIR));
        if (props.containsKey(REPORT)) config.setReport(ReportFormat.fromValue(props.getProperty(REPORT)));
        return config;
    }

    private static String requireDir(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new RemiConfigException(key + " must not be blank");
        }
        return value.trim();
    }
}
