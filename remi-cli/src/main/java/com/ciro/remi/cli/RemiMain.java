package com.ciro.remi.cli;

public class RemiMain {

    public static void main(String[] args) {
        int exitCode;
        try {
            // 1. Configuración (classpath + -D)
            RemiCliConfig config = RemiCliConfig.load();

            // 2. Ejecutar
            exitCode = new RemiCommand(config, System.out, System.err).run(args);
        } catch (RemiConfigException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            exitCode = 1;
        }
        System.exit(exitCode);
    }
}
