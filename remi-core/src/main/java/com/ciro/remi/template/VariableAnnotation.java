package com.ciro.remi.template;

import java.util.Locale;

/** Contexto de ejecución declarado con {@code @anotacion}. Solo se registra. */
public enum VariableAnnotation {
    CLIENT,
    SERVER,
    PUBLIC,
    SSET,
    READABLE;

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static VariableAnnotation fromKeyword(String keyword) {
        return valueOf(keyword.toUpperCase(Locale.ROOT));
    }
}
