package com.ciro.remi.template;

import java.util.Locale;

public enum DeclarationKind {
    CONST,
    LET,
    VAR,
    /** {@code @client x = 1}, sin palabra clave */
    NONE;

    public static DeclarationKind fromKeyword(String keyword) {
        if (keyword == null || keyword.isEmpty()) return NONE;
        return valueOf(keyword.toUpperCase(Locale.ROOT));
    }
}
