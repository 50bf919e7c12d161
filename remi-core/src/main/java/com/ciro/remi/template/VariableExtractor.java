package com.ciro.remi.template;

import com.ciro.remi.error.UnresolvableExpressionException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recorre todo el fichero buscando {@code @anotacion [const|let|var] nombre [= valor]}
 * y llena la tabla de símbolos en orden de aparición.
 */
public final class VariableExtractor {

    private static final Logger log = LoggerFactory.getLogger(VariableExtractor.class);

    private static final Pattern DECLARATION = Pattern.compile(
            "@(client|server|public|sset|readable)\\s+(?:(const|let|var)\\s+)?(\\w+)");

    // '=' (no '==') tras el nombre; puede ir en la línea siguiente
    private static final Pattern ASSIGN = Pattern.compile("\\s*=(?!=)\\s*");

    private VariableExtractor() {}

    public static void extract(CompileState state) {
        String src = state.source();
        Matcher m = DECLARATION.matcher(src);
        int from = 0;

        while (from < src.length() && m.find(from)) {
            VariableAnnotation annotation = VariableAnnotation.fromKeyword(m.group(1));
            DeclarationKind kind = DeclarationKind.fromKeyword(m.group(2));
            String name = m.group(3);
            int line = state.lines().lineOf(m.start());
            int next = m.end();

            Variable variable = Variable.uninitialized(name, annotation, kind, line);

            Matcher assign = ASSIGN.matcher(src).region(m.end(), src.length());
            if (assign.lookingAt()) {
                int initStart = assign.end();
                int initEnd = initializerEnd(src, initStart);
                next = Math.max(next, initEnd);
                variable = evaluateInitializer(state, variable, src.substring(initStart, initEnd).trim());
            }

            state.symbols().declare(variable);
            from = next;
        }

        log.debug("[{}] {} variable(s) extracted", state.fileId(), state.symbols().size());
    }

    private static Variable evaluateInitializer(CompileState state, Variable declared, String initializer) {
        try {
            JsonNode value = state.resolve(initializer);
            if (value.isMissingNode()) {
                log.debug("Initializer of '{}' evaluates to undefined", declared.getName());
                return declared;
            }
            return Variable.initialized(declared.getName(), declared.getAnnotation(),
                    declared.getDeclarationKind(), declared.getLine(), value);
        } catch (UnresolvableExpressionException e) {
            // No es un error de plantilla: la variable queda sin inicializar
            log.debug("Initializer of '{}' is not a compile-time value: {}", declared.getName(), initializer);
            return declared;
        }
    }

    /**
     * Fin del inicializador: primer ';' o salto de línea fuera de corchetes,
     * llaves, paréntesis y strings.
     */
    static int initializerEnd(String src, int start) {
        int depth = 0;
        char quote = 0;
        int i = start;

        while (i < src.length()) {
            char c = src.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i += 2;
                    continue;
                }
                if (c == quote) quote = 0;
                // string sin cerrar: no arrastrar el resto del fichero
                if (c == '\n' && quote != '`') return i;
            } else if (c == '"' || c == '\'' || c == '`') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                if (depth > 0) depth--;
            } else if (depth == 0 && (c == ';' || c == '\n')) {
                return i;
            }
            i++;
        }
        return Math.min(i, src.length());
    }
}
