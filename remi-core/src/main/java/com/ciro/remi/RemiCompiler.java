package com.ciro.remi;

import com.ciro.remi.ast.RemiNode;
import com.ciro.remi.ast.RemiParser;
import com.ciro.remi.template.CompileState;
import com.ciro.remi.template.HtmlGenerator;
import com.ciro.remi.template.TemplateValidator;
import com.ciro.remi.template.VariableExtractor;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Punto de entrada del pipeline: fuente → tabla de símbolos → árbol validado → HTML.
 * Sin estado: cada llamada crea su propio {@link CompileState}, así que es thread-safe.
 */
public final class RemiCompiler {

    private static final Logger log = LoggerFactory.getLogger(RemiCompiler.class);

    private static final Pattern RENDER_BLOCK = Pattern.compile("<render>([\\s\\S]*?)</render>");

    public CompileResult compile(String source, String fileId) {
        log.debug("Compiling {}", fileId);
        CompileState state = new CompileState(source, fileId);

        // 1. Variables de todo el fichero (también fuera de <render>)
        VariableExtractor.extract(state);

        // 2. Bloque <render>
        Matcher m = RENDER_BLOCK.matcher(source);
        if (!m.find()) {
            log.debug("{} has no <render> block", fileId);
            return CompileResult.noTemplate(fileId, source);
        }
        List<RemiNode> tree = RemiParser.parse(source, m.start(1), m.end(1), state.lines());

        // 3. Validación (política estricta)
        TemplateValidator.validate(tree, state);
        if (state.hasDiagnostics()) {
            log.debug("{}: {} diagnostic(s)", fileId, state.diagnostics().size());
            return CompileResult.failure(fileId, state.diagnostics());
        }

        // 4. Generación (política permisiva)
        return CompileResult.success(fileId, HtmlGenerator.generate(tree, state));
    }

    /**
     * Devuelve la fuente intacta si todas las plantillas son resolubles.
     *
     * @throws TemplateCheckException con todos los diagnósticos si alguna no lo es
     */
    public String checkTemplates(String source, String fileId) {
        CompileResult result = compile(source, fileId);
        if (result.isFailure()) {
            throw new TemplateCheckException(result.failureMessage(), result.diagnostics());
        }
        return source;
    }
}
