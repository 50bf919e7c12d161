package com.ciro.remi.template;

import com.ciro.remi.ast.RemiNode;
import com.ciro.remi.ast.RemiParser;
import java.util.List;

/** Estado ya extraído + árbol del bloque render, como lo deja el compilador. */
final class Fixtures {

    private static final String OPEN = "<render>";
    private static final String CLOSE = "</render>";

    private Fixtures() {}

    static CompileState extracted(String source) {
        CompileState state = new CompileState(source, "test.remi");
        VariableExtractor.extract(state);
        return state;
    }

    static List<RemiNode> renderTree(CompileState state) {
        String src = state.source();
        int start = src.indexOf(OPEN) + OPEN.length();
        int end = src.indexOf(CLOSE, start);
        return RemiParser.parse(src, start, end, state.lines());
    }

    static CompileState validated(String source) {
        CompileState state = extracted(source);
        TemplateValidator.validate(renderTree(state), state);
        return state;
    }

    static String generated(String source) {
        CompileState state = extracted(source);
        return HtmlGenerator.generate(renderTree(state), state);
    }
}
