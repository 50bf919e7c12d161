package com.ciro.remi.template;

import com.ciro.remi.ast.AttributeNode;
import com.ciro.remi.ast.ConditionalNode;
import com.ciro.remi.ast.ElementNode;
import com.ciro.remi.ast.PlaceholderNode;
import com.ciro.remi.ast.RemiNode;
import java.util.List;

/**
 * Comprueba que cada {@code {expr}} alcanzable tras plegar ternarios se pueda
 * resolver en compilación, o que su forma {@code fallback until var} tenga un
 * fallback resoluble. Los {@code on:evento} nunca se miran.
 * Nunca lanza: cada fallo queda como diagnóstico en el {@link CompileState}.
 */
public final class TemplateValidator {

    private TemplateValidator() {}

    public static void validate(List<RemiNode> nodes, CompileState state) {
        for (RemiNode n : nodes) validateNode(n, state);
    }

    private static void validateNode(RemiNode n, CompileState state) {
        if (n instanceof PlaceholderNode p) {
            checkPlaceholder(p, state);
        } else if (n instanceof ConditionalNode cond) {
            for (List<RemiNode> branch : ConditionalFolder.branchesToValidate(cond, state)) {
                validate(branch, state);
            }
        } else if (n instanceof ElementNode el) {
            for (RemiNode attr : el.attributes) {
                // EventBindingNode se ignora
                if (attr instanceof AttributeNode a && !a.isBoolean()) validate(a.value, state);
            }
            validate(el.children, state);
        }
    }

    private static void checkPlaceholder(PlaceholderNode p, CompileState state) {
        if (p.isDeferred()) {
            // la variable diferida se resuelve en runtime
            String fallback = p.fallbackExpression();
            if (!state.isResolvable(fallback)) {
                state.report(p.span(), "Fallback expression \"" + fallback + "\" cannot be resolved at compile time");
            }
            return;
        }

        if (!state.isResolvable(p.expression)) {
            state.report(p.span(), "Template expression \"" + p.expression + "\" cannot be resolved at compile time");
        }
    }
}
