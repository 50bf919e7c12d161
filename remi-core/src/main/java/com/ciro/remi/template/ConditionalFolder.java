package com.ciro.remi.template;

import com.ciro.remi.ast.ConditionalNode;
import com.ciro.remi.ast.RemiNode;
import com.ciro.remi.error.UnresolvableExpressionException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluación parcial de ternarios de markup. Solo una condición booleana
 * conocida en compilación pliega el ternario.
 *
 * <ul>
 * <li>Validación (estricta): si no pliega, se validan las dos ramas.</li>
 * <li>Generación (permisiva): si no pliega, se renderiza la rama true.</li>
 * </ul>
 */
public final class ConditionalFolder {

    private static final Logger log = LoggerFactory.getLogger(ConditionalFolder.class);

    private ConditionalFolder() {}

    public static Optional<Boolean> resolve(ConditionalNode cond, CompileState state) {
        String condition = cond.condition.trim();
        try {
            JsonNode value = state.resolve(condition);
            if (value.isBoolean()) {
                log.debug("Line {}: ({}) folds to {}", cond.span().line(), condition, value.booleanValue());
                return Optional.of(value.booleanValue());
            }
            log.debug("Line {}: ({}) is not a boolean, not folded", cond.span().line(), condition);
        } catch (UnresolvableExpressionException e) {
            log.debug("Line {}: ({}) is not known at compile time", cond.span().line(), condition);
        }
        return Optional.empty();
    }

    public static List<List<RemiNode>> branchesToValidate(ConditionalNode cond, CompileState state) {
        return resolve(cond, state)
                .map(taken -> List.of(taken ? cond.trueBranch : cond.falseBranch))
                .orElseGet(() -> List.of(cond.trueBranch, cond.falseBranch));
    }

    public static List<RemiNode> branchToRender(ConditionalNode cond, CompileState state) {
        return resolve(cond, state).orElse(true) ? cond.trueBranch : cond.falseBranch;
    }
}
