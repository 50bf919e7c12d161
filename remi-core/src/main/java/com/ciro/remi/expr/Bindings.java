package com.ciro.remi.expr;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/**
 * Fuente de nombres conocidos en compilación. Solo devuelve valores de
 * variables inicializadas y distintas de {@code undefined}.
 */
public interface Bindings {

    Bindings EMPTY = name -> Optional.empty();

    Optional<JsonNode> lookup(String name);
}
