package com.ciro.remi.expr;

import com.fasterxml.jackson.databind.JsonNode;

interface ExprNode {
    JsonNode eval();
}
