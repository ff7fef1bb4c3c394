package com.syntaxforge.metrics;

/**
 * @param line start line of the declaration, 0 when the node has no location
 */
public record FunctionComplexity(String name, int line, int complexity) {
}
