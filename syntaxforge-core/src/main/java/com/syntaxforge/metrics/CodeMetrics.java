package com.syntaxforge.metrics;

/**
 * Structural counts for one AST. {@code loops} is while loops plus for loops.
 */
public record CodeMetrics(
    int functions,
    int methods,
    int classes,
    int variables,
    int conditionals,
    int loops,
    int complexity,
    int depth,
    int nodeCount
) {
}
