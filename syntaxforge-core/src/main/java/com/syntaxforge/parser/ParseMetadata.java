package com.syntaxforge.parser;

/**
 * @param language  language id of the parser that produced the result
 * @param parseTime wall-clock cost of the parse call in milliseconds
 * @param nodeCount nodes in the AST, not counting {@code BlockStatement} containers; lower than
 *                  {@code AstQueries.countNodes} by the number of blocks, and 1 when the parse failed
 * @param lineCount number of lines in the source; the empty source has one
 * @param filename  file name passed to the parser, can be null
 */
public record ParseMetadata(
    String language,
    double parseTime,
    int nodeCount,
    int lineCount,
    String filename
) {
}
