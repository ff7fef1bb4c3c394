package com.syntaxforge.json;

import com.syntaxforge.ast.Node;
import com.syntaxforge.parser.ParseResult;

/**
 * Writes AST nodes and parse results as JSON. There is no reading side: JSON
 * is produced for hand-off to other tools only.
 */
public interface AstJsonSerializer {

    /**
     * Serializes an AST node to a JSON string.
     *
     * @param node the AST node to serialize
     * @return the JSON representation of the node, starting with its {@code "type"}
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Serializes an AST node to a pretty-printed JSON string.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;

    /**
     * Serializes a whole parse result: {@code ast}, {@code errors}, {@code warnings}
     * and {@code metadata}.
     *
     * @throws AstJsonException if serialization fails
     */
    String serialize(ParseResult result) throws AstJsonException;

    String serializePretty(ParseResult result) throws AstJsonException;
}
